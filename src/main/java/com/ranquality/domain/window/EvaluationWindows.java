package com.ranquality.domain.window;

import java.time.LocalDate;
import java.util.List;

public record EvaluationWindows(
    EvaluationWindow before,
    EvaluationWindow after,
    EvaluationWindow last,
    LocalDate maxDate,
    List<String> warnings
) {
    public static final String AFTER_BEYOND_AVAILABLE_DATA = "AFTER_BEYOND_AVAILABLE_DATA";
    public static final String LAST_OVERLAPS_AFTER = "LAST_OVERLAPS_AFTER";
    public static final String INPUT_DATE_AFTER_MAX_DATE = "INPUT_DATE_AFTER_MAX_DATE";

    public EvaluationWindows {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<EvaluationWindow> all() {
        return List.of(before, after, last);
    }
}

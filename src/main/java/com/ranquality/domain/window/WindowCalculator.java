package com.ranquality.domain.window;

import com.ranquality.exception.InvalidConfigurationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the Before/After/Last windows for an evaluation.
 *
 * <p>After and Last may reach past the data currently available for the site.
 * That is reported through {@link EvaluationWindows#warnings()} and left to the
 * aggregation step, which yields an undefined mean for empty windows.
 */
public final class WindowCalculator {

    private WindowCalculator() {
    }

    public static EvaluationWindows calculate(LocalDate inputDate, int period, int guard, LocalDate maxDate) {
        if (inputDate == null) {
            throw new InvalidConfigurationException("inputDate is required");
        }
        if (maxDate == null) {
            throw new InvalidConfigurationException("maxDate is required");
        }
        if (period <= 0) {
            throw new InvalidConfigurationException("period must be > 0, got " + period);
        }
        if (guard < 0) {
            throw new InvalidConfigurationException("guard must be >= 0, got " + guard);
        }

        EvaluationWindow before = new EvaluationWindow(WindowName.BEFORE,
            inputDate.minusDays((long) guard + period), inputDate.minusDays(guard));
        EvaluationWindow after = new EvaluationWindow(WindowName.AFTER,
            inputDate.plusDays(guard), inputDate.plusDays((long) guard + period));
        EvaluationWindow last = new EvaluationWindow(WindowName.LAST,
            maxDate.minusDays(period), maxDate);

        List<String> warnings = new ArrayList<>();
        if (inputDate.isAfter(maxDate)) {
            warnings.add(EvaluationWindows.INPUT_DATE_AFTER_MAX_DATE);
        }
        if (maxDate.isBefore(after.to())) {
            warnings.add(EvaluationWindows.AFTER_BEYOND_AVAILABLE_DATA);
        }
        if (last.from().isBefore(after.to())) {
            warnings.add(EvaluationWindows.LAST_OVERLAPS_AFTER);
        }
        return new EvaluationWindows(before, after, last, maxDate, warnings);
    }
}

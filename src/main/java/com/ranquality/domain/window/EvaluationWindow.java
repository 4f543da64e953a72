package com.ranquality.domain.window;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/** Closed date interval {@code [from, to]}. */
public record EvaluationWindow(WindowName name, LocalDate from, LocalDate to) {

    public EvaluationWindow {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException(name + " window starts after it ends: " + from + " > " + to);
        }
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }

    public long lengthDays() {
        return ChronoUnit.DAYS.between(from, to) + 1;
    }
}

package com.ranquality.domain.period;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public record TrafficActivePeriod(String cellId, String vendor, LocalDate initDate, LocalDate endDate, int lengthDays) {

    public TrafficActivePeriod {
        Objects.requireNonNull(cellId, "cellId");
        Objects.requireNonNull(initDate, "initDate");
        Objects.requireNonNull(endDate, "endDate");
        long expected = ChronoUnit.DAYS.between(initDate, endDate) + 1;
        if (expected < 1) {
            throw new IllegalArgumentException("period for " + cellId + " ends before it starts: " + initDate + " > " + endDate);
        }
        if (lengthDays != expected) {
            throw new IllegalArgumentException("lengthDays " + lengthDays + " does not match " + initDate + ".." + endDate);
        }
    }

    public static TrafficActivePeriod of(String cellId, String vendor, LocalDate initDate, LocalDate endDate) {
        return new TrafficActivePeriod(cellId, vendor, initDate, endDate,
            (int) (ChronoUnit.DAYS.between(initDate, endDate) + 1));
    }

    public CellKey key() {
        return new CellKey(cellId, vendor);
    }
}

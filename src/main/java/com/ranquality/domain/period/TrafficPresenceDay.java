package com.ranquality.domain.period;

import java.time.LocalDate;
import java.util.Objects;

public record TrafficPresenceDay(String cellId, String vendor, LocalDate date, boolean hasTraffic) {

    public TrafficPresenceDay {
        Objects.requireNonNull(cellId, "cellId");
        Objects.requireNonNull(date, "date");
    }

    /** A day counts as active only when traffic was strictly positive. */
    public static TrafficPresenceDay fromTraffic(String cellId, String vendor, LocalDate date, Double traffic) {
        return new TrafficPresenceDay(cellId, vendor, date, traffic != null && traffic > 0.0);
    }
}

package com.ranquality.domain.metric;

import java.time.LocalDate;
import java.util.Objects;

public record MetricPoint(LocalDate date, Double value) {
    public MetricPoint {
        Objects.requireNonNull(date, "date");
    }
}

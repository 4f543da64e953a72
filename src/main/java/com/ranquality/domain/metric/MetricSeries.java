package com.ranquality.domain.metric;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Daily values of one indicator for one scope, ordered by date. Gaps are
 * allowed and values may be null.
 */
public record MetricSeries(String site, TrackedMetric metric, List<MetricPoint> points) {

    public MetricSeries {
        Objects.requireNonNull(metric, "metric");
        points = points == null
            ? List.of()
            : points.stream().sorted(Comparator.comparing(MetricPoint::date)).toList();
    }

    public static MetricSeries empty(String site, TrackedMetric metric) {
        return new MetricSeries(site, metric, List.of());
    }
}

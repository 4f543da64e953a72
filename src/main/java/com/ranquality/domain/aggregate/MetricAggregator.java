package com.ranquality.domain.aggregate;

import com.ranquality.domain.metric.MetricPoint;
import com.ranquality.domain.metric.MetricSeries;
import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;

public final class MetricAggregator {

    private MetricAggregator() {
    }

    /** Raw arithmetic mean of the non-null samples dated inside the window. */
    public static WindowAggregate aggregate(EvaluationWindow window, TrackedMetric metric, MetricSeries series) {
        double sum = 0.0;
        int count = 0;
        if (series != null) {
            for (MetricPoint point : series.points()) {
                if (point.value() == null || point.value().isNaN() || !window.contains(point.date())) {
                    continue;
                }
                sum += point.value();
                count++;
            }
        }
        return new WindowAggregate(window, metric, count > 0 ? sum / count : null, count);
    }
}

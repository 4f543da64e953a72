package com.ranquality.domain.aggregate;

import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;

/** Mean of a metric over one window; {@code mean} is null when there were no samples. */
public record WindowAggregate(EvaluationWindow window, TrackedMetric metric, Double mean, int sampleCount) {

    public WindowAggregate {
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0");
        }
        if (sampleCount == 0) {
            mean = null;
        }
    }

    public boolean isDefined() {
        return mean != null;
    }
}

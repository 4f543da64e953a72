package com.ranquality.domain.classify;

import com.ranquality.domain.aggregate.WindowAggregate;
import com.ranquality.domain.metric.TrackedMetric;

/**
 * Per-metric breakdown. {@code pattern} and both change classes are null when
 * the verdict is {@link Verdict#INCONCLUSIVE}; {@code failureReason} is set
 * only when the metric could not be computed at all.
 */
public record MetricEvaluation(
    TrackedMetric metric,
    WindowAggregate before,
    WindowAggregate after,
    WindowAggregate last,
    Delta afterVsBefore,
    Delta lastVsAfter,
    ChangeClass afterVsBeforeClass,
    ChangeClass lastVsAfterClass,
    PatternType pattern,
    Verdict verdict,
    String failureReason
) {
    public static MetricEvaluation failed(TrackedMetric metric, String reason) {
        return new MetricEvaluation(metric, null, null, null, null, null,
            null, null, null, Verdict.INCONCLUSIVE, reason);
    }
}

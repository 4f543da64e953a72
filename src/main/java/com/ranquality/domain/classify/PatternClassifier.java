package com.ranquality.domain.classify;

import com.ranquality.domain.aggregate.WindowAggregate;
import com.ranquality.exception.InvalidConfigurationException;

import java.util.Objects;

public class PatternClassifier {

    public static final double DEFAULT_EPS = 1e-9;

    private final VerdictPolicy policy;
    private final double decreaseThreshold;
    private final double increaseThreshold;
    private final double eps;

    public PatternClassifier(VerdictPolicy policy, double decreaseThreshold, double increaseThreshold, double eps) {
        requireFraction("decrease threshold", decreaseThreshold);
        requireFraction("increase threshold", increaseThreshold);
        if (!(eps > 0.0)) {
            throw new InvalidConfigurationException("eps must be > 0, got " + eps);
        }
        this.policy = Objects.requireNonNull(policy, "policy");
        this.decreaseThreshold = decreaseThreshold;
        this.increaseThreshold = increaseThreshold;
        this.eps = eps;
    }

    public PatternClassifier(VerdictPolicy policy, double threshold, double eps) {
        this(policy, threshold, threshold, eps);
    }

    public PatternClassifier(VerdictPolicy policy, double threshold) {
        this(policy, threshold, DEFAULT_EPS);
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value <= 0.0 || value >= 1.0) {
            throw new InvalidConfigurationException(name + " must be in (0, 1), got " + value);
        }
    }

    public MetricEvaluation classify(WindowAggregate before, WindowAggregate after, WindowAggregate last) {
        Delta afterVsBefore = Delta.between(before, after, eps);
        Delta lastVsAfter = Delta.between(after, last, eps);

        if (!afterVsBefore.isDefined() || !lastVsAfter.isDefined()) {
            return new MetricEvaluation(before.metric(), before, after, last, afterVsBefore, lastVsAfter,
                null, null, null, Verdict.INCONCLUSIVE, null);
        }

        ChangeClass first = ChangeClass.of(afterVsBefore, decreaseThreshold, increaseThreshold);
        ChangeClass second = ChangeClass.of(lastVsAfter, decreaseThreshold, increaseThreshold);
        PatternType pattern = PatternType.of(first, second);
        return new MetricEvaluation(before.metric(), before, after, last, afterVsBefore, lastVsAfter,
            first, second, pattern, policy.verdictFor(pattern), null);
    }

    public VerdictPolicy policy() {
        return policy;
    }

    public double decreaseThreshold() {
        return decreaseThreshold;
    }

    public double increaseThreshold() {
        return increaseThreshold;
    }
}

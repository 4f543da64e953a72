package com.ranquality.domain.classify;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Combines per-metric verdicts into one result. Inconclusive metrics are
 * ignored unless nothing else is left; any failure dominates.
 */
public final class EvaluationRollup {

    private EvaluationRollup() {
    }

    public static Verdict rollUp(Collection<Verdict> verdicts) {
        if (verdicts == null || verdicts.isEmpty()) {
            throw new IllegalArgumentException("at least one metric verdict is required");
        }
        Map<Verdict, Integer> counts = new EnumMap<>(Verdict.class);
        for (Verdict v : verdicts) {
            counts.merge(v, 1, Integer::sum);
        }
        if (counts.getOrDefault(Verdict.INCONCLUSIVE, 0) == verdicts.size()) {
            return Verdict.INCONCLUSIVE;
        }
        if (counts.containsKey(Verdict.FAIL)) {
            return Verdict.FAIL;
        }
        if (counts.containsKey(Verdict.RESTORED)) {
            return Verdict.RESTORED;
        }
        return Verdict.PASS;
    }
}

package com.ranquality.domain.classify;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup table from pattern type to verdict. Every pattern must be mapped and
 * no mapping may produce {@link Verdict#INCONCLUSIVE}, which is reserved for
 * missing data.
 */
public final class VerdictPolicy {

    private final String name;
    private final Map<PatternType, Verdict> table;

    public VerdictPolicy(String name, Map<PatternType, Verdict> table) {
        EnumMap<PatternType, Verdict> copy = new EnumMap<>(PatternType.class);
        copy.putAll(table);
        PatternType[] missing = Arrays.stream(PatternType.values())
            .filter(p -> !copy.containsKey(p))
            .toArray(PatternType[]::new);
        if (missing.length > 0) {
            throw new IllegalArgumentException("verdict policy " + name + " has no entry for " + Arrays.toString(missing));
        }
        if (copy.containsValue(Verdict.INCONCLUSIVE)) {
            throw new IllegalArgumentException("verdict policy " + name + " must not map a pattern to INCONCLUSIVE");
        }
        this.name = name;
        this.table = Collections.unmodifiableMap(copy);
    }

    public String name() {
        return name;
    }

    public Verdict verdictFor(PatternType pattern) {
        return table.get(pattern);
    }

    public Map<PatternType, Verdict> table() {
        return table;
    }

    public static VerdictPolicy of(VerdictPolicyType type) {
        return switch (type) {
            case PRIOR_DEGRADATION -> priorDegradation();
            case LATE_DECREASE -> lateDecrease();
        };
    }

    /**
     * Fails only when Before-&gt;After decreased: a later decrease after a stable or
     * improved After window still passes.
     */
    public static VerdictPolicy priorDegradation() {
        EnumMap<PatternType, Verdict> table = new EnumMap<>(PatternType.class);
        table.put(PatternType.T1, Verdict.PASS);
        table.put(PatternType.T2, Verdict.PASS);
        table.put(PatternType.T3, Verdict.PASS);
        table.put(PatternType.T4, Verdict.PASS);
        table.put(PatternType.T5, Verdict.PASS);
        table.put(PatternType.T6, Verdict.PASS);
        table.put(PatternType.T7, Verdict.RESTORED);
        table.put(PatternType.T8, Verdict.FAIL);
        table.put(PatternType.T9, Verdict.FAIL);
        return new VerdictPolicy(VerdictPolicyType.PRIOR_DEGRADATION.name(), table);
    }

    /** Any decrease into the Last window fails; a degraded After window that did not get worse counts as restored. */
    public static VerdictPolicy lateDecrease() {
        EnumMap<PatternType, Verdict> table = new EnumMap<>(PatternType.class);
        table.put(PatternType.T1, Verdict.PASS);
        table.put(PatternType.T2, Verdict.PASS);
        table.put(PatternType.T3, Verdict.FAIL);
        table.put(PatternType.T4, Verdict.PASS);
        table.put(PatternType.T5, Verdict.PASS);
        table.put(PatternType.T6, Verdict.FAIL);
        table.put(PatternType.T7, Verdict.RESTORED);
        table.put(PatternType.T8, Verdict.RESTORED);
        table.put(PatternType.T9, Verdict.FAIL);
        return new VerdictPolicy(VerdictPolicyType.LATE_DECREASE.name(), table);
    }
}

package com.ranquality.domain.classify;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class VerdictPolicyTest {

    @Test
    void priorDegradation_failsOnlyWhenAfterWindowDegraded() {
        VerdictPolicy policy = VerdictPolicy.priorDegradation();

        assertThat(policy.table()).containsExactlyInAnyOrderEntriesOf(Map.of(
            PatternType.T1, Verdict.PASS, PatternType.T2, Verdict.PASS, PatternType.T3, Verdict.PASS,
            PatternType.T4, Verdict.PASS, PatternType.T5, Verdict.PASS, PatternType.T6, Verdict.PASS,
            PatternType.T7, Verdict.RESTORED, PatternType.T8, Verdict.FAIL, PatternType.T9, Verdict.FAIL));
        assertThat(policy.name()).isEqualTo("PRIOR_DEGRADATION");
    }

    @Test
    void lateDecrease_failsAnyDecreaseIntoLastWindow() {
        VerdictPolicy policy = VerdictPolicy.lateDecrease();

        assertThat(policy.verdictFor(PatternType.T3)).isEqualTo(Verdict.FAIL);
        assertThat(policy.verdictFor(PatternType.T6)).isEqualTo(Verdict.FAIL);
        assertThat(policy.verdictFor(PatternType.T9)).isEqualTo(Verdict.FAIL);
        assertThat(policy.verdictFor(PatternType.T7)).isEqualTo(Verdict.RESTORED);
        assertThat(policy.verdictFor(PatternType.T8)).isEqualTo(Verdict.RESTORED);
        assertThat(policy.verdictFor(PatternType.T5)).isEqualTo(Verdict.PASS);
    }

    @Test
    void of_resolvesEveryConfiguredType() {
        for (VerdictPolicyType type : VerdictPolicyType.values()) {
            assertThat(VerdictPolicy.of(type).name()).isEqualTo(type.name());
        }
    }

    @Test
    void constructor_rejectsIncompleteTable() {
        Map<PatternType, Verdict> table = new EnumMap<>(VerdictPolicy.priorDegradation().table());
        table.remove(PatternType.T4);

        assertThatThrownBy(() -> new VerdictPolicy("broken", table))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("T4");
    }

    @Test
    void constructor_rejectsInconclusiveEntries() {
        Map<PatternType, Verdict> table = new EnumMap<>(VerdictPolicy.priorDegradation().table());
        table.put(PatternType.T5, Verdict.INCONCLUSIVE);

        assertThatThrownBy(() -> new VerdictPolicy("broken", table))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void table_isImmutable() {
        VerdictPolicy policy = VerdictPolicy.priorDegradation();

        assertThatThrownBy(() -> policy.table().put(PatternType.T1, Verdict.FAIL))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}

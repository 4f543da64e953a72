package com.ranquality.domain.classify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.ranquality.domain.classify.Verdict.*;
import static org.assertj.core.api.Assertions.*;

class EvaluationRollupTest {

    @Test
    void rollUp_emptyInput_throws() {
        assertThatThrownBy(() -> EvaluationRollup.rollUp(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rollUp_allInconclusive_isInconclusive() {
        assertThat(EvaluationRollup.rollUp(List.of(INCONCLUSIVE, INCONCLUSIVE))).isEqualTo(INCONCLUSIVE);
    }

    @Test
    void rollUp_anyFail_dominates() {
        assertThat(EvaluationRollup.rollUp(List.of(PASS, RESTORED, FAIL, INCONCLUSIVE))).isEqualTo(FAIL);
    }

    @Test
    void rollUp_restoredWithPassAndInconclusive_isRestored() {
        assertThat(EvaluationRollup.rollUp(List.of(PASS, RESTORED, INCONCLUSIVE))).isEqualTo(RESTORED);
    }

    @Test
    void rollUp_passesIgnoringInconclusive() {
        assertThat(EvaluationRollup.rollUp(List.of(PASS, INCONCLUSIVE, PASS))).isEqualTo(PASS);
        assertThat(EvaluationRollup.rollUp(List.of(PASS))).isEqualTo(PASS);
    }

    @Test
    void rollUp_isOrderIndependent() {
        List<Verdict> verdicts = new ArrayList<>(List.of(PASS, PASS, RESTORED, INCONCLUSIVE, INCONCLUSIVE));
        Verdict expected = EvaluationRollup.rollUp(verdicts);
        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(verdicts, random);
            assertThat(EvaluationRollup.rollUp(verdicts)).isEqualTo(expected);
        }
    }
}

package com.ranquality.domain.classify;

import com.ranquality.domain.aggregate.WindowAggregate;
import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;
import com.ranquality.domain.window.WindowName;
import com.ranquality.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class PatternClassifierTest {

    private static final TrackedMetric METRIC = TrackedMetric.SITE_UMTS_CQI;

    private final PatternClassifier classifier = new PatternClassifier(VerdictPolicy.priorDegradation(), 0.05);

    private static WindowAggregate agg(WindowName name, Double mean) {
        LocalDate day = LocalDate.of(2024, 1, 1).plusDays(name.ordinal() * 30L);
        return new WindowAggregate(new EvaluationWindow(name, day, day), METRIC, mean, mean == null ? 0 : 1);
    }

    private MetricEvaluation classify(PatternClassifier c, Double before, Double after, Double last) {
        return c.classify(agg(WindowName.BEFORE, before), agg(WindowName.AFTER, after), agg(WindowName.LAST, last));
    }

    @Test
    void classify_decreaseThenStable_fails() {
        MetricEvaluation e = classify(classifier, 10.0, 7.0, 7.0);

        assertThat(e.afterVsBefore().ratio()).isCloseTo(-0.30, within(1e-12));
        assertThat(e.lastVsAfter().ratio()).isZero();
        assertThat(e.pattern()).isEqualTo(PatternType.T8);
        assertThat(e.verdict()).isEqualTo(Verdict.FAIL);
        assertThat(e.metric()).isEqualTo(METRIC);
    }

    @Test
    void classify_decreaseThenIncrease_isRestored() {
        MetricEvaluation e = classify(classifier, 10.0, 7.0, 10.0);

        assertThat(e.lastVsAfter().ratio()).isCloseTo(0.4286, within(1e-4));
        assertThat(e.afterVsBeforeClass()).isEqualTo(ChangeClass.DECREASE);
        assertThat(e.lastVsAfterClass()).isEqualTo(ChangeClass.INCREASE);
        assertThat(e.pattern()).isEqualTo(PatternType.T7);
        assertThat(e.verdict()).isEqualTo(Verdict.RESTORED);
    }

    @Test
    void classify_stableThenDecrease_passesUnderDefaultPolicy() {
        MetricEvaluation e = classify(classifier, 10.0, 10.2, 9.0);

        assertThat(e.afterVsBefore().ratio()).isCloseTo(0.02, within(1e-9));
        assertThat(e.lastVsAfter().ratio()).isCloseTo(-0.1176, within(1e-4));
        assertThat(e.pattern()).isEqualTo(PatternType.T6);
        assertThat(e.verdict()).isEqualTo(Verdict.PASS);
    }

    @Test
    void classify_stableThenDecrease_failsUnderLateDecreasePolicy() {
        PatternClassifier late = new PatternClassifier(VerdictPolicy.lateDecrease(), 0.05);

        assertThat(classify(late, 10.0, 10.2, 9.0).verdict()).isEqualTo(Verdict.FAIL);
        assertThat(classify(late, 10.0, 7.0, 7.0).verdict()).isEqualTo(Verdict.RESTORED);
    }

    @Test
    void classify_missingWindow_isInconclusiveWithoutPattern() {
        MetricEvaluation e = classify(classifier, 10.0, null, 9.0);

        assertThat(e.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(e.pattern()).isNull();
        assertThat(e.afterVsBefore().isDefined()).isFalse();
        assertThat(e.lastVsAfter().isDefined()).isFalse();
        assertThat(e.failureReason()).isNull();
    }

    @Test
    void classify_missingLastOnly_isInconclusive() {
        assertThat(classify(classifier, 10.0, 10.0, null).verdict()).isEqualTo(Verdict.INCONCLUSIVE);
    }

    @Test
    void classify_zeroBeforeMean_usesEpsilonDenominator() {
        MetricEvaluation e = classify(classifier, 0.0, 1.0, 1.0);

        assertThat(e.afterVsBefore().ratio()).isEqualTo(1.0 / PatternClassifier.DEFAULT_EPS);
        assertThat(e.afterVsBeforeClass()).isEqualTo(ChangeClass.INCREASE);
        assertThat(e.pattern()).isEqualTo(PatternType.T2);
    }

    @Test
    void classify_negativeBeforeMean_usesAbsoluteDenominator() {
        MetricEvaluation e = classify(classifier, -10.0, -5.0, -5.0);

        assertThat(e.afterVsBefore().ratio()).isCloseTo(0.5, within(1e-12));
        assertThat(e.afterVsBeforeClass()).isEqualTo(ChangeClass.INCREASE);
    }

    @Test
    void changeClass_thresholdBoundsAreInclusive() {
        assertThat(ChangeClass.of(0.05, 0.05)).isEqualTo(ChangeClass.INCREASE);
        assertThat(ChangeClass.of(-0.05, 0.05)).isEqualTo(ChangeClass.DECREASE);
        assertThat(ChangeClass.of(0.0499, 0.05)).isEqualTo(ChangeClass.STABLE);
        assertThat(ChangeClass.of(-0.0499, 0.05)).isEqualTo(ChangeClass.STABLE);
    }

    @Test
    void changeClass_undefinedDelta_throws() {
        Delta undefined = new Delta(WindowName.BEFORE, WindowName.AFTER, null);

        assertThatThrownBy(() -> ChangeClass.of(undefined, 0.05)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void patternType_isTotalAndOrderedLexicographically() {
        ChangeClass[] order = {ChangeClass.INCREASE, ChangeClass.STABLE, ChangeClass.DECREASE};
        int n = 0;
        for (ChangeClass first : order) {
            for (ChangeClass second : order) {
                PatternType p = PatternType.of(first, second);
                assertThat(p).isEqualTo(PatternType.values()[n++]);
                assertThat(p.beforeAfter()).isEqualTo(first);
                assertThat(p.afterLast()).isEqualTo(second);
            }
        }
        assertThat(PatternType.T7.code()).isEqualTo("DI");
        assertThat(PatternType.T3.code()).isEqualTo("ID");
    }

    @Test
    void constructor_rejectsThresholdOutsideOpenUnitInterval() {
        VerdictPolicy policy = VerdictPolicy.priorDegradation();

        assertThatThrownBy(() -> new PatternClassifier(policy, 0.0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new PatternClassifier(policy, 1.0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new PatternClassifier(policy, -0.1)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new PatternClassifier(policy, Double.NaN)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new PatternClassifier(policy, 0.05, 0.0)).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void changeClass_separateBoundsPerDirection() {
        assertThat(ChangeClass.of(-0.08, 0.1, 0.02)).isEqualTo(ChangeClass.STABLE);
        assertThat(ChangeClass.of(-0.1, 0.1, 0.02)).isEqualTo(ChangeClass.DECREASE);
        assertThat(ChangeClass.of(0.02, 0.1, 0.02)).isEqualTo(ChangeClass.INCREASE);
        assertThat(ChangeClass.of(0.0199, 0.1, 0.02)).isEqualTo(ChangeClass.STABLE);
    }

    @Test
    void classify_asymmetricThresholds_toleratesSmallDropButCountsSmallRise() {
        PatternClassifier lenientOnDrops = new PatternClassifier(VerdictPolicy.priorDegradation(), 0.1, 0.02,
            PatternClassifier.DEFAULT_EPS);

        MetricEvaluation e = classify(lenientOnDrops, 10.0, 9.2, 9.5);

        assertThat(e.afterVsBeforeClass()).isEqualTo(ChangeClass.STABLE);
        assertThat(e.lastVsAfterClass()).isEqualTo(ChangeClass.INCREASE);
        assertThat(e.pattern()).isEqualTo(PatternType.T4);
        assertThat(lenientOnDrops.decreaseThreshold()).isEqualTo(0.1);
        assertThat(lenientOnDrops.increaseThreshold()).isEqualTo(0.02);
    }

    @Test
    void constructor_rejectsEitherDirectionalThresholdOutOfRange() {
        VerdictPolicy policy = VerdictPolicy.priorDegradation();

        assertThatThrownBy(() -> new PatternClassifier(policy, 0.0, 0.05, PatternClassifier.DEFAULT_EPS))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("decrease threshold");
        assertThatThrownBy(() -> new PatternClassifier(policy, 0.05, 1.0, PatternClassifier.DEFAULT_EPS))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("increase threshold");
    }
}

package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ranquality.domain.aggregate.WindowAggregate;
import com.ranquality.domain.classify.ChangeClass;
import com.ranquality.domain.classify.Delta;
import com.ranquality.domain.classify.MetricEvaluation;
import com.ranquality.domain.window.EvaluationWindow;
import com.ranquality.service.EvaluationReport;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Evaluation result for API consumers. Means are rounded to 4 decimals and
 * changes are percentages rounded to 2 decimals.
 */
@Value
@Builder
public class EvaluationResponse {
    String siteAtt;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate inputDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate maxDate;
    double threshold;
    double thresholdDecrease;
    double thresholdIncrease;
    int period;
    int guard;
    String verdictPolicy;
    String overallVerdict;
    List<WindowResponse> windows;
    List<String> warnings;
    List<MetricResult> metrics;
    List<CellChangeEventResponse> changeEvents;
    String requestId;

    @Value
    @Builder
    public static class WindowResponse {
        String name;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate from;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate to;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MetricResult {
        String metric;
        String scope;
        String technology;
        Double beforeMean;
        Double afterMean;
        Double lastMean;
        Integer beforeSamples;
        Integer afterSamples;
        Integer lastSamples;
        Double afterVsBeforePct;
        Double lastVsAfterPct;
        String afterVsBeforeClass;
        String lastVsAfterClass;
        String pattern;
        String patternCode;
        String verdict;
        String failureReason;
    }

    public static EvaluationResponse from(EvaluationReport report, String requestId) {
        return EvaluationResponse.builder()
            .siteAtt(report.site())
            .inputDate(report.inputDate())
            .maxDate(report.windows().maxDate())
            .threshold(report.threshold())
            .thresholdDecrease(report.thresholdDecrease())
            .thresholdIncrease(report.thresholdIncrease())
            .period(report.period())
            .guard(report.guard())
            .verdictPolicy(report.verdictPolicy())
            .overallVerdict(report.overall().name())
            .windows(report.windows().all().stream().map(EvaluationResponse::toWindow).toList())
            .warnings(report.windows().warnings())
            .metrics(report.metrics().stream().map(EvaluationResponse::toMetric).toList())
            .changeEvents(report.changeEvents().stream().map(CellChangeEventResponse::from).toList())
            .requestId(requestId)
            .build();
    }

    static WindowResponse toWindow(EvaluationWindow window) {
        return WindowResponse.builder()
            .name(window.name().name())
            .from(window.from())
            .to(window.to())
            .build();
    }

    private static MetricResult toMetric(MetricEvaluation e) {
        return MetricResult.builder()
            .metric(e.metric().name())
            .scope(e.metric().scope().name())
            .technology(e.metric().technology() != null ? e.metric().technology().name() : null)
            .beforeMean(mean(e.before()))
            .afterMean(mean(e.after()))
            .lastMean(mean(e.last()))
            .beforeSamples(samples(e.before()))
            .afterSamples(samples(e.after()))
            .lastSamples(samples(e.last()))
            .afterVsBeforePct(percent(e.afterVsBefore()))
            .lastVsAfterPct(percent(e.lastVsAfter()))
            .afterVsBeforeClass(name(e.afterVsBeforeClass()))
            .lastVsAfterClass(name(e.lastVsAfterClass()))
            .pattern(e.pattern() != null ? e.pattern().name() : null)
            .patternCode(e.pattern() != null ? e.pattern().code() : null)
            .verdict(e.verdict().name())
            .failureReason(e.failureReason())
            .build();
    }

    private static Double mean(WindowAggregate aggregate) {
        return aggregate != null && aggregate.isDefined() ? round(aggregate.mean(), 10000.0) : null;
    }

    private static Integer samples(WindowAggregate aggregate) {
        return aggregate != null ? aggregate.sampleCount() : null;
    }

    private static Double percent(Delta delta) {
        return delta != null && delta.isDefined() ? round(delta.ratio() * 100.0, 100.0) : null;
    }

    private static String name(ChangeClass changeClass) {
        return changeClass != null ? changeClass.name() : null;
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}

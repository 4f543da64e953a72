package com.ranquality.service;

import com.ranquality.domain.change.CellChangeEvent;
import com.ranquality.domain.classify.MetricEvaluation;
import com.ranquality.domain.classify.Verdict;
import com.ranquality.domain.window.EvaluationWindows;

import java.time.LocalDate;
import java.util.List;

/**
 * Rendering-neutral result of one evaluation, at full precision.
 * {@code changeEvents} is empty when change-event annotation is off or failed.
 */
public record EvaluationReport(
    String site,
    LocalDate inputDate,
    double threshold,
    double thresholdDecrease,
    double thresholdIncrease,
    int period,
    int guard,
    String verdictPolicy,
    EvaluationWindows windows,
    List<MetricEvaluation> metrics,
    Verdict overall,
    List<CellChangeEvent> changeEvents
) {
    public EvaluationReport {
        metrics = List.copyOf(metrics);
        changeEvents = changeEvents == null ? List.of() : List.copyOf(changeEvents);
    }
}

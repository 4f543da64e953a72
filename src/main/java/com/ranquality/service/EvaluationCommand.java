package com.ranquality.service;

import java.time.LocalDate;

/**
 * One evaluation request. Null options fall back to the configured defaults;
 * a null decrease or increase threshold falls back to {@code threshold}.
 */
public record EvaluationCommand(
    String site,
    LocalDate inputDate,
    Double threshold,
    Integer period,
    Integer guard,
    Boolean includeNeighbors,
    String requestId,
    Double thresholdDecrease,
    Double thresholdIncrease
) {
    public EvaluationCommand(String site, LocalDate inputDate, Double threshold, Integer period, Integer guard,
                             Boolean includeNeighbors, String requestId) {
        this(site, inputDate, threshold, period, guard, includeNeighbors, requestId, null, null);
    }

    public static EvaluationCommand of(String site, LocalDate inputDate) {
        return new EvaluationCommand(site, inputDate, null, null, null, null, null);
    }
}

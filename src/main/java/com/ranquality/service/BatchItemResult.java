package com.ranquality.service;

import java.time.LocalDate;

/**
 * Outcome of one site in a batch: either a report, or the error code and
 * message of the failure that stopped that site alone.
 */
public record BatchItemResult(
    String site,
    LocalDate inputDate,
    EvaluationReport report,
    String errorCode,
    String message
) {
    public static BatchItemResult completed(EvaluationReport report) {
        return new BatchItemResult(report.site(), report.inputDate(), report, null, null);
    }

    public static BatchItemResult failed(EvaluationCommand command, String errorCode, String message) {
        return new BatchItemResult(command.site(), command.inputDate(), null, errorCode, message);
    }

    public boolean isFailed() {
        return report == null;
    }
}

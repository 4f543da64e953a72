package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ranquality.service.EvaluationCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Threshold, period and guard are optional; their ranges are checked by the
 * evaluation itself and rejected as an invalid configuration.
 * {@code thresholdDecrease} and {@code thresholdIncrease} override
 * {@code threshold} for one direction only.
 */
@Value
@Builder
@Jacksonized
public class EvaluationRequest {

    @NotBlank(message = "siteAtt is required")
    @Size(max = 32, message = "siteAtt must be at most 32 characters")
    String siteAtt;

    @NotNull(message = "inputDate is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate inputDate;

    Double threshold;

    Double thresholdDecrease;

    Double thresholdIncrease;

    Integer period;

    Integer guard;

    Boolean includeNeighbors;

    public EvaluationCommand toCommand(String requestId) {
        return new EvaluationCommand(siteAtt, inputDate, threshold, period, guard, includeNeighbors, requestId,
            thresholdDecrease, thresholdIncrease);
    }
}

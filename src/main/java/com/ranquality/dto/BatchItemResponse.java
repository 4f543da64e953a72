package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ranquality.service.BatchItemResult;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemResponse {
    String siteAtt;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate inputDate;
    String status;
    String errorCode;
    String message;
    EvaluationResponse evaluation;

    public static BatchItemResponse from(BatchItemResult result, String requestId) {
        return BatchItemResponse.builder()
            .siteAtt(result.site())
            .inputDate(result.inputDate())
            .status(result.isFailed() ? "FAILED" : "COMPLETED")
            .errorCode(result.errorCode())
            .message(result.message())
            .evaluation(result.isFailed() ? null : EvaluationResponse.from(result.report(), requestId))
            .build();
    }
}

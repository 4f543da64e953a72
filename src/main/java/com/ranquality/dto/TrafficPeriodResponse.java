package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ranquality.domain.period.TrafficActivePeriod;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class TrafficPeriodResponse {
    String cellId;
    String vendor;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate initDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate endDate;
    int lengthDays;

    public static TrafficPeriodResponse from(TrafficActivePeriod period) {
        return TrafficPeriodResponse.builder()
            .cellId(period.cellId())
            .vendor(period.vendor())
            .initDate(period.initDate())
            .endDate(period.endDate())
            .lengthDays(period.lengthDays())
            .build();
    }
}

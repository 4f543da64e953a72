package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ranquality.domain.change.CellChangeEvent;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

@Value
@Builder
public class CellChangeEventResponse {
    String siteAtt;
    String technology;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    int added;
    int removed;
    int total;
    Map<String, Integer> buckets;
    String remark;

    public static CellChangeEventResponse from(CellChangeEvent event) {
        return CellChangeEventResponse.builder()
            .siteAtt(event.site())
            .technology(event.technology().name())
            .date(event.date())
            .added(event.addedCount())
            .removed(event.removedCount())
            .total(event.totalCount())
            .buckets(event.bucketCounts())
            .remark(event.remark())
            .build();
    }
}

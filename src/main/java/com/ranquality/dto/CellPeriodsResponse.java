package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ranquality.domain.change.CellMetadata;
import com.ranquality.service.CellPeriods;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellPeriodsResponse {
    String cellId;
    String siteAtt;
    String band;
    String technology;
    List<TrafficPeriodResponse> periods;

    public static CellPeriodsResponse from(CellPeriods cellPeriods) {
        CellMetadata cell = cellPeriods.cell();
        return CellPeriodsResponse.builder()
            .cellId(cellPeriods.cellId())
            .siteAtt(cell != null ? cell.site() : null)
            .band(cell != null ? cell.band() : null)
            .technology(cell != null ? cell.technology().name() : null)
            .periods(cellPeriods.periods().stream().map(TrafficPeriodResponse::from).toList())
            .build();
    }
}

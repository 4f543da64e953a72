package com.ranquality.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class RecommendedDatesResponse {
    String siteAtt;
    List<LocalDate> dates;
}

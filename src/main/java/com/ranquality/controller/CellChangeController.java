package com.ranquality.controller;

import com.ranquality.domain.metric.Technology;
import com.ranquality.dto.CellChangeEventResponse;
import com.ranquality.dto.CellPeriodsResponse;
import com.ranquality.dto.RecommendedDatesResponse;
import com.ranquality.exception.InvalidConfigurationException;
import com.ranquality.service.CellChangeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CellChangeController {

    private final CellChangeService cellChangeService;

    @GetMapping("/cells/{cellId}/periods")
    public ResponseEntity<CellPeriodsResponse> periods(
            @PathVariable String cellId, @RequestParam(required = false) String vendor) {
        log.info("GET /cells/{}/periods | vendor={}", cellId, vendor);
        return ResponseEntity.ok(CellPeriodsResponse.from(cellChangeService.cellPeriods(cellId, vendor)));
    }

    /** {@code technologies} takes UMTS/LTE/NR or 3G/4G/5G labels. */
    @GetMapping("/sites/{siteAtt}/change-events")
    public ResponseEntity<List<CellChangeEventResponse>> changeEvents(
            @PathVariable String siteAtt,
            @RequestParam(required = false) List<String> technologies,
            @RequestParam(required = false) List<String> vendors) {
        log.info("GET /sites/{}/change-events | technologies={} | vendors={}", siteAtt, technologies, vendors);
        return ResponseEntity.ok(cellChangeService
            .aggregateChangeEvents(siteAtt, parseTechnologies(technologies), vendors == null ? List.of() : vendors)
            .stream()
            .map(CellChangeEventResponse::from)
            .toList());
    }

    @GetMapping("/sites/{siteAtt}/recommended-dates")
    public ResponseEntity<RecommendedDatesResponse> recommendedDates(@PathVariable String siteAtt) {
        return ResponseEntity.ok(RecommendedDatesResponse.builder()
            .siteAtt(siteAtt)
            .dates(cellChangeService.recommendedInputDates(siteAtt))
            .build());
    }

    private static Set<Technology> parseTechnologies(List<String> labels) {
        Set<Technology> technologies = EnumSet.noneOf(Technology.class);
        if (labels == null) {
            return technologies;
        }
        for (String label : labels) {
            try {
                technologies.add(Technology.fromLabel(label));
            } catch (IllegalArgumentException ex) {
                throw new InvalidConfigurationException(ex.getMessage());
            }
        }
        return technologies;
    }
}

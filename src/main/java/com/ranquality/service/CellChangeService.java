package com.ranquality.service;

import com.ranquality.config.CellChangeProperties;
import com.ranquality.datasource.CellTrafficDataSource;
import com.ranquality.domain.change.CellChangeEvent;
import com.ranquality.domain.change.CellMetadata;
import com.ranquality.domain.change.ChangeEventAggregator;
import com.ranquality.domain.change.PeriodWithMetadata;
import com.ranquality.domain.metric.Technology;
import com.ranquality.domain.period.PeriodDetector;
import com.ranquality.domain.period.TrafficActivePeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CellChangeService {

    private final CellTrafficDataSource dataSource;
    private final CellChangeProperties properties;

    public List<TrafficActivePeriod> detectPeriods(String cellId, String vendor) {
        return PeriodDetector.detect(dataSource.getTrafficPresence(cellId, vendor), properties.getMinRun());
    }

    public CellPeriods cellPeriods(String cellId, String vendor) {
        CellMetadata cell = dataSource.getCellMetadata(cellId).orElse(null);
        return new CellPeriods(cellId, cell, detectPeriods(cellId, vendor));
    }

    /** Change events of every technology at the site, UMTS first, each technology by date. */
    public List<CellChangeEvent> aggregateChangeEvents(String site) {
        return aggregateChangeEvents(site, Set.of(), Set.of());
    }

    /**
     * Same as {@link #aggregateChangeEvents(String)}, keeping only cells of the
     * given technologies and vendors. An empty filter keeps everything; vendors
     * match ignoring case.
     */
    public List<CellChangeEvent> aggregateChangeEvents(String site, Collection<Technology> technologies,
                                                       Collection<String> vendors) {
        Set<String> vendorFilter = vendors.stream()
            .map(v -> v.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        Map<Technology, List<PeriodWithMetadata>> byTechnology = new EnumMap<>(Technology.class);
        for (CellMetadata cell : dataSource.getCellsForSite(site)) {
            if (!technologies.isEmpty() && !technologies.contains(cell.technology())) {
                continue;
            }
            for (TrafficActivePeriod period : periodsOf(cell)) {
                PeriodWithMetadata withMetadata = new PeriodWithMetadata(period, cell);
                if (vendorFilter.isEmpty() || (withMetadata.vendor() != null
                        && vendorFilter.contains(withMetadata.vendor().toLowerCase(Locale.ROOT)))) {
                    byTechnology.computeIfAbsent(cell.technology(), t -> new ArrayList<>()).add(withMetadata);
                }
            }
        }

        List<CellChangeEvent> events = new ArrayList<>();
        byTechnology.forEach((technology, periods) -> events.addAll(
            ChangeEventAggregator.aggregate(site, technology, properties.schemeFor(technology), periods)));
        log.debug("Change events computed | site={} | technologies={} | events={}",
            site, byTechnology.keySet(), events.size());
        return events;
    }

    public List<LocalDate> recommendedInputDates(String site) {
        return ChangeEventAggregator.recommendedInputDates(aggregateChangeEvents(site));
    }

    /** Stored periods win when present; they may overlap and are cleaned first. */
    private List<TrafficActivePeriod> periodsOf(CellMetadata cell) {
        List<TrafficActivePeriod> stored = dataSource.getStoredPeriods(cell.cellId());
        if (!stored.isEmpty()) {
            return PeriodDetector.resolveOverlaps(stored);
        }
        return detectPeriods(cell.cellId(), null);
    }
}

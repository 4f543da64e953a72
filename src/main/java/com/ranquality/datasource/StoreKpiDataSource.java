package com.ranquality.datasource;

import com.ranquality.client.NeighborKpiClient;
import com.ranquality.domain.metric.MetricPoint;
import com.ranquality.domain.metric.MetricScope;
import com.ranquality.domain.metric.MetricSeries;
import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;
import com.ranquality.entity.SiteKpiDaily;
import com.ranquality.exception.DataSourceUnavailableException;
import com.ranquality.repository.SiteKpiDailyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Site-level series come from the {@code site_kpi_daily} table, neighbor
 * series from the neighbor aggregation service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreKpiDataSource implements KpiDataSource {

    static final String KPI_STORE = "KPI store";

    private final SiteKpiDailyRepository repository;
    private final NeighborKpiClient neighborKpiClient;

    @Override
    public Mono<MetricSeries> getSeries(String site, TrackedMetric metric, EvaluationWindow window) {
        if (metric.scope() == MetricScope.NEIGHBOR) {
            return neighborKpiClient.getSeries(site, metric, window);
        }
        return Mono.fromCallable(() -> readSiteSeries(site, metric, window))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<LocalDate> getMaxDate(String site) {
        return Mono.fromCallable(() -> {
                try {
                    return repository.findMaxDate(site).orElse(null);
                } catch (DataAccessException ex) {
                    throw new DataSourceUnavailableException(KPI_STORE, ex);
                }
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private MetricSeries readSiteSeries(String site, TrackedMetric metric, EvaluationWindow window) {
        List<SiteKpiDaily> rows;
        try {
            rows = repository.findBySiteAttAndKpiDateBetweenOrderByKpiDateAsc(site, window.from(), window.to());
        } catch (DataAccessException ex) {
            throw new DataSourceUnavailableException(KPI_STORE, ex);
        }
        Function<SiteKpiDaily, Double> column = columnFor(metric);
        List<MetricPoint> points = rows.stream()
            .map(r -> new MetricPoint(r.getKpiDate(), column.apply(r)))
            .toList();
        log.debug("Site series loaded | site={} | metric={} | window={} | rows={}",
            site, metric, window.name(), points.size());
        return new MetricSeries(site, metric, points);
    }

    static Function<SiteKpiDaily, Double> columnFor(TrackedMetric metric) {
        return switch (metric.kpiKey()) {
            case "umts_cqi" -> SiteKpiDaily::getUmtsCqi;
            case "lte_cqi" -> SiteKpiDaily::getLteCqi;
            case "nr_cqi" -> SiteKpiDaily::getNrCqi;
            case "data_traffic_gb" -> SiteKpiDaily::getDataTrafficGb;
            case "voice_traffic_erl" -> SiteKpiDaily::getVoiceTrafficErl;
            default -> throw new IllegalArgumentException("No site column for " + metric);
        };
    }
}

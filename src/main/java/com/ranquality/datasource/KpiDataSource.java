package com.ranquality.datasource;

import com.ranquality.domain.metric.MetricSeries;
import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Daily KPI series for a site and its neighbor set.
 *
 * <p>Both calls are lazy and may be re-subscribed to retry. Transient failures
 * are signalled as {@link com.ranquality.exception.DataSourceUnavailableException}.
 */
public interface KpiDataSource {

    /** Values dated inside {@code window}; days without data are simply absent. */
    Mono<MetricSeries> getSeries(String site, TrackedMetric metric, EvaluationWindow window);

    /** Latest date with any site-level data; empty when the site is unknown. */
    Mono<LocalDate> getMaxDate(String site);
}

package com.ranquality.service;

import com.ranquality.config.EvaluationProperties;
import com.ranquality.datasource.KpiDataSource;
import com.ranquality.domain.aggregate.MetricAggregator;
import com.ranquality.domain.change.CellChangeEvent;
import com.ranquality.domain.classify.EvaluationRollup;
import com.ranquality.domain.classify.MetricEvaluation;
import com.ranquality.domain.classify.PatternClassifier;
import com.ranquality.domain.classify.Verdict;
import com.ranquality.domain.classify.VerdictPolicy;
import com.ranquality.domain.metric.MetricSeries;
import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;
import com.ranquality.domain.window.EvaluationWindows;
import com.ranquality.domain.window.WindowCalculator;
import com.ranquality.exception.BatchSizeExceededException;
import com.ranquality.exception.DataSourceUnavailableException;
import com.ranquality.exception.InvalidConfigurationException;
import com.ranquality.exception.RanQualityException;
import com.ranquality.exception.SiteNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs one KPI pattern evaluation: resolve the windows against the site's
 * latest data date, fetch and classify every tracked metric concurrently,
 * then roll the per-metric verdicts up.
 *
 * <p>A metric that cannot be computed (fetch retries exhausted, neighbor
 * service rejection, deadline) becomes {@link Verdict#INCONCLUSIVE} with a
 * failure reason and does not affect its siblings. Only when every metric
 * failed because its data source was unavailable does the whole request fail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";
    private static final String DATA_SOURCE_UNAVAILABLE = "DATA_SOURCE_UNAVAILABLE";
    private static final String KPI_SOURCE = "KPI data source";

    private final KpiDataSource kpiDataSource;
    private final CellChangeService cellChangeService;
    private final EvaluationProperties properties;

    public Mono<EvaluationReport> evaluate(EvaluationCommand command) {
        return Mono.defer(() -> {
            String site = requireSite(command);
            double threshold = command.threshold() != null ? command.threshold() : properties.getDefaultThreshold();
            double decrease = command.thresholdDecrease() != null ? command.thresholdDecrease() : threshold;
            double increase = command.thresholdIncrease() != null ? command.thresholdIncrease() : threshold;
            int period = resolvePeriod(command.period());
            int guard = resolveGuard(command.guard());
            boolean neighbors = command.includeNeighbors() != null
                ? command.includeNeighbors() && properties.isNeighborsEnabled()
                : properties.isNeighborsEnabled();
            PatternClassifier classifier = new PatternClassifier(
                VerdictPolicy.of(properties.getVerdictPolicy()), decrease, increase, properties.getEps());

            return maxDate(site)
                .flatMap(maxDate -> {
                    EvaluationWindows windows = WindowCalculator.calculate(command.inputDate(), period, guard, maxDate);
                    if (!windows.warnings().isEmpty()) {
                        log.info("Window warnings | site={} | inputDate={} | maxDate={} | warnings={} | requestId={}",
                            site, command.inputDate(), maxDate, windows.warnings(), command.requestId());
                    }
                    List<TrackedMetric> metrics = TrackedMetric.inScope(neighbors);
                    return Mono.zip(
                            evaluateMetrics(site, metrics, windows, classifier, command.requestId()),
                            changeEvents(site, command.requestId()))
                        .map(t -> {
                            Verdict overall = EvaluationRollup.rollUp(
                                t.getT1().stream().map(MetricEvaluation::verdict).toList());
                            log.info("Evaluation done | site={} | inputDate={} | overall={} | requestId={}",
                                site, command.inputDate(), overall, command.requestId());
                            return new EvaluationReport(site, command.inputDate(), threshold, decrease, increase,
                                period, guard, classifier.policy().name(), windows, t.getT1(), overall, t.getT2());
                        });
                });
        });
    }

    /**
     * Latest data date of a site plus, when {@code inputDate} is given, the
     * windows an evaluation with these options would use.
     */
    public Mono<WindowPreview> previewWindows(String site, LocalDate inputDate, Integer period, Integer guard) {
        return Mono.defer(() -> {
            if (site == null || site.isBlank()) {
                throw new InvalidConfigurationException("site is required");
            }
            int resolvedPeriod = resolvePeriod(period);
            int resolvedGuard = resolveGuard(guard);
            return maxDate(site).map(maxDate -> new WindowPreview(site, inputDate, maxDate, inputDate == null
                ? null
                : WindowCalculator.calculate(inputDate, resolvedPeriod, resolvedGuard, maxDate)));
        });
    }

    /**
     * Evaluates several sites one after the other; used by background batch
     * jobs. A site that fails is reported in its own entry and does not stop
     * the others.
     */
    public List<BatchItemResult> evaluateBatchBlocking(List<EvaluationCommand> commands) {
        if (commands.size() > properties.getMaxBatchSize()) {
            throw new BatchSizeExceededException(commands.size(), properties.getMaxBatchSize());
        }
        List<BatchItemResult> results = Flux.fromIterable(commands)
            .concatMap(command -> evaluate(command)
                .map(BatchItemResult::completed)
                .onErrorResume(ex -> {
                    String reason = failureReason(ex);
                    log.warn("Batch item failed | site={} | inputDate={} | reason={} | error={} | requestId={}",
                        command.site(), command.inputDate(), reason, ex.getMessage(), command.requestId());
                    return Mono.just(BatchItemResult.failed(command, reason, ex.getMessage()));
                }))
            .collectList()
            .block();
        long failed = results == null ? 0 : results.stream().filter(BatchItemResult::isFailed).count();
        log.info("Batch evaluation done | count={} | failed={}", results == null ? 0 : results.size(), failed);
        return results;
    }

    private Mono<LocalDate> maxDate(String site) {
        return kpiDataSource.getMaxDate(site)
            .retryWhen(fetchRetry())
            .timeout(properties.getRequestTimeout())
            .onErrorMap(TimeoutException.class, ex -> new DataSourceUnavailableException(KPI_SOURCE, ex))
            .switchIfEmpty(Mono.error(() -> new SiteNotFoundException(site)));
    }

    private int resolvePeriod(Integer requested) {
        int period = requested != null ? requested : properties.getDefaultPeriod();
        if (period <= 0) {
            throw new InvalidConfigurationException("period must be > 0, got " + period);
        }
        return period;
    }

    private int resolveGuard(Integer requested) {
        int guard = requested != null ? requested : properties.getDefaultGuard();
        if (guard < 0) {
            throw new InvalidConfigurationException("guard must be >= 0, got " + guard);
        }
        return guard;
    }

    private Mono<List<MetricEvaluation>> evaluateMetrics(String site, List<TrackedMetric> metrics,
                                                         EvaluationWindows windows, PatternClassifier classifier,
                                                         String requestId) {
        return Flux.fromIterable(metrics)
            .flatMap(metric -> evaluateMetric(site, metric, windows, classifier)
                .timeout(properties.getRequestTimeout())
                .onErrorResume(ex -> {
                    String reason = failureReason(ex);
                    log.warn("Metric evaluation failed | site={} | metric={} | reason={} | error={} | requestId={}",
                        site, metric, reason, ex.getMessage(), requestId);
                    return Mono.just(MetricEvaluation.failed(metric, reason));
                }))
            .sort(Comparator.comparing(MetricEvaluation::metric))
            .collectList()
            .flatMap(results -> {
                boolean allUnavailable = results.stream()
                    .allMatch(r -> DATA_SOURCE_UNAVAILABLE.equals(r.failureReason()));
                if (allUnavailable) {
                    return Mono.error(new DataSourceUnavailableException(KPI_SOURCE, null));
                }
                return Mono.just(results);
            });
    }

    private Mono<MetricEvaluation> evaluateMetric(String site, TrackedMetric metric, EvaluationWindows windows,
                                                  PatternClassifier classifier) {
        return Mono.zip(
                fetch(site, metric, windows.before()),
                fetch(site, metric, windows.after()),
                fetch(site, metric, windows.last()))
            .map(t -> classifier.classify(
                MetricAggregator.aggregate(windows.before(), metric, t.getT1()),
                MetricAggregator.aggregate(windows.after(), metric, t.getT2()),
                MetricAggregator.aggregate(windows.last(), metric, t.getT3())));
    }

    private Mono<MetricSeries> fetch(String site, TrackedMetric metric, EvaluationWindow window) {
        return kpiDataSource.getSeries(site, metric, window)
            .switchIfEmpty(Mono.fromSupplier(() -> MetricSeries.empty(site, metric)))
            .retryWhen(fetchRetry());
    }

    private Mono<List<CellChangeEvent>> changeEvents(String site, String requestId) {
        if (!properties.isAnnotateChangeEvents()) {
            return Mono.just(List.of());
        }
        return Mono.fromCallable(() -> cellChangeService.aggregateChangeEvents(site))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(ex -> {
                log.warn("Change-event annotation skipped | site={} | error={} | requestId={}",
                    site, ex.getMessage(), requestId);
                return Mono.just(List.of());
            });
    }

    private Retry fetchRetry() {
        return Retry.backoff(Math.max(0, properties.getFetch().getMaxAttempts() - 1), properties.getFetch().getBackoff())
            .filter(DataSourceUnavailableException.class::isInstance)
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static String failureReason(Throwable ex) {
        if (ex instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (ex instanceof RanQualityException rq) {
            return rq.getErrorCode();
        }
        return UNEXPECTED_ERROR;
    }

    private static String requireSite(EvaluationCommand command) {
        if (command.site() == null || command.site().isBlank()) {
            throw new InvalidConfigurationException("site is required");
        }
        if (command.inputDate() == null) {
            throw new InvalidConfigurationException("inputDate is required");
        }
        return command.site();
    }
}

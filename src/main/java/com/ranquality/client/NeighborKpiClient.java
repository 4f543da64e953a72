package com.ranquality.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ranquality.domain.metric.MetricPoint;
import com.ranquality.domain.metric.MetricSeries;
import com.ranquality.domain.metric.TrackedMetric;
import com.ranquality.domain.window.EvaluationWindow;
import com.ranquality.exception.DataSourceUnavailableException;
import com.ranquality.exception.NeighborApiException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeUnit;

/**
 * Client for the neighbor aggregation service, which owns the neighbor search
 * and returns one daily series already aggregated across a site's neighbors.
 *
 * <p>{@code GET /neighbors/{site}/kpis/{kpi}?technology=&from=&to=} answers with
 * a JSON array of {@code {"date": "yyyy-MM-dd", "value": number|null}}.
 * Rejections (4xx) and malformed bodies are {@link NeighborApiException};
 * 5xx and connection failures are {@link DataSourceUnavailableException} and
 * may be retried by the caller.
 */
@Slf4j
@Component
public class NeighborKpiClient {

    static final String NEIGHBOR_SERVICE = "neighbor KPI service";

    @Value("${neighbor.api.base-url}")
    private String baseUrl;

    @Value("${neighbor.api.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Accept", "application/json")
            .build();
        log.info("NeighborKpiClient initialised → {}", baseUrl);
    }

    public Mono<MetricSeries> getSeries(String site, TrackedMetric metric, EvaluationWindow window) {
        return webClient.get()
            .uri(b -> {
                b.path("/neighbors/{site}/kpis/{kpi}")
                    .queryParam("from", window.from())
                    .queryParam("to", window.to());
                if (metric.technology() != null) {
                    b.queryParam("technology", metric.technology().name());
                }
                return b.build(site, metric.kpiKey());
            })
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new NeighborApiException("Neighbor service rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new DataSourceUnavailableException(NEIGHBOR_SERVICE, new RuntimeException(b))))
            .bodyToFlux(JsonNode.class)
            .map(this::toPoint)
            .collectList()
            .map(points -> new MetricSeries(site, metric, points))
            .onErrorMap(WebClientRequestException.class, ex -> new DataSourceUnavailableException(NEIGHBOR_SERVICE, ex));
    }

    private MetricPoint toPoint(JsonNode json) {
        if (json == null || !json.hasNonNull("date")) {
            throw new NeighborApiException("Neighbor service response missing 'date': " + json);
        }
        LocalDate date;
        try {
            date = LocalDate.parse(json.get("date").asText());
        } catch (DateTimeParseException ex) {
            throw new NeighborApiException("Neighbor service returned an invalid date: " + json.get("date").asText());
        }
        JsonNode value = json.get("value");
        return new MetricPoint(date, (value == null || value.isNull()) ? null : value.asDouble());
    }
}

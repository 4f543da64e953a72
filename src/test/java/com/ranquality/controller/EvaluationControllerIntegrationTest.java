package com.ranquality.controller;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.ranquality.dto.EvaluationRequest;
import com.ranquality.entity.CellInventory;
import com.ranquality.entity.CellTrafficDaily;
import com.ranquality.entity.CellTrafficPeriod;
import com.ranquality.entity.SiteKpiDaily;
import com.ranquality.repository.CellInventoryRepository;
import com.ranquality.repository.CellTrafficDailyRepository;
import com.ranquality.repository.CellTrafficPeriodRepository;
import com.ranquality.repository.SiteKpiDailyRepository;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class EvaluationControllerIntegrationTest {

    private static final String SITE = "MEXMTY0001";
    private static final LocalDate INPUT = LocalDate.of(2024, 3, 15);

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;
    @Autowired SiteKpiDailyRepository kpiRepository;
    @Autowired CellTrafficDailyRepository trafficRepository;
    @Autowired CellInventoryRepository inventoryRepository;
    @Autowired CellTrafficPeriodRepository periodRepository;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void seed() {
        kpiRepository.deleteAll();
        trafficRepository.deleteAll();
        inventoryRepository.deleteAll();
        periodRepository.deleteAll();

        // LTE CQI drops from 10 to 7 on the input date and never recovers
        List<SiteKpiDaily> rows = new ArrayList<>();
        for (LocalDate d = LocalDate.of(2024, 3, 1); !d.isAfter(LocalDate.of(2024, 5, 1)); d = d.plusDays(1)) {
            rows.add(SiteKpiDaily.builder()
                .siteAtt(SITE).kpiDate(d)
                .umtsCqi(80.0).lteCqi(d.isBefore(INPUT) ? 10.0 : 7.0)
                .dataTrafficGb(120.0).voiceTrafficErl(35.0)
                .build());
        }
        kpiRepository.saveAll(rows);

        inventoryRepository.save(CellInventory.builder()
            .cellId("U1").siteAtt(SITE).band("band_2_pcs").vendor("huawei").technology("UMTS").build());
        inventoryRepository.save(CellInventory.builder()
            .cellId("L1").siteAtt(SITE).band("band_7_2600").vendor("samsung").technology("LTE").build());
        List<CellTrafficDaily> traffic = new ArrayList<>();
        for (int day = 1; day <= 20; day++) {
            traffic.add(CellTrafficDaily.builder().cellId("U1").vendor("huawei")
                .trafficDate(LocalDate.of(2024, 3, day)).traffic(5.0).build());
        }
        for (int day = 14; day <= 20; day++) {
            traffic.add(CellTrafficDaily.builder().cellId("L1").vendor("samsung")
                .trafficDate(LocalDate.of(2024, 3, day)).traffic(day == 16 ? 0.0 : 9.0).build());
        }
        trafficRepository.saveAll(traffic);
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private void stubNeighbors(int status, String body) {
        wireMock.stubFor(get(urlPathMatching("/neighbors/" + SITE + "/kpis/.*")).willReturn(aResponse()
            .withStatus(status)
            .withHeader("Content-Type", "application/json")
            .withBody(body)));
    }

    private EvaluationRequest request() {
        return EvaluationRequest.builder().siteAtt(SITE).inputDate(INPUT).build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> metric(Map<String, Object> body, String name) {
        return ((List<Map<String, Object>>) body.get("metrics")).stream()
            .filter(m -> name.equals(m.get("metric")))
            .findFirst()
            .orElseThrow();
    }

    @Test
    void evaluate_returnsBreakdownAndOverallVerdict() {
        stubNeighbors(200, "[]");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/evaluations", request(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = resp.getBody();
        assertThat(body.get("overallVerdict")).isEqualTo("FAIL");
        assertThat(body.get("maxDate")).isEqualTo("2024-05-01");
        Map<String, Object> lte = metric(body, "SITE_LTE_CQI");
        assertThat(lte.get("patternCode")).isEqualTo("DS");
        assertThat(lte.get("verdict")).isEqualTo("FAIL");
        assertThat(((Number) lte.get("afterVsBeforePct")).doubleValue()).isEqualTo(-30.0);
        assertThat(((Number) lte.get("beforeMean")).doubleValue()).isEqualTo(10.0);
        assertThat(metric(body, "SITE_UMTS_CQI").get("verdict")).isEqualTo("PASS");
        assertThat(metric(body, "SITE_NR_CQI").get("verdict")).isEqualTo("INCONCLUSIVE");
        assertThat(metric(body, "NEIGHBOR_LTE_CQI").get("verdict")).isEqualTo("INCONCLUSIVE");
        assertThat((List<?>) body.get("windows")).hasSize(3);
        assertThat((List<?>) body.get("changeEvents")).isNotEmpty();
    }

    @Test
    void evaluate_echoesRequestId() {
        stubNeighbors(200, "[]");
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/evaluations", HttpMethod.POST,
            new HttpEntity<>(request(), headers), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
        assertThat(resp.getBody().get("requestId")).isEqualTo("trace-42");
    }

    @Test
    void evaluate_neighborServiceDown_isolatesNeighborMetrics() {
        stubNeighbors(500, "{\"error\":\"down\"}");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/evaluations", request(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(metric(resp.getBody(), "NEIGHBOR_UMTS_CQI").get("failureReason"))
            .isEqualTo("DATA_SOURCE_UNAVAILABLE");
        assertThat(resp.getBody().get("overallVerdict")).isEqualTo("FAIL");
    }

    @Test
    void evaluate_unknownSite_returns404() {
        EvaluationRequest unknown = EvaluationRequest.builder().siteAtt("NOPE0001").inputDate(INPUT).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/evaluations", unknown, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("SITE_NOT_FOUND");
    }

    @Test
    void evaluate_thresholdOutOfRange_returns400() {
        EvaluationRequest bad = EvaluationRequest.builder().siteAtt(SITE).inputDate(INPUT).threshold(1.5).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/evaluations", bad, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("INVALID_CONFIGURATION");
    }

    @Test
    void evaluate_missingSite_returns422() {
        EvaluationRequest bad = EvaluationRequest.builder().inputDate(INPUT).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/evaluations", bad, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void evaluateAsync_createsJobAndProvidesStatus() {
        stubNeighbors(200, "[]");

        ResponseEntity<Map> created = restTemplate.postForEntity(
            "/api/v1/evaluations/async", List.of(request(), request()), Map.class);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        String jobId = (String) created.getBody().get("jobId");
        assertThat(jobId).isNotBlank();
        assertThat(created.getHeaders().getLocation()).hasToString("/api/v1/jobs/" + jobId);

        ResponseEntity<Map> job = restTemplate.getForEntity("/api/v1/jobs/" + jobId, Map.class);
        assertThat(job.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(job.getBody().get("jobType")).isEqualTo("EVALUATION_BATCH");
        assertThat(job.getBody()).containsKey("status");
    }

    @Test
    void jobStatus_unknownJob_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/jobs/00000000-0000-0000-0000-000000000000", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @SuppressWarnings("unchecked")
    void cellPeriods_splitOnZeroTrafficDay() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/cells/L1/periods?vendor=samsung", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("siteAtt")).isEqualTo(SITE);
        assertThat(resp.getBody().get("band")).isEqualTo("band_7_2600");
        assertThat(resp.getBody().get("technology")).isEqualTo("LTE");
        List<Map<String, Object>> periods = (List<Map<String, Object>>) resp.getBody().get("periods");
        assertThat(periods).hasSize(1);
        assertThat(periods.get(0).get("initDate")).isEqualTo("2024-03-17");
        assertThat(periods.get(0).get("endDate")).isEqualTo("2024-03-20");
        assertThat(periods.get(0).get("lengthDays")).isEqualTo(4);
    }

    @Test
    @SuppressWarnings("unchecked")
    void ranges_previewWindowsAndMaxDate() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/sites/" + SITE + "/ranges?inputDate=2024-03-15", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("maxDate")).isEqualTo("2024-05-01");
        List<Map<String, Object>> windows = (List<Map<String, Object>>) resp.getBody().get("windows");
        assertThat(windows).extracting(w -> w.get("name")).containsExactly("BEFORE", "AFTER", "LAST");
        assertThat(windows.get(0).get("from")).isEqualTo("2024-03-01");
        assertThat(windows.get(2).get("to")).isEqualTo("2024-05-01");
    }

    @Test
    void ranges_unknownSite_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/sites/NOPE/ranges", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void changeEvents_filteredByTechnologyAndVendor() {
        ResponseEntity<List> events = restTemplate.getForEntity(
            "/api/v1/sites/" + SITE + "/change-events?technologies=4G&vendors=samsung", List.class);

        assertThat(events.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> body = events.getBody();
        assertThat(body).extracting(e -> e.get("technology")).containsOnly("LTE");
        assertThat(body.get(0).get("date")).isEqualTo("2024-03-17");
    }

    @Test
    void changeEvents_unknownTechnology_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/sites/" + SITE + "/change-events?technologies=6G", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void changeEvents_preferStoredPeriods() {
        periodRepository.save(CellTrafficPeriod.builder()
            .cellId("U1").vendor("huawei").initDate(LocalDate.of(2024, 3, 3)).endDate(LocalDate.of(2024, 3, 12))
            .minRun(3).build());

        ResponseEntity<List> events = restTemplate.getForEntity(
            "/api/v1/sites/" + SITE + "/change-events?technologies=UMTS", List.class);

        List<Map<String, Object>> body = events.getBody();
        assertThat(body).hasSize(1);
        assertThat(body.get(0).get("date")).isEqualTo("2024-03-03");
    }

    @Test
    void changeEvents_andRecommendedDates() {
        ResponseEntity<List> events = restTemplate.getForEntity("/api/v1/sites/" + SITE + "/change-events", List.class);

        assertThat(events.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> body = events.getBody();
        assertThat(body).extracting(e -> e.get("technology")).containsExactly("UMTS", "LTE");
        assertThat(body.get(0).get("remark")).isEqualTo("add 01 b2_h3g");
        assertThat(body.get(1).get("date")).isEqualTo("2024-03-17");

        ResponseEntity<Map> dates = restTemplate.getForEntity(
            "/api/v1/sites/" + SITE + "/recommended-dates", Map.class);
        assertThat(dates.getBody().get("dates")).isEqualTo(List.of("2024-03-01", "2024-03-17"));
    }
}

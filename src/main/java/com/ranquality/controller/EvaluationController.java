package com.ranquality.controller;

import com.ranquality.config.EvaluationProperties;
import com.ranquality.config.RequestContextFilter;
import com.ranquality.dto.AsyncJobResponse;
import com.ranquality.dto.BatchItemResponse;
import com.ranquality.dto.EvaluationRequest;
import com.ranquality.dto.EvaluationResponse;
import com.ranquality.dto.WindowPreviewResponse;
import com.ranquality.exception.BatchSizeExceededException;
import com.ranquality.service.AsyncJobService;
import com.ranquality.service.EvaluationCommand;
import com.ranquality.service.EvaluationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final AsyncJobService asyncJobService;
    private final EvaluationProperties properties;

    @PostMapping("/evaluations")
    public Mono<ResponseEntity<EvaluationResponse>> evaluate(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestContextFilter.requestIdOf(httpRequest);
        log.info("POST /evaluations | site={} | inputDate={} | requestId={}",
                 request.getSiteAtt(), request.getInputDate(), requestId);
        return evaluationService.evaluate(request.toCommand(requestId))
            .map(report -> ResponseEntity.ok()
                .header(RequestContextFilter.REQUEST_ID_HEADER, requestId)
                .body(EvaluationResponse.from(report, requestId)));
    }

    @PostMapping("/evaluations/async")
    public ResponseEntity<AsyncJobResponse> evaluateAsync(
            @Valid @RequestBody List<@Valid EvaluationRequest> requests, HttpServletRequest httpRequest) {
        String requestId = RequestContextFilter.requestIdOf(httpRequest);
        if (requests.size() > properties.getMaxBatchSize()) {
            throw new BatchSizeExceededException(requests.size(), properties.getMaxBatchSize());
        }
        log.info("POST /evaluations/async | count={} | requestId={}", requests.size(), requestId);
        List<EvaluationCommand> commands = requests.stream().map(r -> r.toCommand(requestId)).toList();
        UUID jobId = asyncJobService.submit(
            AsyncJobService.EVALUATION_BATCH,
            requestId,
            commands.size(),
            () -> evaluationService.evaluateBatchBlocking(commands).stream()
                .map(result -> BatchItemResponse.from(result, requestId))
                .toList()
        );
        return ResponseEntity.accepted()
            .header(RequestContextFilter.REQUEST_ID_HEADER, requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/sites/{siteAtt}/ranges")
    public Mono<ResponseEntity<WindowPreviewResponse>> ranges(
            @PathVariable String siteAtt,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate inputDate,
            @RequestParam(required = false) Integer period,
            @RequestParam(required = false) Integer guard) {
        log.info("GET /sites/{}/ranges | inputDate={} | period={} | guard={}", siteAtt, inputDate, period, guard);
        return evaluationService.previewWindows(siteAtt, inputDate, period, guard)
            .map(preview -> ResponseEntity.ok(WindowPreviewResponse.from(preview)));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }
}

package com.ranquality.service;

import com.ranquality.config.RequestContextFilter;
import com.ranquality.dto.AsyncJobResponse;
import com.ranquality.dto.AsyncJobStatus;
import com.ranquality.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * In-memory background jobs, polled by id. Finished jobs are evicted oldest
 * first once more than {@code jobs.max-retained} are held.
 */
@Slf4j
@Service
public class AsyncJobService {

    public static final String EVALUATION_BATCH = "EVALUATION_BATCH";

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, int itemCount, Supplier<Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = JobState.queued(jobId, jobType, requestId, itemCount);
        jobs.put(jobId, state);
        cleanupIfNeeded();
        log.info("Job queued | jobId={} | type={} | items={} | requestId={}", jobId, jobType, itemCount, requestId);

        CompletableFuture.runAsync(() -> execute(state, task), executor);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Supplier<Object> task) {
        if (state.requestId != null) {
            MDC.put(RequestContextFilter.REQUEST_ID_MDC_KEY, state.requestId);
        }
        state.markRunning("Evaluating " + state.itemCount + " item(s)", 5);
        try {
            Object result = task.get();
            state.markCompleted(result, "Job completed", 100);
            log.info("Job completed | jobId={} | type={}", state.jobId, state.jobType);
        } catch (Exception ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            state.markFailed(message);
            log.warn("Job failed | jobId={} | type={} | error={}", state.jobId, state.jobType, message);
        } finally {
            MDC.remove(RequestContextFilter.REQUEST_ID_MDC_KEY);
        }
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == AsyncJobStatus.COMPLETED || e.getValue().status == AsyncJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final int itemCount;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status;
        private volatile Integer progressPercent;
        private volatile String message;
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, int itemCount, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.itemCount = itemCount;
            this.createdAt = createdAt;
            this.status = AsyncJobStatus.QUEUED;
            this.progressPercent = 0;
            this.message = "Queued";
        }

        private static JobState queued(UUID id, String type, String requestId, int itemCount) {
            return new JobState(id, type, requestId, itemCount, Instant.now());
        }

        private synchronized void markRunning(String message, int progress) {
            this.startedAt = Instant.now();
            this.status = AsyncJobStatus.RUNNING;
            this.message = message;
            this.progressPercent = progress;
        }

        private synchronized void markCompleted(Object result, String message, int progress) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.COMPLETED;
            this.result = result;
            this.message = message;
            this.progressPercent = progress;
        }

        private synchronized void markFailed(String message) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.FAILED;
            this.message = message;
            this.progressPercent = 100;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .itemCount(itemCount)
                .progressPercent(progressPercent)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}

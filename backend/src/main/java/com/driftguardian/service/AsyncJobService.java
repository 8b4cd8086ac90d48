package com.driftguardian.service;

import com.driftguardian.dto.AsyncJobResponse;
import com.driftguardian.dto.AsyncJobStatus;
import com.driftguardian.dto.JobType;
import com.driftguardian.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs analysis and root-cause work off the request thread.
 * <p>
 * At most one job of each {@link JobType} is in flight per model: submitting
 * while one is queued or running returns the existing job id, so two analyses
 * of the same model never race on its latest report. Finished jobs stay
 * pollable until the retention limit evicts them, oldest completion first.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, MonitoringJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<InFlightKey, UUID> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<UUID> finishedOrder = new ConcurrentLinkedQueue<>();

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

    public UUID submit(JobType type, String modelId, String requestId, Supplier<?> task) {
        InFlightKey key = new InFlightKey(modelId, type);
        MonitoringJob[] created = new MonitoringJob[1];
        UUID jobId = inFlight.compute(key, (k, existing) -> {
            MonitoringJob running = existing != null ? jobs.get(existing) : null;
            if (running != null && running.isActive()) {
                return existing;
            }
            MonitoringJob job = new MonitoringJob(UUID.randomUUID(), type, modelId, requestId);
            jobs.put(job.jobId, job);
            created[0] = job;
            return job.jobId;
        });

        if (created[0] == null) {
            log.info("Job already in flight; reusing | jobId={} | type={} | modelId={} | requestId={}",
                     jobId, type, modelId, requestId);
            return jobId;
        }
        log.info("Job queued | jobId={} | type={} | modelId={} | requestId={}", jobId, type, modelId, requestId);
        evictFinished();
        CompletableFuture.runAsync(() -> run(created[0], task), executor);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        MonitoringJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.snapshot();
    }

    /** Retained jobs for one model, newest first. */
    public List<AsyncJobResponse> jobsForModel(String modelId) {
        return jobs.values().stream()
            .filter(job -> job.modelId.equals(modelId))
            .map(MonitoringJob::snapshot)
            .sorted(Comparator.comparing(AsyncJobResponse::getCreatedAt).reversed())
            .toList();
    }

    private void run(MonitoringJob job, Supplier<?> task) {
        job.start();
        try {
            Object result = task.get();
            job.finish(AsyncJobStatus.COMPLETED, "Completed", result);
            log.info("Job completed | jobId={} | type={} | modelId={} | resultType={}",
                     job.jobId, job.type, job.modelId, result != null ? result.getClass().getSimpleName() : null);
        } catch (Exception ex) {
            log.error("Job failed | jobId={} | type={} | modelId={}", job.jobId, job.type, job.modelId, ex);
            job.finish(AsyncJobStatus.FAILED,
                ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), null);
        } finally {
            inFlight.remove(new InFlightKey(job.modelId, job.type), job.jobId);
            finishedOrder.add(job.jobId);
            evictFinished();
        }
    }

    private void evictFinished() {
        while (jobs.size() > maxRetained) {
            UUID oldest = finishedOrder.poll();
            if (oldest == null) {
                return;
            }
            jobs.remove(oldest);
        }
    }

    private record InFlightKey(String modelId, JobType type) {
    }

    private static final class MonitoringJob {
        private final UUID jobId;
        private final JobType type;
        private final String modelId;
        private final String requestId;
        private final Instant createdAt = Instant.now();
        private Instant startedAt;
        private Instant completedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private String message = "Queued";
        private Object result;
        private String resultType;

        private MonitoringJob(UUID jobId, JobType type, String modelId, String requestId) {
            this.jobId = jobId;
            this.type = type;
            this.modelId = modelId;
            this.requestId = requestId;
        }

        private synchronized void start() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
            message = "Running";
        }

        private synchronized void finish(AsyncJobStatus outcome, String message, Object result) {
            this.completedAt = Instant.now();
            this.status = outcome;
            this.message = message;
            this.result = result;
            this.resultType = result != null ? result.getClass().getSimpleName() : null;
        }

        private synchronized boolean isActive() {
            return status == AsyncJobStatus.QUEUED || status == AsyncJobStatus.RUNNING;
        }

        private synchronized AsyncJobResponse snapshot() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(type)
                .modelId(modelId)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .resultType(resultType)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}

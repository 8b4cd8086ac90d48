package com.driftguardian.controller;

import com.driftguardian.analysis.Leaderboard;
import com.driftguardian.client.AttributionApiClient;
import com.driftguardian.dto.AsyncJobResponse;
import com.driftguardian.dto.MonitoringReport;
import com.driftguardian.dto.PredictionLogRequest;
import com.driftguardian.dto.PredictionLogResponse;
import com.driftguardian.dto.RegisterModelRequest;
import com.driftguardian.dto.RegisterModelResponse;
import com.driftguardian.service.AsyncJobService;
import com.driftguardian.service.ModelRegistryService;
import com.driftguardian.service.MonitoringService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitoringController {

    private final MonitoringService    monitoringService;
    private final ModelRegistryService registry;
    private final AsyncJobService      asyncJobService;
    private final AttributionApiClient attributionApiClient;

    @PostMapping("/models/register")
    public ResponseEntity<RegisterModelResponse> register(
            @Valid @RequestBody RegisterModelRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/register | modelId={} | baselineRows={} | modelType={} | requestId={}",
                 request.getModelId(), request.getBaselineData().size(), request.getModelType(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(monitoringService.register(request, requestId));
    }

    @GetMapping("/models")
    public ResponseEntity<Map<String, List<String>>> models() {
        return ResponseEntity.ok(Map.of("models", registry.ids()));
    }

    @PostMapping("/predictions/log")
    public ResponseEntity<PredictionLogResponse> logPrediction(
            @Valid @RequestBody PredictionLogRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        PredictionLogResponse response = monitoringService.logObservation(request, requestId);
        if (response.getAnalysisJobId() != null) {
            log.info("POST /predictions/log | modelId={} | total={} | analysisJobId={} | requestId={}",
                     request.getModelId(), response.getTotalObservations(), response.getAnalysisJobId(), requestId);
        }
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .body(response);
    }

    @GetMapping("/metrics/{modelId}")
    public ResponseEntity<MonitoringReport> metrics(@PathVariable String modelId, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("GET /metrics/{} | requestId={}", modelId, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(monitoringService.analyze(modelId, requestId));
    }

    @GetMapping("/metrics/{modelId}/latest")
    public ResponseEntity<MonitoringReport> latestMetrics(@PathVariable String modelId) {
        return ResponseEntity.ok(monitoringService.latest(modelId));
    }

    @GetMapping("/metrics/{modelId}/intersectional")
    public ResponseEntity<Leaderboard> intersectional(
            @PathVariable String modelId,
            @RequestParam(required = false) @Min(1) Integer minGroupSize,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("GET /metrics/{}/intersectional | minGroupSize={} | requestId={}", modelId, minGroupSize, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(monitoringService.intersectional(modelId, minGroupSize));
    }

    @PostMapping("/models/{modelId}/root-cause")
    public ResponseEntity<AsyncJobResponse> rootCause(@PathVariable String modelId, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/root-cause | requestId={}", modelId, requestId);
        AsyncJobResponse job = monitoringService.queueRootCause(modelId, requestId);
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/jobs/" + job.getJobId())
            .body(job);
    }

    @GetMapping("/models/{modelId}/jobs")
    public ResponseEntity<Map<String, List<AsyncJobResponse>>> modelJobs(@PathVariable String modelId) {
        registry.get(modelId);
        return ResponseEntity.ok(Map.of("jobs", asyncJobService.jobsForModel(modelId)));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return attributionApiClient.isHealthy().map(healthy -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "healthy");
            body.put("modelsCount", registry.count());
            body.put("attributionApi", healthy ? "UP" : "DOWN");
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.ok(body);
        });
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}

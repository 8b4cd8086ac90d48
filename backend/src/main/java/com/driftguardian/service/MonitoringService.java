package com.driftguardian.service;

import com.driftguardian.analysis.AttributionDriftReport;
import com.driftguardian.analysis.DriftReport;
import com.driftguardian.analysis.FairnessReport;
import com.driftguardian.analysis.Leaderboard;
import com.driftguardian.dto.AsyncJobResponse;
import com.driftguardian.dto.JobType;
import com.driftguardian.dto.MonitoringReport;
import com.driftguardian.dto.PredictionLogRequest;
import com.driftguardian.dto.PredictionLogResponse;
import com.driftguardian.dto.RegisterModelRequest;
import com.driftguardian.dto.RegisterModelResponse;
import com.driftguardian.dto.RootCauseTrigger;
import com.driftguardian.entity.ObservationRecord;
import com.driftguardian.exception.InputValidationException;
import com.driftguardian.repository.ObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Ties the observation log to the analyzers of each registered model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringService {

    static final String NO_OBSERVATIONS = "NO_OBSERVATIONS";
    static final String NOT_ANALYZED = "NOT_ANALYZED";
    static final String ANALYZED = "ANALYZED";

    private final ModelRegistryService registry;
    private final ObservationRepository repository;
    private final AsyncJobService asyncJobService;

    @Value("${analysis.trigger-every:100}")
    private int triggerEvery;

    @Value("${analysis.root-cause.sample-size:100}")
    private int rootCauseSampleSize;

    @Value("${analysis.root-cause.top-k:3}")
    private int rootCauseTopK;

    @Transactional
    public RegisterModelResponse register(RegisterModelRequest request, String requestId) {
        ModelContext context = registry.register(request);
        long dropped = repository.deleteByModelId(request.getModelId());
        if (dropped > 0) {
            log.info("Observation log reset on re-registration | modelId={} | dropped={} | requestId={}",
                     request.getModelId(), dropped, requestId);
        }
        return RegisterModelResponse.builder()
            .status("registered")
            .modelId(context.getModelId())
            .baselineRows(context.getDriftDetector().getBaseline().size())
            .features(context.getSchema().allFeatures())
            .sensitiveAttributes(context.getSensitiveAttributes())
            .attributionEnabled(context.isAttributionEnabled())
            .registeredAt(context.getRegisteredAt())
            .build();
    }

    @Transactional
    public PredictionLogResponse logObservation(PredictionLogRequest request, String requestId) {
        ModelContext context = registry.get(request.getModelId());
        ObservationRecord saved = repository.save(ObservationRecord.builder()
            .modelId(context.getModelId())
            .features(request.getFeatures())
            .prediction(request.getPrediction())
            .trueLabel(request.getTrueLabel())
            .sensitiveFeatures(request.getSensitiveFeatures())
            .requestId(requestId)
            .build());

        long total = repository.countByModelId(context.getModelId());
        UUID analysisJobId = null;
        if (triggerEvery > 0 && total % triggerEvery == 0) {
            String modelId = context.getModelId();
            analysisJobId = asyncJobService.submit(JobType.ANALYSIS, modelId, requestId,
                () -> analyze(modelId, requestId));
        }
        log.debug("Observation logged | modelId={} | id={} | total={} | requestId={}",
                  context.getModelId(), saved.getId(), total, requestId);

        return PredictionLogResponse.builder()
            .status("logged")
            .modelId(context.getModelId())
            .observationId(saved.getId())
            .totalObservations(total)
            .analysisJobId(analysisJobId)
            .timestamp(Instant.now())
            .build();
    }

    public MonitoringReport analyze(String modelId, String requestId) {
        ModelContext context = registry.get(modelId);
        List<ObservationRecord> records = repository.findByModelIdOrderByIdAsc(modelId);
        if (records.isEmpty()) {
            return MonitoringReport.builder()
                .modelId(modelId)
                .status(NO_OBSERVATIONS)
                .message("No observations have been logged for this model yet.")
                .totalObservations(0)
                .generatedAt(Instant.now())
                .build();
        }

        List<Map<String, Object>> currentRows = featureRows(records);
        DriftReport drift = context.getDriftDetector().detect(currentRows);

        FairnessReport bias = null;
        Leaderboard intersectional = null;
        String fairnessNote = null;
        if (!context.hasSensitiveAttributes()) {
            fairnessNote = "No sensitive attributes were registered for this model.";
        } else {
            List<Integer> predictions = predictions(records);
            List<Integer> labels = labels(records);
            List<Map<String, Object>> sensitiveRows = sensitiveRows(records);
            try {
                bias = context.getBiasAnalyzer().evaluate(predictions, labels, sensitiveRows);
                intersectional = context.getIntersectionalAnalyzer().evaluate(predictions, sensitiveRows);
            } catch (InputValidationException ex) {
                log.warn("Fairness analysis skipped | modelId={} | reason={} | requestId={}",
                         modelId, ex.getMessage(), requestId);
                fairnessNote = ex.getMessage();
            }
        }

        MonitoringReport report = MonitoringReport.builder()
            .modelId(modelId)
            .status(ANALYZED)
            .totalObservations(records.size())
            .driftAnalysis(drift)
            .biasAnalysis(bias)
            .intersectionalAnalysis(intersectional)
            .fairnessNote(fairnessNote)
            .rootCause(triggerRootCause(context, drift, currentRows, requestId))
            .generatedAt(Instant.now())
            .build();
        context.getLatestReport().set(report);

        log.info("Analysis complete | modelId={} | observations={} | driftAlerts={} | fairnessScore={} | requestId={}",
                 modelId, records.size(), drift.alertedFeatures(),
                 bias != null ? bias.getFairnessScore() : null, requestId);
        return report;
    }

    public MonitoringReport latest(String modelId) {
        ModelContext context = registry.get(modelId);
        MonitoringReport report = context.getLatestReport().get();
        if (report != null) {
            return report;
        }
        return MonitoringReport.builder()
            .modelId(modelId)
            .status(NOT_ANALYZED)
            .message("No analysis has run for this model yet.")
            .totalObservations(repository.countByModelId(modelId))
            .generatedAt(Instant.now())
            .build();
    }

    public Leaderboard intersectional(String modelId, Integer minGroupSize) {
        ModelContext context = registry.get(modelId);
        if (!context.hasSensitiveAttributes()) {
            throw new InputValidationException("Model '" + modelId + "' has no sensitive attributes registered");
        }
        List<ObservationRecord> records = repository.findByModelIdOrderByIdAsc(modelId);
        if (records.isEmpty()) {
            throw new InputValidationException("No observations have been logged for model '" + modelId + "'");
        }
        int size = minGroupSize != null ? minGroupSize : context.getSettings().getMinGroupSize();
        return context.getIntersectionalAnalyzer().evaluate(predictions(records), sensitiveRows(records), size);
    }

    public AsyncJobResponse queueRootCause(String modelId, String requestId) {
        ModelContext context = registry.get(modelId);
        UUID jobId = asyncJobService.submit(JobType.ROOT_CAUSE, modelId, requestId,
            () -> explainDrift(context.getModelId()));
        return asyncJobService.getJob(jobId);
    }

    public AttributionDriftReport explainDrift(String modelId) {
        ModelContext context = registry.get(modelId);
        return explainDrift(context, featureRows(repository.findByModelIdOrderByIdAsc(modelId)));
    }

    private AttributionDriftReport explainDrift(ModelContext context, List<Map<String, Object>> currentRows) {
        AttributionDriftReport report = context.getRootCauseAnalyzer().explainDrift(
            context.getModel(), context.getDriftDetector().getBaseline(), currentRows,
            rootCauseSampleSize, rootCauseTopK);
        log.info("Root cause analysis finished | modelId={} | status={} | reason={}",
                 context.getModelId(), report.getStatus(), report.getReason());
        return report;
    }

    private RootCauseTrigger triggerRootCause(ModelContext context, DriftReport drift,
                                              List<Map<String, Object>> currentRows, String requestId) {
        if (!drift.hasAlerts()) {
            return RootCauseTrigger.builder()
                .status(RootCauseTrigger.Status.NOT_REQUIRED)
                .message("No drift alerts were raised.")
                .build();
        }
        if (!context.isAttributionEnabled()) {
            return RootCauseTrigger.builder()
                .status(RootCauseTrigger.Status.MODEL_NOT_ATTACHED)
                .message("Model artifact not available for attribution analysis.")
                .build();
        }
        UUID jobId = asyncJobService.submit(JobType.ROOT_CAUSE, context.getModelId(), requestId,
            () -> explainDrift(context, currentRows));
        return RootCauseTrigger.builder()
            .status(RootCauseTrigger.Status.QUEUED)
            .jobId(jobId)
            .message("Root cause analysis queued for " + drift.alertedFeatures())
            .build();
    }

    private static List<Map<String, Object>> featureRows(List<ObservationRecord> records) {
        return records.stream().map(ObservationRecord::getFeatures).toList();
    }

    private static List<Integer> predictions(List<ObservationRecord> records) {
        return records.stream().map(ObservationRecord::getPrediction).toList();
    }

    private static List<Integer> labels(List<ObservationRecord> records) {
        if (records.stream().map(ObservationRecord::getTrueLabel).allMatch(Objects::isNull)) {
            return null;
        }
        return records.stream().map(ObservationRecord::getTrueLabel).toList();
    }

    private static List<Map<String, Object>> sensitiveRows(List<ObservationRecord> records) {
        return records.stream()
            .map(r -> r.getSensitiveFeatures() != null ? r.getSensitiveFeatures() : new HashMap<String, Object>())
            .toList();
    }
}

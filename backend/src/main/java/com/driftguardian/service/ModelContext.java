package com.driftguardian.service;

import com.driftguardian.analysis.AnalysisSettings;
import com.driftguardian.analysis.BiasAnalyzer;
import com.driftguardian.analysis.DriftDetector;
import com.driftguardian.analysis.FeatureSchema;
import com.driftguardian.analysis.IntersectionalAnalyzer;
import com.driftguardian.analysis.ModelReference;
import com.driftguardian.analysis.RootCauseAnalyzer;
import com.driftguardian.dto.MonitoringReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Everything the service keeps for one registered model. The fairness analyzers
 * are null when no sensitive attributes were registered, and {@code model} is
 * null when no model type was supplied for attribution.
 */
@Value
@Builder
public class ModelContext {
    String modelId;
    FeatureSchema schema;
    AnalysisSettings settings;
    List<String> sensitiveAttributes;
    DriftDetector driftDetector;
    BiasAnalyzer biasAnalyzer;
    IntersectionalAnalyzer intersectionalAnalyzer;
    RootCauseAnalyzer rootCauseAnalyzer;
    ModelReference model;
    Instant registeredAt;
    @Builder.Default
    AtomicReference<MonitoringReport> latestReport = new AtomicReference<>();

    public boolean hasSensitiveAttributes() {
        return biasAnalyzer != null;
    }

    public boolean isAttributionEnabled() {
        return model != null;
    }
}

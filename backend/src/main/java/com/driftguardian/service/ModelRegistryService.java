package com.driftguardian.service;

import com.driftguardian.analysis.AnalysisSettings;
import com.driftguardian.analysis.AttributionEngine;
import com.driftguardian.analysis.BiasAnalyzer;
import com.driftguardian.analysis.DriftDetector;
import com.driftguardian.analysis.FeatureSchema;
import com.driftguardian.analysis.IntersectionalAnalyzer;
import com.driftguardian.analysis.ModelReference;
import com.driftguardian.analysis.RootCauseAnalyzer;
import com.driftguardian.analysis.StatisticalTests;
import com.driftguardian.dto.RegisterModelRequest;
import com.driftguardian.exception.ModelNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private final AnalysisSettings defaultSettings;
    private final StatisticalTests statisticalTests;
    private final AttributionEngine attributionEngine;

    @Value("${analysis.root-cause.seed:42}")
    private long rootCauseSeed;

    private final ConcurrentHashMap<String, ModelContext> contexts = new ConcurrentHashMap<>();

    /**
     * Builds the analyzers for a model and replaces any earlier registration
     * under the same id.
     */
    public ModelContext register(RegisterModelRequest request) {
        AnalysisSettings settings = (request.getSettings() != null ? request.getSettings() : defaultSettings).validate();
        FeatureSchema schema = FeatureSchema.of(request.getNumericalFeatures(), request.getCategoricalFeatures());
        List<String> sensitive = request.getSensitiveAttributes() != null
            ? List.copyOf(request.getSensitiveAttributes())
            : List.of();

        ModelReference model = request.getModelType() != null && !request.getModelType().isBlank()
            ? new ModelReference(request.getModelId(), request.getModelType())
            : null;

        ModelContext context = ModelContext.builder()
            .modelId(request.getModelId())
            .schema(schema)
            .settings(settings)
            .sensitiveAttributes(sensitive)
            .driftDetector(new DriftDetector(schema, request.getBaselineData(), settings, statisticalTests))
            .biasAnalyzer(sensitive.isEmpty() ? null : new BiasAnalyzer(sensitive, settings))
            .intersectionalAnalyzer(sensitive.isEmpty() ? null : new IntersectionalAnalyzer(sensitive, settings))
            .rootCauseAnalyzer(new RootCauseAnalyzer(attributionEngine, schema.allFeatures(), rootCauseSeed))
            .model(model)
            .registeredAt(Instant.now())
            .build();

        ModelContext previous = contexts.put(request.getModelId(), context);
        log.info("Model registered | modelId={} | baselineRows={} | features={} | sensitive={} | modelType={} | replaced={}",
                 request.getModelId(), request.getBaselineData().size(), schema.allFeatures().size(),
                 sensitive, request.getModelType(), previous != null);
        return context;
    }

    public ModelContext get(String modelId) {
        ModelContext context = contexts.get(modelId);
        if (context == null) {
            throw new ModelNotFoundException(modelId);
        }
        return context;
    }

    public List<String> ids() {
        return contexts.keySet().stream().sorted().toList();
    }

    public int count() {
        return contexts.size();
    }
}

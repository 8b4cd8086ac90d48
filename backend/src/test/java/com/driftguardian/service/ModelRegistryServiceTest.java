package com.driftguardian.service;

import com.driftguardian.analysis.AnalysisSettings;
import com.driftguardian.analysis.AttributionEngine;
import com.driftguardian.analysis.CommonsMathStatisticalTests;
import com.driftguardian.dto.RegisterModelRequest;
import com.driftguardian.exception.InputValidationException;
import com.driftguardian.exception.ModelNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ModelRegistryServiceTest {

    private ModelRegistryService registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistryService(AnalysisSettings.defaults(), new CommonsMathStatisticalTests(),
            mock(AttributionEngine.class));
        ReflectionTestUtils.setField(registry, "rootCauseSeed", 42L);
    }

    private static RegisterModelRequest.RegisterModelRequestBuilder request(String modelId) {
        return RegisterModelRequest.builder()
            .modelId(modelId)
            .numericalFeatures(List.of("age"))
            .categoricalFeatures(List.of("region"))
            .baselineData(List.of(Map.of("age", 30.0, "region", "north"), Map.of("age", 40.0, "region", "south")));
    }

    @Test
    void register_buildsAnalyzersPerModel() {
        ModelContext context = registry.register(request("credit")
            .sensitiveAttributes(List.of("gender"))
            .modelType("xgboost")
            .build());

        assertThat(context.getDriftDetector().getBaseline()).hasSize(2);
        assertThat(context.hasSensitiveAttributes()).isTrue();
        assertThat(context.getIntersectionalAnalyzer().getMaxCombinationSize()).isEqualTo(1);
        assertThat(context.isAttributionEnabled()).isTrue();
        assertThat(context.getModel().modelType()).isEqualTo("xgboost");
        assertThat(registry.get("credit")).isSameAs(context);
    }

    @Test
    void register_withoutModelTypeOrSensitiveAttributes() {
        ModelContext context = registry.register(request("plain").build());

        assertThat(context.isAttributionEnabled()).isFalse();
        assertThat(context.hasSensitiveAttributes()).isFalse();
        assertThat(context.getSensitiveAttributes()).isEmpty();
    }

    @Test
    void register_requestSettingsOverrideDefaults() {
        AnalysisSettings custom = AnalysisSettings.defaults().toBuilder().minGroupSize(25).build();

        ModelContext context = registry.register(request("custom").settings(custom).build());

        assertThat(context.getSettings().getMinGroupSize()).isEqualTo(25);
    }

    @Test
    void reRegistration_replacesContext() {
        ModelContext first = registry.register(request("credit").build());
        ModelContext second = registry.register(request("credit").build());

        assertThat(registry.get("credit")).isSameAs(second).isNotSameAs(first);
        assertThat(registry.count()).isEqualTo(1);
    }

    @Test
    void ids_areSorted() {
        registry.register(request("zeta").build());
        registry.register(request("alpha").build());

        assertThat(registry.ids()).containsExactly("alpha", "zeta");
    }

    @Test
    void unknownModel_isNotFound() {
        assertThatThrownBy(() -> registry.get("missing")).isInstanceOf(ModelNotFoundException.class);
    }

    @Test
    void overlappingFeatureNames_areRejected() {
        RegisterModelRequest bad = request("bad").categoricalFeatures(List.of("age")).build();

        assertThatThrownBy(() -> registry.register(bad)).isInstanceOf(InputValidationException.class);
        assertThat(registry.ids()).doesNotContain("bad");
    }
}

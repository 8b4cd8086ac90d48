package com.driftguardian.service;

import com.driftguardian.analysis.AnalysisSettings;
import com.driftguardian.analysis.AttributionDriftReport;
import com.driftguardian.analysis.AttributionEngine;
import com.driftguardian.analysis.BiasAnalyzer;
import com.driftguardian.analysis.DriftDetector;
import com.driftguardian.analysis.FeatureAttributions;
import com.driftguardian.analysis.FeatureSchema;
import com.driftguardian.analysis.IntersectionalAnalyzer;
import com.driftguardian.analysis.ModelReference;
import com.driftguardian.analysis.RootCauseAnalyzer;
import com.driftguardian.dto.JobType;
import com.driftguardian.dto.MonitoringReport;
import com.driftguardian.dto.PredictionLogRequest;
import com.driftguardian.dto.PredictionLogResponse;
import com.driftguardian.dto.RegisterModelRequest;
import com.driftguardian.dto.RootCauseTrigger;
import com.driftguardian.entity.ObservationRecord;
import com.driftguardian.exception.InputValidationException;
import com.driftguardian.exception.ModelNotFoundException;
import com.driftguardian.repository.ObservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringServiceTest {

    @Mock ModelRegistryService  registry;
    @Mock ObservationRepository repository;
    @Mock AsyncJobService       asyncJobService;
    @Mock AttributionEngine     engine;
    @InjectMocks MonitoringService service;

    private static final FeatureSchema SCHEMA = FeatureSchema.of(List.of("age"), List.of("region"));
    private static final List<String> SENSITIVE = List.of("gender", "age_group");

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "triggerEvery", 100);
        ReflectionTestUtils.setField(service, "rootCauseSampleSize", 100);
        ReflectionTestUtils.setField(service, "rootCauseTopK", 3);
    }

    private static List<Map<String, Object>> baseline() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            rows.add(Map.of("age", 20.0 + 40.0 * i / 199, "region", i % 2 == 0 ? "north" : "south"));
        }
        return rows;
    }

    private ModelContext context(ModelReference model) {
        AnalysisSettings settings = AnalysisSettings.defaults();
        return ModelContext.builder()
            .modelId("credit")
            .schema(SCHEMA)
            .settings(settings)
            .sensitiveAttributes(SENSITIVE)
            .driftDetector(new DriftDetector(SCHEMA, baseline()))
            .biasAnalyzer(new BiasAnalyzer(SENSITIVE, settings))
            .intersectionalAnalyzer(new IntersectionalAnalyzer(SENSITIVE, settings))
            .rootCauseAnalyzer(new RootCauseAnalyzer(engine, SCHEMA.allFeatures()))
            .model(model)
            .registeredAt(Instant.now())
            .build();
    }

    private static List<ObservationRecord> observations(double ageFrom, boolean withSensitive) {
        List<ObservationRecord> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            Map<String, Object> sensitive = new HashMap<>();
            if (withSensitive) {
                sensitive.put("gender", i % 2 == 0 ? "Male" : "Female");
                sensitive.put("age_group", i < 100 ? "<50" : "50+");
            }
            records.add(ObservationRecord.builder()
                .id((long) i + 1)
                .modelId("credit")
                .features(Map.of("age", ageFrom + 40.0 * i / 199, "region", i % 2 == 0 ? "north" : "south"))
                .prediction(i % 3 == 0 ? 0 : 1)
                .trueLabel(i % 4 == 0 ? 0 : 1)
                .sensitiveFeatures(withSensitive ? sensitive : null)
                .build());
        }
        return records;
    }

    private static PredictionLogRequest logRequest() {
        return PredictionLogRequest.builder()
            .modelId("credit")
            .features(Map.of("age", 33.0, "region", "north"))
            .prediction(1)
            .sensitiveFeatures(Map.of("gender", "Female"))
            .build();
    }

    @Test
    void logObservation_persistsAndTriggersAnalysisOnBoundary() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.save(any())).thenAnswer(inv -> {
            ObservationRecord r = inv.getArgument(0);
            r.setId(100L);
            return r;
        });
        when(repository.countByModelId("credit")).thenReturn(100L);
        UUID jobId = UUID.randomUUID();
        when(asyncJobService.submit(eq(JobType.ANALYSIS), eq("credit"), eq("req-1"), any())).thenReturn(jobId);

        PredictionLogResponse response = service.logObservation(logRequest(), "req-1");

        assertThat(response.getStatus()).isEqualTo("logged");
        assertThat(response.getTotalObservations()).isEqualTo(100L);
        assertThat(response.getAnalysisJobId()).isEqualTo(jobId);
        ArgumentCaptor<ObservationRecord> saved = ArgumentCaptor.forClass(ObservationRecord.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getRequestId()).isEqualTo("req-1");
        assertThat(saved.getValue().getSensitiveFeatures()).containsEntry("gender", "Female");
    }

    @Test
    void logObservation_betweenBoundaries_queuesNothing() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.save(any())).thenAnswer(inv -> {
            ObservationRecord r = inv.getArgument(0);
            r.setId(42L);
            return r;
        });
        when(repository.countByModelId("credit")).thenReturn(42L);

        PredictionLogResponse response = service.logObservation(logRequest(), "req-2");

        assertThat(response.getAnalysisJobId()).isNull();
        verifyNoInteractions(asyncJobService);
    }

    @Test
    void logObservation_unknownModel_propagates() {
        when(registry.get("credit")).thenThrow(new ModelNotFoundException("credit"));

        assertThatThrownBy(() -> service.logObservation(logRequest(), "req-3"))
            .isInstanceOf(ModelNotFoundException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void analyze_withoutObservations_reportsStatusOnly() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(List.of());

        MonitoringReport report = service.analyze("credit", "req-4");

        assertThat(report.getStatus()).isEqualTo(MonitoringService.NO_OBSERVATIONS);
        assertThat(report.getDriftAnalysis()).isNull();
    }

    @Test
    void analyze_driftWithModel_queuesRootCauseJob() {
        ModelReference model = new ModelReference("credit", "xgboost");
        ModelContext context = context(model);
        when(registry.get("credit")).thenReturn(context);
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(observations(40.0, true));
        UUID jobId = UUID.randomUUID();
        when(asyncJobService.submit(eq(JobType.ROOT_CAUSE), eq("credit"), eq("req-5"), any())).thenReturn(jobId);

        MonitoringReport report = service.analyze("credit", "req-5");

        assertThat(report.getStatus()).isEqualTo(MonitoringService.ANALYZED);
        assertThat(report.getTotalObservations()).isEqualTo(200);
        assertThat(report.getDriftAnalysis().alertedFeatures()).contains("age");
        assertThat(report.getBiasAnalysis().getAttributes()).containsKeys("gender", "age_group");
        assertThat(report.getIntersectionalAnalysis().getEntries()).isNotEmpty();
        assertThat(report.getRootCause().getStatus()).isEqualTo(RootCauseTrigger.Status.QUEUED);
        assertThat(report.getRootCause().getJobId()).isEqualTo(jobId);
        assertThat(service.latest("credit")).isSameAs(report);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Supplier<Object>> task = ArgumentCaptor.forClass(Supplier.class);
        verify(asyncJobService).submit(eq(JobType.ROOT_CAUSE), eq("credit"), eq("req-5"), task.capture());
        when(engine.attribute(eq(model), anyList(), anyList()))
            .thenReturn(new FeatureAttributions(List.of("age", "region"), new double[][]{{0.1, 0.2}}))
            .thenReturn(new FeatureAttributions(List.of("age", "region"), new double[][]{{0.5, 0.2}}));
        AttributionDriftReport rootCause = (AttributionDriftReport) task.getValue().get();
        assertThat(rootCause.isAvailable()).isTrue();
        assertThat(rootCause.getTopContributors().get(0).getFeature()).isEqualTo("age");
    }

    @Test
    void analyze_driftWithoutModel_reportsModelNotAttached() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(observations(40.0, true));

        MonitoringReport report = service.analyze("credit", "req-6");

        assertThat(report.getRootCause().getStatus()).isEqualTo(RootCauseTrigger.Status.MODEL_NOT_ATTACHED);
        verifyNoInteractions(asyncJobService);
    }

    @Test
    void analyze_withoutDrift_needsNoRootCause() {
        when(registry.get("credit")).thenReturn(context(new ModelReference("credit", "xgboost")));
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(observations(20.0, true));

        MonitoringReport report = service.analyze("credit", "req-7");

        assertThat(report.getDriftAnalysis().hasAlerts()).isFalse();
        assertThat(report.getRootCause().getStatus()).isEqualTo(RootCauseTrigger.Status.NOT_REQUIRED);
        verifyNoInteractions(asyncJobService);
    }

    @Test
    void analyze_withoutSensitiveValues_keepsDriftAndNotesFairness() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(observations(20.0, false));

        MonitoringReport report = service.analyze("credit", "req-8");

        assertThat(report.getDriftAnalysis().getFeatures()).hasSize(2);
        assertThat(report.getBiasAnalysis()).isNull();
        assertThat(report.getFairnessNote()).contains("sensitive attributes");
    }

    @Test
    void latest_beforeAnyAnalysis_isNotAnalyzed() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.countByModelId("credit")).thenReturn(7L);

        MonitoringReport report = service.latest("credit");

        assertThat(report.getStatus()).isEqualTo(MonitoringService.NOT_ANALYZED);
        assertThat(report.getTotalObservations()).isEqualTo(7L);
    }

    @Test
    void intersectional_honoursRequestedMinimum() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(observations(20.0, true));

        assertThat(service.intersectional("credit", 60).getEntries()).isEmpty();
        assertThat(service.intersectional("credit", null).getMinGroupSize()).isEqualTo(10);
    }

    @Test
    void intersectional_withoutObservations_isRejected() {
        when(registry.get("credit")).thenReturn(context(null));
        when(repository.findByModelIdOrderByIdAsc("credit")).thenReturn(List.of());

        assertThatThrownBy(() -> service.intersectional("credit", null))
            .isInstanceOf(InputValidationException.class);
    }

    @Test
    void register_resetsObservationLog() {
        RegisterModelRequest request = RegisterModelRequest.builder()
            .modelId("credit")
            .numericalFeatures(List.of("age"))
            .categoricalFeatures(List.of("region"))
            .sensitiveAttributes(SENSITIVE)
            .baselineData(baseline())
            .modelType("xgboost")
            .build();
        when(registry.register(request)).thenReturn(context(new ModelReference("credit", "xgboost")));
        when(repository.deleteByModelId("credit")).thenReturn(12L);

        var response = service.register(request, "req-9");

        assertThat(response.getStatus()).isEqualTo("registered");
        assertThat(response.getBaselineRows()).isEqualTo(200);
        assertThat(response.isAttributionEnabled()).isTrue();
        assertThat(response.getFeatures()).containsExactly("age", "region");
        verify(repository).deleteByModelId("credit");
    }
}

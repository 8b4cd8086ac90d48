package com.driftguardian.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttributionDriftReport {
    RootCauseStatus status;
    String reason;
    String modelType;
    Integer baselineSampleSize;
    Integer currentSampleSize;
    List<FeatureAttributionDrift> features;
    List<FeatureAttributionDrift> topContributors;
    String report;

    public boolean isAvailable() {
        return status == RootCauseStatus.AVAILABLE;
    }

    public static AttributionDriftReport unavailable(String modelType, String reason) {
        return AttributionDriftReport.builder()
            .status(RootCauseStatus.UNAVAILABLE)
            .modelType(modelType)
            .reason(reason)
            .features(List.of())
            .topContributors(List.of())
            .report("Root cause analysis unavailable: " + reason)
            .build();
    }
}

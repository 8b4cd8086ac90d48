package com.driftguardian.dto;

import com.driftguardian.analysis.DriftReport;
import com.driftguardian.analysis.FairnessReport;
import com.driftguardian.analysis.Leaderboard;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitoringReport {
    String modelId;
    String status;
    String message;
    long totalObservations;
    DriftReport driftAnalysis;
    FairnessReport biasAnalysis;
    Leaderboard intersectionalAnalysis;
    String fairnessNote;
    RootCauseTrigger rootCause;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}

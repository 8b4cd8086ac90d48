package com.driftguardian.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PredictionLogResponse {
    String status;
    String modelId;
    long observationId;
    long totalObservations;
    UUID analysisJobId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
}

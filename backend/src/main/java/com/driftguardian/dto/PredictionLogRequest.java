package com.driftguardian.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class PredictionLogRequest {

    @NotBlank(message = "modelId is required")
    String modelId;

    @NotNull(message = "features is required")
    Map<String, Object> features;

    @NotNull(message = "prediction is required")
    Integer prediction;

    Integer trueLabel;

    Map<String, Object> sensitiveFeatures;
}

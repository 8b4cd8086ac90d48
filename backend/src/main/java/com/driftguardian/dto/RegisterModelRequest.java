package com.driftguardian.dto;

import com.driftguardian.analysis.AnalysisSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class RegisterModelRequest {

    @NotBlank(message = "modelId is required")
    @Pattern(regexp = "^[a-zA-Z0-9._-]{1,64}$",
             message = "modelId must match ^[a-zA-Z0-9._-]{1,64}$")
    String modelId;

    @NotNull(message = "numericalFeatures is required (may be empty)")
    List<String> numericalFeatures;

    @NotNull(message = "categoricalFeatures is required (may be empty)")
    List<String> categoricalFeatures;

    List<String> sensitiveAttributes;

    @NotEmpty(message = "baselineData must contain at least one row")
    List<Map<String, Object>> baselineData;

    String modelType;

    AnalysisSettings settings;
}

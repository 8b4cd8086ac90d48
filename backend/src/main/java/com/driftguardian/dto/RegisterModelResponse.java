package com.driftguardian.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RegisterModelResponse {
    String status;
    String modelId;
    int baselineRows;
    List<String> features;
    List<String> sensitiveAttributes;
    boolean attributionEnabled;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant registeredAt;
}

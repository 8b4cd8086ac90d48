package com.driftguardian.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricResult {
    Double value;
    double threshold;
    MetricStatus status;
    String reason;

    public static MetricResult atLeast(double value, double threshold) {
        return MetricResult.builder()
            .value(value)
            .threshold(threshold)
            .status(value >= threshold ? MetricStatus.PASS : MetricStatus.FAIL)
            .build();
    }

    public static MetricResult atMost(double value, double threshold) {
        return MetricResult.builder()
            .value(value)
            .threshold(threshold)
            .status(value <= threshold ? MetricStatus.PASS : MetricStatus.FAIL)
            .build();
    }

    public static MetricResult notApplicable(double threshold, String reason) {
        return MetricResult.builder()
            .threshold(threshold)
            .status(MetricStatus.NOT_APPLICABLE)
            .reason(reason)
            .build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == MetricStatus.FAIL;
    }
}

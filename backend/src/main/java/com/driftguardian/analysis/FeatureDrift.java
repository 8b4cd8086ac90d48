package com.driftguardian.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureDrift {
    String feature;
    FeatureKind kind;
    String metric;
    double score;
    @JsonProperty("pValue")
    Double pValue;
    Double psi;
    boolean alert;
    DriftSeverity severity;
    DriftStatus status;
    String message;

    static FeatureDrift skipped(String feature, FeatureKind kind, String metric,
                                DriftStatus status, String message) {
        return FeatureDrift.builder()
            .feature(feature)
            .kind(kind)
            .metric(metric)
            .score(0.0)
            .alert(false)
            .severity(DriftSeverity.NONE)
            .status(status)
            .message(message)
            .build();
    }
}

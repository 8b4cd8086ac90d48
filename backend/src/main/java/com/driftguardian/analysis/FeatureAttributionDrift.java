package com.driftguardian.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeatureAttributionDrift {
    String feature;
    double baselineMeanAbsAttribution;
    double currentMeanAbsAttribution;
    double delta;
    ChangeDirection direction;
}

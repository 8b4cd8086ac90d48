package com.driftguardian.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DriftReport {
    int baselineSize;
    int currentSize;
    List<FeatureDrift> features;

    public boolean hasAlerts() {
        return features.stream().anyMatch(FeatureDrift::isAlert);
    }

    public List<String> alertedFeatures() {
        return features.stream().filter(FeatureDrift::isAlert).map(FeatureDrift::getFeature).toList();
    }

    public FeatureDrift feature(String name) {
        return features.stream()
            .filter(f -> f.getFeature().equals(name))
            .findFirst()
            .orElse(null);
    }
}

package com.driftguardian.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class FairnessReport {
    Map<String, AttributeFairness> attributes;
    List<String> missingAttributes;
    int fairnessScore;

    public AttributeFairness attribute(String name) {
        return attributes.get(name);
    }
}

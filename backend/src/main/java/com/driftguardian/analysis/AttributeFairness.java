package com.driftguardian.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.stream.Stream;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttributeFairness {
    String attribute;
    Map<String, Double> selectionRateByGroup;
    Map<String, Long> groupCounts;
    Map<String, Long> excludedGroups;
    Map<String, Double> accuracyByGroup;
    MetricResult disparateImpact;
    MetricResult demographicParityDifference;
    MetricResult equalizedOddsDifference;
    int compositeScore;

    public long failedMetricCount() {
        return Stream.of(disparateImpact, demographicParityDifference, equalizedOddsDifference)
            .filter(MetricResult::isFailed)
            .count();
    }
}

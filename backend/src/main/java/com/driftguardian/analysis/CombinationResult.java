package com.driftguardian.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class CombinationResult {
    String combination;
    List<String> attributes;
    Map<String, IntersectionalGroup> groups;
    Map<String, Long> excludedGroups;
    boolean violation;
}

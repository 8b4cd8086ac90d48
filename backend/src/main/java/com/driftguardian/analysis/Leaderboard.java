package com.driftguardian.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Leaderboard {

    public static final int DEFAULT_WORST_GROUPS = 5;

    int minGroupSize;
    List<CombinationResult> combinations;
    List<String> skippedCombinations;
    List<IntersectionalGroup> entries;
    int intersectionalFairnessScore;
    String summary;

    /** The first {@value #DEFAULT_WORST_GROUPS} leaderboard entries; serialized as {@code worstGroups}. */
    public List<IntersectionalGroup> getWorstGroups() {
        return worstGroups(DEFAULT_WORST_GROUPS);
    }

    public List<IntersectionalGroup> worstGroups(int limit) {
        return entries.stream().limit(limit).toList();
    }

    public CombinationResult combination(String name) {
        return combinations.stream()
            .filter(c -> c.getCombination().equals(name))
            .findFirst()
            .orElse(null);
    }
}

package com.driftguardian.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntersectionalGroup {
    Integer rank;
    String combination;
    List<String> attributes;
    List<String> key;
    String group;
    double selectionRate;
    long count;
    double disparityRatio;
    boolean violation;
    GroupStatus status;
    Double accuracy;
}

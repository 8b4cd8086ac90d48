package com.driftguardian.analysis;

import com.driftguardian.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Typed options shared by the analyzers. Every field has a default, so
 * {@code AnalysisSettings.defaults()} is a complete configuration.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisSettings {

    /** Groups with fewer members are excluded from fairness reporting. */
    @Builder.Default
    int minGroupSize = 10;

    /** Upper bound on intersectional combination size. */
    @Builder.Default
    int maxCombinationSize = 3;

    /** Number of equal-frequency baseline bins used for PSI. */
    @Builder.Default
    int psiBins = 10;

    /** Prediction value treated as the favourable outcome. */
    @Builder.Default
    int positiveLabel = 1;

    /** Points deducted from a fairness score per failed metric. */
    @Builder.Default
    int scorePenalty = 20;

    /** Chi-square cells with a smaller expected count are dropped. */
    @Builder.Default
    double minExpectedFrequency = 5.0;

    @Builder.Default
    Thresholds thresholds = Thresholds.builder().build();

    public static AnalysisSettings defaults() {
        return AnalysisSettings.builder().build();
    }

    public AnalysisSettings validate() {
        if (minGroupSize < 1) {
            throw new InputValidationException("minGroupSize must be >= 1");
        }
        if (maxCombinationSize < 1) {
            throw new InputValidationException("maxCombinationSize must be >= 1");
        }
        if (psiBins < 2) {
            throw new InputValidationException("psiBins must be >= 2");
        }
        if (scorePenalty < 0) {
            throw new InputValidationException("scorePenalty must be >= 0");
        }
        if (thresholds == null) {
            throw new InputValidationException("thresholds are required");
        }
        if (thresholds.getPsiMinor() > thresholds.getPsiMajor()) {
            throw new InputValidationException("psiMinor must not exceed psiMajor");
        }
        return this;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Thresholds {
        @Builder.Default
        double psiMinor = 0.1;
        @Builder.Default
        double psiMajor = 0.25;
        @Builder.Default
        @JsonProperty("pValue")
        double pValue = 0.05;
        @Builder.Default
        double disparateImpact = 0.8;
        @Builder.Default
        double parityDiff = 0.1;
        @Builder.Default
        double eqOddsDiff = 0.1;
    }
}

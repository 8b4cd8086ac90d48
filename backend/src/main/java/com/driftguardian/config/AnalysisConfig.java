package com.driftguardian.config;

import com.driftguardian.analysis.AnalysisSettings;
import com.driftguardian.analysis.CommonsMathStatisticalTests;
import com.driftguardian.analysis.StatisticalTests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AnalysisConfig {

    @Value("${analysis.min-group-size:10}")
    private int minGroupSize;

    @Value("${analysis.max-combination-size:3}")
    private int maxCombinationSize;

    @Value("${analysis.psi-bins:10}")
    private int psiBins;

    @Value("${analysis.positive-label:1}")
    private int positiveLabel;

    @Value("${analysis.score-penalty:20}")
    private int scorePenalty;

    @Value("${analysis.min-expected-frequency:5.0}")
    private double minExpectedFrequency;

    @Value("${analysis.thresholds.psi-minor:0.1}")
    private double psiMinor;

    @Value("${analysis.thresholds.psi-major:0.25}")
    private double psiMajor;

    @Value("${analysis.thresholds.p-value:0.05}")
    private double pValue;

    @Value("${analysis.thresholds.disparate-impact:0.8}")
    private double disparateImpact;

    @Value("${analysis.thresholds.parity-diff:0.1}")
    private double parityDiff;

    @Value("${analysis.thresholds.eq-odds-diff:0.1}")
    private double eqOddsDiff;

    @Bean
    public AnalysisSettings analysisSettings() {
        AnalysisSettings settings = AnalysisSettings.builder()
            .minGroupSize(minGroupSize)
            .maxCombinationSize(maxCombinationSize)
            .psiBins(psiBins)
            .positiveLabel(positiveLabel)
            .scorePenalty(scorePenalty)
            .minExpectedFrequency(minExpectedFrequency)
            .thresholds(AnalysisSettings.Thresholds.builder()
                .psiMinor(psiMinor)
                .psiMajor(psiMajor)
                .pValue(pValue)
                .disparateImpact(disparateImpact)
                .parityDiff(parityDiff)
                .eqOddsDiff(eqOddsDiff)
                .build())
            .build()
            .validate();
        log.info("Analysis defaults | minGroupSize={} | maxCombinationSize={} | psiBins={} | penalty={}",
                 minGroupSize, maxCombinationSize, psiBins, scorePenalty);
        return settings;
    }

    @Bean
    public StatisticalTests statisticalTests() {
        return new CommonsMathStatisticalTests();
    }
}

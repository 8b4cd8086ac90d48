package com.driftguardian.analysis;

import com.driftguardian.exception.InputValidationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Group-fairness metrics for one sensitive attribute at a time.
 * <p>
 * Groups smaller than {@link AnalysisSettings#getMinGroupSize()} are left out of
 * every metric and listed under {@code excludedGroups}. With fewer than two
 * remaining groups the ratio and difference metrics are not applicable.
 */
@Slf4j
public class BiasAnalyzer {

    @Getter
    private final List<String> sensitiveAttributes;
    private final AnalysisSettings settings;

    public BiasAnalyzer(List<String> sensitiveAttributes) {
        this(sensitiveAttributes, AnalysisSettings.defaults());
    }

    public BiasAnalyzer(List<String> sensitiveAttributes, AnalysisSettings settings) {
        if (sensitiveAttributes == null || sensitiveAttributes.isEmpty()) {
            throw new InputValidationException("At least one sensitive attribute must be configured");
        }
        if (sensitiveAttributes.stream().anyMatch(a -> a == null || a.isBlank())) {
            throw new InputValidationException("Sensitive attribute names must not be blank");
        }
        this.sensitiveAttributes = List.copyOf(sensitiveAttributes);
        this.settings = settings.validate();
    }

    public FairnessReport evaluate(List<Integer> predictions, List<Integer> labels,
                                   List<Map<String, Object>> sensitiveRows) {
        validateInputs(predictions, labels);
        if (sensitiveRows == null || sensitiveRows.isEmpty()) {
            throw new InputValidationException("Sensitive features must contain at least one row");
        }
        if (sensitiveRows.size() != predictions.size()) {
            throw new InputValidationException("Sensitive features have " + sensitiveRows.size()
                + " rows but there are " + predictions.size() + " predictions");
        }

        Map<String, AttributeFairness> byAttribute = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String attribute : sensitiveAttributes) {
            List<String> groups = column(attribute, sensitiveRows);
            if (groups.stream().allMatch(Objects::isNull)) {
                missing.add(attribute);
                continue;
            }
            byAttribute.put(attribute, evaluateAttribute(attribute, predictions, labels, groups));
        }
        if (byAttribute.isEmpty()) {
            throw new InputValidationException("None of the sensitive attributes " + sensitiveAttributes
                + " has any group values");
        }

        long failed = byAttribute.values().stream().mapToLong(AttributeFairness::failedMetricCount).sum();
        return FairnessReport.builder()
            .attributes(byAttribute)
            .missingAttributes(List.copyOf(missing))
            .fairnessScore(score(failed))
            .build();
    }

    public AttributeFairness evaluateAttribute(String attribute, List<Integer> predictions,
                                               List<Integer> labels, List<String> groups) {
        validateInputs(predictions, labels);
        if (groups == null || groups.size() != predictions.size()) {
            throw new InputValidationException("Group values for '" + attribute
                + "' must align with the predictions");
        }

        Map<String, GroupTally> tallies = tally(predictions, labels, groups, settings.getPositiveLabel());
        if (tallies.isEmpty()) {
            throw new InputValidationException("Sensitive attribute '" + attribute + "' has no groups");
        }

        Map<String, GroupTally> retained = new TreeMap<>();
        Map<String, Long> excluded = new TreeMap<>();
        tallies.forEach((group, t) -> {
            if (t.getCount() >= settings.getMinGroupSize()) {
                retained.put(group, t);
            } else {
                excluded.put(group, t.getCount());
            }
        });
        if (!excluded.isEmpty()) {
            log.debug("Groups below minimum size excluded | attribute={} | groups={}", attribute, excluded);
        }

        Map<String, Double> rates = new TreeMap<>();
        Map<String, Long> counts = new TreeMap<>();
        Map<String, Double> accuracy = new TreeMap<>();
        retained.forEach((group, t) -> {
            rates.put(group, t.selectionRate());
            counts.put(group, t.getCount());
            if (t.accuracy() != null) {
                accuracy.put(group, t.accuracy());
            }
        });

        AnalysisSettings.Thresholds thresholds = settings.getThresholds();
        MetricResult di;
        MetricResult parity;
        MetricResult eqOdds;
        if (retained.size() < 2) {
            String reason = "Fewer than two groups with at least " + settings.getMinGroupSize() + " members";
            di = MetricResult.notApplicable(thresholds.getDisparateImpact(), reason);
            parity = MetricResult.notApplicable(thresholds.getParityDiff(), reason);
            eqOdds = MetricResult.notApplicable(thresholds.getEqOddsDiff(), reason);
        } else {
            DoubleSummaryStatistics stats = rates.values().stream().mapToDouble(Double::doubleValue).summaryStatistics();
            double ratio = stats.getMax() > 0 ? stats.getMin() / stats.getMax() : 1.0;
            di = MetricResult.atLeast(ratio, thresholds.getDisparateImpact());
            parity = MetricResult.atMost(stats.getMax() - stats.getMin(), thresholds.getParityDiff());
            eqOdds = equalizedOdds(retained.values(), hasLabels(labels), thresholds.getEqOddsDiff());
        }

        AttributeFairness result = AttributeFairness.builder()
            .attribute(attribute)
            .selectionRateByGroup(rates)
            .groupCounts(counts)
            .excludedGroups(excluded)
            .accuracyByGroup(accuracy.isEmpty() ? null : accuracy)
            .disparateImpact(di)
            .demographicParityDifference(parity)
            .equalizedOddsDifference(eqOdds)
            .compositeScore(0)
            .build();
        return result.toBuilder().compositeScore(score(result.failedMetricCount())).build();
    }

    int score(long failedMetrics) {
        return (int) Math.max(0, 100 - failedMetrics * settings.getScorePenalty());
    }

    private MetricResult equalizedOdds(Collection<GroupTally> groups, boolean labelsSupplied, double threshold) {
        if (!labelsSupplied) {
            return MetricResult.notApplicable(threshold, "Ground-truth labels were not supplied");
        }
        List<Double> tprs = groups.stream().map(GroupTally::truePositiveRate).filter(Objects::nonNull).toList();
        List<Double> fprs = groups.stream().map(GroupTally::falsePositiveRate).filter(Objects::nonNull).toList();
        if (tprs.size() < 2 && fprs.size() < 2) {
            return MetricResult.notApplicable(threshold,
                "Fewer than two groups have labelled outcomes to compare error rates");
        }
        double diff = Math.max(spread(tprs), spread(fprs));
        return MetricResult.atMost(diff, threshold);
    }

    private static double spread(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        DoubleSummaryStatistics stats = values.stream().mapToDouble(Double::doubleValue).summaryStatistics();
        return stats.getMax() - stats.getMin();
    }

    static Map<String, GroupTally> tally(List<Integer> predictions, List<Integer> labels,
                                         List<String> groups, int positiveLabel) {
        Map<String, GroupTally> tallies = new TreeMap<>();
        for (int i = 0; i < predictions.size(); i++) {
            String group = groups.get(i);
            if (group == null) {
                continue;
            }
            Integer label = labels != null ? labels.get(i) : null;
            tallies.computeIfAbsent(group, g -> new GroupTally()).add(predictions.get(i), label, positiveLabel);
        }
        return tallies;
    }

    static List<String> column(String attribute, List<Map<String, Object>> rows) {
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object raw = row != null ? row.get(attribute) : null;
            values.add(raw != null ? String.valueOf(raw) : null);
        }
        return values;
    }

    static void validateInputs(List<Integer> predictions, List<Integer> labels) {
        if (predictions == null || predictions.isEmpty()) {
            throw new InputValidationException("Predictions must contain at least one value");
        }
        if (predictions.stream().anyMatch(Objects::isNull)) {
            throw new InputValidationException("Predictions must not contain null values");
        }
        if (labels != null && labels.size() != predictions.size()) {
            throw new InputValidationException("Labels have " + labels.size()
                + " values but there are " + predictions.size() + " predictions");
        }
    }

    static boolean hasLabels(List<Integer> labels) {
        return labels != null && labels.stream().anyMatch(Objects::nonNull);
    }
}

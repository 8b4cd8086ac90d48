package com.driftguardian.analysis;

import com.driftguardian.exception.InputValidationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Selection-rate disparities across combinations of sensitive attributes.
 * <p>
 * Combinations are enumerated in lexicographic order of the configured
 * attributes, from size 2 up to {@code maxCombinationSize}. The cap keeps the
 * number of combinations and composite groups bounded.
 */
@Slf4j
public class IntersectionalAnalyzer {

    private static final int WORST_GROUPS_IN_SUMMARY = 3;

    @Getter
    private final List<String> sensitiveAttributes;
    @Getter
    private final int maxCombinationSize;
    private final AnalysisSettings settings;

    public IntersectionalAnalyzer(List<String> sensitiveAttributes) {
        this(sensitiveAttributes, AnalysisSettings.defaults());
    }

    public IntersectionalAnalyzer(List<String> sensitiveAttributes, AnalysisSettings settings) {
        if (sensitiveAttributes == null || sensitiveAttributes.isEmpty()) {
            throw new InputValidationException("At least one sensitive attribute must be configured");
        }
        this.settings = settings.validate();
        this.sensitiveAttributes = List.copyOf(sensitiveAttributes);
        this.maxCombinationSize = Math.min(settings.getMaxCombinationSize(), sensitiveAttributes.size());
    }

    public Leaderboard evaluate(List<Integer> predictions, List<Map<String, Object>> sensitiveRows) {
        return evaluate(predictions, sensitiveRows, settings.getMinGroupSize());
    }

    public Leaderboard evaluate(List<Integer> predictions, List<Map<String, Object>> sensitiveRows,
                                int minGroupSize) {
        if (maxCombinationSize < 2) {
            BiasAnalyzer.validateInputs(predictions, null);
            if (minGroupSize < 1) {
                throw new InputValidationException("minGroupSize must be >= 1");
            }
            log.info("Intersectional analysis skipped | attributes={} | reason=fewer than two attributes",
                     sensitiveAttributes);
            return Leaderboard.builder()
                .minGroupSize(minGroupSize)
                .combinations(List.of())
                .skippedCombinations(List.of())
                .entries(List.of())
                .intersectionalFairnessScore(100)
                .summary(summarize(List.of(), 100))
                .build();
        }
        return evaluate(predictions, null, sensitiveRows, minGroupSize, 2, maxCombinationSize);
    }

    public Leaderboard evaluate(List<Integer> predictions, List<Integer> labels,
                                List<Map<String, Object>> sensitiveRows, int minGroupSize,
                                int fromSize, int toSize) {
        BiasAnalyzer.validateInputs(predictions, labels);
        if (sensitiveRows == null || sensitiveRows.isEmpty()) {
            throw new InputValidationException("Sensitive features must contain at least one row");
        }
        if (sensitiveRows.size() != predictions.size()) {
            throw new InputValidationException("Sensitive features have " + sensitiveRows.size()
                + " rows but there are " + predictions.size() + " predictions");
        }
        if (minGroupSize < 1) {
            throw new InputValidationException("minGroupSize must be >= 1");
        }
        if (fromSize < 1 || fromSize > toSize || toSize > maxCombinationSize) {
            throw new InputValidationException("Combination sizes must satisfy 1 <= from <= to <= "
                + maxCombinationSize + ", got " + fromSize + ".." + toSize);
        }

        List<CombinationResult> combinations = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (int size = fromSize; size <= toSize; size++) {
            for (List<String> combo : combinations(sensitiveAttributes, size)) {
                CombinationResult result = evaluateCombination(combo, predictions, labels, sensitiveRows, minGroupSize);
                if (result == null) {
                    skipped.add(String.join(GroupKey.SEPARATOR, combo));
                } else {
                    combinations.add(result);
                }
            }
        }

        List<IntersectionalGroup> entries = new ArrayList<>();
        combinations.forEach(c -> entries.addAll(c.getGroups().values()));
        entries.sort(Comparator.comparingDouble(IntersectionalGroup::getDisparityRatio));
        List<IntersectionalGroup> ranked = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            ranked.add(entries.get(i).toBuilder().rank(i + 1).build());
        }

        long violating = combinations.stream().filter(CombinationResult::isViolation).count();
        int score = (int) Math.max(0, 100 - violating * settings.getScorePenalty());

        log.info("Intersectional analysis complete | combinations={} | groups={} | violatingCombinations={} | score={}",
                 combinations.size(), ranked.size(), violating, score);

        return Leaderboard.builder()
            .minGroupSize(minGroupSize)
            .combinations(List.copyOf(combinations))
            .skippedCombinations(List.copyOf(skipped))
            .entries(List.copyOf(ranked))
            .intersectionalFairnessScore(score)
            .summary(summarize(ranked, score))
            .build();
    }

    private CombinationResult evaluateCombination(List<String> combo, List<Integer> predictions,
                                                  List<Integer> labels, List<Map<String, Object>> rows,
                                                  int minGroupSize) {
        Map<GroupKey, GroupTally> tallies = new TreeMap<>();
        int positive = settings.getPositiveLabel();
        for (int i = 0; i < rows.size(); i++) {
            GroupKey key = keyOf(combo, rows.get(i));
            if (key == null) {
                continue;
            }
            Integer label = labels != null ? labels.get(i) : null;
            tallies.computeIfAbsent(key, k -> new GroupTally()).add(predictions.get(i), label, positive);
        }
        if (tallies.isEmpty()) {
            return null;
        }

        String name = String.join(GroupKey.SEPARATOR, combo);
        Map<GroupKey, GroupTally> retained = new TreeMap<>();
        Map<String, Long> excluded = new LinkedHashMap<>();
        tallies.forEach((key, t) -> {
            if (t.getCount() >= minGroupSize) {
                retained.put(key, t);
            } else {
                excluded.put(key.label(), t.getCount());
            }
        });

        double maxRate = retained.values().stream().mapToDouble(GroupTally::selectionRate).max().orElse(0.0);
        double threshold = settings.getThresholds().getDisparateImpact();
        Map<String, IntersectionalGroup> groups = new LinkedHashMap<>();
        boolean violation = false;
        for (Map.Entry<GroupKey, GroupTally> e : retained.entrySet()) {
            GroupTally t = e.getValue();
            double ratio = maxRate > 0 ? t.selectionRate() / maxRate : 1.0;
            boolean violates = ratio < threshold;
            violation |= violates;
            groups.put(e.getKey().label(), IntersectionalGroup.builder()
                .combination(name)
                .attributes(combo)
                .key(e.getKey().values())
                .group(e.getKey().label())
                .selectionRate(t.selectionRate())
                .count(t.getCount())
                .disparityRatio(ratio)
                .violation(violates)
                .status(GroupStatus.of(ratio, threshold))
                .accuracy(t.accuracy())
                .build());
        }

        return CombinationResult.builder()
            .combination(name)
            .attributes(combo)
            .groups(groups)
            .excludedGroups(excluded)
            .violation(violation)
            .build();
    }

    private static GroupKey keyOf(List<String> combo, Map<String, Object> row) {
        if (row == null) {
            return null;
        }
        List<String> values = new ArrayList<>(combo.size());
        for (String attribute : combo) {
            Object raw = row.get(attribute);
            if (raw == null) {
                return null;
            }
            values.add(String.valueOf(raw));
        }
        return new GroupKey(values);
    }

    static List<List<String>> combinations(List<String> attributes, int size) {
        List<List<String>> out = new ArrayList<>();
        if (size < 1 || size > attributes.size()) {
            return out;
        }
        int[] idx = new int[size];
        for (int i = 0; i < size; i++) {
            idx[i] = i;
        }
        int n = attributes.size();
        while (true) {
            List<String> combo = new ArrayList<>(size);
            for (int i : idx) {
                combo.add(attributes.get(i));
            }
            out.add(List.copyOf(combo));

            int i = size - 1;
            while (i >= 0 && idx[i] == n - size + i) {
                i--;
            }
            if (i < 0) {
                return out;
            }
            idx[i]++;
            for (int j = i + 1; j < size; j++) {
                idx[j] = idx[j - 1] + 1;
            }
        }
    }

    private String summarize(List<IntersectionalGroup> ranked, int score) {
        List<IntersectionalGroup> violations = ranked.stream().filter(IntersectionalGroup::isViolation).toList();
        if (violations.isEmpty()) {
            return "No significant intersectional bias detected.";
        }
        StringBuilder sb = new StringBuilder("Intersectional bias detected.\n\n")
            .append("The following groups show significantly lower selection rates:\n\n");
        int n = 1;
        for (IntersectionalGroup g : violations.subList(0, Math.min(WORST_GROUPS_IN_SUMMARY, violations.size()))) {
            sb.append(n++).append(". ").append(g.getGroup()).append(" (").append(g.getCombination()).append(")\n")
                .append(String.format(Locale.ROOT, "   - Selection rate: %.1f%%%n", g.getSelectionRate() * 100))
                .append(String.format(Locale.ROOT, "   - Disparity ratio: %.2f (%s four-fifths rule)%n",
                    g.getDisparityRatio(), g.getStatus() == GroupStatus.FAIL ? "fails" : "passes"))
                .append("   - Sample size: ").append(g.getCount()).append('\n');
        }
        sb.append('\n');
        if (score < 60) {
            sb.append("Recommendation: immediate investigation required; the pattern suggests intersectional discrimination.");
        } else if (score < 80) {
            sb.append("Recommendation: monitor closely and consider mitigation.");
        } else {
            sb.append("Status: intersectional fairness is within acceptable levels.");
        }
        return sb.toString();
    }
}

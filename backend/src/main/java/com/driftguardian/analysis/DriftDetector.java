package com.driftguardian.analysis;

import com.driftguardian.exception.InputValidationException;
import com.driftguardian.exception.InsufficientDataException;
import com.driftguardian.exception.UnsupportedTypeException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares batches of feature rows against a baseline captured at registration.
 * <p>
 * The baseline and schema are copied on construction and never change afterwards,
 * so one detector can serve concurrent {@link #detect} calls.
 */
@Slf4j
public class DriftDetector {

    static final String NUMERICAL_METRIC = "KS+PSI";
    static final String CATEGORICAL_METRIC = "Chi-square";

    @Getter
    private final FeatureSchema schema;
    private final List<Map<String, Object>> baseline;
    private final AnalysisSettings settings;
    private final StatisticalTests tests;

    public DriftDetector(FeatureSchema schema, List<Map<String, Object>> baselineRows) {
        this(schema, baselineRows, AnalysisSettings.defaults(), new CommonsMathStatisticalTests());
    }

    public DriftDetector(FeatureSchema schema, List<Map<String, Object>> baselineRows,
                         AnalysisSettings settings, StatisticalTests tests) {
        if (schema == null) {
            throw new InputValidationException("A feature schema is required to register a baseline");
        }
        if (baselineRows == null || baselineRows.isEmpty()) {
            throw new InputValidationException("Baseline data must contain at least one row");
        }
        this.schema = schema;
        this.baseline = freeze(baselineRows);
        this.settings = settings.validate();
        this.tests = tests;
    }

    public List<Map<String, Object>> getBaseline() {
        return baseline;
    }

    public DriftReport detect(List<Map<String, Object>> currentRows) {
        if (currentRows == null || currentRows.isEmpty()) {
            throw new InputValidationException("Current batch is empty; there is nothing to compare");
        }

        List<FeatureDrift> results = new ArrayList<>();
        for (String feature : schema.getNumericalFeatures()) {
            results.add(numericalDrift(feature, currentRows));
        }
        for (String feature : schema.getCategoricalFeatures()) {
            results.add(categoricalDrift(feature, currentRows));
        }

        long alerts = results.stream().filter(FeatureDrift::isAlert).count();
        log.info("Drift detection complete | features={} | alerts={} | baselineSize={} | currentSize={}",
                 results.size(), alerts, baseline.size(), currentRows.size());

        return DriftReport.builder()
            .baselineSize(baseline.size())
            .currentSize(currentRows.size())
            .features(List.copyOf(results))
            .build();
    }

    private FeatureDrift numericalDrift(String feature, List<Map<String, Object>> currentRows) {
        String missingSide = missingSide(feature, currentRows);
        if (missingSide != null) {
            return FeatureDrift.skipped(feature, FeatureKind.NUMERICAL, NUMERICAL_METRIC,
                DriftStatus.MISSING_FEATURE, "Feature is missing from the " + missingSide + " data");
        }

        double[] base;
        double[] cur;
        try {
            base = numericColumn(feature, baseline);
            cur = numericColumn(feature, currentRows);
        } catch (UnsupportedTypeException ex) {
            log.warn("Skipping drift scoring | feature={} | reason={}", feature, ex.getMessage());
            return FeatureDrift.skipped(feature, FeatureKind.NUMERICAL, NUMERICAL_METRIC,
                DriftStatus.SKIPPED_UNSUPPORTED_TYPE, ex.getMessage());
        }

        if (cur.length == 0 || base.length == 0) {
            return FeatureDrift.skipped(feature, FeatureKind.NUMERICAL, NUMERICAL_METRIC,
                DriftStatus.MISSING_FEATURE, "Feature has no non-null values in the "
                    + (base.length == 0 ? "baseline" : "current") + " data");
        }

        StatisticalTests.TestOutcome ks;
        try {
            ks = tests.twoSample(base, cur);
        } catch (InsufficientDataException ex) {
            return FeatureDrift.skipped(feature, FeatureKind.NUMERICAL, NUMERICAL_METRIC,
                DriftStatus.INSUFFICIENT_DATA, ex.getMessage());
        }

        AnalysisSettings.Thresholds thresholds = settings.getThresholds();
        double psi = PopulationStabilityIndex.compute(base, cur, settings.getPsiBins());
        boolean ksSignificant = ks.pValue() < thresholds.getPValue();
        boolean alert = psi > thresholds.getPsiMinor() || ksSignificant;

        DriftSeverity severity = PopulationStabilityIndex.band(psi, thresholds);
        if (ksSignificant && severity == DriftSeverity.NONE) {
            severity = DriftSeverity.MINOR;
        }

        return FeatureDrift.builder()
            .feature(feature)
            .kind(FeatureKind.NUMERICAL)
            .metric(NUMERICAL_METRIC)
            .score(ks.statistic())
            .pValue(ks.pValue())
            .psi(psi)
            .alert(alert)
            .severity(severity)
            .status(DriftStatus.SCORED)
            .build();
    }

    private FeatureDrift categoricalDrift(String feature, List<Map<String, Object>> currentRows) {
        String missingSide = missingSide(feature, currentRows);
        if (missingSide != null) {
            return FeatureDrift.skipped(feature, FeatureKind.CATEGORICAL, CATEGORICAL_METRIC,
                DriftStatus.MISSING_FEATURE, "Feature is missing from the " + missingSide + " data");
        }

        Map<String, Long> baseCounts = categoryCounts(feature, baseline);
        Map<String, Long> curCounts = categoryCounts(feature, currentRows);
        long baseTotal = baseCounts.values().stream().mapToLong(Long::longValue).sum();
        long curTotal = curCounts.values().stream().mapToLong(Long::longValue).sum();
        if (baseTotal == 0 || curTotal == 0) {
            return FeatureDrift.skipped(feature, FeatureKind.CATEGORICAL, CATEGORICAL_METRIC,
                DriftStatus.MISSING_FEATURE, "Feature has no non-null values in the "
                    + (baseTotal == 0 ? "baseline" : "current") + " data");
        }

        Set<String> categories = new TreeSet<>(baseCounts.keySet());
        categories.addAll(curCounts.keySet());

        List<Double> expected = new ArrayList<>();
        List<Long> observed = new ArrayList<>();
        long pooledBase = 0L;
        long pooledObserved = 0L;
        for (String category : categories) {
            long baseCount = baseCounts.getOrDefault(category, 0L);
            long curCount = curCounts.getOrDefault(category, 0L);
            double exp = (double) baseCount / baseTotal * curTotal;
            if (exp < settings.getMinExpectedFrequency() || exp <= 0.0) {
                pooledBase += baseCount;
                pooledObserved += curCount;
                continue;
            }
            expected.add(exp);
            observed.add(curCount);
        }

        // Unseen and rare categories share one "other" cell so mass moving into them still counts.
        if (!expected.isEmpty() && (pooledBase > 0 || pooledObserved > 0)) {
            double share = Math.max((double) pooledBase / baseTotal, PopulationStabilityIndex.EPSILON);
            expected.add(share * curTotal);
            observed.add(pooledObserved);
        }

        StatisticalTests.TestOutcome chi;
        try {
            chi = tests.chiSquare(
                expected.stream().mapToDouble(Double::doubleValue).toArray(),
                observed.stream().mapToLong(Long::longValue).toArray());
        } catch (InsufficientDataException ex) {
            return insufficientCategories(feature);
        }
        if (Double.isNaN(chi.statistic()) || Double.isNaN(chi.pValue())) {
            log.warn("Chi-square produced no usable result | feature={}", feature);
            return insufficientCategories(feature);
        }

        boolean alert = chi.pValue() < settings.getThresholds().getPValue();
        return FeatureDrift.builder()
            .feature(feature)
            .kind(FeatureKind.CATEGORICAL)
            .metric(CATEGORICAL_METRIC)
            .score(chi.statistic())
            .pValue(chi.pValue())
            .alert(alert)
            .severity(alert ? DriftSeverity.MAJOR : DriftSeverity.NONE)
            .status(DriftStatus.SCORED)
            .build();
    }

    private FeatureDrift insufficientCategories(String feature) {
        FeatureDrift skipped = FeatureDrift.skipped(feature, FeatureKind.CATEGORICAL, CATEGORICAL_METRIC,
            DriftStatus.INSUFFICIENT_DATA,
            "Fewer than two categories have an expected count of at least "
                + settings.getMinExpectedFrequency());
        return skipped.toBuilder().pValue(1.0).build();
    }

    private String missingSide(String feature, List<Map<String, Object>> currentRows) {
        if (baseline.stream().noneMatch(row -> row.containsKey(feature))) {
            return "baseline";
        }
        if (currentRows.stream().noneMatch(row -> row != null && row.containsKey(feature))) {
            return "current";
        }
        return null;
    }

    static double[] numericColumn(String feature, List<Map<String, Object>> rows) {
        List<Double> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (row == null) {
                continue;
            }
            Object raw = row.get(feature);
            if (raw == null) {
                continue;
            }
            if (!(raw instanceof Number number)) {
                throw new UnsupportedTypeException(feature, raw);
            }
            double v = number.doubleValue();
            if (!Double.isNaN(v)) {
                values.add(v);
            }
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static Map<String, Long> categoryCounts(String feature, List<Map<String, Object>> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            if (row == null) {
                continue;
            }
            Object raw = row.get(feature);
            if (raw != null) {
                counts.merge(String.valueOf(raw), 1L, Long::sum);
            }
        }
        return counts;
    }

    private static List<Map<String, Object>> freeze(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (row != null) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        if (copy.isEmpty()) {
            throw new InputValidationException("Baseline data must contain at least one row");
        }
        return Collections.unmodifiableList(copy);
    }
}

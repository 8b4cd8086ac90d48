package com.driftguardian.analysis;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Population Stability Index over equal-frequency bins of the baseline.
 */
public final class PopulationStabilityIndex {

    static final double EPSILON = 1e-4;

    private PopulationStabilityIndex() {
    }

    public static double compute(double[] baseline, double[] current, int bins) {
        if (baseline.length == 0 || current.length == 0) {
            return 0.0;
        }
        double[] edges = binEdges(baseline, bins);
        if (edges.length < 2) {
            return 0.0;
        }
        double[] basePct = proportions(baseline, edges);
        double[] curPct = proportions(current, edges);

        double psi = 0.0;
        for (int i = 0; i < basePct.length; i++) {
            double b = basePct[i] == 0.0 ? EPSILON : basePct[i];
            double c = curPct[i] == 0.0 ? EPSILON : curPct[i];
            psi += (c - b) * Math.log(c / b);
        }
        return psi;
    }

    public static DriftSeverity band(double psi, AnalysisSettings.Thresholds thresholds) {
        if (psi > thresholds.getPsiMajor()) {
            return DriftSeverity.MAJOR;
        }
        if (psi >= thresholds.getPsiMinor()) {
            return DriftSeverity.MINOR;
        }
        return DriftSeverity.NONE;
    }

    static double[] binEdges(double[] baseline, int bins) {
        double[] sorted = baseline.clone();
        Arrays.sort(sorted);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(sorted);

        double[] edges = new double[bins + 1];
        edges[0] = sorted[0];
        for (int i = 1; i <= bins; i++) {
            edges[i] = percentile.evaluate(100.0 * i / bins);
        }
        return Arrays.stream(edges).distinct().toArray();
    }

    static double[] proportions(double[] values, double[] edges) {
        int binCount = edges.length - 1;
        long[] counts = new long[binCount];
        for (double v : values) {
            counts[binIndex(v, edges)]++;
        }
        double[] pct = new double[binCount];
        for (int i = 0; i < binCount; i++) {
            pct[i] = (double) counts[i] / values.length;
        }
        return pct;
    }

    // [e_i, e_{i+1}) with the last bin closed; out-of-range values clip to the edge bins
    static int binIndex(double value, double[] edges) {
        int last = edges.length - 2;
        if (value < edges[1]) {
            return 0;
        }
        if (value >= edges[last]) {
            return last;
        }
        int pos = Arrays.binarySearch(edges, value);
        return pos >= 0 ? pos : -pos - 2;
    }
}

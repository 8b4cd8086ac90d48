package com.driftguardian.analysis;

import java.util.List;

/**
 * Per-instance, per-feature attribution scores; {@code values[row][feature]}
 * lines up with {@code features}.
 */
public record FeatureAttributions(List<String> features, double[][] values) {

    public double[] meanAbsolute() {
        double[] means = new double[features.size()];
        if (values.length == 0) {
            return means;
        }
        for (double[] row : values) {
            for (int f = 0; f < means.length; f++) {
                means[f] += Math.abs(row[f]);
            }
        }
        for (int f = 0; f < means.length; f++) {
            means[f] /= values.length;
        }
        return means;
    }
}

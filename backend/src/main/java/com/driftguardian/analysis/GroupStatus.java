package com.driftguardian.analysis;

public enum GroupStatus {
    PASS,
    WARN,
    FAIL;

    private static final double WARN_MARGIN = 0.1;

    public static GroupStatus of(double disparityRatio, double threshold) {
        if (disparityRatio < threshold) {
            return FAIL;
        }
        if (disparityRatio < threshold + WARN_MARGIN) {
            return WARN;
        }
        return PASS;
    }
}

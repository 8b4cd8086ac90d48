package com.driftguardian.analysis;

public enum DriftStatus {
    SCORED,
    SKIPPED_UNSUPPORTED_TYPE,
    MISSING_FEATURE,
    INSUFFICIENT_DATA
}

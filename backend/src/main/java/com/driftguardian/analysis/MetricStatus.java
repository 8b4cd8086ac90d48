package com.driftguardian.analysis;

public enum MetricStatus {
    PASS,
    FAIL,
    NOT_APPLICABLE
}

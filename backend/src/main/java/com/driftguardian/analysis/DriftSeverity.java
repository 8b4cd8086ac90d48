package com.driftguardian.analysis;

public enum DriftSeverity {
    NONE,
    MINOR,
    MAJOR
}

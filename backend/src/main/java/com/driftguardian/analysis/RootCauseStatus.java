package com.driftguardian.analysis;

public enum RootCauseStatus {
    AVAILABLE,
    UNAVAILABLE
}

package com.driftguardian.analysis;

public enum FeatureKind {
    NUMERICAL,
    CATEGORICAL
}

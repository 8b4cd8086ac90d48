package com.driftguardian.analysis;

public enum ChangeDirection {
    INCREASED,
    DECREASED,
    UNCHANGED;

    public static ChangeDirection of(double delta) {
        if (delta > 0) {
            return INCREASED;
        }
        if (delta < 0) {
            return DECREASED;
        }
        return UNCHANGED;
    }
}

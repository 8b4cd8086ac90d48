package com.driftguardian.dto;

public enum JobType {
    ANALYSIS,
    ROOT_CAUSE
}

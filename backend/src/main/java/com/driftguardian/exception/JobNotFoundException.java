package com.driftguardian.exception;

import java.util.UUID;

public class JobNotFoundException extends DriftGuardianException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Job with id '" + jobId + "' not found.");
    }
}

package com.driftguardian.exception;

import lombok.Getter;

@Getter
public abstract class DriftGuardianException extends RuntimeException {
    private final String errorCode;
    protected DriftGuardianException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DriftGuardianException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}

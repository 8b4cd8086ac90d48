package com.driftguardian.exception;

public class InsufficientDataException extends DriftGuardianException {
    public InsufficientDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}

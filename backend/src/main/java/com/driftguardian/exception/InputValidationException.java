package com.driftguardian.exception;

public class InputValidationException extends DriftGuardianException {
    public InputValidationException(String message) {
        super("INPUT_VALIDATION_ERROR", message);
    }
}

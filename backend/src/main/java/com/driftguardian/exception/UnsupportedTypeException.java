package com.driftguardian.exception;

public class UnsupportedTypeException extends DriftGuardianException {
    public UnsupportedTypeException(String feature, Object value) {
        super("UNSUPPORTED_TYPE",
              "Feature '" + feature + "' is declared numerical but holds a non-numeric value of type "
              + (value == null ? "null" : value.getClass().getSimpleName()) + ".");
    }
}

package com.driftguardian.exception;

public class UnsupportedModelException extends DriftGuardianException {
    public UnsupportedModelException(String modelType) {
        super("UNSUPPORTED_MODEL",
              "The attribution engine cannot explain models of type '" + modelType + "'.");
    }
}

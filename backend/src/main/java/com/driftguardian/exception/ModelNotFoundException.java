package com.driftguardian.exception;

public class ModelNotFoundException extends DriftGuardianException {
    public ModelNotFoundException(String modelId) {
        super("MODEL_NOT_FOUND", "Model '" + modelId + "' is not registered.");
    }
}

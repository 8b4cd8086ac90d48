package com.driftguardian.exception;

public class AttributionApiException extends DriftGuardianException {
    public AttributionApiException(String message) {
        super("ATTRIBUTION_API_ERROR", message);
    }
    public AttributionApiException(String message, Throwable cause) {
        super("ATTRIBUTION_API_ERROR", message, cause);
    }
}

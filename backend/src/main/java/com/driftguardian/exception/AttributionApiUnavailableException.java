package com.driftguardian.exception;

public class AttributionApiUnavailableException extends DriftGuardianException {
    public AttributionApiUnavailableException(Throwable cause) {
        super("ATTRIBUTION_API_UNAVAILABLE",
              "The attribution service is currently unavailable. Please try again later.",
              cause);
    }
}

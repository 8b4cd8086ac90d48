package com.driftguardian.analysis;

/**
 * Identifies the deployed model an attribution engine should explain.
 */
public record ModelReference(String modelId, String modelType) {}

package com.autocoder.features.service;

/**
 * Thrown when a transition only valid for pending features is applied to a
 * feature that already passes (skipping it, or recording a failure for it).
 */
public class FeatureAlreadyPassingException extends RuntimeException {

    private final long featureId;

    /**
     * @param action what was attempted, e.g. "skip"
     */
    public FeatureAlreadyPassingException(long featureId, String action) {
        super("Cannot " + action + " a feature that is already passing (ID " + featureId + ")");
        this.featureId = featureId;
    }

    public long getFeatureId() { return featureId; }
}

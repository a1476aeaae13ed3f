package com.autocoder.features.service;

public class FeatureNotFoundException extends RuntimeException {

    private final long featureId;

    public FeatureNotFoundException(long featureId) {
        super("Feature with ID " + featureId + " not found");
        this.featureId = featureId;
    }

    public long getFeatureId() { return featureId; }
}

package com.autocoder.features.service;

/**
 * Result of recording one failure.
 * thresholdExceeded means the next fetch-next will auto-skip the feature.
 */
public record FailureRecord(long featureId,
                            String featureName,
                            int failureCount,
                            int maxFailures,
                            boolean thresholdExceeded) {}

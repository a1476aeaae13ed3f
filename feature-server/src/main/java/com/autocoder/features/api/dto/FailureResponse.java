package com.autocoder.features.api.dto;

import com.autocoder.features.service.FailureRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response body for POST /features/{id}/failures.
 * warning is only present once the failure threshold has been reached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureResponse(
        long    featureId,
        String  featureName,
        int     failureCount,
        int     maxFailures,
        boolean thresholdExceeded,
        String  message,
        String  warning
) {
    public static FailureResponse from(FailureRecord r) {
        return new FailureResponse(
                r.featureId(),
                r.featureName(),
                r.failureCount(),
                r.maxFailures(),
                r.thresholdExceeded(),
                "Recorded failure #" + r.failureCount() + " for feature '" + r.featureName() + "'",
                r.thresholdExceeded() ? "Feature will be auto-skipped on next attempt" : null
        );
    }
}

package com.autocoder.features.api.dto;

import com.autocoder.features.model.Feature;

import java.util.List;

/**
 * Snapshot of one feature as the agent sees it.
 */
public record FeatureResponse(
        Long         id,
        int          priority,
        String       category,
        String       name,
        String       description,
        List<String> steps,
        boolean      passes,
        boolean      inProgress,
        int          failureCount,
        String       lastError
) {
    public static FeatureResponse from(Feature f) {
        return new FeatureResponse(
                f.getId(),
                f.getPriority(),
                f.getCategory(),
                f.getName(),
                f.getDescription(),
                List.copyOf(f.getSteps()),
                f.isPasses(),
                f.isInProgress(),
                f.getFailureCount(),
                f.getLastError()
        );
    }
}

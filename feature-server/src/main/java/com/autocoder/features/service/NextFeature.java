package com.autocoder.features.service;

import com.autocoder.features.model.Feature;

/**
 * Outcome of one fetch-next call.
 *
 * <ul>
 *   <li>{@link Assigned}: a pending feature was claimed.</li>
 *   <li>{@link Resumed}: a feature was already in progress (previous session
 *       crashed or was stopped) and is handed back unchanged.</li>
 *   <li>{@link AutoSkipped}: the in-progress feature had reached the failure
 *       threshold and was moved to the back. The caller should fetch again.</li>
 *   <li>{@link Blocked}: every remaining feature is at the threshold.</li>
 *   <li>{@link AllComplete}: nothing left to do.</li>
 * </ul>
 */
public sealed interface NextFeature
        permits NextFeature.Assigned, NextFeature.Resumed, NextFeature.AutoSkipped,
                NextFeature.Blocked, NextFeature.AllComplete {

    /** attemptsRemaining is null when the feature has never failed. */
    record Assigned(Feature feature, Integer attemptsRemaining) implements NextFeature {}

    record Resumed(Feature feature, int attemptsRemaining) implements NextFeature {}

    /** failureCount is the count before the reset. */
    record AutoSkipped(long featureId,
                       String featureName,
                       int failureCount,
                       String lastError,
                       int oldPriority,
                       int newPriority) implements NextFeature {}

    record Blocked(long blockedCount) implements NextFeature {}

    record AllComplete() implements NextFeature {}
}

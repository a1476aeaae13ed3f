package com.autocoder.features.service;

import com.autocoder.features.model.Feature;
import com.autocoder.features.repository.FeatureRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * The feature queue: scheduling, outcome recording and bulk loading.
 *
 * Each public method is one transaction (begin → read/mutate → commit), so a
 * crash between calls leaves the last committed state intact and the agent
 * can resume from it. Only one agent is expected to call in at a time.
 */
@Service
public class FeatureQueueService {

    private static final Logger log = LoggerFactory.getLogger(FeatureQueueService.class);

    /** Consecutive failures after which a feature is auto-skipped on the next fetch. */
    public static final int MAX_FEATURE_FAILURES = 5;

    public static final int MAX_REGRESSION_LIMIT = 10;

    private static final int MAX_CATEGORY_LENGTH = 100;
    private static final int MAX_NAME_LENGTH     = 255;

    private final FeatureRepository featureRepo;
    private final MeterRegistry     meterRegistry;
    private final Random            random;

    public FeatureQueueService(FeatureRepository featureRepo,
                               MeterRegistry meterRegistry,
                               Random regressionRandom) {
        this.featureRepo   = featureRepo;
        this.meterRegistry = meterRegistry;
        this.random        = regressionRandom;
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    /**
     * Hand the agent its next feature.
     *
     *  1. An in-progress feature is resumed, or auto-skipped if it has
     *     reached MAX_FEATURE_FAILURES.
     *  2. Otherwise the lowest (priority, id) pending feature under the
     *     threshold is claimed.
     *  3. With nothing eligible the queue is either blocked or complete.
     *
     * Auto-skip only happens here, never in recordFailure().
     */
    @Transactional
    public NextFeature fetchNext() {
        List<Feature> inProgress = featureRepo.findByInProgressTrueOrderByPriorityAscIdAsc();
        if (!inProgress.isEmpty()) {
            if (inProgress.size() > 1) {
                log.warn("{} features are marked in progress, expected at most one; resuming {}",
                        inProgress.size(), inProgress.get(0).getId());
            }
            return resumeOrAutoSkip(inProgress.get(0));
        }

        Optional<Feature> next = featureRepo
                .findFirstByPassesFalseAndFailureCountLessThanOrderByPriorityAscIdAsc(MAX_FEATURE_FAILURES);

        if (next.isEmpty()) {
            long blocked = featureRepo.countByPassesFalseAndFailureCountGreaterThanEqual(MAX_FEATURE_FAILURES);
            if (blocked > 0) {
                log.warn("Queue blocked: {} features reached {} failures, manual intervention required",
                        blocked, MAX_FEATURE_FAILURES);
                return new NextFeature.Blocked(blocked);
            }
            log.info("All features are passing");
            return new NextFeature.AllComplete();
        }

        Feature feature = next.get();
        feature.claim();
        featureRepo.save(feature);
        count("assigned");
        log.info("Assigned feature {} '{}' (priority={}, failures={})",
                feature.getId(), feature.getName(), feature.getPriority(), feature.getFailureCount());

        Integer attemptsRemaining = feature.getFailureCount() > 0
                ? MAX_FEATURE_FAILURES - feature.getFailureCount()
                : null;
        return new NextFeature.Assigned(feature, attemptsRemaining);
    }

    private NextFeature resumeOrAutoSkip(Feature feature) {
        int failures = feature.getFailureCount();
        if (failures < MAX_FEATURE_FAILURES) {
            count("resumed");
            log.info("Resuming in-progress feature {} '{}' ({} attempts remaining)",
                    feature.getId(), feature.getName(), MAX_FEATURE_FAILURES - failures);
            return new NextFeature.Resumed(feature, MAX_FEATURE_FAILURES - failures);
        }

        int oldPriority = feature.getPriority();
        int newPriority = nextTailPriority();
        feature.moveToBack(newPriority, false);
        featureRepo.save(feature);
        count("auto_skipped");
        log.warn("Auto-skipped feature {} '{}' after {} consecutive failures (priority {} -> {}). Last error: {}",
                feature.getId(), feature.getName(), failures, oldPriority, newPriority, feature.getLastError());

        return new NextFeature.AutoSkipped(
                feature.getId(), feature.getName(), failures, feature.getLastError(), oldPriority, newPriority);
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    /**
     * Mark a feature as passing. Clears in-progress and failure state.
     * Calling it again on a passing feature changes nothing.
     */
    @Transactional
    public Feature markPassing(long featureId) {
        Feature feature = load(featureId);
        feature.markPassing();
        featureRepo.save(feature);
        count("passing");
        log.info("Feature {} '{}' marked passing", feature.getId(), feature.getName());
        return feature;
    }

    /**
     * Move a pending feature to the end of the queue with a clean failure slate.
     *
     * @throws FeatureAlreadyPassingException if the feature already passes
     */
    @Transactional
    public SkipResult skip(long featureId) {
        Feature feature = load(featureId);
        if (feature.isPasses()) {
            throw new FeatureAlreadyPassingException(featureId, "skip");
        }

        int oldPriority = feature.getPriority();
        int newPriority = nextTailPriority();
        feature.moveToBack(newPriority, true);
        featureRepo.save(feature);
        count("skipped");
        log.info("Skipped feature {} '{}' (priority {} -> {})",
                feature.getId(), feature.getName(), oldPriority, newPriority);

        return new SkipResult(feature.getId(), feature.getName(), oldPriority, newPriority);
    }

    /**
     * Count one failure against a feature and remember its error (cut to 500 chars).
     *
     * The feature stays in progress at its current priority. Once the count
     * reaches MAX_FEATURE_FAILURES the next fetchNext() auto-skips it.
     *
     * @throws FeatureAlreadyPassingException if the feature already passes
     */
    @Transactional
    public FailureRecord recordFailure(long featureId, String errorMessage) {
        Feature feature = load(featureId);
        if (feature.isPasses()) {
            throw new FeatureAlreadyPassingException(featureId, "record a failure for");
        }
        feature.recordFailure(errorMessage);
        featureRepo.save(feature);
        count("failure");

        boolean thresholdExceeded = feature.getFailureCount() >= MAX_FEATURE_FAILURES;
        log.warn("Recorded failure #{} for feature {} '{}'{}",
                feature.getFailureCount(), feature.getId(), feature.getName(),
                thresholdExceeded ? ", will be auto-skipped on next fetch" : "");

        return new FailureRecord(feature.getId(), feature.getName(),
                feature.getFailureCount(), MAX_FEATURE_FAILURES, thresholdExceeded);
    }

    // ------------------------------------------------------------------
    // Bulk loading
    // ------------------------------------------------------------------

    /**
     * Append features to the end of the queue, keeping the caller's order.
     *
     * Every entry is validated before anything is written, and the whole
     * batch is one transaction: either all features are created or none.
     *
     * @return number of features created, 0 for an empty batch
     * @throws FeatureValidationException on the first malformed entry
     */
    @Transactional
    public int createBulk(List<NewFeature> features) {
        if (features == null) {
            throw new FeatureValidationException("No features given");
        }
        if (features.isEmpty()) {
            return 0;
        }
        for (int i = 0; i < features.size(); i++) {
            List<String> invalid = invalidFields(features.get(i));
            if (!invalid.isEmpty()) {
                log.warn("Rejected bulk create of {} features: entry {} invalid {}",
                        features.size(), i, invalid);
                throw new FeatureValidationException(i, invalid);
            }
        }

        int startPriority = nextTailPriority();
        List<Feature> rows = new ArrayList<>(features.size());
        for (int i = 0; i < features.size(); i++) {
            NewFeature f = features.get(i);
            rows.add(new Feature(startPriority + i, f.category(), f.name(), f.description(), f.steps()));
        }
        featureRepo.saveAll(rows);
        meterRegistry.counter("autocoder.feature.transitions", "outcome", "created").increment(rows.size());
        log.info("Created {} features (priorities {}..{})",
                rows.size(), startPriority, startPriority + rows.size() - 1);
        return rows.size();
    }

    // ------------------------------------------------------------------
    // Read-only views
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public QueueStats getStats() {
        long total   = featureRepo.count();
        long passing = featureRepo.countByPassesTrue();
        double percentage = total > 0
                ? Math.round(passing * 1000.0 / total) / 10.0
                : 0.0;
        return new QueueStats(passing, total, percentage);
    }

    /**
     * A random sample of passing features for regression checks.
     * Returns fewer than {@code limit} when fewer features pass.
     */
    @Transactional(readOnly = true)
    public List<Feature> getForRegression(int limit) {
        if (limit < 1 || limit > MAX_REGRESSION_LIMIT) {
            throw new IllegalArgumentException(
                    "limit must be between 1 and " + MAX_REGRESSION_LIMIT + ", got " + limit);
        }
        List<Feature> passing = new ArrayList<>(featureRepo.findByPassesTrue());
        Collections.shuffle(passing, random);
        return List.copyOf(passing.subList(0, Math.min(limit, passing.size())));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Feature load(long featureId) {
        return featureRepo.findById(featureId)
                .orElseThrow(() -> new FeatureNotFoundException(featureId));
    }

    /** max(priority) + 1, or 1 for an empty table. Strictly after every current feature. */
    private int nextTailPriority() {
        Integer max = featureRepo.findMaxPriority();
        return max == null ? 1 : max + 1;
    }

    /** Names of the missing or malformed fields of one entry, empty when it is valid. */
    static List<String> invalidFields(NewFeature f) {
        List<String> invalid = new ArrayList<>();
        if (f == null) {
            return List.of("category", "name", "description", "steps");
        }
        if (isBlank(f.category()) || f.category().length() > MAX_CATEGORY_LENGTH) invalid.add("category");
        if (isBlank(f.name())     || f.name().length()     > MAX_NAME_LENGTH)     invalid.add("name");
        if (isBlank(f.description()))                                             invalid.add("description");
        if (f.steps() == null || f.steps().isEmpty()
                || f.steps().stream().anyMatch(FeatureQueueService::isBlank))     invalid.add("steps");
        return invalid;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private void count(String outcome) {
        meterRegistry.counter("autocoder.feature.transitions", "outcome", outcome).increment();
    }
}

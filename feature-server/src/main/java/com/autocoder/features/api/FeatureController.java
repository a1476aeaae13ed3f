package com.autocoder.features.api;

import com.autocoder.features.api.dto.*;
import com.autocoder.features.model.Feature;
import com.autocoder.features.service.FeatureQueueService;
import com.autocoder.features.service.NextFeature;
import com.autocoder.features.service.QueueStats;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool API used by the coding agent, one endpoint per tool.
 *
 * GET  /features/stats           — progress counters
 * POST /features/next            — claim (or resume) the next feature
 * GET  /features/regression      — random passing features to re-verify
 * POST /features/{id}/passing    — mark a feature as passing
 * POST /features/{id}/skip       — move a feature to the end of the queue
 * POST /features/{id}/failures   — record a failed attempt
 * POST /features/bulk            — append features to the queue
 *
 * Errors come back as JSON with an "error" field (see ApiExceptionHandler).
 * "Blocked" and "all complete" are not faults: they are 200 responses that
 * carry an "error" text for the agent to read.
 */
@RestController
@RequestMapping("/features")
public class FeatureController {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final FeatureQueueService queueService;
    private final ObjectMapper        objectMapper;

    public FeatureController(FeatureQueueService queueService, ObjectMapper objectMapper) {
        this.queueService = queueService;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/stats")
    public QueueStats getStats() {
        return queueService.getStats();
    }

    /**
     * Claim the next feature.
     *
     * Example:
     *   curl -X POST http://localhost:8080/features/next
     */
    @PostMapping("/next")
    public Map<String, Object> fetchNext() {
        NextFeature next = queueService.fetchNext();

        if (next instanceof NextFeature.Resumed resumed) {
            Map<String, Object> body = snapshot(resumed.feature());
            body.put("resumed", true);
            body.put("message", "Resuming previously started feature");
            body.put("attemptsRemaining", resumed.attemptsRemaining());
            return body;
        }
        if (next instanceof NextFeature.Assigned assigned) {
            Map<String, Object> body = snapshot(assigned.feature());
            if (assigned.attemptsRemaining() != null) {
                int failures = assigned.feature().getFailureCount();
                body.put("attemptsRemaining", assigned.attemptsRemaining());
                body.put("warning", "This feature has failed " + failures + " time(s) previously");
            }
            return body;
        }
        if (next instanceof NextFeature.AutoSkipped skipped) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("autoSkipped", true);
            body.put("skippedFeatureId", skipped.featureId());
            body.put("skippedFeatureName", skipped.featureName());
            body.put("failureCount", skipped.failureCount());
            body.put("oldPriority", skipped.oldPriority());
            body.put("newPriority", skipped.newPriority());
            body.put("reason", "Feature failed " + skipped.failureCount()
                    + " times consecutively and was auto-skipped");
            body.put("lastError", skipped.lastError());
            body.put("message", "Fetching next feature...");
            return body;
        }
        if (next instanceof NextFeature.Blocked blocked) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "All remaining features have failed too many times ("
                    + blocked.blockedCount() + " features blocked). Manual intervention required.");
            body.put("blockedCount", blocked.blockedCount());
            return body;
        }
        return Map.of("error", "All features are passing! No more work to do.");
    }

    /**
     * Random passing features for regression testing.
     * limit must be 1..10; fewer are returned when fewer features pass.
     */
    @GetMapping("/regression")
    public RegressionResponse getForRegression(@RequestParam(defaultValue = "3") int limit) {
        List<FeatureResponse> features = queueService.getForRegression(limit).stream()
                .map(FeatureResponse::from)
                .toList();
        return new RegressionResponse(features, features.size());
    }

    @PostMapping("/{id}/passing")
    public FeatureResponse markPassing(@PathVariable long id) {
        return FeatureResponse.from(queueService.markPassing(id));
    }

    @PostMapping("/{id}/skip")
    public SkipResponse skip(@PathVariable long id) {
        return SkipResponse.from(queueService.skip(id));
    }

    @PostMapping("/{id}/failures")
    public FailureResponse recordFailure(@PathVariable long id,
                                         @RequestBody(required = false) RecordFailureRequest req) {
        String message = req == null ? null : req.message();
        return FailureResponse.from(queueService.recordFailure(id, message));
    }

    /**
     * Append features to the queue.
     *
     * Example:
     *   curl -X POST http://localhost:8080/features/bulk \
     *     -H "Content-Type: application/json" \
     *     -d '{"features":[{"category":"auth","name":"Login","description":"...","steps":["open /login"]}]}'
     */
    @PostMapping("/bulk")
    public ResponseEntity<BulkCreateResponse> createBulk(@RequestBody BulkCreateRequest req) {
        int created = queueService.createBulk(req.features());
        return ResponseEntity.status(HttpStatus.CREATED).body(new BulkCreateResponse(created));
    }

    private Map<String, Object> snapshot(Feature feature) {
        return new LinkedHashMap<>(objectMapper.convertValue(FeatureResponse.from(feature), MAP_TYPE));
    }
}

package com.autocoder.features.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of backlog work for the coding agent.
 *
 * A Feature is created by the bulk loader with passes = false and is worked
 * on until it is marked passing. Passing is terminal: rows are never deleted.
 *
 * Invariant kept by every transition into passing:
 *   passes = true  implies  inProgress = false, failureCount = 0, lastError = null
 *
 * DB table: features  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "features")
public class Feature {

    /** Longest error message kept in last_error; longer ones are cut. */
    public static final int MAX_ERROR_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Lower runs earlier. Not unique: ties are broken by id.
    @Column(nullable = false)
    private int priority;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    // Stored as a JSON array in a TEXT column.
    @Convert(converter = StepListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<String> steps = new ArrayList<>();

    @Column(nullable = false)
    private boolean passes = false;

    @Column(name = "in_progress", nullable = false)
    private boolean inProgress = false;

    // Consecutive failures since the last pass / skip / auto-skip.
    @Column(name = "failure_count", nullable = false)
    private int failureCount = 0;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Feature() {}   // required by JPA

    public Feature(int priority, String category, String name, String description, List<String> steps) {
        this.priority    = priority;
        this.category    = category;
        this.name        = name;
        this.description = description;
        this.steps       = new ArrayList<>(steps);
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** Claimed by fetch-next: the agent is now working on this feature. */
    public void claim() {
        this.inProgress = true;
    }

    /** Terminal transition. Safe to repeat. */
    public void markPassing() {
        this.passes       = true;
        this.inProgress   = false;
        this.failureCount = 0;
        this.lastError    = null;
    }

    /**
     * Send the feature to the back of the queue.
     *
     * Used by both manual skip and auto-skip; the caller decides whether
     * the last error survives.
     */
    public void moveToBack(int newPriority, boolean clearError) {
        this.priority     = newPriority;
        this.inProgress   = false;
        this.failureCount = 0;
        if (clearError) {
            this.lastError = null;
        }
    }

    /** Count one more failure. Does not release the feature. */
    public void recordFailure(String message) {
        this.failureCount++;
        this.lastError = truncate(message);
    }

    private static String truncate(String message) {
        if (message == null || message.isBlank()) return null;
        if (message.length() <= MAX_ERROR_LENGTH) return message;
        int end = MAX_ERROR_LENGTH;
        // never split a surrogate pair
        if (Character.isHighSurrogate(message.charAt(end - 1))) end--;
        return message.substring(0, end);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long         getId()           { return id; }
    public int          getPriority()     { return priority; }
    public String       getCategory()     { return category; }
    public String       getName()         { return name; }
    public String       getDescription()  { return description; }
    public List<String> getSteps()        { return steps; }
    public boolean      isPasses()        { return passes; }
    public boolean      isInProgress()    { return inProgress; }
    public int          getFailureCount() { return failureCount; }
    public String       getLastError()    { return lastError; }
    public Instant      getCreatedAt()    { return createdAt; }
    public Instant      getUpdatedAt()    { return updatedAt; }

    // Only used by the legacy import, which carries the old passing flag over.
    public void setPasses(boolean passes) { this.passes = passes; }
}

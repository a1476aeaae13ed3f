package com.autocoder.features.repository;

import com.autocoder.features.model.Feature;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + queue queries for the features table.
 *
 * Every ordered query sorts by (priority ASC, id ASC) so equal priorities
 * come out in creation order.
 */
public interface FeatureRepository extends JpaRepository<Feature, Long> {

    /**
     * Features currently claimed by the agent.
     *
     * Normally zero or one row. The rows are locked FOR UPDATE so the
     * resume / auto-skip decision and the following UPDATE are atomic.
     * Must run inside a @Transactional service method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<Feature> findByInProgressTrueOrderByPriorityAscIdAsc();

    /** Next pending feature that is still under the failure threshold. */
    Optional<Feature> findFirstByPassesFalseAndFailureCountLessThanOrderByPriorityAscIdAsc(int maxFailures);

    /** Pending features that reached the failure threshold without being auto-skipped. */
    long countByPassesFalseAndFailureCountGreaterThanEqual(int maxFailures);

    long countByPassesTrue();

    List<Feature> findByPassesTrue();

    /** Highest priority in the table, or null when it is empty. */
    @Query("SELECT MAX(f.priority) FROM Feature f")
    Integer findMaxPriority();
}

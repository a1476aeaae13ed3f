package com.autocoder.features.repository;

import com.autocoder.features.model.Feature;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Queue queries against the Flyway schema on embedded H2.
 */
@DataJpaTest
class FeatureRepositoryTest {

    @Autowired FeatureRepository repo;

    @Test
    void findMaxPriority_emptyTable_isNull() {
        assertThat(repo.findMaxPriority()).isNull();
    }

    @Test
    void findMaxPriority_returnsHighestNotLatest() {
        repo.save(feature(9, "a"));
        repo.save(feature(4, "b"));

        assertThat(repo.findMaxPriority()).isEqualTo(9);
    }

    @Test
    void nextPending_skipsPassingAndExhaustedFeatures() {
        Feature passing = feature(1, "passing");
        passing.markPassing();
        repo.save(passing);
        Feature exhausted = feature(2, "exhausted");
        for (int i = 0; i < 5; i++) exhausted.recordFailure("e");
        repo.save(exhausted);
        repo.save(feature(3, "eligible"));

        assertThat(repo.findFirstByPassesFalseAndFailureCountLessThanOrderByPriorityAscIdAsc(5))
                .get()
                .extracting(Feature::getName)
                .isEqualTo("eligible");
        assertThat(repo.countByPassesFalseAndFailureCountGreaterThanEqual(5)).isEqualTo(1);
        assertThat(repo.countByPassesTrue()).isEqualTo(1);
    }

    @Test
    void inProgress_orderedByPriorityThenId() {
        Feature late  = feature(5, "late");
        Feature early = feature(2, "early");
        late.claim();
        early.claim();
        repo.save(late);
        repo.save(early);
        repo.save(feature(1, "idle"));

        List<Feature> inProgress = repo.findByInProgressTrueOrderByPriorityAscIdAsc();

        assertThat(inProgress).extracting(Feature::getName).containsExactly("early", "late");
    }

    private static Feature feature(int priority, String name) {
        return new Feature(priority, "core", name, "d", List.of("s"));
    }
}

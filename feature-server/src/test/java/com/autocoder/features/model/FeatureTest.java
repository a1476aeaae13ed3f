package com.autocoder.features.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * State transitions on the entity itself. No JPA involved.
 */
class FeatureTest {

    @Test
    void newFeature_startsPendingWithCleanSlate() {
        Feature f = newFeature();

        assertThat(f.isPasses()).isFalse();
        assertThat(f.isInProgress()).isFalse();
        assertThat(f.getFailureCount()).isZero();
        assertThat(f.getLastError()).isNull();
    }

    @Test
    void markPassing_clearsInProgressFailuresAndError() {
        Feature f = newFeature();
        f.claim();
        f.recordFailure("flaky selector");
        f.recordFailure("timeout");

        f.markPassing();

        assertThat(f.isPasses()).isTrue();
        assertThat(f.isInProgress()).isFalse();
        assertThat(f.getFailureCount()).isZero();
        assertThat(f.getLastError()).isNull();
    }

    @Test
    void recordFailure_truncatesLongMessageTo500Chars() {
        Feature f = newFeature();

        f.recordFailure("x".repeat(800));

        assertThat(f.getLastError()).hasSize(Feature.MAX_ERROR_LENGTH);
        assertThat(f.getFailureCount()).isEqualTo(1);
    }

    @Test
    void recordFailure_cutInsideSurrogatePair_dropsTheWholeCharacter() {
        Feature f = newFeature();
        // the emoji occupies UTF-16 units 499 and 500
        String message = "x".repeat(Feature.MAX_ERROR_LENGTH - 1) + "\uD83D\uDE00" + " and more";

        f.recordFailure(message);

        assertThat(f.getLastError()).hasSize(Feature.MAX_ERROR_LENGTH - 1);
        assertThat(f.getLastError()).isEqualTo("x".repeat(Feature.MAX_ERROR_LENGTH - 1));
        assertThat(Character.isHighSurrogate(f.getLastError().charAt(f.getLastError().length() - 1))).isFalse();
    }

    @Test
    void recordFailure_blankMessage_storesNull() {
        Feature f = newFeature();

        f.recordFailure("   ");

        assertThat(f.getLastError()).isNull();
        assertThat(f.getFailureCount()).isEqualTo(1);
    }

    @Test
    void recordFailure_keepsClaimAndPriority() {
        Feature f = newFeature();
        f.claim();

        f.recordFailure("boom");

        assertThat(f.isInProgress()).isTrue();
        assertThat(f.getPriority()).isEqualTo(3);
    }

    @Test
    void moveToBack_keepingError_resetsCounterOnly() {
        Feature f = newFeature();
        f.claim();
        f.recordFailure("boom");

        f.moveToBack(9, false);

        assertThat(f.getPriority()).isEqualTo(9);
        assertThat(f.isInProgress()).isFalse();
        assertThat(f.getFailureCount()).isZero();
        assertThat(f.getLastError()).isEqualTo("boom");
    }

    @Test
    void moveToBack_clearingError_dropsLastError() {
        Feature f = newFeature();
        f.recordFailure("boom");

        f.moveToBack(9, true);

        assertThat(f.getLastError()).isNull();
    }

    private Feature newFeature() {
        return new Feature(3, "auth", "Login form", "User can log in", List.of("open /login", "submit"));
    }
}

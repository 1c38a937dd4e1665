package com.ryuqq.reconciler.core.classifier;

import com.ryuqq.reconciler.core.diagnostic.Phase;
import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.error.ResourceClientException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusCodeRetryClassifier 테스트.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class StatusCodeRetryClassifierTest {

    private final StatusCodeRetryClassifier classifier = new StatusCodeRetryClassifier();

    @Test
    void classify_ConflictAndRateLimited_Retry() {
        // When & Then
        assertEquals(RetryDecision.RETRY, classifier.classify(error(ClientErrorType.CONFLICT), Phase.CREATE));
        assertEquals(RetryDecision.RETRY, classifier.classify(error(ClientErrorType.RATE_LIMITED), Phase.DELETE));
    }

    @Test
    void classify_ClientErrorsAndServerErrors_FailByDefault() {
        // When & Then
        for (ClientErrorType type : EnumSet.complementOf(EnumSet.of(ClientErrorType.CONFLICT, ClientErrorType.RATE_LIMITED))) {
            assertEquals(RetryDecision.FAIL, classifier.classify(error(type), Phase.UPDATE),
                "Expected FAIL for " + type);
        }
    }

    @Test
    void classify_NonClientException_Fail() {
        // When & Then
        assertEquals(RetryDecision.FAIL, classifier.classify(new IllegalStateException("boom"), Phase.CREATE));
        assertEquals(RetryDecision.FAIL, classifier.classify(null, Phase.CREATE));
    }

    @Test
    void classify_CustomRetryableSet_AddsServiceUnavailable() {
        // Given
        StatusCodeRetryClassifier custom = new StatusCodeRetryClassifier(
            EnumSet.of(ClientErrorType.CONFLICT, ClientErrorType.SERVICE_UNAVAILABLE));

        // When & Then
        assertEquals(RetryDecision.RETRY, custom.classify(error(ClientErrorType.SERVICE_UNAVAILABLE), Phase.CREATE));
        assertEquals(RetryDecision.FAIL, custom.classify(error(ClientErrorType.RATE_LIMITED), Phase.CREATE));
        assertEquals(Set.of(ClientErrorType.CONFLICT, ClientErrorType.SERVICE_UNAVAILABLE), custom.getRetryableTypes());
    }

    @Test
    void constructor_NotFoundRetryable_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new StatusCodeRetryClassifier(Set.of(ClientErrorType.NOT_FOUND)));
        assertThrows(IllegalArgumentException.class, () -> new StatusCodeRetryClassifier(null));
    }

    private static ResourceClientException error(ClientErrorType type) {
        return new ResourceClientException(type, type.name().toLowerCase());
    }
}

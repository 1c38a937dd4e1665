package com.ryuqq.reconciler.core.error;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 오류 타입 테스트.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class ResourceClientExceptionTest {

    @Test
    void fromStatusCode_ExactMatch() {
        // When & Then
        assertEquals(ClientErrorType.NOT_FOUND, ClientErrorType.fromStatusCode(404));
        assertEquals(ClientErrorType.CONFLICT, ClientErrorType.fromStatusCode(409));
        assertEquals(ClientErrorType.RATE_LIMITED, ClientErrorType.fromStatusCode(429));
        assertEquals(ClientErrorType.SERVICE_UNAVAILABLE, ClientErrorType.fromStatusCode(503));
    }

    @Test
    void fromStatusCode_UnlistedCodes_FallBackByClass() {
        // When & Then
        assertEquals(ClientErrorType.SERVER_ERROR, ClientErrorType.fromStatusCode(502));
        assertEquals(ClientErrorType.BAD_REQUEST, ClientErrorType.fromStatusCode(422));
        assertEquals(ClientErrorType.UNKNOWN, ClientErrorType.fromStatusCode(0));
        assertEquals(ClientErrorType.UNKNOWN, ClientErrorType.fromStatusCode(302));
    }

    @Test
    void ofStatus_KeepsActualStatusCode() {
        // When
        ResourceClientException exception = ResourceClientException.ofStatus(502, "bad gateway");

        // Then
        assertEquals(ClientErrorType.SERVER_ERROR, exception.getType());
        assertEquals(502, exception.getStatusCode());
        assertEquals("bad gateway", exception.getMessage());
    }

    @Test
    void isNotFound_DistinguishesNotFound() {
        // When & Then
        assertTrue(ResourceClientException.notFound("gone").isNotFound());
        assertTrue(ResourceClientException.isNotFound(ResourceClientException.ofStatus(404, "gone")));
        assertFalse(ResourceClientException.isNotFound(new ResourceClientException(ClientErrorType.CONFLICT, "busy")));
        assertFalse(ResourceClientException.isNotFound(new IllegalStateException("x")));
        assertFalse(ResourceClientException.isNotFound(null));
    }

    @Test
    void constructor_NullType_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new ResourceClientException(null, "x"));
    }

    @Test
    void pollTimeoutException_MessageNamesTargetAndLastState() {
        // When
        PollTimeoutException exception = new PollTimeoutException(
            Set.of(LifecycleState.ACTIVE), LifecycleState.PENDING, 50, 52);

        // Then
        assertTrue(exception.getMessage().contains("ACTIVE"));
        assertTrue(exception.getMessage().contains("last state: PENDING"));
        assertEquals(LifecycleState.PENDING, exception.getLastObservedState());
        assertEquals(50, exception.getTimeoutMs());
        assertEquals(52, exception.getElapsedMs());
    }

    @Test
    void unexpectedStateException_KeepsObservedState() {
        // When
        UnexpectedStateException exception = new UnexpectedStateException(
            LifecycleState.ERROR, Set.of(LifecycleState.ACTIVE));

        // Then
        assertEquals(LifecycleState.ERROR, exception.getObserved());
        assertTrue(exception.getMessage().contains("unexpected state 'ERROR'"));
    }
}

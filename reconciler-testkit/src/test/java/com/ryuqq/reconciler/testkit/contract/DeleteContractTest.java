package com.ryuqq.reconciler.testkit.contract;

import com.ryuqq.reconciler.application.reconciler.ReconcileResult;
import com.ryuqq.reconciler.core.diagnostic.Diagnostic;
import com.ryuqq.reconciler.core.diagnostic.ErrorKind;
import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Reconcile-Delete.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Deleting an absent zone twice succeeds both times</li>
 *   <li>Polling converges when the zone disappears (NOT_FOUND observed as DELETED)</li>
 *   <li>Polling converges when the backend reports DELETED</li>
 *   <li>A zone stuck in ACTIVE times out with DELETE_TIMEOUT_OR_ERROR</li>
 *   <li>Other delete errors surface as DELETE_FAILED</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class DeleteContractTest extends AbstractDefaultReconcilerContractTest {

    private static final ResourceId ZONE_ID = ResourceId.of("z1");

    @Test
    void testDelete_AlreadyAbsentTwice_SucceedsBothTimes() {
        // Given
        client.failDelete(ClientErrorType.NOT_FOUND);

        // When
        ReconcileResult first = reconciler.delete(ZONE_ID, deletedConfig(60_000, 0, 10), false);
        ReconcileResult second = reconciler.delete(ZONE_ID, deletedConfig(60_000, 0, 10), false);

        // Then
        ResourceDescriptor firstDescriptor = assertSuccess(first);
        ResourceDescriptor secondDescriptor = assertSuccess(second);
        assertEquals(ZONE_ID, firstDescriptor.id());
        assertEquals(ResourceDescriptor.STATUS_DELETED, firstDescriptor.status());
        assertEquals(ResourceDescriptor.STATUS_DELETED, secondDescriptor.status());
        assertEquals(2, client.getDeleteCount());
        assertEquals(0, client.getReadCount(), "Already-absent zone must not be polled");
    }

    @Test
    void testDelete_ZoneDisappears_NotFoundObservedAsDeleted() {
        // Given
        client.withExisting(ResourceDescriptor.builder(ZONE_ID).status("ACTIVE").build())
                .thenStatus("ACTIVE")
                .thenStatus("PENDING")
                .thenError(ClientErrorType.NOT_FOUND);

        // When
        ReconcileResult result = reconciler.delete(ZONE_ID, deletedConfig(60_000, 5_000, 3_000), false);

        // Then
        ResourceDescriptor descriptor = assertSuccess(result);
        assertEquals(ZONE_ID, descriptor.id());
        assertEquals(ResourceDescriptor.STATUS_DELETED, descriptor.status());
        assertEquals(3, client.getReadCount());
        assertEquals(List.of(5_000L, 3_000L, 3_000L), time.getSleeps());
    }

    @Test
    void testDelete_BackendReportsDeleted_Succeeds() {
        // Given
        client.withExisting(ResourceDescriptor.builder(ZONE_ID).status("ACTIVE").build())
                .thenStatus("DELETED");

        // When
        ReconcileResult result = reconciler.delete(ZONE_ID, deletedConfig(60_000, 0, 10), false);

        // Then
        assertEquals(ResourceDescriptor.STATUS_DELETED, assertSuccess(result).status());
        assertEquals(1, client.getReadCount());
    }

    @Test
    void testDelete_StuckActive_TimesOut() {
        // Given
        client.withExisting(ResourceDescriptor.builder(ZONE_ID).status("ACTIVE").build());

        // When
        ReconcileResult result = reconciler.delete(ZONE_ID, deletedConfig(9_000, 0, 3_000), false);

        // Then
        Diagnostic diagnostic = assertFailure(result, ErrorKind.POLL_TIMEOUT);
        assertEquals("DELETE_TIMEOUT_OR_ERROR", diagnostic.code());
        assertEquals(LifecycleState.ACTIVE, diagnostic.lastObservedStateOrNull());
        assertFalse(diagnostic.isPartialCreate());
        assertTrue(diagnostic.message().contains("deleted"));
    }

    @Test
    void testDelete_ServerError_SurfacesDeleteFailed() {
        // Given
        client.failDelete(ClientErrorType.SERVER_ERROR);

        // When
        ReconcileResult result = reconciler.delete(ZONE_ID, deletedConfig(60_000, 0, 10), false);

        // Then
        Diagnostic diagnostic = assertFailure(result, ErrorKind.CLIENT_CALL_FAILED);
        assertEquals("DELETE_FAILED", diagnostic.code());
        assertEquals(ZONE_ID, diagnostic.resourceIdOrNull());
        assertEquals(0, client.getReadCount());
    }
}

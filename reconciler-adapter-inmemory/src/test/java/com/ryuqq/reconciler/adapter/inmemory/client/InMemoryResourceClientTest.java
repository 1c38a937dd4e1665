package com.ryuqq.reconciler.adapter.inmemory.client;

import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.error.ResourceClientException;
import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.model.ZoneType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryResourceClient}.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Create: PENDING for the configured number of reads, then ACTIVE</li>
 *   <li>Update: applies the delta and goes back to PENDING</li>
 *   <li>Delete: zone disappears after the configured reads, reads then fail with NOT_FOUND</li>
 *   <li>Backend rules: duplicate names, secondary zones without masters, deleting zones</li>
 *   <li>Fault injection for reads and mutations</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class InMemoryResourceClientTest {

    private InMemoryResourceClient client;

    @BeforeEach
    void setUp() {
        client = new InMemoryResourceClient();
    }

    private static ClientErrorType errorType(Runnable call) {
        ResourceClientException exception = assertThrows(ResourceClientException.class, call::run);
        return exception.getType();
    }

    @Test
    void testCreate_PendingReadsThenActive() {
        // Given
        ResourceDescriptor created = client.create(DesiredState.of("example.com.").withTtl(300));

        // When & Then
        assertEquals("zone-1", created.id().getValue());
        assertEquals("PENDING", created.status());
        assertEquals("PENDING", client.read(created.id()).status());
        assertEquals("PENDING", client.read(created.id()).status());
        ResourceDescriptor active = client.read(created.id());
        assertEquals("ACTIVE", active.status());
        assertEquals(300, active.ttl());
        assertEquals(ZoneType.PRIMARY, active.type());
        assertEquals(3, client.getReadCount());
    }

    @Test
    void testCreate_ValueSpecsMergedIntoAttributes() {
        // Given
        DesiredState desired = DesiredState.of("example.com.")
            .withAttributes(Map.of("env", "prod"))
            .withValueSpecs(Map.of("env", "dev", "region", "eu"));

        // When
        ResourceDescriptor created = client.create(desired);

        // Then
        assertEquals(Map.of("env", "prod", "region", "eu"), created.attributes());
    }

    @Test
    void testCreate_DuplicateName_Conflict() {
        // Given
        client.create(DesiredState.of("example.com."));

        // When & Then
        assertEquals(ClientErrorType.CONFLICT, errorType(() -> client.create(DesiredState.of("example.com."))));
        assertEquals(1, client.size());
    }

    @Test
    void testCreate_SecondaryWithoutMasters_BadRequest() {
        // Given
        DesiredState desired = DesiredState.of("example.com.").withType(ZoneType.SECONDARY);

        // When & Then
        assertEquals(ClientErrorType.BAD_REQUEST, errorType(() -> client.create(desired)));
        assertEquals(0, client.size());
    }

    @Test
    void testCreate_DefaultProjectIdApplied() {
        // Given
        client = new InMemoryResourceClient(InMemoryBackendConfig.immediate().withDefaultProjectId("proj-1"));

        // When
        ResourceDescriptor created = client.create(DesiredState.of("example.com."));

        // Then
        assertEquals("ACTIVE", created.status());
        assertEquals("proj-1", created.projectId());
    }

    @Test
    void testRead_UnknownZone_NotFound() {
        // When
        ResourceClientException exception = assertThrows(ResourceClientException.class,
            () -> client.read(ResourceId.of("zone-404")));

        // Then
        assertTrue(exception.isNotFound());
    }

    @Test
    void testUpdate_AppliesDeltaAndReturnsToPending() {
        // Given
        client = new InMemoryResourceClient(InMemoryBackendConfig.immediate().withPendingReadsOnUpdate(1));
        ResourceId id = client.create(DesiredState.of("example.com.").withTtl(300)).id();

        // When
        ResourceDescriptor updated = client.update(id, ResourceDelta.empty().withTtl(600).withMasters(Set.of("ns1")));

        // Then
        assertEquals("PENDING", updated.status());
        assertEquals(600, updated.ttl());
        assertEquals("PENDING", client.read(id).status());
        ResourceDescriptor active = client.read(id);
        assertEquals("ACTIVE", active.status());
        assertEquals(Set.of("ns1"), active.masters());
    }

    @Test
    void testUpdate_EmptyDeltaOrUnknownZone_Rejected() {
        // Given
        ResourceId id = client.create(DesiredState.of("example.com.")).id();

        // When & Then
        assertEquals(ClientErrorType.BAD_REQUEST, errorType(() -> client.update(id, ResourceDelta.empty())));
        assertEquals(ClientErrorType.NOT_FOUND,
            errorType(() -> client.update(ResourceId.of("zone-404"), ResourceDelta.empty().withTtl(60))));
    }

    @Test
    void testDelete_ZoneDisappearsAfterPendingReads() {
        // Given
        client = new InMemoryResourceClient(InMemoryBackendConfig.immediate().withPendingReadsOnDelete(1));
        ResourceId id = client.create(DesiredState.of("example.com.")).id();

        // When
        client.delete(id);

        // Then
        assertEquals("PENDING", client.read(id).status());
        assertEquals(ClientErrorType.NOT_FOUND, errorType(() -> client.read(id)));
        assertFalse(client.contains(id));
    }

    @Test
    void testDelete_WhileDeleting_AcceptedAndUpdateConflicts() {
        // Given
        ResourceId id = client.create(DesiredState.of("example.com.")).id();
        client.delete(id);

        // When & Then
        assertDoesNotThrow(() -> client.delete(id));
        assertEquals(ClientErrorType.CONFLICT, errorType(() -> client.update(id, ResourceDelta.empty().withTtl(60))));
        assertEquals(2, client.getDeleteCount());
    }

    @Test
    void testDelete_ImmediateBackend_RemovedAtOnce() {
        // Given
        client = new InMemoryResourceClient(InMemoryBackendConfig.immediate());
        ResourceId id = client.create(DesiredState.of("example.com.")).id();

        // When
        client.delete(id);

        // Then
        assertEquals(0, client.size());
        assertEquals(ClientErrorType.NOT_FOUND, errorType(() -> client.delete(id)));
    }

    @Test
    void testFaultInjection_ReadsFailInOrderThenRecover() {
        // Given
        ResourceId id = client.create(DesiredState.of("example.com.")).id();
        client.failNextReads(ClientErrorType.RATE_LIMITED, 2);

        // When & Then
        assertEquals(ClientErrorType.RATE_LIMITED, errorType(() -> client.read(id)));
        assertEquals(ClientErrorType.RATE_LIMITED, errorType(() -> client.read(id)));
        assertEquals("PENDING", client.read(id).status());
    }

    @Test
    void testFaultInjection_NextMutationFailsOnce() {
        // Given
        client.failNextMutation(ClientErrorType.SERVICE_UNAVAILABLE);

        // When & Then
        assertEquals(ClientErrorType.SERVICE_UNAVAILABLE, errorType(() -> client.create(DesiredState.of("example.com."))));
        assertDoesNotThrow(() -> client.create(DesiredState.of("example.com.")));
        assertEquals(2, client.getCreateCount());
    }

    @Test
    void testFaultInjection_InvalidArguments_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> client.failNextReads(null, 1));
        assertThrows(IllegalArgumentException.class, () -> client.failNextReads(ClientErrorType.CONFLICT, 0));
        assertThrows(IllegalArgumentException.class, () -> client.failNextMutation(null));
    }

    @Test
    void testConfig_NegativePendingReads_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryBackendConfig(-1, 0, 0, null));
    }
}

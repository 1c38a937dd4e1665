package com.ryuqq.reconciler.testkit.contract;

import com.ryuqq.reconciler.application.reconciler.ReconcileResult;
import com.ryuqq.reconciler.core.diagnostic.Diagnostic;
import com.ryuqq.reconciler.core.diagnostic.ErrorKind;
import com.ryuqq.reconciler.core.diagnostic.Phase;
import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Reconcile-Read and import.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Absent zone on read → gone signal, not a generic failure</li>
 *   <li>Other read errors → READ_FAILED</li>
 *   <li>{@code <id>:<projectId>} fills in a missing project</li>
 *   <li>Malformed import IDs fail before any backend call</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class ReadAndImportContractTest extends AbstractDefaultReconcilerContractTest {

    private static final ResourceId ZONE_ID = ResourceId.of("z1");

    @Test
    void testRead_ZoneAbsent_ReportedAsGone() {
        // Given
        client.thenError(ClientErrorType.NOT_FOUND);

        // When
        ReconcileResult result = reconciler.read(ZONE_ID);

        // Then
        Diagnostic diagnostic = assertFailure(result, ErrorKind.NOT_FOUND);
        assertTrue(result.isGone());
        assertEquals("READ_NOT_FOUND", diagnostic.code());
        assertEquals(ZONE_ID, diagnostic.resourceIdOrNull());
    }

    @Test
    void testRead_ServerError_ReportedAsReadFailed() {
        // Given
        client.thenError(ClientErrorType.SERVER_ERROR);

        // When
        ReconcileResult result = reconciler.read(ZONE_ID);

        // Then
        Diagnostic diagnostic = assertFailure(result, ErrorKind.CLIENT_CALL_FAILED);
        assertFalse(result.isGone());
        assertEquals("READ_FAILED", diagnostic.code());
        assertEquals(1, client.getReadCount(), "Read is never retried outside polling");
    }

    @Test
    void testImport_WithProjectId_FillsMissingProject() {
        // Given
        client.withExisting(ResourceDescriptor.builder(ZONE_ID).status("ACTIVE").name("zone1").build());

        // When
        ReconcileResult result = reconciler.importResource("z1:proj-9");

        // Then
        ResourceDescriptor descriptor = assertSuccess(result);
        assertEquals(ZONE_ID, descriptor.id());
        assertEquals("proj-9", descriptor.projectId());
    }

    @Test
    void testImport_BackendReportsProject_KeepsBackendValue() {
        // Given
        client.withExisting(ResourceDescriptor.builder(ZONE_ID).status("ACTIVE").projectId("owner").build());

        // When
        ReconcileResult result = reconciler.importResource("z1:other");

        // Then
        assertEquals("owner", assertSuccess(result).projectId());
    }

    @Test
    void testImport_TooManySegments_MalformedWithoutBackendCall() {
        // When
        ReconcileResult result = reconciler.importResource("z1:proj:extra");

        // Then
        Diagnostic diagnostic = assertFailure(result, ErrorKind.MALFORMED_IMPORT_ID);
        assertEquals(Phase.IMPORT, diagnostic.phase());
        assertEquals("MALFORMED_IMPORT_ID", diagnostic.code());
        assertTrue(diagnostic.message().contains("z1:proj:extra"));
        assertEquals(0, client.getReadCount());
    }

    @Test
    void testImport_ZoneAbsent_ReportedAsGone() {
        // Given
        client.thenError(ClientErrorType.NOT_FOUND);

        // When
        ReconcileResult result = reconciler.importResource("z1");

        // Then
        assertFailure(result, ErrorKind.NOT_FOUND);
        assertTrue(result.isGone());
    }
}

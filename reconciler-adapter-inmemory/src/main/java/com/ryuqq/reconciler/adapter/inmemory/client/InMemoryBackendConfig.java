package com.ryuqq.reconciler.adapter.inmemory.client;

/**
 * Timing and ownership settings for {@link InMemoryResourceClient}.
 *
 * <p>Transitions are counted in reads rather than wall-clock time, so a test can state
 * exactly how many polls a zone spends in its transitional state.</p>
 *
 * @param pendingReadsOnCreate reads that observe PENDING after create (0 = ACTIVE immediately)
 * @param pendingReadsOnUpdate reads that observe PENDING after update (0 = ACTIVE immediately)
 * @param pendingReadsOnDelete reads that observe PENDING after delete before the zone disappears
 *                             (0 = removed immediately)
 * @param defaultProjectId project assigned to created zones (nullable)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record InMemoryBackendConfig(
    int pendingReadsOnCreate,
    int pendingReadsOnUpdate,
    int pendingReadsOnDelete,
    String defaultProjectId
) {

    /**
     * Default configuration: every transition takes two pending reads, no project.
     */
    public InMemoryBackendConfig() {
        this(2, 2, 2, null);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if any read count is negative
     */
    public InMemoryBackendConfig {
        requireNonNegative("pendingReadsOnCreate", pendingReadsOnCreate);
        requireNonNegative("pendingReadsOnUpdate", pendingReadsOnUpdate);
        requireNonNegative("pendingReadsOnDelete", pendingReadsOnDelete);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative (current: " + value + ")");
        }
    }

    /**
     * Configuration where every transition completes on the first read.
     */
    public static InMemoryBackendConfig immediate() {
        return new InMemoryBackendConfig(0, 0, 0, null);
    }

    public InMemoryBackendConfig withPendingReadsOnCreate(int pendingReadsOnCreate) {
        return new InMemoryBackendConfig(pendingReadsOnCreate, pendingReadsOnUpdate, pendingReadsOnDelete, defaultProjectId);
    }

    public InMemoryBackendConfig withPendingReadsOnUpdate(int pendingReadsOnUpdate) {
        return new InMemoryBackendConfig(pendingReadsOnCreate, pendingReadsOnUpdate, pendingReadsOnDelete, defaultProjectId);
    }

    public InMemoryBackendConfig withPendingReadsOnDelete(int pendingReadsOnDelete) {
        return new InMemoryBackendConfig(pendingReadsOnCreate, pendingReadsOnUpdate, pendingReadsOnDelete, defaultProjectId);
    }

    public InMemoryBackendConfig withDefaultProjectId(String defaultProjectId) {
        return new InMemoryBackendConfig(pendingReadsOnCreate, pendingReadsOnUpdate, pendingReadsOnDelete, defaultProjectId);
    }
}

package com.ryuqq.reconciler.adapter.inmemory.client;

import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.error.ResourceClientException;
import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.model.ZoneType;
import com.ryuqq.reconciler.core.spi.ResourceClient;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link ResourceClient} SPI for testing and reference purposes.
 *
 * <p>Simulates an eventually consistent DNS backend: every mutating call puts the zone into
 * PENDING, and the zone settles after a configured number of reads
 * ({@link InMemoryBackendConfig}). A deleted zone disappears once settled, after which
 * reads fail with NOT_FOUND.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>zones:</strong> ConcurrentHashMap&lt;ResourceId, ZoneEntry&gt; - Current zone snapshot and pending transition</li>
 *   <li><strong>readFaults:</strong> ConcurrentLinkedQueue&lt;ClientErrorType&gt; - Errors returned by the next reads, in order</li>
 *   <li><strong>mutationFault:</strong> AtomicReference&lt;ClientErrorType&gt; - Error returned by the next create/update/delete</li>
 * </ul>
 *
 * <p><strong>Backend Rules:</strong></p>
 * <ul>
 *   <li>Zone names are unique: creating a second zone with the same name fails with CONFLICT</li>
 *   <li>A SECONDARY zone without masters is rejected with BAD_REQUEST</li>
 *   <li>Updating a zone that is being deleted fails with CONFLICT</li>
 *   <li>Deleting a zone that is already being deleted is accepted again</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Transitions are driven by reads, not by time</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryResourceClient client = new InMemoryResourceClient();
 * Reconciler reconciler = new DefaultReconciler(client);
 *
 * // Two PENDING reads, then ACTIVE
 * ReconcileResult result = reconciler.create(DesiredState.of("example.com.").withTtl(300));
 *
 * // Inject a transient error into the next poll
 * client.failNextReads(ClientErrorType.RATE_LIMITED, 1);
 * </pre>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class InMemoryResourceClient implements ResourceClient {

    static final String STATUS_PENDING = "PENDING";
    static final String STATUS_ACTIVE = "ACTIVE";

    private final InMemoryBackendConfig config;
    private final ConcurrentHashMap<ResourceId, ZoneEntry> zones;
    private final ConcurrentLinkedQueue<ClientErrorType> readFaults;
    private final AtomicReference<ClientErrorType> mutationFault;
    private final AtomicInteger idSequence;

    private final AtomicInteger createCount;
    private final AtomicInteger readCount;
    private final AtomicInteger updateCount;
    private final AtomicInteger deleteCount;

    /**
     * Creates a client with the default backend configuration.
     */
    public InMemoryResourceClient() {
        this(new InMemoryBackendConfig());
    }

    /**
     * Creates a client with a custom backend configuration.
     *
     * @param config backend configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryResourceClient(InMemoryBackendConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.zones = new ConcurrentHashMap<>();
        this.readFaults = new ConcurrentLinkedQueue<>();
        this.mutationFault = new AtomicReference<>();
        this.idSequence = new AtomicInteger();
        this.createCount = new AtomicInteger();
        this.readCount = new AtomicInteger();
        this.updateCount = new AtomicInteger();
        this.deleteCount = new AtomicInteger();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Assigns sequential IDs ({@code zone-1}, {@code zone-2}, ...)</li>
     *   <li>valueSpecs are merged into attributes (explicit attributes win)</li>
     *   <li>Type defaults to PRIMARY</li>
     * </ul>
     */
    @Override
    public synchronized ResourceDescriptor create(DesiredState desired) {
        createCount.incrementAndGet();
        if (desired == null) {
            throw new ResourceClientException(ClientErrorType.BAD_REQUEST, "desired state is required");
        }
        throwInjectedMutationFault("create");

        ZoneType type = desired.type() == null ? ZoneType.PRIMARY : desired.type();
        if (type == ZoneType.SECONDARY && desired.masters().isEmpty()) {
            throw new ResourceClientException(ClientErrorType.BAD_REQUEST,
                "secondary zone " + desired.name() + " requires at least one master");
        }
        boolean nameTaken = zones.values().stream()
            .anyMatch(entry -> desired.name().equals(entry.descriptor.name()));
        if (nameTaken) {
            throw new ResourceClientException(ClientErrorType.CONFLICT,
                "duplicate zone name: " + desired.name());
        }

        Map<String, String> attributes = new HashMap<>(desired.valueSpecs());
        attributes.putAll(desired.attributes());

        ResourceId id = ResourceId.of("zone-" + idSequence.incrementAndGet());
        ResourceDescriptor descriptor = ResourceDescriptor.builder(id)
            .status(STATUS_PENDING)
            .name(desired.name())
            .email(desired.email())
            .ttl(desired.ttl())
            .description(desired.description())
            .type(type)
            .masters(desired.masters())
            .attributes(attributes)
            .projectId(config.defaultProjectId())
            .build();

        ZoneEntry entry = new ZoneEntry(descriptor, Transition.ACTIVATING, config.pendingReadsOnCreate());
        zones.put(id, entry);
        return entry.view();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Injected read faults are returned first, one per read</li>
     *   <li>Each read while a transition is pending consumes one pending read</li>
     *   <li>A settled delete removes the zone and the read fails with NOT_FOUND</li>
     * </ul>
     */
    @Override
    public synchronized ResourceDescriptor read(ResourceId id) {
        readCount.incrementAndGet();
        ClientErrorType fault = readFaults.poll();
        if (fault != null) {
            throw new ResourceClientException(fault, "injected read failure for " + describe(id));
        }

        ZoneEntry entry = id == null ? null : zones.get(id);
        if (entry == null) {
            throw ResourceClientException.notFound("zone not found: " + describe(id));
        }

        if (entry.pendingReads > 0) {
            entry.pendingReads--;
            return entry.view();
        }

        if (entry.transition == Transition.DELETING) {
            zones.remove(id);
            throw ResourceClientException.notFound("zone not found: " + describe(id));
        }
        entry.settle();
        return entry.view();
    }

    /**
     * {@inheritDoc}
     *
     * @throws ResourceClientException NOT_FOUND if the zone does not exist,
     *         CONFLICT if the zone is being deleted
     */
    @Override
    public synchronized ResourceDescriptor update(ResourceId id, ResourceDelta delta) {
        updateCount.incrementAndGet();
        throwInjectedMutationFault("update");

        ZoneEntry entry = id == null ? null : zones.get(id);
        if (entry == null) {
            throw ResourceClientException.notFound("zone not found: " + describe(id));
        }
        if (entry.transition == Transition.DELETING) {
            throw new ResourceClientException(ClientErrorType.CONFLICT,
                "zone " + id.getValue() + " is being deleted");
        }
        if (delta == null || delta.isEmpty()) {
            throw new ResourceClientException(ClientErrorType.BAD_REQUEST, "update requires at least one field");
        }

        entry.descriptor = delta.applyTo(entry.descriptor);
        entry.begin(Transition.ACTIVATING, config.pendingReadsOnUpdate());
        return entry.view();
    }

    /**
     * {@inheritDoc}
     *
     * @throws ResourceClientException NOT_FOUND if the zone does not exist
     */
    @Override
    public synchronized void delete(ResourceId id) {
        deleteCount.incrementAndGet();
        throwInjectedMutationFault("delete");

        ZoneEntry entry = id == null ? null : zones.get(id);
        if (entry == null) {
            throw ResourceClientException.notFound("zone not found: " + describe(id));
        }
        if (entry.transition == Transition.DELETING) {
            return;
        }
        if (config.pendingReadsOnDelete() == 0) {
            zones.remove(id);
            return;
        }
        entry.begin(Transition.DELETING, config.pendingReadsOnDelete());
    }

    /**
     * Makes the next {@code times} reads fail with the given error type.
     *
     * @param type error type
     * @param times number of failing reads (positive)
     * @throws IllegalArgumentException if type is null or times is not positive
     */
    public void failNextReads(ClientErrorType type, int times) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        for (int i = 0; i < times; i++) {
            readFaults.add(type);
        }
    }

    /**
     * Makes the next create, update or delete call fail with the given error type.
     *
     * @param type error type
     * @throws IllegalArgumentException if type is null
     */
    public void failNextMutation(ClientErrorType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        mutationFault.set(type);
    }

    /**
     * Checks whether a zone exists, including zones that are being deleted.
     */
    public boolean contains(ResourceId id) {
        return zones.containsKey(id);
    }

    /**
     * Returns the number of stored zones.
     */
    public int size() {
        return zones.size();
    }

    public int getCreateCount() {
        return createCount.get();
    }

    public int getReadCount() {
        return readCount.get();
    }

    public int getUpdateCount() {
        return updateCount.get();
    }

    public int getDeleteCount() {
        return deleteCount.get();
    }

    private void throwInjectedMutationFault(String operation) {
        ClientErrorType fault = mutationFault.getAndSet(null);
        if (fault != null) {
            throw new ResourceClientException(fault, "injected " + operation + " failure");
        }
    }

    private static String describe(ResourceId id) {
        return id == null ? "null" : id.getValue();
    }

    /**
     * Pending transition of a zone.
     */
    private enum Transition {
        NONE,
        ACTIVATING,
        DELETING
    }

    /**
     * Mutable per-zone record, guarded by the client's monitor.
     */
    private static final class ZoneEntry {
        ResourceDescriptor descriptor;
        Transition transition;
        int pendingReads;

        ZoneEntry(ResourceDescriptor descriptor, Transition transition, int pendingReads) {
            this.descriptor = descriptor;
            begin(transition, pendingReads);
        }

        void begin(Transition transition, int pendingReads) {
            this.transition = transition;
            this.pendingReads = pendingReads;
            if (pendingReads == 0 && transition == Transition.ACTIVATING) {
                settle();
            } else {
                this.descriptor = descriptor.withStatus(STATUS_PENDING);
            }
        }

        void settle() {
            this.transition = Transition.NONE;
            this.descriptor = descriptor.withStatus(STATUS_ACTIVE);
        }

        ResourceDescriptor view() {
            return descriptor;
        }
    }
}

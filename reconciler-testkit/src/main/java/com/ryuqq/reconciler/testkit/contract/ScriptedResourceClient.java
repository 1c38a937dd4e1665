package com.ryuqq.reconciler.testkit.contract;

import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.error.ResourceClientException;
import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.spi.ResourceClient;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ResourceClient} whose read responses are scripted in advance.
 *
 * <p>Each read consumes the next scripted step: either a status (returned on top of the
 * last known descriptor) or an error. When the script is exhausted, the last status step
 * repeats forever, which models a backend stuck in a state.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedResourceClient client = new ScriptedResourceClient()
 *     .thenStatus("PENDING")
 *     .thenError(ClientErrorType.CONFLICT)
 *     .thenStatus("ACTIVE");
 * </pre>
 *
 * <p>Not thread-safe; one instance per test.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class ScriptedResourceClient implements ResourceClient {

    private static final String DEFAULT_ID = "z1";

    private final ResourceId assignedId;
    private final Deque<Object> script = new ArrayDeque<>();
    private ResourceDescriptor current;
    private String lastStatus = "PENDING";

    private ClientErrorType createError;
    private ClientErrorType updateError;
    private ClientErrorType deleteError;
    private Runnable onRead = () -> { };

    private final AtomicInteger createCount = new AtomicInteger();
    private final AtomicInteger readCount = new AtomicInteger();
    private final AtomicInteger updateCount = new AtomicInteger();
    private final AtomicInteger deleteCount = new AtomicInteger();

    /**
     * Creates a client that assigns ID {@code z1} on create.
     */
    public ScriptedResourceClient() {
        this(ResourceId.of(DEFAULT_ID));
    }

    /**
     * Creates a client that assigns the given ID on create.
     *
     * @param assignedId ID returned by create
     */
    public ScriptedResourceClient(ResourceId assignedId) {
        if (assignedId == null) {
            throw new IllegalArgumentException("assignedId cannot be null");
        }
        this.assignedId = assignedId;
        this.current = ResourceDescriptor.builder(assignedId).status(lastStatus).build();
    }

    /**
     * Appends a read that returns the given raw status.
     */
    public ScriptedResourceClient thenStatus(String status) {
        script.add(status);
        return this;
    }

    /**
     * Appends a read that fails with the given error type.
     */
    public ScriptedResourceClient thenError(ClientErrorType type) {
        script.add(type);
        return this;
    }

    /**
     * Sets the descriptor the reads are based on (for read/update/delete scenarios without create).
     */
    public ScriptedResourceClient withExisting(ResourceDescriptor descriptor) {
        this.current = descriptor;
        this.lastStatus = descriptor.status();
        return this;
    }

    public ScriptedResourceClient failCreate(ClientErrorType type) {
        this.createError = type;
        return this;
    }

    public ScriptedResourceClient failUpdate(ClientErrorType type) {
        this.updateError = type;
        return this;
    }

    public ScriptedResourceClient failDelete(ClientErrorType type) {
        this.deleteError = type;
        return this;
    }

    /**
     * Registers a callback run at the start of every read (e.g. to advance a manual clock).
     */
    public ScriptedResourceClient onRead(Runnable onRead) {
        this.onRead = onRead == null ? () -> { } : onRead;
        return this;
    }

    @Override
    public ResourceDescriptor create(DesiredState desired) {
        createCount.incrementAndGet();
        if (createError != null) {
            throw new ResourceClientException(createError, "scripted create failure");
        }
        current = ResourceDescriptor.builder(assignedId)
            .status("PENDING")
            .name(desired.name())
            .email(desired.email())
            .ttl(desired.ttl())
            .description(desired.description())
            .type(desired.type())
            .masters(desired.masters())
            .attributes(desired.attributes())
            .build();
        lastStatus = "PENDING";
        return current;
    }

    @Override
    public ResourceDescriptor read(ResourceId id) {
        readCount.incrementAndGet();
        onRead.run();
        Object step = script.poll();
        if (step instanceof ClientErrorType type) {
            throw new ResourceClientException(type, "scripted read failure (" + type + ")");
        }
        if (step instanceof String status) {
            lastStatus = status;
        }
        current = current.withStatus(lastStatus);
        return current;
    }

    @Override
    public ResourceDescriptor update(ResourceId id, ResourceDelta delta) {
        updateCount.incrementAndGet();
        if (updateError != null) {
            throw new ResourceClientException(updateError, "scripted update failure");
        }
        current = delta.applyTo(current).withStatus("PENDING");
        lastStatus = "PENDING";
        return current;
    }

    @Override
    public void delete(ResourceId id) {
        deleteCount.incrementAndGet();
        if (deleteError != null) {
            throw new ResourceClientException(deleteError, "scripted delete failure");
        }
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
}

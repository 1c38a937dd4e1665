package com.ryuqq.reconciler.adapter.runner;

import com.ryuqq.reconciler.application.reconciler.ReconcileResult;
import com.ryuqq.reconciler.application.reconciler.Reconciler;
import com.ryuqq.reconciler.core.classifier.RetryClassifier;
import com.ryuqq.reconciler.core.classifier.StatusCodeRetryClassifier;
import com.ryuqq.reconciler.core.diagnostic.Diagnostic;
import com.ryuqq.reconciler.core.diagnostic.Phase;
import com.ryuqq.reconciler.core.error.ResourceClientException;
import com.ryuqq.reconciler.core.error.UnexpectedStateException;
import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ImportId;
import com.ryuqq.reconciler.core.model.MalformedImportIdException;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.outcome.Failed;
import com.ryuqq.reconciler.core.outcome.PollOutcome;
import com.ryuqq.reconciler.core.outcome.Reached;
import com.ryuqq.reconciler.core.poll.PollConfig;
import com.ryuqq.reconciler.core.spi.ResourceClient;
import com.ryuqq.reconciler.core.spi.StateResolver;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;
import com.ryuqq.reconciler.core.time.CancellationToken;
import com.ryuqq.reconciler.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciler 기본 구현체.
 *
 * <p>원격 변경 호출을 한 번 수행하고, 필요하면 {@link StatusPoller}로 목표 상태까지 대기한 뒤
 * 결과를 {@link ReconcileResult}로 반환합니다. 실패는 예외로 던지지 않고 Diagnostic으로 감쌉니다.</p>
 *
 * <p><strong>최종 Read:</strong> 폴링이 target에 도달한 tick의 Read 결과가 곧 최신 descriptor이므로
 * 추가 Read를 하지 않습니다. skipStatusCheck인 경우에만 변경 호출 직후 Read를 1회 수행합니다.</p>
 *
 * <p><strong>Update 중 삭제:</strong> Update 폴링 중 리소스가 사라지면(DELETED 관측) POLL_FATAL이 아닌
 * NOT_FOUND로 보고하여 {@link ReconcileResult#isGone()}이 true가 됩니다.</p>
 *
 * <p><strong>의존성 주입:</strong> ResourceClient는 호출자가 완전히 구성하여 전달합니다.
 * 이 클래스는 전역 설정을 읽거나 변경하지 않으며, 호출 간 공유되는 가변 상태가 없습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public final class DefaultReconciler implements Reconciler {

    private static final Logger log = LoggerFactory.getLogger(DefaultReconciler.class);

    private final ResourceClient client;
    private final StatusPoller poller;
    private final ReconcilerConfig config;

    /**
     * 기본 설정으로 생성.
     *
     * <p>상태 변환은 {@link StateResolver#byName()}, 재시도 분류는 {@link StatusCodeRetryClassifier},
     * 시계는 {@link TimeSource#system()}을 사용합니다.</p>
     *
     * @param client 리소스 클라이언트
     * @throws IllegalArgumentException client가 null인 경우
     */
    public DefaultReconciler(ResourceClient client) {
        this(client, StateResolver.byName(), new StatusCodeRetryClassifier(), TimeSource.system(),
            new ReconcilerConfig());
    }

    /**
     * 협력 객체를 모두 지정하여 생성.
     *
     * @param client 리소스 클라이언트
     * @param stateResolver 상태 변환기
     * @param retryClassifier 재시도 분류기
     * @param timeSource 시계
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultReconciler(ResourceClient client, StateResolver stateResolver, RetryClassifier retryClassifier,
                             TimeSource timeSource, ReconcilerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.poller = new StatusPoller(client, stateResolver, retryClassifier, timeSource,
            config.maxBackoffMs(), config.jitterFactor());
        this.client = client;
        this.config = config;
    }

    /**
     * 설정의 Create 폴링 값으로 생성.
     *
     * @param desired 목표 상태
     * @return 결과
     */
    public ReconcileResult create(DesiredState desired) {
        return create(desired, config.createPollConfig(), config.skipStatusCheck());
    }

    /**
     * 설정의 Update 폴링 값으로 수정.
     *
     * @param id 리소스 ID
     * @param delta 변경할 필드
     * @return 결과
     */
    public ReconcileResult update(ResourceId id, ResourceDelta delta) {
        return update(id, delta, config.updatePollConfig(), config.skipStatusCheck());
    }

    /**
     * 설정의 Delete 폴링 값으로 삭제.
     *
     * @param id 리소스 ID
     * @return 결과
     */
    public ReconcileResult delete(ResourceId id) {
        return delete(id, config.deletePollConfig(), config.skipStatusCheck());
    }

    @Override
    public ReconcileResult create(DesiredState desired, PollConfig pollConfig, boolean skipStatusCheck,
                                  CancellationToken cancellation) {
        if (desired == null) {
            throw new IllegalArgumentException("desired cannot be null");
        }
        requirePolling(pollConfig, cancellation);

        log.debug("Creating zone {}", desired.name());
        ResourceDescriptor created;
        try {
            created = client.create(desired);
        } catch (RuntimeException e) {
            Diagnostic diagnostic = Diagnostic.clientCallFailed(Phase.CREATE, null, e);
            log.warn("{}", diagnostic.message());
            return ReconcileResult.failure(diagnostic);
        }

        ResourceId id = created.id();
        log.debug("Created zone {} (status: {})", id, created.status());

        if (skipStatusCheck) {
            return readNow(Phase.CREATE, id);
        }
        return awaitAndReport(Phase.CREATE, id, pollConfig, cancellation);
    }

    @Override
    public ReconcileResult update(ResourceId id, ResourceDelta delta, PollConfig pollConfig,
                                  boolean skipStatusCheck, CancellationToken cancellation) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (delta == null) {
            throw new IllegalArgumentException("delta cannot be null");
        }
        requirePolling(pollConfig, cancellation);

        if (delta.isEmpty()) {
            log.debug("No mutable field changed for zone {}, skipping remote update", id);
            return readNow(Phase.UPDATE, id);
        }

        log.debug("Updating zone {} (fields: {})", id, delta.changedFields());
        try {
            client.update(id, delta);
        } catch (RuntimeException e) {
            Diagnostic diagnostic = ResourceClientException.isNotFound(e)
                ? Diagnostic.notFound(Phase.UPDATE, id, e)
                : Diagnostic.clientCallFailed(Phase.UPDATE, id, e);
            log.warn("{}", diagnostic.message());
            return ReconcileResult.failure(diagnostic);
        }

        if (skipStatusCheck) {
            return readNow(Phase.UPDATE, id);
        }
        return awaitAndReport(Phase.UPDATE, id, pollConfig, cancellation);
    }

    @Override
    public ReconcileResult delete(ResourceId id, PollConfig pollConfig, boolean skipStatusCheck,
                                  CancellationToken cancellation) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        requirePolling(pollConfig, cancellation);

        log.debug("Deleting zone {}", id);
        try {
            client.delete(id);
        } catch (RuntimeException e) {
            if (ResourceClientException.isNotFound(e)) {
                log.debug("Zone {} is already gone", id);
                return ReconcileResult.success(ResourceDescriptor.deleted(id));
            }
            Diagnostic diagnostic = Diagnostic.clientCallFailed(Phase.DELETE, id, e);
            log.warn("{}", diagnostic.message());
            return ReconcileResult.failure(diagnostic);
        }

        if (skipStatusCheck) {
            return ReconcileResult.success(ResourceDescriptor.deleted(id));
        }

        PollOutcome outcome = poller.await(id, Phase.DELETE, pollConfig, cancellation);
        if (!outcome.isReached()) {
            return pollFailure(Phase.DELETE, id, outcome);
        }
        log.debug("Deleted zone {} after {} reads", id, outcome.reads());
        return ReconcileResult.success(ResourceDescriptor.deleted(id));
    }

    @Override
    public ReconcileResult read(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return readNow(Phase.READ, id);
    }

    @Override
    public ReconcileResult importResource(String rawImportId) {
        ImportId importId;
        try {
            importId = ImportId.parse(rawImportId);
        } catch (MalformedImportIdException e) {
            Diagnostic diagnostic = Diagnostic.malformedImportId(e);
            log.warn("{}", diagnostic.message());
            return ReconcileResult.failure(diagnostic);
        }

        ReconcileResult result = readNow(Phase.IMPORT, importId.resourceId());
        if (!result.isSuccess() || !importId.hasProjectId()) {
            return result;
        }

        ResourceDescriptor descriptor = result.getDescriptorOrNull();
        if (descriptor.projectId() != null) {
            return result;
        }
        return ReconcileResult.success(descriptor.withProjectId(importId.projectIdOrNull()));
    }

    private ReconcileResult awaitAndReport(Phase phase, ResourceId id, PollConfig pollConfig,
                                           CancellationToken cancellation) {
        log.debug("Waiting for zone {} to become {}", id, phase.awaitedCondition());
        PollOutcome outcome = poller.await(id, phase, pollConfig, cancellation);
        if (phase == Phase.UPDATE && vanished(outcome)) {
            Diagnostic diagnostic = Diagnostic.notFound(phase, id, ((Failed) outcome).cause());
            log.warn("[{}] {}", diagnostic.code(), diagnostic.message());
            return ReconcileResult.failure(diagnostic);
        }
        if (!outcome.isReached()) {
            return pollFailure(phase, id, outcome);
        }

        Reached reached = (Reached) outcome;
        log.debug("Zone {} is {} after {} reads ({}ms)", id, reached.state(), reached.reads(), reached.elapsedMs());
        return ReconcileResult.success(reached.descriptor());
    }

    /**
     * 폴링 중 리소스가 사라져 DELETED가 관측되었는지 확인.
     */
    private static boolean vanished(PollOutcome outcome) {
        return outcome instanceof Failed failed
            && failed.cause() instanceof UnexpectedStateException unexpected
            && unexpected.getObserved() == LifecycleState.DELETED;
    }

    private ReconcileResult pollFailure(Phase phase, ResourceId id, PollOutcome outcome) {
        Diagnostic diagnostic = Diagnostic.fromPoll(phase, id, outcome);
        log.warn("[{}] {}", diagnostic.code(), diagnostic.message());
        return ReconcileResult.failure(diagnostic);
    }

    private ReconcileResult readNow(Phase phase, ResourceId id) {
        try {
            return ReconcileResult.success(client.read(id));
        } catch (RuntimeException e) {
            if (ResourceClientException.isNotFound(e)) {
                log.debug("Zone {} not found while {}", id, phase.gerund());
                return ReconcileResult.failure(Diagnostic.notFound(phase, id, e));
            }
            Diagnostic diagnostic = Diagnostic.clientCallFailed(phase, id, e);
            log.warn("{}", diagnostic.message());
            return ReconcileResult.failure(diagnostic);
        }
    }

    private static void requirePolling(PollConfig pollConfig, CancellationToken cancellation) {
        if (pollConfig == null) {
            throw new IllegalArgumentException("pollConfig cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
    }
}

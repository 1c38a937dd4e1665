package com.ryuqq.reconciler.adapter.runner;

import com.ryuqq.reconciler.core.classifier.RetryClassifier;
import com.ryuqq.reconciler.core.classifier.RetryDecision;
import com.ryuqq.reconciler.core.diagnostic.Phase;
import com.ryuqq.reconciler.core.error.PollTimeoutException;
import com.ryuqq.reconciler.core.error.ReconcileCancelledException;
import com.ryuqq.reconciler.core.error.ResourceClientException;
import com.ryuqq.reconciler.core.error.UnexpectedStateException;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.outcome.Cancelled;
import com.ryuqq.reconciler.core.outcome.Failed;
import com.ryuqq.reconciler.core.outcome.PollOutcome;
import com.ryuqq.reconciler.core.outcome.Reached;
import com.ryuqq.reconciler.core.outcome.TimedOut;
import com.ryuqq.reconciler.core.poll.PollConfig;
import com.ryuqq.reconciler.core.spi.ResourceClient;
import com.ryuqq.reconciler.core.spi.StateResolver;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;
import com.ryuqq.reconciler.core.statemachine.StateTransition;
import com.ryuqq.reconciler.core.time.CancellationToken;
import com.ryuqq.reconciler.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 리소스 상태 폴링 상태 머신.
 *
 * <p>리소스가 target 상태에 도달하거나, 치명적 오류가 발생하거나, 제한 시간이 지날 때까지
 * {@link ResourceClient#read(ResourceId)}를 반복 호출합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>시작 시각 기록 후 고정 지연(delay) 동안 대기 (그 전에는 Read하지 않음)</li>
 *   <li>매 tick 전: 취소 요청 시 Cancelled, 경과 시간 ≥ timeout이면 TimedOut
 *       (단, delay가 끝난 뒤 첫 tick은 항상 수행)</li>
 *   <li>Read 후 StateResolver로 상태 변환 (NOT_FOUND는 DELETED로 관측)</li>
 *   <li>target이면 Reached, pending이면 최소 간격 대기 후 반복, 그 외 상태는 Failed</li>
 *   <li>Read 실패 시 RetryClassifier 판정: RETRY면 backoff 대기 후 반복, FAIL이면 Failed</li>
 * </ol>
 *
 * <p><strong>마감 시각:</strong> 모든 대기는 남은 시간으로 잘리므로 마감 이후 Read는 발생하지 않습니다.
 * timeout == delay인 설정도 마감 시각에 Read 1회는 보장되므로 Read 없이 TimedOut이 되지 않습니다.
 * 단일 Read가 오래 걸리는 경우는 Client 자체의 호출 제한 시간에 맡깁니다.</p>
 *
 * <p><strong>인터럽트:</strong> 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 Cancelled를 반환합니다.</p>
 *
 * <p>인스턴스는 호출 간 상태를 공유하지 않으므로 여러 스레드에서 동시에 사용할 수 있습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public final class StatusPoller {

    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    private final ResourceClient client;
    private final StateResolver stateResolver;
    private final RetryClassifier retryClassifier;
    private final TimeSource timeSource;
    private final long maxBackoffMs;
    private final double jitterFactor;

    /**
     * 생성자.
     *
     * @param client 리소스 클라이언트
     * @param stateResolver 상태 변환기
     * @param retryClassifier 재시도 분류기
     * @param timeSource 시계
     * @param maxBackoffMs 재시도 backoff 상한 (밀리초, 양수)
     * @param jitterFactor backoff jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StatusPoller(ResourceClient client, StateResolver stateResolver, RetryClassifier retryClassifier,
                        TimeSource timeSource, long maxBackoffMs, double jitterFactor) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (stateResolver == null) {
            throw new IllegalArgumentException("stateResolver cannot be null");
        }
        if (retryClassifier == null) {
            throw new IllegalArgumentException("retryClassifier cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (maxBackoffMs <= 0) {
            throw new IllegalArgumentException("maxBackoffMs must be positive (current: " + maxBackoffMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.client = client;
        this.stateResolver = stateResolver;
        this.retryClassifier = retryClassifier;
        this.timeSource = timeSource;
        this.maxBackoffMs = maxBackoffMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * target 상태 도달까지 폴링.
     *
     * @param id 리소스 ID
     * @param phase 폴링을 요청한 단계 (재시도 분류에 전달)
     * @param config 폴링 설정
     * @param cancellation 취소 신호
     * @return 폴링 결과 (Reached, TimedOut, Failed, Cancelled 중 하나, null 아님)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PollOutcome await(ResourceId id, Phase phase, PollConfig config, CancellationToken cancellation) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        long startNanos = timeSource.nanoTime();
        BackoffCalculator backoff = new BackoffCalculator(
            config.minIntervalMs(), Math.max(config.minIntervalMs(), maxBackoffMs), jitterFactor);
        LifecycleState machineState = LifecycleState.PENDING;
        LifecycleState lastObserved = null;
        int reads = 0;
        int consecutiveRetries = 0;

        log.debug("Waiting {}ms before polling {} for {} (timeout: {}ms)",
            config.delayMs(), id, config.targets(), config.timeoutMs());
        InterruptedException interruption = pause(config.delayMs(), startNanos, config);
        if (interruption != null) {
            return interrupted(id, interruption, lastObserved, reads, startNanos);
        }

        while (true) {
            if (cancellation.isCancellationRequested()) {
                machineState = StateTransition.transition(machineState, LifecycleState.ERROR);
                long elapsedMs = elapsedMs(startNanos);
                log.info("Polling {} cancelled after {} reads ({}ms, state: {})", id, reads, elapsedMs, machineState);
                return new Cancelled(
                    new ReconcileCancelledException("polling of " + id.getValue() + " cancelled by caller"),
                    lastObserved, reads, elapsedMs);
            }

            long elapsedMs = elapsedMs(startNanos);
            if (reads > 0 && elapsedMs >= config.timeoutMs()) {
                machineState = StateTransition.transition(machineState, LifecycleState.ERROR);
                PollTimeoutException cause = new PollTimeoutException(
                    config.targets(), lastObserved, config.timeoutMs(), elapsedMs);
                log.warn("Polling {} timed out after {} reads: {}", id, reads, cause.getMessage());
                return new TimedOut(cause, lastObserved, reads, elapsedMs);
            }

            ResourceDescriptor descriptor;
            LifecycleState observed;
            reads++;
            try {
                descriptor = client.read(id);
                observed = stateResolver.resolve(descriptor.status());
            } catch (RuntimeException e) {
                if (ResourceClientException.isNotFound(e)) {
                    log.debug("{} not found on read #{}, observing as DELETED", id, reads);
                    descriptor = ResourceDescriptor.deleted(id);
                    observed = LifecycleState.DELETED;
                } else {
                    RetryDecision decision = retryClassifier.classify(e, phase);
                    if (decision != RetryDecision.RETRY) {
                        machineState = StateTransition.transition(machineState, LifecycleState.ERROR);
                        log.warn("Read #{} of {} failed with non-retryable error: {}", reads, id, e.getMessage());
                        return new Failed(e, lastObserved, reads, elapsedMs(startNanos));
                    }
                    consecutiveRetries++;
                    long waitMs = backoff.calculate(consecutiveRetries);
                    log.debug("Read #{} of {} failed with retryable error, retrying in {}ms (attempt {}): {}",
                        reads, id, waitMs, consecutiveRetries, e.getMessage());
                    interruption = pause(waitMs, startNanos, config);
                    if (interruption != null) {
                        return interrupted(id, interruption, lastObserved, reads, startNanos);
                    }
                    continue;
                }
            }

            consecutiveRetries = 0;
            lastObserved = observed;

            if (config.isTarget(observed)) {
                machineState = StateTransition.transition(machineState, observed);
                long reachedMs = elapsedMs(startNanos);
                log.debug("{} reached {} after {} reads ({}ms)", id, machineState, reads, reachedMs);
                return new Reached(observed, descriptor, reads, reachedMs);
            }

            if (!config.isPending(observed)) {
                machineState = StateTransition.transition(machineState, LifecycleState.ERROR);
                UnexpectedStateException cause = new UnexpectedStateException(observed, config.targets());
                log.warn("Polling {} stopped: {}", id, cause.getMessage());
                return new Failed(cause, observed, reads, elapsedMs(startNanos));
            }

            log.trace("{} still {} after read #{}", id, observed, reads);
            interruption = pause(config.minIntervalMs(), startNanos, config);
            if (interruption != null) {
                return interrupted(id, interruption, lastObserved, reads, startNanos);
            }
        }
    }

    /**
     * 남은 시간으로 잘라서 대기.
     *
     * <p>인터럽트되면 플래그를 복원하고 예외를 반환합니다.</p>
     *
     * @return 대기가 끝까지 진행되면 null, 인터럽트되면 해당 예외
     */
    private InterruptedException pause(long millis, long startNanos, PollConfig config) {
        long remainingMs = config.timeoutMs() - elapsedMs(startNanos);
        long waitMs = Math.min(millis, Math.max(remainingMs, 0));
        if (waitMs <= 0) {
            return null;
        }
        try {
            timeSource.sleep(waitMs);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }

    private Cancelled interrupted(ResourceId id, InterruptedException interruption, LifecycleState lastObserved,
                                  int reads, long startNanos) {
        long elapsedMs = elapsedMs(startNanos);
        log.info("Polling {} interrupted after {} reads ({}ms)", id, reads, elapsedMs);
        return new Cancelled(
            new ReconcileCancelledException("polling of " + id.getValue() + " interrupted", interruption),
            lastObserved, reads, elapsedMs);
    }

    private long elapsedMs(long startNanos) {
        return (timeSource.nanoTime() - startNanos) / 1_000_000;
    }
}

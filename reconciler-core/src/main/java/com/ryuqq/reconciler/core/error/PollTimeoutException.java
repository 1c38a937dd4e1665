package com.ryuqq.reconciler.core.error;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;

import java.util.Set;

/**
 * 폴링 deadline 초과.
 *
 * <p>리소스가 pending 상태에 머무른 채로 timeout이 지났음을 나타냅니다.
 * 치명적 오류와 구분되므로 호출자는 나중에 다시 시도할지 판단할 수 있습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class PollTimeoutException extends RuntimeException {

    private final LifecycleState lastObservedState;
    private final long timeoutMs;
    private final long elapsedMs;

    public PollTimeoutException(Set<LifecycleState> targets, LifecycleState lastObservedState,
                                long timeoutMs, long elapsedMs) {
        super(String.format("timeout while waiting for state to become %s (last state: %s, timeout: %dms, elapsed: %dms)",
            targets, lastObservedState, timeoutMs, elapsedMs));
        this.lastObservedState = lastObservedState;
        this.timeoutMs = timeoutMs;
        this.elapsedMs = elapsedMs;
    }

    /**
     * 마지막으로 관측된 상태.
     *
     * @return 마지막 상태 또는 null (한 번도 관측하지 못한 경우)
     */
    public LifecycleState getLastObservedState() {
        return lastObservedState;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }
}

package com.ryuqq.reconciler.core.outcome;

import com.ryuqq.reconciler.core.error.PollTimeoutException;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;

/**
 * deadline 초과.
 *
 * @param cause 마지막 관측 상태와 timeout 정보를 담은 예외
 * @param lastObservedState 마지막으로 관측된 상태 (한 번도 관측하지 못한 경우 null)
 * @param reads Read 호출 횟수
 * @param elapsedMs 경과 시간 (밀리초)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record TimedOut(
    PollTimeoutException cause,
    LifecycleState lastObservedState,
    int reads,
    long elapsedMs
) implements PollOutcome {

    public TimedOut {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public LifecycleState finalState() {
        return LifecycleState.ERROR;
    }
}

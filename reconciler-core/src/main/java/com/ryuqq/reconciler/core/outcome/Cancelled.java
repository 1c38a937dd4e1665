package com.ryuqq.reconciler.core.outcome;

import com.ryuqq.reconciler.core.error.ReconcileCancelledException;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;

/**
 * 호출자 취소.
 *
 * <p>취소는 tick 경계에서만 반영되며, 진행 중인 Read 호출을 중단하지 않습니다.</p>
 *
 * @param cause 취소 사유
 * @param lastObservedState 마지막으로 관측된 상태 (null 가능)
 * @param reads Read 호출 횟수
 * @param elapsedMs 경과 시간 (밀리초)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record Cancelled(
    ReconcileCancelledException cause,
    LifecycleState lastObservedState,
    int reads,
    long elapsedMs
) implements PollOutcome {

    public Cancelled {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public LifecycleState finalState() {
        return LifecycleState.ERROR;
    }
}

package com.ryuqq.reconciler.core.outcome;

import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;

/**
 * target 상태 도달.
 *
 * @param state 도달한 target 상태
 * @param descriptor 마지막 Read 결과
 * @param reads Read 호출 횟수
 * @param elapsedMs 경과 시간 (밀리초)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record Reached(
    LifecycleState state,
    ResourceDescriptor descriptor,
    int reads,
    long elapsedMs
) implements PollOutcome {

    public Reached {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal (current: " + state + ")");
        }
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (reads < 1) {
            throw new IllegalArgumentException("reads must be positive (current: " + reads + ")");
        }
    }

    @Override
    public LifecycleState finalState() {
        return state;
    }
}

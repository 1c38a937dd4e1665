package com.ryuqq.reconciler.core.outcome;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;

/**
 * 재시도 불가 실패.
 *
 * <p>Read 오류를 Retry Classifier가 FAIL로 분류했거나,
 * target/pending 어디에도 속하지 않는 상태를 관측한 경우입니다.</p>
 *
 * @param cause 원인
 * @param lastObservedState 마지막으로 관측된 상태 (null 가능)
 * @param reads Read 호출 횟수
 * @param elapsedMs 경과 시간 (밀리초)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record Failed(
    Throwable cause,
    LifecycleState lastObservedState,
    int reads,
    long elapsedMs
) implements PollOutcome {

    public Failed {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public LifecycleState finalState() {
        return LifecycleState.ERROR;
    }
}

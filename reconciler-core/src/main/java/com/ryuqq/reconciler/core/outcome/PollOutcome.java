package com.ryuqq.reconciler.core.outcome;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;

/**
 * 폴링 상태 머신의 종료 결과.
 *
 * <p>PollOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Reached}: target 상태 도달</li>
 *   <li>{@link TimedOut}: deadline 초과 (pending 상태 유지)</li>
 *   <li>{@link Failed}: 재시도 불가 오류 또는 예상하지 못한 상태</li>
 *   <li>{@link Cancelled}: 호출자 취소</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려져 있습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public sealed interface PollOutcome permits Reached, TimedOut, Failed, Cancelled {

    /**
     * 폴링 중 수행한 Read 호출 횟수 (실패한 Read 포함).
     *
     * @return Read 호출 횟수
     */
    int reads();

    /**
     * 폴링 시작부터 종료까지 경과 시간.
     *
     * @return 경과 시간 (밀리초)
     */
    long elapsedMs();

    /**
     * 상태 머신의 최종 상태.
     *
     * @return Reached인 경우 도달한 상태, 그 외에는 ERROR
     */
    LifecycleState finalState();

    default boolean isReached() {
        return this instanceof Reached;
    }
}

package com.ryuqq.reconciler.core.time;

/**
 * 협력적 취소 신호.
 *
 * <p>폴링 상태 머신은 매 tick 직전에 이 신호를 확인합니다.
 * 진행 중인 원격 호출은 중단되지 않습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationToken {

    /**
     * 취소가 요청되었는지 확인.
     *
     * @return 취소 요청 시 true
     */
    boolean isCancellationRequested();

    /**
     * 취소되지 않는 토큰.
     *
     * @return 항상 false를 반환하는 토큰
     */
    static CancellationToken none() {
        return () -> false;
    }
}

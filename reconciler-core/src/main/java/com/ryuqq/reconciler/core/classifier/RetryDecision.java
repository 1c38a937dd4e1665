package com.ryuqq.reconciler.core.classifier;

/**
 * 폴링 중 Read 오류에 대한 판정.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public enum RetryDecision {

    /**
     * 일시적 오류. PENDING을 유지하고 backoff 후 다시 Read합니다.
     */
    RETRY,

    /**
     * 영구 오류. 상태 머신을 ERROR로 종료합니다.
     */
    FAIL
}

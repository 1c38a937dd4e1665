package com.ryuqq.reconciler.core.classifier;

import com.ryuqq.reconciler.core.diagnostic.Phase;

/**
 * Retry Classifier SPI.
 *
 * <p>폴링 중 발생한 Read 오류가 일시적인지 판정합니다.
 * 최초의 Create/Update/Delete 호출에는 사용되지 않으며, 그 오류는 즉시 실패로 처리됩니다.</p>
 *
 * <p>구현체는 thread-safe해야 합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryClassifier {

    /**
     * 오류 분류.
     *
     * @param error Read 호출이 던진 오류
     * @param phase 폴링을 시작한 Reconcile 단계
     * @return RETRY 또는 FAIL
     */
    RetryDecision classify(Throwable error, Phase phase);
}

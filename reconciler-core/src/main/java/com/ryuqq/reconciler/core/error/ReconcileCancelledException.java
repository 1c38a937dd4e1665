package com.ryuqq.reconciler.core.error;

/**
 * 호출자가 Reconcile 호출을 취소함.
 *
 * <p>타임아웃과 구분되는 취소 사유를 Diagnostic의 cause로 전달하기 위해 사용합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class ReconcileCancelledException extends RuntimeException {

    public ReconcileCancelledException(String message) {
        super(message);
    }

    public ReconcileCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ryuqq.reconciler.core.error;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;

import java.util.Set;

/**
 * 폴링 중 target에도 pending에도 속하지 않는 상태를 관측함.
 *
 * <p>예: 생성 대기 중 ERROR 또는 DELETED 관측.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class UnexpectedStateException extends RuntimeException {

    private final LifecycleState observed;

    public UnexpectedStateException(LifecycleState observed, Set<LifecycleState> targets) {
        super(String.format("unexpected state '%s', wanted target %s", observed, targets));
        this.observed = observed;
    }

    public LifecycleState getObserved() {
        return observed;
    }
}

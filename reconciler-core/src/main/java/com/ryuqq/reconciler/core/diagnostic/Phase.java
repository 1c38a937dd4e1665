package com.ryuqq.reconciler.core.diagnostic;

/**
 * Reconcile 단계.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public enum Phase {

    CREATE("creating", "active"),
    READ("retrieving", null),
    UPDATE("updating", "active"),
    DELETE("deleting", "deleted"),
    IMPORT("importing", null);

    private final String gerund;
    private final String awaitedCondition;

    Phase(String gerund, String awaitedCondition) {
        this.gerund = gerund;
        this.awaitedCondition = awaitedCondition;
    }

    /**
     * 메시지용 진행형 동사 (예: "creating").
     */
    public String gerund() {
        return gerund;
    }

    /**
     * 폴링 시 기다리는 조건 (예: "active").
     *
     * @return 조건 또는 null (폴링하지 않는 단계)
     */
    public String awaitedCondition() {
        return awaitedCondition;
    }
}

package com.ryuqq.reconciler.core.model;

/**
 * DNS Zone 유형.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public enum ZoneType {

    /**
     * 이 백엔드가 레코드를 직접 관리하는 Zone.
     */
    PRIMARY,

    /**
     * masters 호스트로부터 Zone 전송(AXFR)을 받는 Zone.
     */
    SECONDARY
}

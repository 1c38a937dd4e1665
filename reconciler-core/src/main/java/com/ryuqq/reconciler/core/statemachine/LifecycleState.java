package com.ryuqq.reconciler.core.statemachine;

/**
 * 원격 리소스의 생명주기 상태.
 *
 * <p>백엔드가 매 폴링마다 보고하는 상태이며, 영속화되지 않습니다.
 * 폴링 상태 머신도 같은 상태 집합을 사용합니다.</p>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► ACTIVE  (생성/수정 완료)
 *    │
 *    ├─► DELETED (삭제 완료)
 *    │
 *    └─► ERROR   (치명적 오류, 타임아웃, 예상하지 못한 상태)
 *
 * 금지된 전이:
 * - ACTIVE → * ❌
 * - DELETED → * ❌
 * - ERROR → * ❌
 * </pre>
 *
 * <p><strong>불변식:</strong> PENDING은 경유 상태일 뿐이며,
 * Reconciler의 공개 연산은 PENDING 상태로 반환하지 않습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public enum LifecycleState {

    /**
     * 백엔드가 변경을 처리 중.
     */
    PENDING,

    /**
     * 사용 가능.
     */
    ACTIVE,

    /**
     * 삭제됨.
     */
    DELETED,

    /**
     * 오류.
     */
    ERROR;

    /**
     * 종료 상태인지 확인.
     *
     * @return ACTIVE, DELETED, ERROR인 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}

package com.ryuqq.reconciler.core.diagnostic;

/**
 * Diagnostic 오류 분류.
 *
 * <p>호출자가 나중에 다시 시도할 가치가 있는지 판단할 수 있도록
 * 타임아웃, 치명적 오류, 취소를 서로 구분합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 최초 Create/Update/Delete 호출 또는 단건 Read 호출 실패.
     */
    CLIENT_CALL_FAILED,

    /**
     * 리소스가 없음. 호출자는 로컬 기록을 삭제된 것으로 간주할 수 있습니다.
     */
    NOT_FOUND,

    /**
     * 리소스가 pending 상태인 채로 폴링 deadline 초과.
     */
    POLL_TIMEOUT,

    /**
     * 폴링 중 재시도 불가 오류 또는 예상하지 못한 상태 관측.
     */
    POLL_FATAL,

    /**
     * 호출자 취소.
     */
    CANCELLED,

    /**
     * Import 문자열 형식 오류.
     */
    MALFORMED_IMPORT_ID
}

package com.ryuqq.reconciler.core.error;

/**
 * Resource Client 오류 유형.
 *
 * <p>백엔드 응답 코드를 전송 계층과 무관한 유형으로 분류합니다.
 * 재시도 여부는 이 유형을 기반으로 {@code RetryClassifier}가 결정합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public enum ClientErrorType {

    BAD_REQUEST(400),
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    NOT_FOUND(404),
    CONFLICT(409),
    RATE_LIMITED(429),
    SERVER_ERROR(500),
    SERVICE_UNAVAILABLE(503),

    /**
     * 상태 코드가 없거나 알려지지 않은 오류 (예: 연결 실패).
     */
    UNKNOWN(0);

    private final int statusCode;

    ClientErrorType(int statusCode) {
        this.statusCode = statusCode;
    }

    /**
     * 대표 HTTP 상태 코드.
     *
     * @return 상태 코드 (UNKNOWN은 0)
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * HTTP 상태 코드로부터 유형 결정.
     *
     * <p>정확히 일치하는 유형이 없으면 5xx는 SERVER_ERROR, 4xx는 BAD_REQUEST, 그 외는 UNKNOWN입니다.</p>
     *
     * @param statusCode HTTP 상태 코드
     * @return 오류 유형
     */
    public static ClientErrorType fromStatusCode(int statusCode) {
        for (ClientErrorType type : values()) {
            if (type != UNKNOWN && type.statusCode == statusCode) {
                return type;
            }
        }
        if (statusCode >= 500 && statusCode < 600) {
            return SERVER_ERROR;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return BAD_REQUEST;
        }
        return UNKNOWN;
    }
}

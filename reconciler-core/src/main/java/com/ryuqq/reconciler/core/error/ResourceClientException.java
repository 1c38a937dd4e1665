package com.ryuqq.reconciler.core.error;

/**
 * Resource Client 호출 실패.
 *
 * <p>Resource Client 구현체는 모든 원격 호출 실패를 이 예외로 변환해야 합니다.
 * 존재하지 않는 리소스에 대한 Read는 반드시 {@link ClientErrorType#NOT_FOUND} 유형이어야 합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class ResourceClientException extends RuntimeException {

    private final ClientErrorType type;
    private final int statusCode;

    public ResourceClientException(ClientErrorType type, String message) {
        this(type, type == null ? 0 : type.statusCode(), message, null);
    }

    public ResourceClientException(ClientErrorType type, String message, Throwable cause) {
        this(type, type == null ? 0 : type.statusCode(), message, cause);
    }

    /**
     * 생성자.
     *
     * @param type 오류 유형
     * @param statusCode 백엔드가 반환한 실제 상태 코드
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException type이 null인 경우
     */
    public ResourceClientException(ClientErrorType type, int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.type = type;
        this.statusCode = statusCode;
    }

    /**
     * HTTP 상태 코드로부터 예외 생성.
     *
     * @param statusCode HTTP 상태 코드
     * @param message 오류 메시지
     * @return 상태 코드에 해당하는 유형의 예외
     */
    public static ResourceClientException ofStatus(int statusCode, String message) {
        return new ResourceClientException(ClientErrorType.fromStatusCode(statusCode), statusCode, message, null);
    }

    public static ResourceClientException notFound(String message) {
        return new ResourceClientException(ClientErrorType.NOT_FOUND, message);
    }

    public ClientErrorType getType() {
        return type;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return type == ClientErrorType.NOT_FOUND;
    }

    /**
     * 주어진 오류가 NOT_FOUND 유형의 Resource Client 오류인지 확인.
     *
     * @param error 검사할 오류 (null 가능)
     * @return NOT_FOUND인 경우 true
     */
    public static boolean isNotFound(Throwable error) {
        return error instanceof ResourceClientException clientError && clientError.isNotFound();
    }
}

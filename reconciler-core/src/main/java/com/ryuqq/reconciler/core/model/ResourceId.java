package com.ryuqq.reconciler.core.model;

/**
 * 원격 리소스의 식별자.
 *
 * <p>백엔드가 Create 응답으로 발급하는 불투명(opaque) 문자열이며,
 * 한 번 할당되면 변경되지 않습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>콜론(:) 불가 (Import ID 구분자로 사용됨)</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public final class ResourceId {

    private final String value;

    private ResourceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ResourceId length cannot exceed 255 characters");
        }
        if (value.indexOf(':') >= 0) {
            throw new IllegalArgumentException("ResourceId cannot contain ':' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ResourceId 생성.
     *
     * @param value 백엔드가 발급한 ID
     * @return ResourceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceId that = (ResourceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceId{" + value + '}';
    }
}

package com.ryuqq.reconciler.core.model;

import java.util.Map;
import java.util.Set;

/**
 * 호출자가 요청한 리소스의 목표 속성.
 *
 * <p>Create 요청의 입력이며, Update 시에는 마지막으로 관측된
 * {@link ResourceDescriptor}와 비교하여 {@link ResourceDelta}를 계산하는 데 사용됩니다.</p>
 *
 * <p>null인 선택 필드는 "관리하지 않음"을 의미하며, 백엔드 기본값을 따릅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DesiredState desired = DesiredState.of("example.com.")
 *     .withEmail("admin@example.com")
 *     .withTtl(300);
 * </pre>
 *
 * @param name Zone 이름 (필수)
 * @param email 관리자 이메일
 * @param ttl 기본 TTL (초, 0 이상)
 * @param description 설명
 * @param type Zone 유형
 * @param masters master 호스트 집합 (순서 무관)
 * @param attributes 자유 형식 key/value 속성
 * @param valueSpecs 백엔드 고유 옵션 (그대로 전달됨)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record DesiredState(
    String name,
    String email,
    Integer ttl,
    String description,
    ZoneType type,
    Set<String> masters,
    Map<String, String> attributes,
    Map<String, String> valueSpecs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null/blank이거나 ttl이 음수인 경우
     */
    public DesiredState {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (ttl != null && ttl < 0) {
            throw new IllegalArgumentException("ttl must be non-negative (current: " + ttl + ")");
        }
        masters = masters == null ? Set.of() : Set.copyOf(masters);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        valueSpecs = valueSpecs == null ? Map.of() : Map.copyOf(valueSpecs);
    }

    /**
     * 이름만 지정한 DesiredState 생성.
     *
     * @param name Zone 이름
     * @return DesiredState 인스턴스
     */
    public static DesiredState of(String name) {
        return new DesiredState(name, null, null, null, null, null, null, null);
    }

    public DesiredState withEmail(String email) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }

    public DesiredState withTtl(Integer ttl) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }

    public DesiredState withDescription(String description) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }

    public DesiredState withType(ZoneType type) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }

    public DesiredState withMasters(Set<String> masters) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }

    public DesiredState withAttributes(Map<String, String> attributes) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }

    public DesiredState withValueSpecs(Map<String, String> valueSpecs) {
        return new DesiredState(name, email, ttl, description, type, masters, attributes, valueSpecs);
    }
}

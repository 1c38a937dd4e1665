package com.ryuqq.reconciler.core.model;

import java.util.Map;
import java.util.Set;

/**
 * 원격 리소스(DNS Zone)의 관측된 상태.
 *
 * <p>Resource Client가 Create/Read/Update 응답으로 반환하는 불변 스냅샷입니다.
 * Reconciler는 매 호출마다 새 인스턴스를 반환하며, 호출 간 영속화는
 * 호출자의 책임입니다.</p>
 *
 * <p><strong>불변성:</strong></p>
 * <ul>
 *   <li>masters, attributes는 방어적 복사 후 불변 컬렉션으로 보관</li>
 *   <li>masters는 순서 무관 (Set 비교)</li>
 *   <li>status는 백엔드의 원시 상태 문자열이며, {@code StateResolver}가 해석합니다</li>
 * </ul>
 *
 * @param id 리소스 ID
 * @param status 백엔드가 보고한 원시 상태 (예: ACTIVE, PENDING)
 * @param name Zone 이름
 * @param email 관리자 이메일 (null 가능)
 * @param ttl 기본 TTL (초, null 가능)
 * @param description 설명 (null 가능)
 * @param type Zone 유형 (null 가능)
 * @param masters SECONDARY Zone의 master 호스트 집합
 * @param attributes 자유 형식 key/value 속성
 * @param projectId 소유 프로젝트 ID (null 가능)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record ResourceDescriptor(
    ResourceId id,
    String status,
    String name,
    String email,
    Integer ttl,
    String description,
    ZoneType type,
    Set<String> masters,
    Map<String, String> attributes,
    String projectId
) {

    /**
     * 삭제 완료를 나타내는 상태 문자열.
     */
    public static final String STATUS_DELETED = "DELETED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null인 경우
     */
    public ResourceDescriptor {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        masters = masters == null ? Set.of() : Set.copyOf(masters);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 삭제가 완료된 리소스의 descriptor 생성.
     *
     * <p>Delete 성공 시 반환값으로 사용되며, ID와 DELETED 상태만 가집니다.</p>
     *
     * @param id 리소스 ID
     * @return status가 DELETED인 descriptor
     */
    public static ResourceDescriptor deleted(ResourceId id) {
        return builder(id).status(STATUS_DELETED).build();
    }

    public static Builder builder(ResourceId id) {
        return new Builder(id);
    }

    /**
     * projectId만 변경한 새 인스턴스 생성.
     */
    public ResourceDescriptor withProjectId(String projectId) {
        return new ResourceDescriptor(id, status, name, email, ttl, description, type, masters, attributes, projectId);
    }

    /**
     * status만 변경한 새 인스턴스 생성.
     */
    public ResourceDescriptor withStatus(String status) {
        return new ResourceDescriptor(id, status, name, email, ttl, description, type, masters, attributes, projectId);
    }

    /**
     * 현재 값을 복사한 Builder 생성.
     */
    public Builder toBuilder() {
        return new Builder(id)
            .status(status)
            .name(name)
            .email(email)
            .ttl(ttl)
            .description(description)
            .type(type)
            .masters(masters)
            .attributes(attributes)
            .projectId(projectId);
    }

    /**
     * ResourceDescriptor Builder.
     *
     * <p>필드가 많은 descriptor를 Resource Client 구현체와 테스트에서 읽기 쉽게 만들기 위한 용도입니다.</p>
     */
    public static final class Builder {

        private final ResourceId id;
        private String status;
        private String name;
        private String email;
        private Integer ttl;
        private String description;
        private ZoneType type;
        private Set<String> masters;
        private Map<String, String> attributes;
        private String projectId;

        private Builder(ResourceId id) {
            this.id = id;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder ttl(Integer ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(ZoneType type) {
            this.type = type;
            return this;
        }

        public Builder masters(Set<String> masters) {
            this.masters = masters;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public ResourceDescriptor build() {
            return new ResourceDescriptor(id, status, name, email, ttl, description, type, masters, attributes, projectId);
        }
    }
}

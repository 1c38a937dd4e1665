package com.ryuqq.reconciler.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 원격에서 변경 가능한 필드에 대한 타입 안전한 패치.
 *
 * <p>Update 호출에 그대로 전달되며, {@link #isEmpty()}가 true이면
 * Reconciler는 원격 Update 호출을 생략하고 Read만 수행합니다.</p>
 *
 * <p><strong>변경 가능한 필드:</strong> email, ttl, masters, description.
 * name, type, attributes는 생성 후 변경할 수 없으므로 포함되지 않습니다.</p>
 *
 * <p>null 필드는 "변경 없음"을 의미합니다.</p>
 *
 * @param email 새 이메일
 * @param ttl 새 TTL (0 이상)
 * @param masters 새 master 호스트 집합
 * @param description 새 설명 (빈 문자열은 설명 삭제)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record ResourceDelta(
    String email,
    Integer ttl,
    Set<String> masters,
    String description
) {

    private static final ResourceDelta EMPTY = new ResourceDelta(null, null, null, null);

    public ResourceDelta {
        if (ttl != null && ttl < 0) {
            throw new IllegalArgumentException("ttl must be non-negative (current: " + ttl + ")");
        }
        masters = masters == null ? null : Set.copyOf(masters);
    }

    public static ResourceDelta empty() {
        return EMPTY;
    }

    /**
     * 마지막으로 관측된 상태와 목표 상태를 비교하여 delta 계산.
     *
     * <p>목표 상태에서 null인 email, ttl, description은 관리 대상이 아니므로 비교하지 않습니다.
     * masters는 순서와 무관하게 집합으로 비교합니다.</p>
     *
     * @param current 마지막으로 관측된 descriptor
     * @param desired 목표 상태
     * @return 변경된 필드만 담은 delta (변경이 없으면 {@link #empty()})
     * @throws IllegalArgumentException current 또는 desired가 null인 경우
     */
    public static ResourceDelta between(ResourceDescriptor current, DesiredState desired) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        if (desired == null) {
            throw new IllegalArgumentException("desired cannot be null");
        }

        String email = changed(current.email(), desired.email());
        Integer ttl = changed(current.ttl(), desired.ttl());
        String description = changed(current.description(), desired.description());
        Set<String> masters = current.masters().equals(desired.masters()) ? null : desired.masters();

        ResourceDelta delta = new ResourceDelta(email, ttl, masters, description);
        return delta.isEmpty() ? EMPTY : delta;
    }

    private static <T> T changed(T current, T desired) {
        if (desired == null || Objects.equals(current, desired)) {
            return null;
        }
        return desired;
    }

    public ResourceDelta withEmail(String email) {
        return new ResourceDelta(email, ttl, masters, description);
    }

    public ResourceDelta withTtl(Integer ttl) {
        return new ResourceDelta(email, ttl, masters, description);
    }

    public ResourceDelta withMasters(Set<String> masters) {
        return new ResourceDelta(email, ttl, masters, description);
    }

    public ResourceDelta withDescription(String description) {
        return new ResourceDelta(email, ttl, masters, description);
    }

    /**
     * 변경 필드가 하나도 없는지 확인.
     *
     * @return 모든 필드가 null이면 true
     */
    public boolean isEmpty() {
        return email == null && ttl == null && masters == null && description == null;
    }

    /**
     * 변경된 필드 이름 목록 (로깅용).
     *
     * @return 변경된 필드 이름 (선언 순서)
     */
    public List<String> changedFields() {
        List<String> fields = new ArrayList<>(4);
        if (email != null) fields.add("email");
        if (ttl != null) fields.add("ttl");
        if (masters != null) fields.add("masters");
        if (description != null) fields.add("description");
        return List.copyOf(fields);
    }

    /**
     * 이 delta를 descriptor에 적용한 결과 계산.
     *
     * <p>Resource Client 구현체가 로컬 사본을 갱신할 때 사용합니다.</p>
     *
     * @param current 현재 descriptor
     * @return delta가 적용된 새 descriptor
     */
    public ResourceDescriptor applyTo(ResourceDescriptor current) {
        ResourceDescriptor.Builder builder = current.toBuilder();
        if (email != null) builder.email(email);
        if (ttl != null) builder.ttl(ttl);
        if (masters != null) builder.masters(masters);
        if (description != null) builder.description(description);
        return builder.build();
    }
}

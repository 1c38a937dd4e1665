package com.ryuqq.reconciler.core.model;

/**
 * Import 문자열의 파싱 결과.
 *
 * <p>외부에서 이미 생성된 리소스를 관리 대상으로 가져올 때 사용하는 ID이며,
 * 다른 프로젝트의 리소스를 가져올 수 있도록 두 가지 형식을 지원합니다.</p>
 * <ul>
 *   <li>{@code <id>}</li>
 *   <li>{@code <id>:<projectId>}</li>
 * </ul>
 *
 * @param resourceId 리소스 ID
 * @param projectIdOrNull 프로젝트 ID (지정하지 않은 경우 null)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record ImportId(ResourceId resourceId, String projectIdOrNull) {

    private static final String SEPARATOR = ":";

    public ImportId {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (projectIdOrNull != null && projectIdOrNull.isBlank()) {
            throw new IllegalArgumentException("projectId cannot be blank when present");
        }
    }

    /**
     * Import 문자열 파싱.
     *
     * @param raw {@code <id>} 또는 {@code <id>:<projectId>}
     * @return 파싱된 ImportId
     * @throws MalformedImportIdException 형식이 올바르지 않은 경우
     */
    public static ImportId parse(String raw) {
        if (raw == null) {
            throw new MalformedImportIdException(null);
        }
        String[] parts = raw.split(SEPARATOR, -1);
        if (parts[0].isBlank() || parts.length > 2) {
            throw new MalformedImportIdException(raw);
        }
        if (parts.length == 2 && parts[1].isBlank()) {
            throw new MalformedImportIdException(raw);
        }
        String projectId = parts.length == 2 ? parts[1] : null;
        try {
            return new ImportId(ResourceId.of(parts[0]), projectId);
        } catch (IllegalArgumentException e) {
            throw new MalformedImportIdException(raw, e);
        }
    }

    public boolean hasProjectId() {
        return projectIdOrNull != null;
    }
}

package com.ryuqq.reconciler.core.model;

/**
 * Import 문자열이 {@code <id>} 또는 {@code <id>:<projectId>} 형식이 아닐 때 발생.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class MalformedImportIdException extends IllegalArgumentException {

    private final String rawImportId;

    public MalformedImportIdException(String rawImportId) {
        super("unexpected format of ID (" + rawImportId + "), expected <id> or <id>:<projectId>");
        this.rawImportId = rawImportId;
    }

    public MalformedImportIdException(String rawImportId, Throwable cause) {
        super("unexpected format of ID (" + rawImportId + "), expected <id> or <id>:<projectId>", cause);
        this.rawImportId = rawImportId;
    }

    public String getRawImportId() {
        return rawImportId;
    }
}

package com.ryuqq.reconciler.core.diagnostic;

import com.ryuqq.reconciler.core.model.MalformedImportIdException;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.outcome.Cancelled;
import com.ryuqq.reconciler.core.outcome.Failed;
import com.ryuqq.reconciler.core.outcome.PollOutcome;
import com.ryuqq.reconciler.core.outcome.TimedOut;
import com.ryuqq.reconciler.core.statemachine.LifecycleState;

/**
 * Reconcile 실패 기록.
 *
 * <p>모든 실패는 Diagnostic으로 호출자에게 전달되며, 조용히 버려지지 않습니다.</p>
 *
 * <p><strong>포함 정보:</strong></p>
 * <ul>
 *   <li>단계 (create/read/update/delete/import)</li>
 *   <li>리소스 ID (할당된 경우)</li>
 *   <li>원인 및 메시지</li>
 *   <li>폴링 실패 시 마지막 관측 상태와 경과 시간</li>
 * </ul>
 *
 * <p><strong>부분 실패:</strong> Create 호출은 성공했지만 폴링이 실패한 경우
 * resourceIdOrNull이 채워져 있으며, 리소스는 롤백되지 않습니다 ({@link #isPartialCreate()}).</p>
 *
 * @param phase 실패한 단계
 * @param kind 오류 분류
 * @param resourceIdOrNull 리소스 ID (할당 전이면 null)
 * @param message 사용자에게 보여줄 메시지
 * @param cause 원인 (null 가능)
 * @param lastObservedStateOrNull 폴링 중 마지막으로 관측된 상태 (null 가능)
 * @param elapsedMs 폴링 경과 시간 (폴링하지 않았으면 0)
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public record Diagnostic(
    Phase phase,
    ErrorKind kind,
    ResourceId resourceIdOrNull,
    String message,
    Throwable cause,
    LifecycleState lastObservedStateOrNull,
    long elapsedMs
) {

    private static final String RESOURCE_NAME = "zone";

    public Diagnostic {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be non-negative (current: " + elapsedMs + ")");
        }
    }

    /**
     * 최초 원격 호출 실패.
     *
     * @param phase 단계
     * @param resourceIdOrNull 리소스 ID (Create는 null)
     * @param cause 원인
     * @return Diagnostic (kind=CLIENT_CALL_FAILED)
     */
    public static Diagnostic clientCallFailed(Phase phase, ResourceId resourceIdOrNull, Throwable cause) {
        String message = String.format("Error %s %s%s: %s",
            phase.gerund(), RESOURCE_NAME, describe(resourceIdOrNull), causeMessage(cause));
        return new Diagnostic(phase, ErrorKind.CLIENT_CALL_FAILED, resourceIdOrNull, message, cause, null, 0);
    }

    /**
     * 리소스 없음.
     *
     * @param phase 단계
     * @param resourceId 리소스 ID
     * @param cause 원인 (NOT_FOUND 예외)
     * @return Diagnostic (kind=NOT_FOUND)
     */
    public static Diagnostic notFound(Phase phase, ResourceId resourceId, Throwable cause) {
        String message = String.format("%s%s is gone (%s): %s",
            RESOURCE_NAME, describe(resourceId), phase.gerund(), causeMessage(cause));
        return new Diagnostic(phase, ErrorKind.NOT_FOUND, resourceId, message, cause, null, 0);
    }

    /**
     * 폴링 실패.
     *
     * @param phase 단계
     * @param resourceId 리소스 ID
     * @param outcome Reached가 아닌 폴링 결과
     * @return Diagnostic (kind=POLL_TIMEOUT, POLL_FATAL, CANCELLED 중 하나)
     * @throws IllegalArgumentException outcome이 null이거나 Reached인 경우
     */
    public static Diagnostic fromPoll(Phase phase, ResourceId resourceId, PollOutcome outcome) {
        if (outcome == null || outcome.isReached()) {
            throw new IllegalArgumentException("outcome must be a failed poll outcome (current: " + outcome + ")");
        }

        ErrorKind kind;
        Throwable cause;
        LifecycleState lastObserved;
        if (outcome instanceof TimedOut timedOut) {
            kind = ErrorKind.POLL_TIMEOUT;
            cause = timedOut.cause();
            lastObserved = timedOut.lastObservedState();
        } else if (outcome instanceof Failed failed) {
            kind = ErrorKind.POLL_FATAL;
            cause = failed.cause();
            lastObserved = failed.lastObservedState();
        } else {
            Cancelled cancelled = (Cancelled) outcome;
            kind = ErrorKind.CANCELLED;
            cause = cancelled.cause();
            lastObserved = cancelled.lastObservedState();
        }

        String message = String.format("Error waiting for %s%s to become %s: %s",
            RESOURCE_NAME, describe(resourceId), phase.awaitedCondition(), causeMessage(cause));
        return new Diagnostic(phase, kind, resourceId, message, cause, lastObserved, outcome.elapsedMs());
    }

    /**
     * Import 문자열 형식 오류.
     *
     * @param cause 파싱 예외
     * @return Diagnostic (kind=MALFORMED_IMPORT_ID)
     */
    public static Diagnostic malformedImportId(MalformedImportIdException cause) {
        return new Diagnostic(Phase.IMPORT, ErrorKind.MALFORMED_IMPORT_ID, null,
            cause.getMessage(), cause, null, 0);
    }

    /**
     * 안정적인 오류 코드.
     *
     * <p>예: CREATE_FAILED, CREATE_TIMEOUT_OR_ERROR, DELETE_FAILED, READ_NOT_FOUND</p>
     *
     * @return 오류 코드
     */
    public String code() {
        return switch (kind) {
            case CLIENT_CALL_FAILED -> phase.name() + "_FAILED";
            case POLL_TIMEOUT, POLL_FATAL -> phase.name() + "_TIMEOUT_OR_ERROR";
            case NOT_FOUND -> phase.name() + "_NOT_FOUND";
            case CANCELLED -> phase.name() + "_CANCELLED";
            case MALFORMED_IMPORT_ID -> "MALFORMED_IMPORT_ID";
        };
    }

    /**
     * Create 호출은 성공했으나 이후 단계가 실패했는지 확인.
     *
     * <p>true인 경우 호출자는 리소스가 원격에 존재할 수 있음을 추적해야 합니다.</p>
     *
     * @return 부분 생성 여부
     */
    public boolean isPartialCreate() {
        return phase == Phase.CREATE && resourceIdOrNull != null;
    }

    public boolean isTimeout() {
        return kind == ErrorKind.POLL_TIMEOUT;
    }

    private static String describe(ResourceId resourceId) {
        return resourceId == null ? "" : " " + resourceId.getValue();
    }

    private static String causeMessage(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

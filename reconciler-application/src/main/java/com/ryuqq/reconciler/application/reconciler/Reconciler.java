package com.ryuqq.reconciler.application.reconciler;

import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.poll.PollConfig;
import com.ryuqq.reconciler.core.time.CancellationToken;

/**
 * 리소스 생명주기 Reconcile 계약.
 *
 * <p>외부 CRUD 핸들러 계층에 노출되는 동기 API입니다. 모든 연산은 블로킹이며,
 * 반환 시 {@link ReconcileResult}의 descriptor와 diagnostic 중 정확히 하나만 non-null입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ReconcileResult result = reconciler.create(
 *     DesiredState.of("example.com.").withTtl(300),
 *     PollConfig.untilActive(600_000),
 *     false);
 *
 * if (result.isSuccess()) {
 *     ResourceDescriptor zone = result.getDescriptorOrNull();
 * } else if (result.getDiagnosticOrNull().isPartialCreate()) {
 *     // 원격에 리소스가 남아있을 수 있음
 * }
 * </pre>
 *
 * <p><strong>동시성:</strong> 서로 다른 리소스 ID에 대한 호출은 동시에 실행할 수 있습니다.
 * 같은 ID에 대한 동시 호출은 계약 위반이며, 호출자가 직렬화해야 합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public interface Reconciler {

    /**
     * 리소스 생성 후 ACTIVE까지 대기.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>Client.create 호출 (실패 시 CREATE_FAILED)</li>
     *   <li>skipStatusCheck인 경우 즉시 Read 1회 후 반환</li>
     *   <li>target={ACTIVE}, pending={PENDING}으로 폴링 (실패 시 CREATE_TIMEOUT_OR_ERROR, ID 유지)</li>
     *   <li>ACTIVE 도달 시 Read 결과 반환</li>
     * </ol>
     *
     * @param desired 목표 상태
     * @param pollConfig 폴링 설정
     * @param skipStatusCheck true면 폴링 생략
     * @param cancellation 취소 신호
     * @return 결과 (descriptor 또는 diagnostic)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    ReconcileResult create(DesiredState desired, PollConfig pollConfig, boolean skipStatusCheck,
                           CancellationToken cancellation);

    default ReconcileResult create(DesiredState desired, PollConfig pollConfig, boolean skipStatusCheck) {
        return create(desired, pollConfig, skipStatusCheck, CancellationToken.none());
    }

    /**
     * 리소스 수정 후 ACTIVE까지 대기.
     *
     * <p>delta가 비어있으면 원격 Update를 호출하지 않고 Read 결과만 반환합니다.</p>
     *
     * @param id 리소스 ID
     * @param delta 변경할 필드
     * @param pollConfig 폴링 설정
     * @param skipStatusCheck true면 폴링 생략
     * @param cancellation 취소 신호
     * @return 결과 (descriptor 또는 diagnostic)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    ReconcileResult update(ResourceId id, ResourceDelta delta, PollConfig pollConfig, boolean skipStatusCheck,
                           CancellationToken cancellation);

    default ReconcileResult update(ResourceId id, ResourceDelta delta, PollConfig pollConfig, boolean skipStatusCheck) {
        return update(id, delta, pollConfig, skipStatusCheck, CancellationToken.none());
    }

    /**
     * 리소스 삭제 후 DELETED까지 대기.
     *
     * <p>이미 없는 리소스(NOT_FOUND)는 성공으로 처리합니다 (멱등 삭제).
     * 성공 시 descriptor는 ID와 DELETED 상태만 가집니다.</p>
     *
     * @param id 리소스 ID
     * @param pollConfig 폴링 설정
     * @param skipStatusCheck true면 폴링 생략
     * @param cancellation 취소 신호
     * @return 결과 (descriptor 또는 diagnostic)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    ReconcileResult delete(ResourceId id, PollConfig pollConfig, boolean skipStatusCheck,
                           CancellationToken cancellation);

    default ReconcileResult delete(ResourceId id, PollConfig pollConfig, boolean skipStatusCheck) {
        return delete(id, pollConfig, skipStatusCheck, CancellationToken.none());
    }

    /**
     * 리소스 조회.
     *
     * <p>NOT_FOUND는 {@link ReconcileResult#isGone()}으로 구분되어 반환됩니다.</p>
     *
     * @param id 리소스 ID
     * @return 결과 (descriptor 또는 diagnostic)
     * @throws IllegalArgumentException id가 null인 경우
     */
    ReconcileResult read(ResourceId id);

    /**
     * 외부에서 생성된 리소스 가져오기.
     *
     * @param rawImportId {@code <id>} 또는 {@code <id>:<projectId>}
     * @return 결과 (형식 오류 시 MALFORMED_IMPORT_ID diagnostic)
     */
    ReconcileResult importResource(String rawImportId);
}

package com.ryuqq.reconciler.core.spi;

import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;

/**
 * Resource Client SPI.
 *
 * <p>원격 API에 대해 Create/Read/Update/Delete를 수행합니다.
 * Reconciler는 준비가 끝난 인스턴스를 주입받으며, 리전이나 인증 헤더 같은
 * 클라이언트 설정을 변경하지 않습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>모든 실패는 {@link com.ryuqq.reconciler.core.error.ResourceClientException}으로 보고</li>
 *   <li>존재하지 않는 ID에 대한 {@link #read}는 NOT_FOUND 유형으로 실패</li>
 *   <li>전송 계층에서 멱등(재시도 안전)해야 함. 백엔드가 재시도를 금지하는 오류는
 *       Retry Classifier가 FAIL로 분류할 수 있는 유형으로 보고</li>
 *   <li>서로 다른 ID에 대해 동시 호출 가능 (thread-safe)</li>
 *   <li>호출 단위 타임아웃은 구현체가 강제</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public interface ResourceClient {

    /**
     * 리소스 생성 요청.
     *
     * @param desired 목표 상태
     * @return 백엔드가 ID를 할당한 descriptor (보통 PENDING 상태)
     * @throws com.ryuqq.reconciler.core.error.ResourceClientException 호출 실패 시
     */
    ResourceDescriptor create(DesiredState desired);

    /**
     * 리소스 조회.
     *
     * @param id 리소스 ID
     * @return 현재 descriptor
     * @throws com.ryuqq.reconciler.core.error.ResourceClientException 호출 실패 시 (없으면 NOT_FOUND)
     */
    ResourceDescriptor read(ResourceId id);

    /**
     * 리소스 수정 요청.
     *
     * @param id 리소스 ID
     * @param delta 변경할 필드 (비어있지 않음)
     * @return 수정 요청 직후의 descriptor
     * @throws com.ryuqq.reconciler.core.error.ResourceClientException 호출 실패 시
     */
    ResourceDescriptor update(ResourceId id, ResourceDelta delta);

    /**
     * 리소스 삭제 요청.
     *
     * @param id 리소스 ID
     * @throws com.ryuqq.reconciler.core.error.ResourceClientException 호출 실패 시 (없으면 NOT_FOUND)
     */
    void delete(ResourceId id);
}

package com.ryuqq.reconciler.application.reconciler;

import com.ryuqq.reconciler.core.diagnostic.Diagnostic;
import com.ryuqq.reconciler.core.diagnostic.ErrorKind;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;

/**
 * Reconcile 호출 결과.
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>성공:</strong> descriptorOrNull non-null, diagnosticOrNull null</li>
 *   <li><strong>실패:</strong> descriptorOrNull null, diagnosticOrNull non-null</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public final class ReconcileResult {

    private final ResourceDescriptor descriptorOrNull;
    private final Diagnostic diagnosticOrNull;

    /**
     * Private constructor - 정적 팩토리 메서드 사용.
     */
    private ReconcileResult(ResourceDescriptor descriptorOrNull, Diagnostic diagnosticOrNull) {
        this.descriptorOrNull = descriptorOrNull;
        this.diagnosticOrNull = diagnosticOrNull;
    }

    /**
     * 성공 결과 생성.
     *
     * @param descriptor 최종 descriptor
     * @return ReconcileResult (성공)
     * @throws IllegalArgumentException descriptor가 null인 경우
     */
    public static ReconcileResult success(ResourceDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null for success result");
        }
        return new ReconcileResult(descriptor, null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param diagnostic 실패 기록
     * @return ReconcileResult (실패)
     * @throws IllegalArgumentException diagnostic이 null인 경우
     */
    public static ReconcileResult failure(Diagnostic diagnostic) {
        if (diagnostic == null) {
            throw new IllegalArgumentException("diagnostic cannot be null for failure result");
        }
        return new ReconcileResult(null, diagnostic);
    }

    public boolean isSuccess() {
        return descriptorOrNull != null;
    }

    /**
     * 리소스가 원격에 없는지 확인.
     *
     * <p>true인 경우 호출자는 로컬 기록을 오래된 것(이미 삭제됨)으로 처리할 수 있습니다.</p>
     *
     * @return NOT_FOUND diagnostic인 경우 true
     */
    public boolean isGone() {
        return diagnosticOrNull != null && diagnosticOrNull.kind() == ErrorKind.NOT_FOUND;
    }

    /**
     * 최종 descriptor 조회.
     *
     * @return descriptor 또는 null (실패 시)
     */
    public ResourceDescriptor getDescriptorOrNull() {
        return descriptorOrNull;
    }

    /**
     * 실패 기록 조회.
     *
     * @return diagnostic 또는 null (성공 시)
     */
    public Diagnostic getDiagnosticOrNull() {
        return diagnosticOrNull;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ReconcileResult{success=true, descriptor=" + descriptorOrNull + "}";
        } else {
            return "ReconcileResult{success=false, code=" + diagnosticOrNull.code()
                + ", message=" + diagnosticOrNull.message() + "}";
        }
    }
}

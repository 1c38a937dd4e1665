package com.ryuqq.reconciler.core.classifier;

import com.ryuqq.reconciler.core.diagnostic.Phase;
import com.ryuqq.reconciler.core.error.ClientErrorType;
import com.ryuqq.reconciler.core.error.ResourceClientException;

import java.util.EnumSet;
import java.util.Set;

/**
 * 오류 유형 기반 Retry Classifier.
 *
 * <p>{@link ResourceClientException}의 유형이 재시도 가능 집합에 속하면 RETRY,
 * 그 외의 모든 오류(Resource Client 예외가 아닌 오류 포함)는 FAIL입니다.</p>
 *
 * <p><strong>기본 재시도 가능 집합:</strong></p>
 * <ul>
 *   <li>CONFLICT (409)</li>
 *   <li>RATE_LIMITED (429)</li>
 * </ul>
 *
 * <p>백엔드가 문서화한 다른 일시적 오류 코드(예: 503)가 있다면 생성자로 집합을 지정합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public final class StatusCodeRetryClassifier implements RetryClassifier {

    private static final Set<ClientErrorType> DEFAULT_RETRYABLE =
        Set.copyOf(EnumSet.of(ClientErrorType.CONFLICT, ClientErrorType.RATE_LIMITED));

    private final Set<ClientErrorType> retryableTypes;

    public StatusCodeRetryClassifier() {
        this(DEFAULT_RETRYABLE);
    }

    /**
     * 재시도 가능 유형을 지정하여 생성.
     *
     * @param retryableTypes 재시도 가능한 오류 유형
     * @throws IllegalArgumentException retryableTypes가 null이거나 NOT_FOUND를 포함하는 경우
     */
    public StatusCodeRetryClassifier(Set<ClientErrorType> retryableTypes) {
        if (retryableTypes == null) {
            throw new IllegalArgumentException("retryableTypes cannot be null");
        }
        if (retryableTypes.contains(ClientErrorType.NOT_FOUND)) {
            throw new IllegalArgumentException("NOT_FOUND cannot be retryable");
        }
        this.retryableTypes = Set.copyOf(retryableTypes);
    }

    @Override
    public RetryDecision classify(Throwable error, Phase phase) {
        if (error instanceof ResourceClientException clientError
            && retryableTypes.contains(clientError.getType())) {
            return RetryDecision.RETRY;
        }
        return RetryDecision.FAIL;
    }

    public Set<ClientErrorType> getRetryableTypes() {
        return retryableTypes;
    }
}

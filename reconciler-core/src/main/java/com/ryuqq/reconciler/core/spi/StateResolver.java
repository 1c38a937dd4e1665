package com.ryuqq.reconciler.core.spi;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;

import java.util.Locale;

/**
 * State Resolver SPI.
 *
 * <p>Resource Client가 반환한 원시 상태 문자열을 {@link LifecycleState}로 해석합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateResolver {

    /**
     * 원시 상태 해석.
     *
     * @param rawStatus 백엔드가 보고한 상태 (null 가능)
     * @return 해석된 생명주기 상태
     */
    LifecycleState resolve(String rawStatus);

    /**
     * 상태 이름을 대소문자 구분 없이 enum 이름과 매칭하는 기본 resolver.
     *
     * <p>null, 빈 문자열, 알 수 없는 상태는 ERROR로 해석합니다.</p>
     *
     * @return 이름 기반 resolver
     */
    static StateResolver byName() {
        return rawStatus -> {
            if (rawStatus == null || rawStatus.isBlank()) {
                return LifecycleState.ERROR;
            }
            try {
                return LifecycleState.valueOf(rawStatus.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return LifecycleState.ERROR;
            }
        };
    }
}

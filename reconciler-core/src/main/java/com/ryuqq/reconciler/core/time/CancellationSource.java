package com.ryuqq.reconciler.core.time;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 외부 스레드에서 취소를 요청할 수 있는 토큰.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CancellationSource cancellation = new CancellationSource();
 * executor.submit(() -> reconciler.create(desired, pollConfig, false, cancellation));
 * // ...
 * cancellation.cancel();
 * </pre>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public final class CancellationSource implements CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 처음 취소된 경우 true
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}

package com.ryuqq.reconciler.core.time;

/**
 * 시스템 시계 기반 TimeSource.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
final class SystemTimeSource implements TimeSource {

    static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private SystemTimeSource() {
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}

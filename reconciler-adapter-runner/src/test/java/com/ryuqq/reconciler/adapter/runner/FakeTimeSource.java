package com.ryuqq.reconciler.adapter.runner;

import com.ryuqq.reconciler.core.time.TimeSource;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트용 가상 시계.
 *
 * <p>sleep은 실제로 대기하지 않고 요청 시간만큼 시계를 전진시키며 요청 시간을 기록합니다.</p>
 */
final class FakeTimeSource implements TimeSource {

    private long nanos;
    private boolean interruptNextSleep;
    private final List<Long> sleeps = new ArrayList<>();

    @Override
    public long nanoTime() {
        return nanos;
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (interruptNextSleep) {
            interruptNextSleep = false;
            throw new InterruptedException("sleep interrupted");
        }
        sleeps.add(millis);
        advance(millis);
    }

    void advance(long millis) {
        nanos += millis * 1_000_000L;
    }

    void interruptNextSleep() {
        interruptNextSleep = true;
    }

    List<Long> sleeps() {
        return sleeps;
    }
}

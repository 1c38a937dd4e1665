package com.ryuqq.reconciler.testkit.contract;

import com.ryuqq.reconciler.core.time.TimeSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic {@link TimeSource} for contract tests.
 *
 * <p>{@link #sleep(long)} returns immediately after advancing the clock by the requested
 * amount and recording it, so polling schedules can be asserted exactly without waiting.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ManualTimeSource time = new ManualTimeSource();
 * // ... run a poll ...
 * assertEquals(List.of(5000L, 3000L), time.getSleeps());
 * </pre>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public class ManualTimeSource implements TimeSource {

    private long nowNanos;
    private final List<Long> sleeps = new ArrayList<>();
    private boolean interruptNextSleep;

    @Override
    public synchronized long nanoTime() {
        return nowNanos;
    }

    @Override
    public synchronized void sleep(long millis) throws InterruptedException {
        if (interruptNextSleep) {
            interruptNextSleep = false;
            throw new InterruptedException("interrupted by ManualTimeSource");
        }
        sleeps.add(millis);
        nowNanos += millis * 1_000_000L;
    }

    /**
     * Advances the clock without recording a sleep, simulating a slow read.
     *
     * @param millis milliseconds to advance
     */
    public synchronized void advance(long millis) {
        nowNanos += millis * 1_000_000L;
    }

    /**
     * Makes the next {@link #sleep(long)} throw {@link InterruptedException}.
     */
    public synchronized void interruptNextSleep() {
        this.interruptNextSleep = true;
    }

    /**
     * Returns the recorded sleeps, in order.
     */
    public synchronized List<Long> getSleeps() {
        return Collections.unmodifiableList(new ArrayList<>(sleeps));
    }

    /**
     * Returns the clock value in milliseconds since creation.
     */
    public synchronized long elapsedMs() {
        return nowNanos / 1_000_000L;
    }
}

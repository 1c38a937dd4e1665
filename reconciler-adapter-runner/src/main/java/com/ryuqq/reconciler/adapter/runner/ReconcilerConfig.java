package com.ryuqq.reconciler.adapter.runner;

import com.ryuqq.reconciler.core.poll.PollConfig;

/**
 * DefaultReconciler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>createTimeoutMs / updateTimeoutMs / deleteTimeoutMs: 단계별 폴링 제한 시간 (기본 10분)</li>
 *   <li>delayMs: 첫 Read 전 대기 시간 (기본 5000ms)</li>
 *   <li>minIntervalMs: Read 사이 최소 간격 (기본 3000ms)</li>
 *   <li>maxBackoffMs: 재시도 backoff 상한 (기본 10000ms)</li>
 *   <li>jitterFactor: backoff jitter 비율 (기본 0.1)</li>
 *   <li>skipStatusCheck: 폴링 생략 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>응답이 느린 백엔드: delayMs, minIntervalMs 증가</li>
 *   <li>Rate limit이 잦은 백엔드: maxBackoffMs 증가</li>
 *   <li>지연 최소화: skipStatusCheck=true (PENDING 상태를 관측할 수 있음)</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 * @param createTimeoutMs Create 폴링 제한 시간 (밀리초)
 * @param updateTimeoutMs Update 폴링 제한 시간 (밀리초)
 * @param deleteTimeoutMs Delete 폴링 제한 시간 (밀리초)
 * @param delayMs 첫 Read 전 대기 시간 (밀리초)
 * @param minIntervalMs Read 사이 최소 간격 (밀리초)
 * @param maxBackoffMs 재시도 backoff 상한 (밀리초, minIntervalMs 이상)
 * @param jitterFactor backoff jitter 비율 (0.0 ~ 1.0)
 * @param skipStatusCheck 폴링 생략 여부
 */
public record ReconcilerConfig(
    long createTimeoutMs,
    long updateTimeoutMs,
    long deleteTimeoutMs,
    long delayMs,
    long minIntervalMs,
    long maxBackoffMs,
    double jitterFactor,
    boolean skipStatusCheck
) {

    /**
     * 기본 설정 생성자.
     */
    public ReconcilerConfig() {
        this(PollConfig.DEFAULT_TIMEOUT_MS, PollConfig.DEFAULT_TIMEOUT_MS, PollConfig.DEFAULT_TIMEOUT_MS,
            PollConfig.DEFAULT_DELAY_MS, PollConfig.DEFAULT_MIN_INTERVAL_MS, 10000, 0.1, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * <p>단계별 timeout은 delay 이상이어야 하므로 잘못된 조합은 Reconcile 호출 전에 거부됩니다.</p>
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReconcilerConfig {
        requirePositive("createTimeoutMs", createTimeoutMs);
        requirePositive("updateTimeoutMs", updateTimeoutMs);
        requirePositive("deleteTimeoutMs", deleteTimeoutMs);
        requirePositive("minIntervalMs", minIntervalMs);
        if (delayMs < 0) {
            throw new IllegalArgumentException(
                "delayMs must be non-negative (current: " + delayMs + ")"
            );
        }
        requireNotShorterThanDelay("createTimeoutMs", createTimeoutMs, delayMs);
        requireNotShorterThanDelay("updateTimeoutMs", updateTimeoutMs, delayMs);
        requireNotShorterThanDelay("deleteTimeoutMs", deleteTimeoutMs, delayMs);
        if (maxBackoffMs < minIntervalMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= minIntervalMs (min: " + minIntervalMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    private static void requireNotShorterThanDelay(String name, long timeoutMs, long delayMs) {
        if (timeoutMs < delayMs) {
            throw new IllegalArgumentException(
                name + " must be >= delayMs (timeout: " + timeoutMs + ", delay: " + delayMs + ")"
            );
        }
    }

    /**
     * Create 단계 PollConfig (target={ACTIVE}, pending={PENDING}).
     */
    public PollConfig createPollConfig() {
        return PollConfig.untilActive(createTimeoutMs, delayMs, minIntervalMs);
    }

    /**
     * Update 단계 PollConfig (target={ACTIVE}, pending={PENDING}).
     */
    public PollConfig updatePollConfig() {
        return PollConfig.untilActive(updateTimeoutMs, delayMs, minIntervalMs);
    }

    /**
     * Delete 단계 PollConfig (target={DELETED}, pending={ACTIVE, PENDING}).
     */
    public PollConfig deletePollConfig() {
        return PollConfig.untilDeleted(deleteTimeoutMs, delayMs, minIntervalMs);
    }

    /**
     * 세 단계의 제한 시간을 한 번에 변경한 새 인스턴스 생성.
     */
    public ReconcilerConfig withTimeoutMs(long timeoutMs) {
        return new ReconcilerConfig(timeoutMs, timeoutMs, timeoutMs, delayMs, minIntervalMs, maxBackoffMs, jitterFactor, skipStatusCheck);
    }

    /**
     * delayMs만 변경한 새 인스턴스 생성.
     */
    public ReconcilerConfig withDelayMs(long delayMs) {
        return new ReconcilerConfig(createTimeoutMs, updateTimeoutMs, deleteTimeoutMs, delayMs, minIntervalMs, maxBackoffMs, jitterFactor, skipStatusCheck);
    }

    /**
     * minIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ReconcilerConfig withMinIntervalMs(long minIntervalMs) {
        return new ReconcilerConfig(createTimeoutMs, updateTimeoutMs, deleteTimeoutMs, delayMs, minIntervalMs, maxBackoffMs, jitterFactor, skipStatusCheck);
    }

    /**
     * maxBackoffMs만 변경한 새 인스턴스 생성.
     */
    public ReconcilerConfig withMaxBackoffMs(long maxBackoffMs) {
        return new ReconcilerConfig(createTimeoutMs, updateTimeoutMs, deleteTimeoutMs, delayMs, minIntervalMs, maxBackoffMs, jitterFactor, skipStatusCheck);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public ReconcilerConfig withJitterFactor(double jitterFactor) {
        return new ReconcilerConfig(createTimeoutMs, updateTimeoutMs, deleteTimeoutMs, delayMs, minIntervalMs, maxBackoffMs, jitterFactor, skipStatusCheck);
    }

    /**
     * skipStatusCheck만 변경한 새 인스턴스 생성.
     */
    public ReconcilerConfig withSkipStatusCheck(boolean skipStatusCheck) {
        return new ReconcilerConfig(createTimeoutMs, updateTimeoutMs, deleteTimeoutMs, delayMs, minIntervalMs, maxBackoffMs, jitterFactor, skipStatusCheck);
    }
}

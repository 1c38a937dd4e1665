package com.ryuqq.reconciler.core.poll;

import com.ryuqq.reconciler.core.statemachine.LifecycleState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 폴링 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>targets: 도달하면 폴링을 종료하는 상태</li>
 *   <li>pendings: 계속 기다리는 상태</li>
 *   <li>timeoutMs: 폴링 시작부터의 hard deadline</li>
 *   <li>delayMs: 첫 Read 전 대기 시간 (기본 5000ms)</li>
 *   <li>minIntervalMs: Read 사이 최소 간격 (기본 3000ms)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> timeoutMs ≥ delayMs, minIntervalMs &gt; 0,
 * targets는 비어있지 않고 pendings와 겹치지 않음.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 * @param targets target 상태 집합 (종료 상태만 허용)
 * @param pendings pending 상태 집합
 * @param timeoutMs 전체 제한 시간 (밀리초, 양수)
 * @param delayMs 첫 Read 전 대기 시간 (밀리초, 0 이상)
 * @param minIntervalMs Read 사이 최소 간격 (밀리초, 양수)
 */
public record PollConfig(
    Set<LifecycleState> targets,
    Set<LifecycleState> pendings,
    long timeoutMs,
    long delayMs,
    long minIntervalMs
) {

    public static final long DEFAULT_TIMEOUT_MS = 10 * 60 * 1000L;
    public static final long DEFAULT_DELAY_MS = 5000;
    public static final long DEFAULT_MIN_INTERVAL_MS = 3000;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollConfig {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("targets cannot be null or empty");
        }
        if (pendings == null) {
            throw new IllegalArgumentException("pendings cannot be null");
        }
        if (targets.contains(LifecycleState.PENDING)) {
            throw new IllegalArgumentException("targets cannot contain PENDING");
        }
        if (!Collections.disjoint(targets, pendings)) {
            throw new IllegalArgumentException(
                "targets and pendings must be disjoint (targets: " + targets + ", pendings: " + pendings + ")"
            );
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException(
                "delayMs must be non-negative (current: " + delayMs + ")"
            );
        }
        if (timeoutMs < delayMs) {
            throw new IllegalArgumentException(
                "timeoutMs must be >= delayMs (timeout: " + timeoutMs + ", delay: " + delayMs + ")"
            );
        }
        if (minIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "minIntervalMs must be positive (current: " + minIntervalMs + ")"
            );
        }
        targets = Collections.unmodifiableSet(EnumSet.copyOf(targets));
        pendings = pendings.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(LifecycleState.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(pendings));
    }

    /**
     * Create/Update용 설정: target={ACTIVE}, pending={PENDING}.
     *
     * @param timeoutMs 제한 시간 (밀리초, 기본 delay 5000ms 이상)
     * @return 기본 delay/minInterval이 적용된 설정
     */
    public static PollConfig untilActive(long timeoutMs) {
        return untilActive(timeoutMs, DEFAULT_DELAY_MS, DEFAULT_MIN_INTERVAL_MS);
    }

    /**
     * Create/Update용 설정: target={ACTIVE}, pending={PENDING}.
     *
     * @param timeoutMs 제한 시간 (밀리초)
     * @param delayMs 첫 Read 전 대기 시간 (밀리초)
     * @param minIntervalMs Read 사이 최소 간격 (밀리초)
     * @return 설정
     */
    public static PollConfig untilActive(long timeoutMs, long delayMs, long minIntervalMs) {
        return new PollConfig(EnumSet.of(LifecycleState.ACTIVE), EnumSet.of(LifecycleState.PENDING),
            timeoutMs, delayMs, minIntervalMs);
    }

    /**
     * Delete용 설정: target={DELETED}, pending={ACTIVE, PENDING}.
     *
     * @param timeoutMs 제한 시간 (밀리초, 기본 delay 5000ms 이상)
     * @return 기본 delay/minInterval이 적용된 설정
     */
    public static PollConfig untilDeleted(long timeoutMs) {
        return untilDeleted(timeoutMs, DEFAULT_DELAY_MS, DEFAULT_MIN_INTERVAL_MS);
    }

    /**
     * Delete용 설정: target={DELETED}, pending={ACTIVE, PENDING}.
     *
     * @param timeoutMs 제한 시간 (밀리초)
     * @param delayMs 첫 Read 전 대기 시간 (밀리초)
     * @param minIntervalMs Read 사이 최소 간격 (밀리초)
     * @return 설정
     */
    public static PollConfig untilDeleted(long timeoutMs, long delayMs, long minIntervalMs) {
        return new PollConfig(EnumSet.of(LifecycleState.DELETED),
            EnumSet.of(LifecycleState.ACTIVE, LifecycleState.PENDING),
            timeoutMs, delayMs, minIntervalMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public PollConfig withTimeoutMs(long timeoutMs) {
        return new PollConfig(targets, pendings, timeoutMs, delayMs, minIntervalMs);
    }

    /**
     * delayMs만 변경한 새 인스턴스 생성.
     */
    public PollConfig withDelayMs(long delayMs) {
        return new PollConfig(targets, pendings, timeoutMs, delayMs, minIntervalMs);
    }

    /**
     * minIntervalMs만 변경한 새 인스턴스 생성.
     */
    public PollConfig withMinIntervalMs(long minIntervalMs) {
        return new PollConfig(targets, pendings, timeoutMs, delayMs, minIntervalMs);
    }

    /**
     * 주어진 상태가 target인지 확인.
     */
    public boolean isTarget(LifecycleState state) {
        return targets.contains(state);
    }

    /**
     * 주어진 상태가 pending인지 확인.
     */
    public boolean isPending(LifecycleState state) {
        return pendings.contains(state);
    }
}

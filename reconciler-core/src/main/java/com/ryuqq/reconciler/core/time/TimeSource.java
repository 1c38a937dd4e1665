package com.ryuqq.reconciler.core.time;

/**
 * 폴링 상태 머신이 사용하는 시계와 대기 함수.
 *
 * <p>주입 가능하게 분리하여 테스트에서 실제 시간 경과 없이 tick을 결정적으로 검증할 수 있습니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
public interface TimeSource {

    /**
     * 단조 증가 시각.
     *
     * @return 나노초 단위 시각 (기준점은 임의)
     */
    long nanoTime();

    /**
     * 현재 스레드 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이상)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * {@link System#nanoTime()}과 {@link Thread#sleep(long)}을 사용하는 기본 구현.
     *
     * @return 시스템 TimeSource
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}

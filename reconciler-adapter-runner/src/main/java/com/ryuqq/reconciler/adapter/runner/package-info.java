/**
 * Runner Adapter Layer - Reconciler 구현체.
 *
 * <p>이 패키지는 Reconciler 인터페이스의 구체적인 구현체와 폴링 상태 머신을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.adapter.runner.DefaultReconciler} - Create/Update/Delete/Read/Import 컨트롤러</li>
 *   <li>{@link com.ryuqq.reconciler.adapter.runner.StatusPoller} - target 상태까지 Read를 반복하는 상태 머신</li>
 *   <li>{@link com.ryuqq.reconciler.adapter.runner.BackoffCalculator} - 재시도 간격 계산</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultReconciler, StatusPoller)
 *   ↓ implements
 * application (Reconciler interface)
 *   ↓ depends on
 * core (ResourceId, PollConfig, PollOutcome, LifecycleState, Diagnostic)
 *   ↓ depends on
 * core/spi (ResourceClient, StateResolver interface)
 * </pre>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
package com.ryuqq.reconciler.adapter.runner;

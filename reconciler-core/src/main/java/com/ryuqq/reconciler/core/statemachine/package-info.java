/**
 * Lifecycle state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.core.statemachine.LifecycleState} - Backend lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.reconciler.core.statemachine.StateTransition} - Transition validation for the polling machine</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → ACTIVE | DELETED | ERROR
 *
 * Forbidden:
 * - ACTIVE → * (terminal state)
 * - DELETED → * (terminal state)
 * - ERROR → * (terminal state)
 * </pre>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.statemachine;

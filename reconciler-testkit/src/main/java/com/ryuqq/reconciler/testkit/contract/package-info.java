/**
 * Contract test infrastructure for Reconciler implementations.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.testkit.contract.AbstractReconcilerContractTest}: base class with fixtures and assertions</li>
 *   <li>{@link com.ryuqq.reconciler.testkit.contract.ScriptedResourceClient}: ResourceClient with scripted reads</li>
 *   <li>{@link com.ryuqq.reconciler.testkit.contract.ManualTimeSource}: virtual clock recording sleeps</li>
 * </ul>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
package com.ryuqq.reconciler.testkit.contract;

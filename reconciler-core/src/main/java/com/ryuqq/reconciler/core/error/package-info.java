/**
 * Unchecked exceptions raised by resource clients and by the polling machine.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.core.error.ResourceClientException} - Remote call failure, typed by {@link com.ryuqq.reconciler.core.error.ClientErrorType}</li>
 *   <li>{@link com.ryuqq.reconciler.core.error.PollTimeoutException} - Deadline exceeded while pending</li>
 *   <li>{@link com.ryuqq.reconciler.core.error.UnexpectedStateException} - State outside targets and pendings</li>
 *   <li>{@link com.ryuqq.reconciler.core.error.ReconcileCancelledException} - Cooperative cancellation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.error;

/**
 * Polling outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the result of one
 * polling run, so every caller handles all terminal cases.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.core.outcome.Reached} - Target state observed</li>
 *   <li>{@link com.ryuqq.reconciler.core.outcome.TimedOut} - Deadline exceeded while pending</li>
 *   <li>{@link com.ryuqq.reconciler.core.outcome.Failed} - Non-retryable read error or unexpected state</li>
 *   <li>{@link com.ryuqq.reconciler.core.outcome.Cancelled} - Cooperative cancellation at a tick boundary</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof Reached reached) {
 *     return reached.descriptor();
 * } else if (outcome instanceof TimedOut timedOut) {
 *     log.warn("still {} after {}ms", timedOut.lastObservedState(), timedOut.elapsedMs());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.outcome;

/**
 * Application Layer - synchronous reconcile contract exposed to CRUD handlers.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.application.reconciler.Reconciler} - Create/Update/Delete/Read/Import contract</li>
 *   <li>{@link com.ryuqq.reconciler.application.reconciler.ReconcileResult} - Descriptor-or-diagnostic result</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (DefaultReconciler, StatusPoller)
 *   ↓ implements
 * application (Reconciler interface)
 *   ↓ depends on
 * core (model, statemachine, outcome, classifier, spi)
 * </pre>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.application.reconciler;

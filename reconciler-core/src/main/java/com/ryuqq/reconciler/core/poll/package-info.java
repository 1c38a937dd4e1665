/**
 * Per-operation polling configuration.
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.poll;

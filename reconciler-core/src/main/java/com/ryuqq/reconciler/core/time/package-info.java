/**
 * Injectable clock, sleep and cancellation primitives for the polling machine.
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.time;

/**
 * Service Provider Interfaces consumed by the reconciliation engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.core.spi.ResourceClient} - Remote create/read/update/delete calls</li>
 *   <li>{@link com.ryuqq.reconciler.core.spi.StateResolver} - Raw backend status to lifecycle state</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.spi;

/**
 * Resource model package containing value objects for the managed DNS zone.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.core.model.ResourceId} - Backend-assigned opaque identifier</li>
 *   <li>{@link com.ryuqq.reconciler.core.model.ImportId} - Parsed {@code <id>[:<projectId>]} import string</li>
 *   <li>{@link com.ryuqq.reconciler.core.model.ResourceDescriptor} - Observed remote state snapshot</li>
 *   <li>{@link com.ryuqq.reconciler.core.model.DesiredState} - Caller-requested attributes</li>
 *   <li>{@link com.ryuqq.reconciler.core.model.ResourceDelta} - Typed patch of remotely mutable fields</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable; collections are copied</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Typed delta:</strong> Dirty checking is one structural comparison, not per-field string lookups</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.model;

/**
 * Retry classification for errors observed while polling.
 *
 * <p>{@link com.ryuqq.reconciler.core.classifier.StatusCodeRetryClassifier} treats
 * CONFLICT (409) and RATE_LIMITED (429) as transient and everything else as fatal.</p>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.classifier;

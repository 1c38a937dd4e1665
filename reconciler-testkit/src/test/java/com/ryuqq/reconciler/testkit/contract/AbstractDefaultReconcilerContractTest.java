package com.ryuqq.reconciler.testkit.contract;

import com.ryuqq.reconciler.adapter.runner.DefaultReconciler;
import com.ryuqq.reconciler.adapter.runner.ReconcilerConfig;
import com.ryuqq.reconciler.application.reconciler.Reconciler;
import com.ryuqq.reconciler.core.classifier.StatusCodeRetryClassifier;
import com.ryuqq.reconciler.core.spi.ResourceClient;
import com.ryuqq.reconciler.core.spi.StateResolver;
import com.ryuqq.reconciler.core.time.TimeSource;

/**
 * Binds the contract tests to {@link DefaultReconciler} with jitter disabled.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
abstract class AbstractDefaultReconcilerContractTest extends AbstractReconcilerContractTest {

    @Override
    protected Reconciler createReconciler(ResourceClient client, TimeSource timeSource) {
        return new DefaultReconciler(client, StateResolver.byName(), new StatusCodeRetryClassifier(),
                timeSource, new ReconcilerConfig().withJitterFactor(0.0));
    }
}

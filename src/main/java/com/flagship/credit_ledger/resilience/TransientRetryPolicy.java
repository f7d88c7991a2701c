package com.flagship.credit_ledger.resilience;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Up to maxAttempts tries, continuing only while the last failure was
 * transient.
 */
public class TransientRetryPolicy extends SimpleRetryPolicy {

    private final TransientErrorClassifier classifier;

    public TransientRetryPolicy(int maxAttempts, TransientErrorClassifier classifier) {
        super(maxAttempts);
        this.classifier = classifier;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        return (last == null || classifier.isTransient(last))
            && context.getRetryCount() < getMaxAttempts();
    }
}

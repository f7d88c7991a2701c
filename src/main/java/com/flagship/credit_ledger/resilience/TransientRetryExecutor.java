package com.flagship.credit_ledger.resilience;

import com.flagship.credit_ledger.exception.TransientStoreException;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a store-touching call, retrying transient failures with exponential
 * backoff.
 *
 * Every other failure, including every ledger error, is rethrown
 * unchanged after the first attempt. Once the attempts are used up the
 * last transient failure is surfaced as {@link TransientStoreException}.
 */
@Component
@Slf4j
public class TransientRetryExecutor {

    private final RetryTemplate retryTemplate;
    private final TransientErrorClassifier classifier;
    private final LedgerMetrics metrics;

    public TransientRetryExecutor(@Qualifier("ledgerRetryTemplate") RetryTemplate retryTemplate,
                                  TransientErrorClassifier classifier,
                                  LedgerMetrics metrics) {
        this.retryTemplate = retryTemplate;
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            return retryTemplate.execute(context -> {
                context.setAttribute(RetryLoggingListener.OPERATION, operation);
                attempts.incrementAndGet();
                return call.get();
            });
        } catch (RuntimeException e) {
            if (!classifier.isTransient(e)) {
                throw e;
            }
            metrics.recordRetryExhausted(operation);
            log.error("Giving up on {} after {} attempts: {}", operation, attempts.get(), e.getMessage());
            throw new TransientStoreException(operation, attempts.get(), e);
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }
}

package com.flagship.credit_ledger.resilience;

import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs and counts each transient failure that the retry template is about
 * to retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryLoggingListener implements RetryListener {

    static final String OPERATION = "ledger.operation";

    private final TransientErrorClassifier classifier;
    private final LedgerMetrics metrics;

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (!classifier.isTransient(throwable)) {
            return;
        }
        String operation = (String) context.getAttribute(OPERATION);
        log.warn("Transient failure in {} (attempt {}): {}",
            operation, context.getRetryCount(), throwable.getMessage());
        metrics.recordRetry(operation);
    }
}

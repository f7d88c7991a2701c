package com.flagship.credit_ledger.config;

import com.flagship.credit_ledger.resilience.RetryLoggingListener;
import com.flagship.credit_ledger.resilience.TransientErrorClassifier;
import com.flagship.credit_ledger.resilience.TransientRetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry template for store calls, built from ledger.retry.
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate ledgerRetryTemplate(LedgerProperties properties,
                                             TransientErrorClassifier classifier,
                                             RetryLoggingListener listener) {
        LedgerProperties.Retry retry = properties.getRetry();

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(retry.getInitialDelay().toMillis());
        backOff.setMultiplier(retry.getMultiplier());
        backOff.setMaxInterval(retry.getMaxDelay().toMillis());

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientRetryPolicy(retry.getMaxAttempts(), classifier));
        template.setBackOffPolicy(backOff);
        template.registerListener(listener);
        return template;
    }
}

package com.flagship.credit_ledger.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Drops a user's cached balance once the current transaction commits.
 *
 * Invalidating before commit would let a concurrent reader reload the
 * old row and cache it again. A rolled back transaction changed nothing,
 * so nothing is invalidated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceCacheInvalidator {

    private final BalanceCache balanceCache;

    public void invalidateAfterCommit(String userId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            balanceCache.invalidate(userId);
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                balanceCache.invalidate(userId);
                log.debug("Invalidated cached balance for user {}", userId);
            }
        });
    }
}

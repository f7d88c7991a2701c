package com.flagship.credit_ledger.event;

import com.flagship.credit_ledger.config.LedgerProperties;
import com.flagship.credit_ledger.ledger.CreditTransaction;
import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Turns a recorded transaction into outbox events. Must run inside the
 * transaction that wrote the balance change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerEventRecorder {

    private final OutboxService outboxService;
    private final LedgerProperties properties;

    public void recordBalanceChange(CreditTransaction transaction) {
        BalanceChangedEvent changed = BalanceChangedEvent.fromTransaction(transaction);
        outboxService.saveEvent(transaction.getUserId(), changed.getEventType(), changed);

        BigDecimal threshold = properties.getLowBalanceThreshold();
        if (threshold != null && LowBalanceEvent.crossesThreshold(transaction, threshold)) {
            LowBalanceEvent low = LowBalanceEvent.fromTransaction(transaction, threshold);
            outboxService.saveEvent(transaction.getUserId(), low.getEventType(), low);
            log.info("User {} dropped below low-balance threshold {}: balance={}",
                transaction.getUserId(), threshold, transaction.getBalanceAfter());
        }
    }
}

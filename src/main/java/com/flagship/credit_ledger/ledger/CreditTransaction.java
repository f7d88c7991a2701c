package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable row of the transaction ledger.
 *
 * amount is signed: negative for debits and forfeitures. It always equals
 * balanceAfter - balanceBefore, which keeps the ledger reconcilable against
 * the balance rows.
 */
@Value
public class CreditTransaction {

    public static final String FROM_ALLOWANCE = "from_allowance";
    public static final String FROM_PURCHASED = "from_purchased";
    public static final String ALLOWANCE_BEFORE = "allowance_before";
    public static final String ALLOWANCE_AFTER = "allowance_after";
    public static final String PURCHASED_BEFORE = "purchased_before";
    public static final String PURCHASED_AFTER = "purchased_after";
    public static final String FORFEITED_ALLOWANCE = "forfeited_allowance";
    public static final String NEW_ALLOWANCE = "new_allowance";
    public static final String RETAINED_PURCHASED_CREDITS = "retained_purchased_credits";

    UUID id;
    String userId;
    BigDecimal amount;
    TransactionType transactionType;
    String description;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    Map<String, Object> metadata;
    Instant createdAt;

    /**
     * Creates a new, not yet recorded, transaction. The amount is derived
     * from the two balances.
     */
    public static CreditTransaction create(String userId, TransactionType type, String description,
                                           BigDecimal balanceBefore, BigDecimal balanceAfter,
                                           Map<String, Object> metadata, Instant createdAt) {
        return new CreditTransaction(
            UUID.randomUUID(),
            userId,
            balanceAfter.subtract(balanceBefore),
            type,
            description,
            balanceBefore,
            balanceAfter,
            Collections.unmodifiableMap(new LinkedHashMap<>(metadata)),
            createdAt
        );
    }

    /**
     * Reads a numeric metadata entry regardless of how the JSON layer typed it.
     *
     * @return the value, or null if the key is absent
     */
    public BigDecimal getMetadataAmount(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }

    public boolean isDebit() {
        return amount.signum() < 0;
    }
}

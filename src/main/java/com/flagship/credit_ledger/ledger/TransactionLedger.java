package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit log of every balance-affecting event.
 *
 * This service enforces the core invariants:
 * 1. Rows are only ever inserted (a database trigger rejects UPDATE and DELETE)
 * 2. Every balance change writes exactly one row, inside the same database
 *    transaction as the balance write
 * 3. The ledger is the reconciliation source of truth
 */
@Service
@Slf4j
public class TransactionLedger {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TransactionLedger(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts a transaction. Joins the caller's database transaction so the
     * audit row commits or rolls back together with the balance write.
     *
     * @param transaction The transaction to record
     * @return The recorded transaction (unchanged)
     */
    @Transactional
    public CreditTransaction record(CreditTransaction transaction) {
        jdbcTemplate.update(
            "INSERT INTO transactions (id, user_id, amount, transaction_type, description, " +
            "balance_before, balance_after, metadata, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)",
            transaction.getId(),
            transaction.getUserId(),
            transaction.getAmount(),
            transaction.getTransactionType().dbValue(),
            transaction.getDescription(),
            transaction.getBalanceBefore(),
            transaction.getBalanceAfter(),
            serializeMetadata(transaction.getMetadata()),
            Timestamp.from(transaction.getCreatedAt())
        );
        log.debug("Recorded {} transaction {} for user {}: amount={}",
            transaction.getTransactionType().dbValue(), transaction.getId(),
            transaction.getUserId(), transaction.getAmount());
        return transaction;
    }

    /**
     * Gets the most recent transactions for a user, newest first.
     */
    @Transactional(readOnly = true)
    public List<CreditTransaction> findByUser(String userId, int limit) {
        return jdbcTemplate.query(
            "SELECT id, user_id, amount, transaction_type, description, balance_before, balance_after, " +
            "metadata, created_at FROM transactions WHERE user_id = ? " +
            "ORDER BY created_at DESC, sequence_number DESC LIMIT ?",
            creditTransactionRowMapper(),
            userId,
            limit
        );
    }

    /**
     * Sums API usage debits for a user in [from, to). Debits are stored
     * negative; the result is positive.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumUsageBetween(String userId, Instant from, Instant to) {
        BigDecimal spent = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(-amount), 0) FROM transactions " +
            "WHERE user_id = ? AND transaction_type = ? AND created_at >= ? AND created_at < ?",
            BigDecimal.class,
            userId,
            TransactionType.API_USAGE.dbValue(),
            Timestamp.from(from),
            Timestamp.from(to)
        );
        return spent != null ? spent : BigDecimal.ZERO;
    }

    /**
     * Compares the ledger against the current balance. The opening balance
     * is the balance_before of the user's first recorded transaction, by
     * insert order.
     */
    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(String userId, BigDecimal currentBalance) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE user_id = ?",
            Long.class,
            userId
        );
        if (count == null || count == 0) {
            return new ReconciliationReport(userId, 0, currentBalance, currentBalance, BigDecimal.ZERO);
        }

        BigDecimal opening = jdbcTemplate.queryForObject(
            "SELECT balance_before FROM transactions WHERE user_id = ? ORDER BY sequence_number ASC LIMIT 1",
            BigDecimal.class,
            userId
        );
        BigDecimal netDecrease = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(balance_before - balance_after), 0) FROM transactions WHERE user_id = ?",
            BigDecimal.class,
            userId
        );
        return new ReconciliationReport(userId, count, opening, currentBalance,
            netDecrease != null ? netDecrease : BigDecimal.ZERO);
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transaction metadata", e);
        }
    }

    private Map<String, Object> deserializeMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored transaction metadata is not valid JSON", e);
        }
    }

    private RowMapper<CreditTransaction> creditTransactionRowMapper() {
        return (rs, rowNum) -> new CreditTransaction(
            rs.getObject("id", UUID.class),
            rs.getString("user_id"),
            rs.getBigDecimal("amount"),
            TransactionType.fromDbValue(rs.getString("transaction_type")),
            rs.getString("description"),
            rs.getBigDecimal("balance_before"),
            rs.getBigDecimal("balance_after"),
            deserializeMetadata(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}

package com.flagship.credit_ledger.balance;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of each user's allowance, purchased credits and
 * subscription state.
 *
 * Every balance write is a single SQL statement. Debits and allowance
 * changes are conditional ({@code UPDATE ... WHERE column = expected}):
 * the statement only matches if the row still holds the values the caller
 * read. That conditional write is the only mutual exclusion in the system;
 * no row locks are taken.
 *
 * Soft-deleted rows are invisible to every method.
 */
@Repository
public class BalanceStore {

    private static final String SELECT_COLUMNS =
        "user_id, subscription_allowance, purchased_credits, tier, subscription_status, " +
        "trial_expires_at, partner_code, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public BalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Reads the current row as one snapshot. Always hits the database.
     */
    public Optional<UserBalance> findById(String userId) {
        List<UserBalance> rows = jdbcTemplate.query(
            "SELECT " + SELECT_COLUMNS + " FROM users WHERE user_id = ? AND deleted_at IS NULL",
            userBalanceRowMapper(),
            userId
        );
        return rows.stream().findFirst();
    }

    public void insert(UserBalance balance) {
        jdbcTemplate.update(
            "INSERT INTO users (user_id, subscription_allowance, purchased_credits, tier, " +
            "subscription_status, trial_expires_at, partner_code, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            balance.getUserId(),
            balance.getSubscriptionAllowance(),
            balance.getPurchasedCredits(),
            balance.getTier().dbValue(),
            balance.getSubscriptionStatus().dbValue(),
            balance.getTrialExpiresAt(),
            balance.getPartnerCode()
        );
    }

    /**
     * Writes both balances only if neither changed since the snapshot was read.
     *
     * @return true if exactly one row was updated, false if the snapshot was stale
     */
    public boolean compareAndSetBalances(String userId,
                                         BigDecimal expectedAllowance, BigDecimal expectedPurchased,
                                         BigDecimal newAllowance, BigDecimal newPurchased) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET subscription_allowance = ?, purchased_credits = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND deleted_at IS NULL " +
            "AND subscription_allowance = ? AND purchased_credits = ?",
            newAllowance,
            newPurchased,
            userId,
            expectedAllowance,
            expectedPurchased
        );
        return updated == 1;
    }

    /**
     * Renewal: replaces the allowance and stores the tier, conditional on
     * the allowance still being the one read. Purchased credits are not touched.
     */
    public boolean compareAndResetAllowance(String userId, BigDecimal expectedAllowance,
                                            BigDecimal newAllowance, Tier tier) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET subscription_allowance = ?, tier = ?, allowance_reset_at = CURRENT_TIMESTAMP, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND deleted_at IS NULL AND subscription_allowance = ?",
            newAllowance,
            tier.dbValue(),
            userId,
            expectedAllowance
        );
        return updated == 1;
    }

    /**
     * Cancellation: zeroes the allowance, conditional on it still being the
     * one read. Purchased credits are not touched.
     */
    public boolean compareAndForfeitAllowance(String userId, BigDecimal expectedAllowance) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET subscription_allowance = 0, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND deleted_at IS NULL AND subscription_allowance = ?",
            userId,
            expectedAllowance
        );
        return updated == 1;
    }

    /**
     * Adds to purchased credits with a single atomic increment. Increments
     * commute, so no expected-value guard is needed.
     *
     * @return the row as it is after the increment, or empty if the user does not exist
     */
    public Optional<UserBalance> incrementPurchasedCredits(String userId, BigDecimal amount) {
        List<UserBalance> rows = jdbcTemplate.query(
            "UPDATE users SET purchased_credits = purchased_credits + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND deleted_at IS NULL RETURNING " + SELECT_COLUMNS,
            userBalanceRowMapper(),
            amount,
            userId
        );
        return rows.stream().findFirst();
    }

    public boolean softDelete(String userId) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET deleted_at = CURRENT_TIMESTAMP, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND deleted_at IS NULL",
            userId
        );
        return updated == 1;
    }

    private RowMapper<UserBalance> userBalanceRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return UserBalance.builder()
                .userId(rs.getString("user_id"))
                .subscriptionAllowance(rs.getBigDecimal("subscription_allowance"))
                .purchasedCredits(rs.getBigDecimal("purchased_credits"))
                .tier(Tier.fromDbValue(rs.getString("tier")))
                .subscriptionStatus(SubscriptionStatus.fromDbValue(rs.getString("subscription_status")))
                .trialExpiresAt(rs.getString("trial_expires_at"))
                .partnerCode(rs.getString("partner_code"))
                .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
                .build();
        };
    }
}

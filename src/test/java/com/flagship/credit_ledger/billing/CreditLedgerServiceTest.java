package com.flagship.credit_ledger.billing;

import com.flagship.credit_ledger.balance.BalanceStore;
import com.flagship.credit_ledger.balance.SubscriptionStatus;
import com.flagship.credit_ledger.balance.Tier;
import com.flagship.credit_ledger.balance.UserBalance;
import com.flagship.credit_ledger.credit.DeductionResult;
import com.flagship.credit_ledger.exception.ConcurrentBalanceModificationException;
import com.flagship.credit_ledger.exception.DailyUsageLimitExceededException;
import com.flagship.credit_ledger.exception.InsufficientCreditsException;
import com.flagship.credit_ledger.exception.LedgerErrorKind;
import com.flagship.credit_ledger.exception.LedgerResult;
import com.flagship.credit_ledger.exception.TrialExpiredException;
import com.flagship.credit_ledger.exception.UserNotFoundException;
import com.flagship.credit_ledger.incident.BillingIncidentEntity;
import com.flagship.credit_ledger.incident.BillingIncidentService;
import com.flagship.credit_ledger.ledger.CreditTransaction;
import com.flagship.credit_ledger.ledger.ReconciliationReport;
import com.flagship.credit_ledger.ledger.TransactionType;
import com.flagship.credit_ledger.limit.DailyUsage;
import com.flagship.credit_ledger.observability.HealthIndicators;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the billing entry points: gates, caching, tagged
 * results, settlement incidents and reconciliation.
 */
@SpringBootTest
@Testcontainers
class CreditLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("credit_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.cache.type", () -> "caffeine");
        registry.add("ledger.daily-limit.default-cap", () -> "1.00");
    }

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Autowired
    private BalanceStore balanceStore;

    @Autowired
    private BillingIncidentService billingIncidentService;

    @Autowired
    private HealthIndicators.BillingIncidentHealthIndicator billingIncidentHealth;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertNotNull(actual);
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "expected " + expected + " but was " + actual);
    }

    private String createUser(String allowance, String purchased, Tier tier, SubscriptionStatus status,
                              String trialExpiresAt) {
        String userId = "user-" + UUID.randomUUID();
        balanceStore.insert(UserBalance.builder()
            .userId(userId)
            .subscriptionAllowance(new BigDecimal(allowance))
            .purchasedCredits(new BigDecimal(purchased))
            .tier(tier)
            .subscriptionStatus(status)
            .trialExpiresAt(trialExpiresAt)
            .build());
        return userId;
    }

    private String activeUser(String allowance, String purchased) {
        return createUser(allowance, purchased, Tier.PRO, SubscriptionStatus.ACTIVE, null);
    }

    private String expiredTrialUser(String allowance) {
        String yesterday = LocalDate.now(ZoneOffset.UTC).minusDays(1).toString();
        return createUser(allowance, "0", Tier.BASIC, SubscriptionStatus.TRIAL, yesterday);
    }

    @Nested
    @DisplayName("Deduct pipeline")
    class DeductPipeline {

        @Test
        @DisplayName("Charges an active user and the next read sees the new balance")
        void chargesAndInvalidatesCache() {
            printTestHeader("Deduct invalidates the cache");
            String userId = activeUser("10", "5");
            assertAmount("15", creditLedgerService.getBalance(userId).getTotal());

            DeductionResult result = creditLedgerService.deduct(userId, new BigDecimal("4"), "chat",
                Map.of("model", "claude"));

            assertTrue(result.isCharged());
            assertAmount("11", creditLedgerService.getBalance(userId).getTotal());
            printSuccess("Own write visible on next read");
        }

        @Test
        @DisplayName("Writes that bypass the ledger stay invisible until the entry is invalidated")
        void readsAreCached() {
            String userId = activeUser("10", "0");
            assertAmount("10", creditLedgerService.getBalance(userId).getTotal());

            jdbcTemplate.update("UPDATE users SET purchased_credits = 100 WHERE user_id = ?", userId);
            assertAmount("10", creditLedgerService.getBalance(userId).getTotal());

            creditLedgerService.deduct(userId, BigDecimal.ONE, "usage", Map.of());
            assertAmount("109", creditLedgerService.getBalance(userId).getTotal());
        }

        @Test
        @DisplayName("Expired trial is rejected before anything is written")
        void expiredTrial() {
            String userId = expiredTrialUser("5");

            assertThrows(TrialExpiredException.class,
                () -> creditLedgerService.deduct(userId, new BigDecimal("0.10"), "chat", Map.of()));
            assertTrue(creditLedgerService.getTransactions(userId, 10).isEmpty());
        }

        @Test
        @DisplayName("Daily cap applies to trial users")
        void dailyCap() {
            String userId = createUser("5", "0", Tier.BASIC, SubscriptionStatus.TRIAL, null);
            creditLedgerService.deduct(userId, new BigDecimal("0.80"), "chat", Map.of());

            assertThrows(DailyUsageLimitExceededException.class,
                () -> creditLedgerService.deduct(userId, new BigDecimal("0.30"), "chat", Map.of()));

            DailyUsage usage = creditLedgerService.getDailyUsage(userId);
            assertAmount("0.80", usage.getSpent());
            assertAmount("0.20", usage.getRemaining());
        }

        @Test
        @DisplayName("Unknown user")
        void unknownUser() {
            assertThrows(UserNotFoundException.class,
                () -> creditLedgerService.deduct("missing-" + UUID.randomUUID(), BigDecimal.ONE, "x", Map.of()));
        }

        @Test
        @DisplayName("The userId MDC entry is cleared after the call")
        void clearsMdc() {
            String userId = activeUser("1", "0");
            creditLedgerService.getBalance(userId);
            assertNull(MDC.get(CreditLedgerService.MDC_USER_ID));
        }
    }

    @Nested
    @DisplayName("Tagged results")
    class TaggedResults {

        @Test
        @DisplayName("Insufficient credits come back as a failed result, not an exception")
        void insufficientAsResult() {
            String userId = activeUser("2", "1");

            LedgerResult<DeductionResult> result = creditLedgerService.tryDeduct(userId, new BigDecimal("5"),
                "too much", Map.of());

            assertTrue(result.isFailure());
            assertEquals(LedgerErrorKind.INSUFFICIENT_CREDITS, result.getErrorKind());
            InsufficientCreditsException error = (InsufficientCreditsException) result.getError().orElseThrow();
            assertAmount("5", error.getRequired());
            assertAmount("3", error.getAvailable());
            assertThrows(IllegalStateException.class, result::getValue);
        }

        @Test
        @DisplayName("Success carries the deduction")
        void successAsResult() {
            String userId = activeUser("2", "1");

            LedgerResult<DeductionResult> result = creditLedgerService.tryDeduct(userId, BigDecimal.ONE,
                "fine", Map.of());

            assertTrue(result.isSuccess());
            assertNull(result.getErrorKind());
            assertTrue(result.orElseThrow().isCharged());
        }
    }

    @Nested
    @DisplayName("Pre-check")
    class PreCheck {

        @Test
        @DisplayName("Passes without writing")
        void passes() {
            String userId = activeUser("2", "0");

            UserBalance checked = creditLedgerService.preCheck(userId, new BigDecimal("1.50"));

            assertAmount("2", checked.getTotal());
            assertTrue(creditLedgerService.getTransactions(userId, 10).isEmpty());
        }

        @Test
        @DisplayName("Rejects an estimate above the balance")
        void insufficient() {
            String userId = activeUser("2", "0");
            assertThrows(InsufficientCreditsException.class,
                () -> creditLedgerService.preCheck(userId, new BigDecimal("2.50")));
        }

        @Test
        @DisplayName("Rejects an expired trial")
        void expiredTrial() {
            String userId = expiredTrialUser("5");
            assertThrows(TrialExpiredException.class,
                () -> creditLedgerService.preCheck(userId, new BigDecimal("0.10")));
        }
    }

    @Nested
    @DisplayName("Settling delivered usage")
    class Settlement {

        @Test
        @DisplayName("Delivered usage is charged even after the trial ran out")
        void skipsTrialGate() {
            String userId = expiredTrialUser("5");

            LedgerResult<DeductionResult> result = creditLedgerService.settleDeliveredUsage(userId,
                new BigDecimal("0.40"), "streamed response", Map.of());

            assertTrue(result.isSuccess());
            assertAmount("4.60", creditLedgerService.getBalance(userId).getTotal());
        }

        @Test
        @DisplayName("A failed settlement is recorded as a billing incident")
        void recordsIncident() {
            printTestHeader("Billing incident");
            String userId = activeUser("0.10", "0");

            LedgerResult<DeductionResult> result = creditLedgerService.settleDeliveredUsage(userId,
                new BigDecimal("0.50"), "streamed response", Map.of("request_id", "req-1"));

            assertTrue(result.isFailure());
            assertEquals(LedgerErrorKind.INSUFFICIENT_CREDITS, result.getErrorKind());

            List<BillingIncidentEntity> incidents = billingIncidentService.findByUser(userId);
            assertEquals(1, incidents.size());
            BillingIncidentEntity incident = incidents.get(0);
            assertAmount("0.50", incident.getAmount());
            assertEquals("INSUFFICIENT_CREDITS", incident.getErrorKind());
            assertEquals("pending", incident.getStatus());
            assertTrue(incident.getMetadata().contains("req-1"));

            Health health = billingIncidentHealth.health();
            assertEquals("WARNING", health.getStatus().getCode());
            assertTrue((Long) health.getDetails().get("pendingIncidents") >= 1);
            printOutput("Incident", incident.getId());
            printSuccess("Incident recorded for manual reconciliation");
        }
    }

    @Nested
    @DisplayName("Credits, lifecycle and reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("Every operation leaves the ledger reconciled with the balance")
        void ledgerReconciles() {
            printTestHeader("Ledger reconciliation");
            String userId = "user-" + UUID.randomUUID();

            creditLedgerService.openAccount(userId, null);
            creditLedgerService.addCredits(userId, new BigDecimal("20"), TransactionType.PURCHASE, "top-up", Map.of());
            creditLedgerService.deduct(userId, new BigDecimal("0.75"), "chat", Map.of());
            creditLedgerService.resetSubscriptionAllowance(userId, new BigDecimal("15"), Tier.PRO);
            creditLedgerService.deduct(userId, new BigDecimal("0.20"), "image", Map.of());
            creditLedgerService.addCredits(userId, new BigDecimal("1.25"), TransactionType.REFUND, "bad output", Map.of());
            creditLedgerService.forfeitSubscriptionAllowance(userId);

            UserBalance balance = creditLedgerService.getBalance(userId);
            assertAmount("0", balance.getSubscriptionAllowance());
            assertAmount("21.25", balance.getPurchasedCredits());

            ReconciliationReport report = creditLedgerService.reconcile(userId);
            printOutput("Report", report);
            assertEquals(7, report.getTransactionCount());
            assertAmount("0", report.getOpeningBalance());
            assertTrue(report.isBalanced());
            assertAmount("0", report.getDiscrepancy());

            List<CreditTransaction> history = creditLedgerService.getTransactions(userId, 50);
            assertEquals(7, history.size());
            assertEquals(TransactionType.ALLOWANCE_FORFEIT, history.get(0).getTransactionType());
            printSuccess("Ledger reconciles");
        }

        @Test
        @DisplayName("Credit grants reject non-grant types and non-positive amounts")
        void invalidGrants() {
            String userId = activeUser("0", "0");

            assertThrows(IllegalArgumentException.class, () -> creditLedgerService.addCredits(
                userId, BigDecimal.TEN, TransactionType.API_USAGE, "nope", Map.of()));
            assertThrows(IllegalArgumentException.class, () -> creditLedgerService.addCredits(
                userId, BigDecimal.ZERO, TransactionType.PURCHASE, "nope", Map.of()));
            assertThrows(UserNotFoundException.class, () -> creditLedgerService.addCredits(
                "missing-" + UUID.randomUUID(), BigDecimal.ONE, TransactionType.ADMIN_CREDIT, "nope", Map.of()));
        }

        @Test
        @DisplayName("Closed accounts disappear from every read")
        void closedAccount() {
            String userId = activeUser("5", "5");
            creditLedgerService.getBalance(userId);

            creditLedgerService.closeAccount(userId);

            assertThrows(UserNotFoundException.class, () -> creditLedgerService.getBalance(userId));
        }
    }

    @Test
    @DisplayName("Many racing deductions with caller-side retry never overspend")
    void racingDeductionsNeverOverspend() throws InterruptedException {
        printTestHeader("20 threads racing on a balance of 10");
        String userId = activeUser("4", "6");

        int threadCount = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger charged = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int attempt = 0; attempt < 50; attempt++) {
                        try {
                            creditLedgerService.deduct(userId, BigDecimal.ONE, "race", Map.of());
                            charged.incrementAndGet();
                            return;
                        } catch (ConcurrentBalanceModificationException e) {
                            conflicts.incrementAndGet();
                        }
                    }
                    unexpected.incrementAndGet();
                } catch (InsufficientCreditsException e) {
                    insufficient.incrementAndGet();
                } catch (Exception e) {
                    unexpected.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Charged", charged.get());
        printOutput("Insufficient", insufficient.get());
        printOutput("Conflicts retried", conflicts.get());

        assertEquals(10, charged.get());
        assertEquals(10, insufficient.get());
        assertEquals(0, unexpected.get());

        UserBalance after = balanceStore.findById(userId).orElseThrow();
        assertAmount("0", after.getSubscriptionAllowance());
        assertAmount("0", after.getPurchasedCredits());
        assertEquals(10, creditLedgerService.getTransactions(userId, 50).size());
        assertTrue(creditLedgerService.reconcile(userId).isBalanced());
        printSuccess("Exactly the available balance was spent");
    }
}

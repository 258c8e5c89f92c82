package com.flagship.deposit_ledger.pool;

import com.flagship.deposit_ledger.auth.AuthorizationPolicy;
import com.flagship.deposit_ledger.auth.OwnerAuthorizationPolicy;
import com.flagship.deposit_ledger.config.JacksonConfig;
import com.flagship.deposit_ledger.custody.AssetCustody;
import com.flagship.deposit_ledger.custody.InMemoryAssetCustody;
import com.flagship.deposit_ledger.event.DepositEvent;
import com.flagship.deposit_ledger.event.InterestRateUpdatedEvent;
import com.flagship.deposit_ledger.event.MarketInitializedEvent;
import com.flagship.deposit_ledger.event.WithdrawEvent;
import com.flagship.deposit_ledger.exception.LedgerErrorCode;
import com.flagship.deposit_ledger.exception.LedgerException;
import com.flagship.deposit_ledger.market.LedgerConfig;
import com.flagship.deposit_ledger.market.MarketSummary;
import com.flagship.deposit_ledger.observability.LedgerMetrics;
import com.flagship.deposit_ledger.outbox.OutboxEvent;
import com.flagship.deposit_ledger.outbox.OutboxService;
import com.flagship.deposit_ledger.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Pool coordinator tests.
 *
 * These tests verify:
 * - Market registration happens once per asset
 * - Deposits and withdrawals move custody and shares together or not at all
 * - Interest accrues on deposited value over time
 * - Rounding never lets a holder take out more than they put in plus interest
 * - Reentrant calls from custody are rejected
 * - Events reach the outbox only for completed operations
 */
class PoolCoordinatorTest {

    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final BigInteger TEN_PERCENT = E18.divide(BigInteger.TEN);

    private static final String OWNER = "ledger-admin";
    private static final String COORDINATOR = "pool-coordinator";
    private static final String ASSET = "MTK";
    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    private MutableClock clock;
    private AuthorizationPolicy authorizationPolicy;
    private InMemoryAssetCustody custody;
    private OutboxService outboxService;
    private SimpleMeterRegistry meterRegistry;
    private PoolCoordinator coordinator;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static BigInteger units(long n) {
        return E18.multiply(BigInteger.valueOf(n));
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        authorizationPolicy = new OwnerAuthorizationPolicy(OWNER, COORDINATOR);
        custody = new InMemoryAssetCustody(authorizationPolicy);
        outboxService = new OutboxService(new JacksonConfig().objectMapper(), clock);
        meterRegistry = new SimpleMeterRegistry();
        coordinator = newCoordinator(custody);

        coordinator.initializeMarket(OWNER, ASSET, LedgerConfig.of("Savings Token", "sMTK", TEN_PERCENT));
        custody.credit(OWNER, ASSET, ALICE, units(1000));
        custody.credit(OWNER, ASSET, BOB, units(1000));
    }

    private PoolCoordinator newCoordinator(AssetCustody assetCustody) {
        return new PoolCoordinator(assetCustody, authorizationPolicy, outboxService,
                new LedgerMetrics(meterRegistry), clock, COORDINATOR);
    }

    /**
     * Delegates to the in-memory custody and runs a callback before each
     * transfer out, optionally refusing the transfer afterwards.
     */
    private class CallbackCustody implements AssetCustody {
        private Runnable onTransferOut = () -> { };
        private boolean refuseTransferOut;

        @Override
        public boolean transferIn(String assetId, String from, BigInteger amount) {
            return custody.transferIn(assetId, from, amount);
        }

        @Override
        public boolean transferOut(String assetId, String to, BigInteger amount) {
            onTransferOut.run();
            return !refuseTransferOut && custody.transferOut(assetId, to, amount);
        }

        @Override
        public BigInteger balanceOf(String assetId, String holder) {
            return custody.balanceOf(assetId, holder);
        }

        @Override
        public BigInteger poolBalance(String assetId) {
            return custody.poolBalance(assetId);
        }
    }

    private List<String> eventTypes() {
        return outboxService.getEventsForAggregate(ASSET).stream()
                .map(OutboxEvent::getEventType)
                .toList();
    }

    @Nested
    @DisplayName("Market initialization")
    class MarketInitialization {

        @Test
        @DisplayName("Initialized market starts at the initial index with the configured rate")
        void testInitializeMarket() {
            MarketSummary market = coordinator.getMarket(ASSET);

            assertEquals(E18, market.getIndex());
            assertEquals(TEN_PERCENT, market.getAnnualInterestRate());
            assertEquals("sMTK", market.getSymbol());
            assertTrue(coordinator.hasMarket(ASSET));
            assertEquals(List.of(MarketInitializedEvent.EVENT_TYPE), eventTypes());
        }

        @Test
        @DisplayName("Initializing the same market twice fails with MARKET_ALREADY_EXISTS")
        void testInitializeTwice() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.initializeMarket(OWNER, ASSET, LedgerConfig.of("Other", "sOTH", BigInteger.ONE)));

            assertEquals(LedgerErrorCode.MARKET_ALREADY_EXISTS, e.getErrorCode());
            assertEquals("Savings Token", coordinator.getMarket(ASSET).getName());
            assertEquals(1, coordinator.marketCount());
        }

        @Test
        @DisplayName("Only the owner may initialize a market")
        void testInitializeUnauthorized() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.initializeMarket(ALICE, "DAI", LedgerConfig.of("Savings DAI", "sDAI", TEN_PERCENT)));

            assertEquals(LedgerErrorCode.UNAUTHORIZED, e.getErrorCode());
            assertFalse(coordinator.hasMarket("DAI"));
        }

        @Test
        @DisplayName("Markets are listed in registration order")
        void testListMarkets() {
            coordinator.initializeMarket(OWNER, "DAI", LedgerConfig.of("Savings DAI", "sDAI", BigInteger.ZERO));

            List<String> assets = coordinator.listMarkets().stream().map(MarketSummary::getAssetId).toList();

            assertEquals(List.of(ASSET, "DAI"), assets);
        }
    }

    @Nested
    @DisplayName("Deposits")
    class Deposits {

        @Test
        @DisplayName("Deposit into a fresh market mints shares equal to the amount")
        void testDepositMintsShares() {
            printTestHeader("Deposit - Mints Shares");
            BigInteger amount = units(100);
            printInput("Amount", amount);

            PoolReceipt receipt = coordinator.deposit(ALICE, ASSET, amount);

            printOutput("Shares", receipt.getShares());
            printOutput("Balance", receipt.getBalance());
            assertEquals(amount, receipt.getShares());
            assertEquals(amount, coordinator.getShareBalance(ASSET, ALICE));
            assertEquals(amount, coordinator.getUserBalance(ASSET, ALICE));
            assertEquals(amount, custody.poolBalance(ASSET));
            assertEquals(units(900), custody.balanceOf(ASSET, ALICE));
            printSuccess("Shares minted 1:1 at the initial index");
        }

        @Test
        @DisplayName("Zero deposit fails with INVALID_AMOUNT")
        void testZeroDeposit() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.deposit(ALICE, ASSET, BigInteger.ZERO));

            assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getErrorCode());
            assertEquals(units(1000), custody.balanceOf(ASSET, ALICE));
        }

        @Test
        @DisplayName("Negative deposit fails with INVALID_AMOUNT")
        void testNegativeDeposit() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.deposit(ALICE, ASSET, BigInteger.valueOf(-1)));

            assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getErrorCode());
        }

        @Test
        @DisplayName("Deposit into an unknown market fails with MARKET_NOT_FOUND")
        void testDepositUnknownMarket() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.deposit(ALICE, "DAI", units(1)));

            assertEquals(LedgerErrorCode.MARKET_NOT_FOUND, e.getErrorCode());
            assertEquals(units(1000), custody.balanceOf(ASSET, ALICE));
        }

        @Test
        @DisplayName("Deposit beyond custody funds fails and mints nothing")
        void testDepositCustodyRefused() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.deposit(ALICE, ASSET, units(1001)));

            assertEquals(LedgerErrorCode.CUSTODY_TRANSFER_FAILED, e.getErrorCode());
            assertEquals(BigInteger.ZERO, coordinator.getShareBalance(ASSET, ALICE));
            assertEquals(BigInteger.ZERO, custody.poolBalance(ASSET));
            assertEquals(List.of(MarketInitializedEvent.EVENT_TYPE), eventTypes());
        }

        @Test
        @DisplayName("Custody that throws is reported as CUSTODY_TRANSFER_FAILED")
        void testDepositCustodyThrows() {
            AssetCustody failing = mock(AssetCustody.class);
            when(failing.transferIn(anyString(), anyString(), any())).thenThrow(new IllegalStateException("node down"));
            PoolCoordinator pool = newCoordinator(failing);
            pool.initializeMarket(OWNER, ASSET, LedgerConfig.of("Savings Token", "sMTK", TEN_PERCENT));

            LedgerException e = assertThrows(LedgerException.class, () -> pool.deposit(ALICE, ASSET, units(1)));

            assertEquals(LedgerErrorCode.CUSTODY_TRANSFER_FAILED, e.getErrorCode());
            assertEquals(BigInteger.ZERO, pool.getShareBalance(ASSET, ALICE));
        }

        @Test
        @DisplayName("Deposit too small to mint a share is refunded")
        void testDustDepositRefunded() {
            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS);

            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.deposit(ALICE, ASSET, BigInteger.ONE));

            assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getErrorCode());
            assertEquals(units(1000), custody.balanceOf(ASSET, ALICE));
            assertEquals(BigInteger.ZERO, custody.poolBalance(ASSET));
        }

        @Test
        @DisplayName("Deposit after accrual increases value by the amount, up to a few units of rounding")
        void testValueConservationOnDeposit() {
            printTestHeader("Deposit - Value Conservation");
            coordinator.deposit(ALICE, ASSET, units(100));
            clock.advanceSeconds(1_234_567);

            BigInteger amount = new BigInteger("123456789012345678901");
            BigInteger before = coordinator.getUserBalance(ASSET, ALICE);
            PoolReceipt receipt = coordinator.deposit(ALICE, ASSET, amount);
            BigInteger after = coordinator.getUserBalance(ASSET, ALICE);

            BigInteger shortfall = amount.subtract(after.subtract(before));
            printOutput("Index", receipt.getIndex());
            printOutput("Shortfall", shortfall);
            assertTrue(receipt.getIndex().compareTo(E18) > 0);
            assertTrue(shortfall.signum() >= 0, "Deposit must never credit more than the amount");
            assertTrue(shortfall.compareTo(BigInteger.valueOf(3)) <= 0, "Rounding loss too large: " + shortfall);
        }
    }

    @Nested
    @DisplayName("Withdrawals")
    class Withdrawals {

        @BeforeEach
        void depositHundred() {
            coordinator.deposit(ALICE, ASSET, units(100));
        }

        @Test
        @DisplayName("Immediate round trip returns shares, value and custody to their starting point")
        void testRoundTrip() {
            PoolReceipt receipt = coordinator.withdraw(ALICE, ASSET, units(100));

            assertEquals(units(100), receipt.getShares());
            assertEquals(BigInteger.ZERO, coordinator.getShareBalance(ASSET, ALICE));
            assertEquals(BigInteger.ZERO, coordinator.getUserBalance(ASSET, ALICE));
            assertEquals(units(1000), custody.balanceOf(ASSET, ALICE));
            assertEquals(BigInteger.ZERO, custody.poolBalance(ASSET));
        }

        @Test
        @DisplayName("Position reads balance and shares together")
        void testGetPosition() {
            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS);

            HolderPosition position = coordinator.getPosition(ASSET, ALICE);

            assertEquals(ASSET, position.getAssetId());
            assertEquals(ALICE, position.getUser());
            assertEquals(units(100), position.getShares());
            assertEquals(units(110), position.getBalance());
            assertEquals(BigInteger.ZERO, coordinator.getPosition(ASSET, BOB).getShares());
        }

        @Test
        @DisplayName("Round trip at an accrued index burns exactly the shares minted")
        void testRoundTripAfterAccrual() {
            clock.advanceSeconds(987_654);
            BigInteger amount = units(50);

            PoolReceipt deposited = coordinator.deposit(BOB, ASSET, amount);
            BigInteger value = coordinator.getUserBalance(ASSET, BOB);
            PoolReceipt withdrawn = coordinator.withdraw(BOB, ASSET, value);

            assertEquals(deposited.getShares(), withdrawn.getShares());
            assertEquals(BigInteger.ZERO, coordinator.getShareBalance(ASSET, BOB));
            BigInteger lost = units(1000).subtract(custody.balanceOf(ASSET, BOB));
            assertTrue(lost.signum() >= 0 && lost.compareTo(BigInteger.valueOf(2)) <= 0,
                    "Round trip cost more than rounding: " + lost);
        }

        @Test
        @DisplayName("Withdrawing more than the balance fails with INSUFFICIENT_BALANCE")
        void testWithdrawTooMuch() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.withdraw(ALICE, ASSET, units(200)));

            assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, e.getErrorCode());
            assertEquals(units(100), coordinator.getShareBalance(ASSET, ALICE));
        }

        @Test
        @DisplayName("Zero withdrawal fails with INVALID_AMOUNT")
        void testZeroWithdraw() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.withdraw(ALICE, ASSET, BigInteger.ZERO));

            assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getErrorCode());
        }

        @Test
        @DisplayName("Withdraw from an unknown market fails with MARKET_NOT_FOUND")
        void testWithdrawUnknownMarket() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.withdraw(ALICE, "DAI", units(1)));

            assertEquals(LedgerErrorCode.MARKET_NOT_FOUND, e.getErrorCode());
        }

        @Test
        @DisplayName("Partial withdrawal leaves the rest of the position")
        void testPartialWithdraw() {
            coordinator.withdraw(ALICE, ASSET, units(40));

            assertEquals(units(60), coordinator.getShareBalance(ASSET, ALICE));
            assertEquals(units(940), custody.balanceOf(ASSET, ALICE));
        }
    }

    @Nested
    @DisplayName("Interest accrual")
    class InterestAccrual {

        @Test
        @DisplayName("100 deposited at 10% is worth about 110 after one year")
        void testInterestAccrual() {
            printTestHeader("Interest Accrual - One Year");
            BigInteger deposit = units(100);
            coordinator.deposit(ALICE, ASSET, deposit);

            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS);
            BigInteger balance = coordinator.getUserBalance(ASSET, ALICE);

            BigInteger expected = deposit.multiply(BigInteger.valueOf(110)).divide(BigInteger.valueOf(100));
            BigInteger tolerance = deposit.divide(BigInteger.valueOf(100));
            printOutput("Balance", balance);
            assertTrue(balance.compareTo(deposit) > 0);
            assertTrue(balance.subtract(expected).abs().compareTo(tolerance) < 0);
            assertEquals(units(100), coordinator.getShareBalance(ASSET, ALICE));
            printSuccess("Interest accrued on read without any state change");
        }

        @Test
        @DisplayName("Whole accrued value can be withdrawn and burns exactly the shares held")
        void testWithdrawAccruedValue() {
            printTestHeader("Withdraw - Full Accrued Value");
            coordinator.deposit(ALICE, ASSET, units(100));
            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS);
            coordinator.deposit(BOB, ASSET, units(50));

            BigInteger balance = coordinator.getUserBalance(ASSET, ALICE);
            printInput("Withdraw amount", balance);
            PoolReceipt receipt = coordinator.withdraw(ALICE, ASSET, balance);

            printOutput("Shares burned", receipt.getShares());
            assertEquals(units(110), balance);
            assertEquals(units(100), receipt.getShares());
            assertEquals(BigInteger.ZERO, coordinator.getShareBalance(ASSET, ALICE));
            assertEquals(units(1010), custody.balanceOf(ASSET, ALICE));
        }

        @Test
        @DisplayName("Withdraw that custody cannot pay rolls back the burn")
        void testWithdrawRolledBackWhenCustodyCannotPay() {
            coordinator.deposit(ALICE, ASSET, units(100));
            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS);
            int eventsBefore = eventTypes().size();

            // pool only holds the 100 deposited, not the interest
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.withdraw(ALICE, ASSET, units(110)));

            assertEquals(LedgerErrorCode.CUSTODY_TRANSFER_FAILED, e.getErrorCode());
            assertEquals(units(100), coordinator.getShareBalance(ASSET, ALICE));
            assertEquals(units(110), coordinator.getUserBalance(ASSET, ALICE));
            assertEquals(units(100), custody.poolBalance(ASSET));
            assertEquals(eventsBefore, eventTypes().size());
        }

        @Test
        @DisplayName("Rate change through the pool settles accrual and emits an event")
        void testSetInterestRate() {
            coordinator.deposit(ALICE, ASSET, units(100));
            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS / 2);

            MarketSummary market = coordinator.setInterestRate(OWNER, ASSET, BigInteger.ZERO);
            clock.advanceSeconds(MutableClock.ONE_YEAR_SECONDS);

            assertEquals(BigInteger.ZERO, market.getAnnualInterestRate());
            assertEquals(units(105), coordinator.getUserBalance(ASSET, ALICE));
            assertTrue(eventTypes().contains(InterestRateUpdatedEvent.EVENT_TYPE));
        }

        @Test
        @DisplayName("Rate change by a non-owner is rejected")
        void testSetInterestRateUnauthorized() {
            LedgerException e = assertThrows(LedgerException.class,
                    () -> coordinator.setInterestRate(ALICE, ASSET, E18));

            assertEquals(LedgerErrorCode.UNAUTHORIZED, e.getErrorCode());
            assertEquals(TEN_PERCENT, coordinator.getMarket(ASSET).getAnnualInterestRate());
        }
    }

    @Nested
    @DisplayName("Reentrancy and serialization")
    class Reentrancy {

        @Test
        @DisplayName("Custody calling back into the pool is rejected with REENTRANT_CALL")
        void testReentrantDepositRejected() {
            printTestHeader("Reentrancy - Callback Rejected");
            List<LedgerException> rejected = new ArrayList<>();
            PoolCoordinator[] pool = new PoolCoordinator[1];

            AssetCustody reentrant = new AssetCustody() {
                @Override
                public boolean transferIn(String assetId, String from, BigInteger amount) {
                    try {
                        pool[0].deposit(from, assetId, amount);
                    } catch (LedgerException e) {
                        rejected.add(e);
                    }
                    return custody.transferIn(assetId, from, amount);
                }

                @Override
                public boolean transferOut(String assetId, String to, BigInteger amount) {
                    return custody.transferOut(assetId, to, amount);
                }

                @Override
                public BigInteger balanceOf(String assetId, String holder) {
                    return custody.balanceOf(assetId, holder);
                }

                @Override
                public BigInteger poolBalance(String assetId) {
                    return custody.poolBalance(assetId);
                }
            };
            pool[0] = newCoordinator(reentrant);
            pool[0].initializeMarket(OWNER, ASSET, LedgerConfig.of("Savings Token", "sMTK", TEN_PERCENT));

            PoolReceipt receipt = pool[0].deposit(ALICE, ASSET, units(10));

            printOutput("Rejected callbacks", rejected.size());
            assertEquals(1, rejected.size());
            assertEquals(LedgerErrorCode.REENTRANT_CALL, rejected.get(0).getErrorCode());
            assertEquals(units(10), receipt.getShares());
            assertEquals(units(10), pool[0].getShareBalance(ASSET, ALICE));

            // the guard is released after the outer call
            pool[0].deposit(ALICE, ASSET, units(1));
            assertEquals(2, rejected.size());
            assertEquals(units(11), pool[0].getShareBalance(ASSET, ALICE));
        }

        @Test
        @DisplayName("Custody calling back into the pool during a withdraw is rejected with REENTRANT_CALL")
        void testReentrantWithdrawRejected() {
            printTestHeader("Reentrancy - Withdraw Callback Rejected");
            List<LedgerException> rejected = new ArrayList<>();
            CallbackCustody callbackCustody = new CallbackCustody();
            PoolCoordinator pool = newCoordinator(callbackCustody);
            pool.initializeMarket(OWNER, ASSET, LedgerConfig.of("Savings Token", "sMTK", TEN_PERCENT));
            pool.deposit(ALICE, ASSET, units(100));

            callbackCustody.onTransferOut = () -> {
                try {
                    pool.withdraw(ALICE, ASSET, units(1));
                } catch (LedgerException e) {
                    rejected.add(e);
                }
                try {
                    pool.deposit(ALICE, ASSET, units(1));
                } catch (LedgerException e) {
                    rejected.add(e);
                }
            };

            PoolReceipt receipt = pool.withdraw(ALICE, ASSET, units(40));

            printOutput("Rejected callbacks", rejected.size());
            assertEquals(2, rejected.size());
            rejected.forEach(e -> assertEquals(LedgerErrorCode.REENTRANT_CALL, e.getErrorCode()));
            assertEquals(units(40), receipt.getShares());
            assertEquals(units(60), pool.getShareBalance(ASSET, ALICE));
            assertEquals(units(60), pool.getMarket(ASSET).getTotalShares());
            assertEquals(units(940), custody.balanceOf(ASSET, ALICE));
            printSuccess("Nested withdraw and deposit rejected, outer withdraw completed once");
        }

        @Test
        @DisplayName("Administrative calls from custody during a withdraw are rejected and survive its rollback")
        void testAdminCallbackRejectedDuringWithdraw() {
            printTestHeader("Reentrancy - Admin Callback Rejected");
            List<LedgerException> rejected = new ArrayList<>();
            CallbackCustody callbackCustody = new CallbackCustody();
            PoolCoordinator pool = newCoordinator(callbackCustody);
            pool.initializeMarket(OWNER, ASSET, LedgerConfig.of("Savings Token", "sMTK", TEN_PERCENT));
            pool.deposit(ALICE, ASSET, units(100));

            callbackCustody.refuseTransferOut = true;
            callbackCustody.onTransferOut = () -> {
                try {
                    pool.setInterestRate(OWNER, ASSET, BigInteger.ZERO);
                } catch (LedgerException e) {
                    rejected.add(e);
                }
                try {
                    pool.initializeMarket(OWNER, "DAI", LedgerConfig.of("Savings DAI", "sDAI", TEN_PERCENT));
                } catch (LedgerException e) {
                    rejected.add(e);
                }
            };

            LedgerException e = assertThrows(LedgerException.class,
                    () -> pool.withdraw(ALICE, ASSET, units(40)));

            printOutput("Outer error", e.getErrorCode());
            assertEquals(LedgerErrorCode.CUSTODY_TRANSFER_FAILED, e.getErrorCode());
            assertEquals(2, rejected.size());
            rejected.forEach(r -> assertEquals(LedgerErrorCode.REENTRANT_CALL, r.getErrorCode()));
            assertEquals(TEN_PERCENT, pool.getMarket(ASSET).getAnnualInterestRate());
            assertFalse(pool.hasMarket("DAI"));
            assertFalse(eventTypes().contains(InterestRateUpdatedEvent.EVENT_TYPE));
            assertEquals(units(100), pool.getShareBalance(ASSET, ALICE));

            // once the withdraw has unwound, the owner can change the rate again
            callbackCustody.onTransferOut = () -> { };
            assertEquals(BigInteger.ZERO, pool.setInterestRate(OWNER, ASSET, BigInteger.ZERO).getAnnualInterestRate());
            printSuccess("Rate unchanged by the aborted withdraw");
        }

        @Test
        @DisplayName("Concurrent deposits are serialized without losing updates")
        void testConcurrentDeposits() throws Exception {
            int threads = 8;
            int depositsPerThread = 25;
            for (int t = 0; t < threads; t++) {
                custody.credit(OWNER, ASSET, "user-" + t, units(depositsPerThread));
            }

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger failures = new AtomicInteger();
            try {
                for (int t = 0; t < threads; t++) {
                    String user = "user-" + t;
                    executor.submit(() -> {
                        try {
                            start.await();
                            for (int i = 0; i < depositsPerThread; i++) {
                                coordinator.deposit(user, ASSET, E18);
                            }
                        } catch (Exception e) {
                            failures.incrementAndGet();
                        }
                    });
                }
                start.countDown();
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
            }

            assertEquals(0, failures.get());
            assertEquals(units((long) threads * depositsPerThread), coordinator.getMarket(ASSET).getTotalShares());
            assertEquals(units((long) threads * depositsPerThread), custody.poolBalance(ASSET));
        }
    }

    @Nested
    @DisplayName("Events and metrics")
    class EventsAndMetrics {

        @Test
        @DisplayName("Completed operations append events in order")
        void testEventsInOrder() {
            coordinator.deposit(ALICE, ASSET, units(100));
            coordinator.withdraw(ALICE, ASSET, units(30));

            assertEquals(List.of(MarketInitializedEvent.EVENT_TYPE, DepositEvent.EVENT_TYPE, WithdrawEvent.EVENT_TYPE),
                    eventTypes());

            OutboxEvent deposit = outboxService.getEventsForAggregate(ASSET).get(1);
            assertTrue(deposit.getPayload().contains("\"user\":\"alice\""));
            assertTrue(deposit.getPayload().contains("\"assetId\":\"MTK\""));
            assertFalse(deposit.isPublished());
        }

        @Test
        @DisplayName("Rejected operations leave no event behind")
        void testRejectedOperationsLeaveNoEvent() {
            assertThrows(LedgerException.class, () -> coordinator.withdraw(ALICE, ASSET, units(1)));
            assertThrows(LedgerException.class, () -> coordinator.deposit(ALICE, ASSET, units(5000)));

            assertEquals(List.of(MarketInitializedEvent.EVENT_TYPE), eventTypes());
        }

        @Test
        @DisplayName("Deposit outcomes are counted by status")
        void testDepositMetrics() {
            coordinator.deposit(ALICE, ASSET, units(1));
            assertThrows(LedgerException.class, () -> coordinator.deposit(ALICE, ASSET, units(5000)));

            assertEquals(1.0, meterRegistry.get("ledger.deposits")
                    .tag("asset", ASSET).tag("status", "success").counter().count());
            assertEquals(1.0, meterRegistry.get("ledger.deposits")
                    .tag("asset", ASSET).tag("status", "CUSTODY_TRANSFER_FAILED").counter().count());
            assertEquals(1.0, meterRegistry.get("ledger.index").tag("asset", ASSET).gauge().value());
        }
    }
}

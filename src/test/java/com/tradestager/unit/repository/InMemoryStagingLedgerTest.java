package com.tradestager.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.AuditEntry;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.StrategyRecord;
import com.tradestager.repository.LedgerFilter;
import com.tradestager.repository.LedgerOutcome;
import com.tradestager.repository.LedgerPartition;
import com.tradestager.repository.LedgerUpdateResult;
import com.tradestager.repository.StatusUpdate;
import com.tradestager.repository.memory.InMemoryStagingLedger;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InMemoryStagingLedger covering all-or-nothing inserts, compare-and-set
 * semantics under contention, history moves and filtered listing.
 */
class InMemoryStagingLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-16T14:30:00Z");

    private InMemoryStagingLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryStagingLedger();
    }

    // ==============================
    // INSERT
    // ==============================

    @Nested
    @DisplayName("Insert")
    class Insert {

        @Test
        @DisplayName("Inserts a strategy and its orders into the active partition")
        void insert_storesEverything() {
            LedgerUpdateResult result = ledger.insert(strategy("s1", "o1", "o2"), orders("s1", "o1", "o2"));

            assertThat(result.isApplied()).isTrue();
            assertThat(ledger.findStrategy("s1", LedgerPartition.ACTIVE)).isPresent();
            assertThat(ledger.findOrder("o1")).isPresent();
            assertThat(ledger.findOrder("o2")).isPresent();
            assertThat(ledger.countOrders(LedgerPartition.ACTIVE)).isEqualTo(2);
        }

        @Test
        @DisplayName("A clashing order id leaves nothing from the second insert behind")
        void clashingOrderId_nothingWritten() {
            ledger.insert(strategy("s1", "o1"), orders("s1", "o1"));

            LedgerUpdateResult result = ledger.insert(strategy("s2", "o2", "o1"), orders("s2", "o2", "o1"));

            assertThat(result.getOutcome()).isEqualTo(LedgerOutcome.CONFLICT);
            assertThat(ledger.findStrategy("s2")).isEmpty();
            assertThat(ledger.findOrder("o2")).isEmpty();
            assertThat(ledger.findOrder("o1").orElseThrow().getStrategyId()).isEqualTo("s1");
        }

        @Test
        @DisplayName("A duplicate strategy id is refused")
        void duplicateStrategy_conflict() {
            ledger.insert(strategy("s1", "o1"), orders("s1", "o1"));

            assertThat(ledger.insert(strategy("s1", "o9"), orders("s1", "o9")).getOutcome())
                    .isEqualTo(LedgerOutcome.CONFLICT);
            assertThat(ledger.findOrder("o9")).isEmpty();
        }
    }

    // ==============================
    // COMPARE AND SET
    // ==============================

    @Nested
    @DisplayName("Compare and Set")
    class CompareAndSet {

        @BeforeEach
        void insertStrategy() {
            ledger.insert(strategy("s1", "o1"), orders("s1", "o1"));
        }

        @Test
        @DisplayName("Matching expected status applies the update and appends the audit entry")
        void matchingStatus_applied() {
            LedgerUpdateResult result = ledger.compareAndSetStatus("o1", OrderStatus.STAGED, update(OrderStatus.APPROVED));

            assertThat(result.isApplied()).isTrue();
            OrderRecord stored = ledger.findOrder("o1").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(OrderStatus.APPROVED);
            assertThat(stored.getVersion()).isEqualTo(1);
            assertThat(stored.getAuditTrail()).extracting(AuditEntry::getEvent).containsExactly("STAGED", "APPROVED");
        }

        @Test
        @DisplayName("Mismatched expected status reports a conflict and leaves the record unchanged")
        void mismatchedStatus_conflict() {
            OrderRecord before = ledger.findOrder("o1").orElseThrow();

            LedgerUpdateResult result =
                    ledger.compareAndSetStatus("o1", OrderStatus.APPROVED, update(OrderStatus.SUBMITTED));

            assertThat(result.getOutcome()).isEqualTo(LedgerOutcome.CONFLICT);
            assertThat(result.getObservedStatus()).isEqualTo(OrderStatus.STAGED);
            assertThat(ledger.findOrder("o1").orElseThrow()).isEqualTo(before);
        }

        @Test
        @DisplayName("Stale expected version reports a conflict")
        void staleVersion_conflict() {
            StatusUpdate stale = StatusUpdate.builder()
                    .newStatus(OrderStatus.APPROVED)
                    .auditEntry(entry("o1", "APPROVED"))
                    .expectedVersion(7L)
                    .build();

            assertThat(ledger.compareAndSetStatus("o1", OrderStatus.STAGED, stale).getOutcome())
                    .isEqualTo(LedgerOutcome.CONFLICT);
        }

        @Test
        @DisplayName("Unknown order reports not found")
        void unknownOrder_notFound() {
            assertThat(ledger.compareAndSetStatus("missing", OrderStatus.STAGED, update(OrderStatus.APPROVED))
                            .getOutcome())
                    .isEqualTo(LedgerOutcome.NOT_FOUND);
        }

        @Test
        @DisplayName("Concurrent callers racing on the same expected status have exactly one winner")
        void concurrentRace_singleWinner() throws Exception {
            int threadCount = 16;
            ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<LedgerUpdateResult>> futures = new ArrayList<>();

            for (int i = 0; i < threadCount; i++) {
                futures.add(executorService.submit(() -> {
                    start.await();
                    return ledger.compareAndSetStatus("o1", OrderStatus.STAGED, update(OrderStatus.APPROVED));
                }));
            }
            start.countDown();

            int applied = 0;
            int conflicts = 0;
            for (Future<LedgerUpdateResult> future : futures) {
                LedgerUpdateResult result = future.get(10, TimeUnit.SECONDS);
                if (result.isApplied()) {
                    applied++;
                } else if (result.getOutcome() == LedgerOutcome.CONFLICT) {
                    conflicts++;
                }
            }
            executorService.shutdown();

            assertThat(applied).isEqualTo(1);
            assertThat(conflicts).isEqualTo(threadCount - 1);
            assertThat(ledger.findOrder("o1").orElseThrow().getAuditTrail()).hasSize(2);
        }
    }

    // ==============================
    // HISTORY
    // ==============================

    @Nested
    @DisplayName("History")
    class History {

        @BeforeEach
        void insertStrategy() {
            ledger.insert(strategy("s1", "o1"), orders("s1", "o1"));
        }

        @Test
        @DisplayName("Live orders cannot be moved to history")
        void liveOrder_notTerminal() {
            assertThat(ledger.moveToHistory("o1").getOutcome()).isEqualTo(LedgerOutcome.NOT_TERMINAL);
            assertThat(ledger.countOrders(LedgerPartition.HISTORY)).isZero();
        }

        @Test
        @DisplayName("Terminal orders move to history and become read-only")
        void terminalOrder_movedAndReadOnly() {
            ledger.compareAndSetStatus("o1", OrderStatus.STAGED, update(OrderStatus.REJECTED));

            assertThat(ledger.moveToHistory("o1").isApplied()).isTrue();
            assertThat(ledger.moveStrategyToHistory("s1").isApplied()).isTrue();

            assertThat(ledger.findOrder("o1").orElseThrow().getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(ledger.isArchived("s1")).isTrue();
            assertThat(ledger.compareAndSetStatus("o1", OrderStatus.REJECTED, update(OrderStatus.APPROVED))
                            .getOutcome())
                    .isEqualTo(LedgerOutcome.ARCHIVED);
            assertThat(ledger.moveToHistory("o1").getOutcome()).isEqualTo(LedgerOutcome.ARCHIVED);
            assertThat(ledger.listOrders(LedgerFilter.active())).isEmpty();
            assertThat(ledger.listOrders(LedgerFilter.builder().partition(LedgerPartition.HISTORY).build()))
                    .extracting(OrderRecord::getId)
                    .containsExactly("o1");
        }
    }

    // ==============================
    // LISTING
    // ==============================

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("Filters by status and symbol, in creation then leg order")
        void listOrders_filtered() {
            ledger.insert(strategy("s1", "o1", "o2"), orders("s1", "o1", "o2"));
            ledger.insert(strategy("s2", "o3"), orders("s2", "o3"));
            ledger.compareAndSetStatus("o2", OrderStatus.STAGED, update(OrderStatus.APPROVED));

            assertThat(ledger.listOrders(LedgerFilter.active()))
                    .extracting(OrderRecord::getId)
                    .containsExactly("o1", "o2", "o3");
            assertThat(ledger.listOrders(LedgerFilter.byStatus(OrderStatus.APPROVED)))
                    .extracting(OrderRecord::getId)
                    .containsExactly("o2");
            assertThat(ledger.listOrders(LedgerFilter.builder()
                            .statuses(Set.of(OrderStatus.STAGED))
                            .symbol("spy")
                            .build()))
                    .extracting(OrderRecord::getId)
                    .containsExactly("o1", "o3");
            assertThat(ledger.listOrders(LedgerFilter.byStrategy("s2")))
                    .extracting(OrderRecord::getId)
                    .containsExactly("o3");
        }
    }

    // ==============================
    // HELPERS
    // ==============================

    private static StrategyRecord strategy(String strategyId, String... orderIds) {
        return StrategyRecord.builder()
                .id(strategyId)
                .orderIds(List.of(orderIds))
                .createdAt(NOW)
                .build();
    }

    private static List<OrderRecord> orders(String strategyId, String... orderIds) {
        List<OrderRecord> orders = new ArrayList<>();
        for (int i = 0; i < orderIds.length; i++) {
            orders.add(OrderRecord.builder()
                    .id(orderIds[i])
                    .strategyId(strategyId)
                    .symbol("SPY")
                    .legIndex(i)
                    .leg(Leg.builder()
                            .side(OrderSide.SELL)
                            .optionType(OptionType.PUT)
                            .strike(new BigDecimal("440"))
                            .quantity(1)
                            .build())
                    .status(OrderStatus.STAGED)
                    .createdAt(NOW)
                    .updatedAt(NOW)
                    .auditTrail(List.of(entry(orderIds[i], "STAGED")))
                    .build());
        }
        return orders;
    }

    private static StatusUpdate update(OrderStatus newStatus) {
        return StatusUpdate.builder()
                .newStatus(newStatus)
                .auditEntry(entry(null, newStatus.name()))
                .build();
    }

    private static AuditEntry entry(String orderId, String event) {
        return AuditEntry.builder()
                .timestamp(NOW)
                .orderId(orderId)
                .event(event)
                .actor("test")
                .build();
    }
}

package com.tradestager.staging;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.enums.StrategyStatus;
import com.tradestager.domain.model.AuditEntry;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.LedgerSummary;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.PortfolioSnapshot;
import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.domain.model.StrategyRecord;
import com.tradestager.domain.model.StrategySnapshot;
import com.tradestager.event.EventPublisherHelper;
import com.tradestager.event.StrategyEventType;
import com.tradestager.exception.LedgerUnavailableException;
import com.tradestager.repository.LedgerFilter;
import com.tradestager.repository.LedgerOutcome;
import com.tradestager.repository.LedgerPartition;
import com.tradestager.repository.LedgerUpdateResult;
import com.tradestager.repository.StagingLedger;
import com.tradestager.repository.StatusUpdate;
import com.tradestager.risk.DailyLossTracker;
import com.tradestager.risk.RiskAssessment;
import com.tradestager.risk.RiskAssessor;
import com.tradestager.risk.RiskLimits;
import com.tradestager.strategy.StructuralValidator;
import com.tradestager.strategy.StructuralViolation;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives staged strategies and their orders through the order lifecycle.
 *
 * <p>Pipeline for a new candidate:
 * <ol>
 *   <li>Structural validation (archetype rules). Any violation ends staging.</li>
 *   <li>Risk assessment against the portfolio snapshot and today's realized loss.</li>
 *   <li>One STAGED order per leg plus the strategy record, inserted into the ledger in one
 *       all-or-none write.</li>
 * </ol>
 *
 * <p>Strategy-level transitions (approve, reject, cancel) are all-or-nothing across the
 * strategy's orders. Each order is moved with a compare-and-set against the status read at the
 * start of the call; if any compare-and-set loses a race, every order already moved is put
 * back with a compensating compare-and-set and an audited ROLLED_BACK entry. Orders are always
 * visited in the strategy's leg order, so two racing strategy-level calls collide on the first
 * order and the loser usually has nothing to roll back.
 *
 * <p>Expected outcomes (structure, risk, illegal transitions, races) are returned as typed
 * results. A {@link LedgerUnavailableException} from the ledger is caught and returned as
 * BACKEND_UNAVAILABLE; success is only reported once the ledger has confirmed the write. The
 * controller never retries on its own.
 *
 * <p>Once every order of a strategy is terminal, the orders and the strategy are moved to the
 * ledger's history partition and become read-only.
 */
@Service
public class LifecycleController {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    public static final String DEFAULT_ACTOR = "system";

    static final String ROLLED_BACK = "ROLLED_BACK";

    private static final Set<OrderStatus> APPROVABLE = EnumSet.of(OrderStatus.STAGED);
    private static final Set<OrderStatus> REJECTABLE = EnumSet.of(OrderStatus.STAGED, OrderStatus.APPROVED);
    private static final Set<OrderStatus> CANCELLABLE = EnumSet.of(OrderStatus.STAGED, OrderStatus.APPROVED);
    private static final Set<OrderStatus> FILLABLE = EnumSet.of(OrderStatus.SUBMITTED, OrderStatus.PARTIALLY_FILLED);

    private final StructuralValidator structuralValidator;
    private final RiskAssessor riskAssessor;
    private final StagingLedger stagingLedger;
    private final DailyLossTracker dailyLossTracker;
    private final EventPublisherHelper eventPublisherHelper;
    private final RiskLimits riskLimits;
    private final Clock clock;

    public LifecycleController(
            StructuralValidator structuralValidator,
            RiskAssessor riskAssessor,
            StagingLedger stagingLedger,
            DailyLossTracker dailyLossTracker,
            EventPublisherHelper eventPublisherHelper,
            RiskLimits riskLimits,
            Clock clock) {
        this.structuralValidator = structuralValidator;
        this.riskAssessor = riskAssessor;
        this.stagingLedger = stagingLedger;
        this.dailyLossTracker = dailyLossTracker;
        this.eventPublisherHelper = eventPublisherHelper;
        this.riskLimits = riskLimits;
        this.clock = clock;
    }

    // ==== Staging ====

    public StagingResult stageStrategy(StrategyCandidate candidate, PortfolioSnapshot portfolio) {
        return stageStrategy(candidate, portfolio, DEFAULT_ACTOR);
    }

    /**
     * Validates, assesses and stages a candidate.
     *
     * @param candidate the proposal
     * @param portfolio holdings at the time of the call; null is treated as empty
     * @param actor who is staging, recorded in each order's audit trail
     */
    public StagingResult stageStrategy(StrategyCandidate candidate, PortfolioSnapshot portfolio, String actor) {
        if (candidate == null) {
            return StagingResult.failure(StagingErrorType.INVALID_REQUEST, "A strategy candidate is required");
        }

        List<StructuralViolation> violations = structuralValidator.validate(candidate);
        if (!violations.isEmpty()) {
            log.info("Structural rejection for {} {}: {}", candidate.getArchetype(), candidate.getSymbol(), violations);
            return StagingResult.structuralError(violations);
        }

        RiskAssessment assessment;
        try {
            BigDecimal dailyLossSoFar = dailyLossSoFar(portfolio, tradeDate());
            assessment = riskAssessor.assess(candidate, portfolio, dailyLossSoFar);
        } catch (LedgerUnavailableException e) {
            log.error("Staging of {} aborted: daily loss unavailable", candidate.getSymbol(), e);
            return StagingResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, e.getMessage());
        }

        if (!assessment.isApproved()) {
            log.warn("Risk rejection for {} {}: {}", candidate.getArchetype(), candidate.getSymbol(),
                    assessment.getViolationMessages());
            eventPublisherHelper.publishRiskRejection(this, candidate, assessment);
            return StagingResult.riskRejected(assessment);
        }

        Instant now = clock.instant();
        String strategyId = UUID.randomUUID().toString();
        String note = String.format(Locale.ROOT, "Staged with risk score %.2f", assessment.getRiskScore());

        List<OrderRecord> orders = new ArrayList<>();
        List<Leg> legs = candidate.getLegs();
        for (int i = 0; i < legs.size(); i++) {
            String orderId = UUID.randomUUID().toString();
            OrderRecord pending = OrderRecord.builder()
                    .id(orderId)
                    .strategyId(strategyId)
                    .symbol(candidate.getSymbol())
                    .legIndex(i)
                    .leg(legs.get(i))
                    .status(OrderStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .filledQuantity(0)
                    .auditTrail(List.of())
                    .build();
            orders.add(StatusUpdate.builder()
                    .newStatus(OrderStatus.STAGED)
                    .auditEntry(audit(now, orderId, OrderStatus.STAGED.name(), actor, note))
                    .build()
                    .applyTo(pending));
        }

        StrategyRecord strategy = StrategyRecord.builder()
                .id(strategyId)
                .candidate(candidate)
                .assessment(assessment)
                .orderIds(orders.stream().map(OrderRecord::getId).toList())
                .createdAt(now)
                .build();

        LedgerUpdateResult result;
        try {
            result = stagingLedger.insert(strategy, orders);
        } catch (LedgerUnavailableException e) {
            log.error("Staging of {} failed: ledger unavailable", strategyId, e);
            return StagingResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, e.getMessage());
        }
        if (!result.isApplied()) {
            return StagingResult.failure(
                    StagingErrorType.STAGING_CONFLICT, "Strategy or order id already present in the ledger");
        }

        log.info(
                "Staged {} {} as {} ({} orders, risk score {})",
                candidate.getArchetype(),
                candidate.getSymbol(),
                strategyId,
                orders.size(),
                assessment.getRiskScore());
        eventPublisherHelper.publishStrategyEvent(
                this, strategy, StrategyEventType.STAGED, StrategyStatus.IN_PROGRESS, actor);
        return StagingResult.staged(strategyId, assessment);
    }

    // ==== Strategy-level transitions ====

    public TransitionResult approveStrategy(String strategyId) {
        return approveStrategy(strategyId, DEFAULT_ACTOR, null);
    }

    /** Moves every order STAGED → APPROVED, or none of them. */
    public TransitionResult approveStrategy(String strategyId, String actor, String note) {
        return transitionStrategy(
                strategyId,
                APPROVABLE,
                OrderStatus.APPROVED,
                StrategyEventType.APPROVED,
                StagingErrorType.PARTIAL_APPROVAL_CONFLICT,
                actor,
                note);
    }

    public TransitionResult rejectStrategy(String strategyId, String reason) {
        return rejectStrategy(strategyId, reason, DEFAULT_ACTOR);
    }

    /** Moves every order from STAGED or APPROVED to REJECTED, or none of them. Terminal. */
    public TransitionResult rejectStrategy(String strategyId, String reason, String actor) {
        return transitionStrategy(
                strategyId,
                REJECTABLE,
                OrderStatus.REJECTED,
                StrategyEventType.REJECTED,
                StagingErrorType.STAGING_CONFLICT,
                actor,
                reason);
    }

    /** Moves every order from STAGED or APPROVED to CANCELLED, or none of them. Terminal. */
    public TransitionResult cancelStrategy(String strategyId, String reason, String actor) {
        return transitionStrategy(
                strategyId,
                CANCELLABLE,
                OrderStatus.CANCELLED,
                StrategyEventType.CANCELLED,
                StagingErrorType.STAGING_CONFLICT,
                actor,
                reason);
    }

    private TransitionResult transitionStrategy(
            String strategyId,
            Set<OrderStatus> allowedFrom,
            OrderStatus target,
            StrategyEventType eventType,
            StagingErrorType conflictType,
            String actor,
            String note) {
        StrategyRecord strategy;
        List<OrderRecord> orders;
        try {
            Optional<StrategyRecord> found = stagingLedger.findStrategy(strategyId);
            if (found.isEmpty()) {
                return TransitionResult.failure(StagingErrorType.NOT_FOUND, "Strategy not found: " + strategyId);
            }
            strategy = found.get();
            orders = loadOrders(strategy);
        } catch (LedgerUnavailableException e) {
            log.error("{} of strategy {} failed: ledger unavailable", target, strategyId, e);
            return TransitionResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, e.getMessage());
        }

        if (orders.size() != strategy.getOrderIds().size()) {
            return TransitionResult.failure(
                    StagingErrorType.NOT_FOUND, "Strategy " + strategyId + " references orders missing from the ledger");
        }

        List<String> illegal = orders.stream()
                .filter(order -> !allowedFrom.contains(order.getStatus()))
                .map(order -> "Order " + order.getId() + " is " + order.getStatus() + "; cannot move to " + target)
                .toList();
        if (!illegal.isEmpty()) {
            log.warn("Rejected {} of strategy {}: {}", target, strategyId, illegal);
            return TransitionResult.failure(StagingErrorType.INVALID_TRANSITION, illegal);
        }

        Instant now = clock.instant();
        List<OrderRecord> before = new ArrayList<>();
        List<OrderRecord> after = new ArrayList<>();
        for (OrderRecord order : orders) {
            StatusUpdate update = StatusUpdate.builder()
                    .newStatus(target)
                    .auditEntry(audit(now, order.getId(), target.name(), actor, note))
                    .build();

            LedgerUpdateResult result;
            try {
                result = stagingLedger.compareAndSetStatus(order.getId(), order.getStatus(), update);
            } catch (LedgerUnavailableException e) {
                log.error("{} of strategy {} failed at order {}: ledger unavailable", target, strategyId,
                        order.getId(), e);
                List<String> reasons = new ArrayList<>();
                reasons.add(e.getMessage());
                reasons.addAll(rollBack(before, after, actor, target + " aborted: ledger unavailable"));
                return TransitionResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, reasons);
            }

            if (!result.isApplied()) {
                String reason = "Order " + order.getId() + " changed concurrently: expected " + order.getStatus()
                        + ", found " + result.getObservedStatus() + " (" + result.getOutcome() + ")";
                log.warn("{} of strategy {} lost a race: {}", target, strategyId, reason);
                List<String> reasons = new ArrayList<>();
                reasons.add(reason);
                reasons.addAll(rollBack(before, after, actor, target + " aborted: " + reason));
                return TransitionResult.failure(conflictType, reasons);
            }
            before.add(order);
            after.add(result.getRecord());
        }

        log.info("Strategy {} moved to {} by {} ({} orders)", strategyId, target, actor, after.size());
        eventPublisherHelper.publishStrategyEvent(this, strategy, eventType, aggregateStatus(after), actor);
        if (target.isTerminal()) {
            archiveIfTerminal(strategy, actor);
        }
        return TransitionResult.applied(strategyId, after);
    }

    /**
     * Compensates the orders already moved by an aborted strategy-level transition, newest first,
     * by putting each back to the status it had before. Returns a reason for every order that
     * could not be put back.
     */
    private List<String> rollBack(List<OrderRecord> before, List<OrderRecord> after, String actor, String note) {
        List<String> failures = new ArrayList<>();
        Instant now = clock.instant();
        for (int i = after.size() - 1; i >= 0; i--) {
            OrderRecord original = before.get(i);
            OrderRecord moved = after.get(i);
            StatusUpdate compensation = StatusUpdate.builder()
                    .newStatus(original.getStatus())
                    .auditEntry(audit(now, moved.getId(), ROLLED_BACK, actor, note))
                    .build();
            try {
                LedgerUpdateResult result =
                        stagingLedger.compareAndSetStatus(moved.getId(), moved.getStatus(), compensation);
                if (result.isApplied()) {
                    log.info("Rolled back order {} to {}", moved.getId(), original.getStatus());
                } else {
                    log.error("Rollback of order {} refused: {} (found {})", moved.getId(), result.getOutcome(),
                            result.getObservedStatus());
                    failures.add("Rollback of order " + moved.getId() + " refused: " + result.getOutcome());
                }
            } catch (LedgerUnavailableException e) {
                log.error("Rollback of order {} failed: ledger unavailable", moved.getId(), e);
                failures.add("Rollback of order " + moved.getId() + " failed: " + e.getMessage());
            }
        }
        return failures;
    }

    // ==== Order-level transitions ====

    public TransitionResult markSubmitted(String orderId, String brokerRef) {
        return markSubmitted(orderId, brokerRef, DEFAULT_ACTOR);
    }

    /** Records that the broker accepted an approved order. APPROVED → SUBMITTED. */
    public TransitionResult markSubmitted(String orderId, String brokerRef, String actor) {
        if (brokerRef == null || brokerRef.isBlank()) {
            return TransitionResult.failure(StagingErrorType.INVALID_REQUEST, "A broker reference is required");
        }

        Optional<OrderRecord> found;
        try {
            found = stagingLedger.findOrder(orderId);
        } catch (LedgerUnavailableException e) {
            log.error("Submission of order {} failed: ledger unavailable", orderId, e);
            return TransitionResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, e.getMessage());
        }
        if (found.isEmpty()) {
            return TransitionResult.failure(StagingErrorType.NOT_FOUND, "Order not found: " + orderId);
        }

        OrderRecord order = found.get();
        if (order.getStatus() != OrderStatus.APPROVED) {
            return invalidTransition(order, OrderStatus.SUBMITTED);
        }

        StatusUpdate update = StatusUpdate.builder()
                .newStatus(OrderStatus.SUBMITTED)
                .auditEntry(audit(clock.instant(), orderId, OrderStatus.SUBMITTED.name(), actor,
                        "Broker reference " + brokerRef))
                .brokerRef(brokerRef)
                .expectedVersion(order.getVersion())
                .build();
        TransitionResult result = applyOrderUpdate(order, update);
        if (result.isSuccess()) {
            log.info("Order {} submitted as {}", orderId, brokerRef);
            eventPublisherHelper.publishOrderSubmitted(this, result.getOrders().get(0), order.getStatus());
        }
        return result;
    }

    public TransitionResult markFilled(String orderId, BigDecimal price, int quantity) {
        return markFilled(orderId, price, quantity, DEFAULT_ACTOR);
    }

    /**
     * Records a fill. The cumulative filled quantity decides the new status: below the leg
     * quantity the order is PARTIALLY_FILLED, at or above it FILLED. The stored fill price is the
     * quantity-weighted average across fills.
     */
    public TransitionResult markFilled(String orderId, BigDecimal price, int quantity, String actor) {
        if (price == null || price.signum() <= 0) {
            return TransitionResult.failure(StagingErrorType.INVALID_REQUEST, "Fill price must be positive");
        }
        if (quantity <= 0) {
            return TransitionResult.failure(StagingErrorType.INVALID_REQUEST, "Fill quantity must be positive");
        }

        Optional<OrderRecord> found;
        try {
            found = stagingLedger.findOrder(orderId);
        } catch (LedgerUnavailableException e) {
            log.error("Fill of order {} failed: ledger unavailable", orderId, e);
            return TransitionResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, e.getMessage());
        }
        if (found.isEmpty()) {
            return TransitionResult.failure(StagingErrorType.NOT_FOUND, "Order not found: " + orderId);
        }

        OrderRecord order = found.get();
        if (!FILLABLE.contains(order.getStatus())) {
            return invalidTransition(order, OrderStatus.FILLED);
        }

        int cumulative = order.getFilledQuantity() + quantity;
        BigDecimal averagePrice = order.getFilledPrice() == null || order.getFilledQuantity() == 0
                ? price
                : order.getFilledPrice()
                        .multiply(BigDecimal.valueOf(order.getFilledQuantity()))
                        .add(price.multiply(BigDecimal.valueOf(quantity)))
                        .divide(BigDecimal.valueOf(cumulative), MathContext.DECIMAL64);
        int legQuantity = order.getLeg().getQuantity();
        OrderStatus newStatus = cumulative >= legQuantity ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        if (cumulative > legQuantity) {
            log.warn("Order {} overfilled: {} filled against leg quantity {}", orderId, cumulative, legQuantity);
        }

        StatusUpdate update = StatusUpdate.builder()
                .newStatus(newStatus)
                .auditEntry(audit(clock.instant(), orderId, newStatus.name(), actor,
                        quantity + " @ " + price.toPlainString() + ", cumulative " + cumulative + "/" + legQuantity))
                .filledPrice(averagePrice)
                .filledQuantity(cumulative)
                .expectedVersion(order.getVersion())
                .build();
        TransitionResult result = applyOrderUpdate(order, update);
        if (!result.isSuccess()) {
            return result;
        }

        OrderRecord filled = result.getOrders().get(0);
        log.info("Order {} {}: {}/{} @ {}", orderId, newStatus, cumulative, legQuantity, averagePrice);
        eventPublisherHelper.publishOrderFill(this, filled, order.getStatus());
        if (newStatus == OrderStatus.FILLED) {
            try {
                stagingLedger.findStrategy(order.getStrategyId(), LedgerPartition.ACTIVE)
                        .ifPresent(strategy -> archiveIfTerminal(strategy, actor));
            } catch (LedgerUnavailableException e) {
                log.error("Fill of order {} recorded but archival check failed", orderId, e);
            }
        }
        return result;
    }

    private TransitionResult applyOrderUpdate(OrderRecord order, StatusUpdate update) {
        LedgerUpdateResult result;
        try {
            result = stagingLedger.compareAndSetStatus(order.getId(), order.getStatus(), update);
        } catch (LedgerUnavailableException e) {
            log.error("{} of order {} failed: ledger unavailable", update.getNewStatus(), order.getId(), e);
            return TransitionResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, e.getMessage());
        }

        if (result.isApplied()) {
            return TransitionResult.applied(result.getRecord());
        }
        String reason = "Order " + order.getId() + " changed concurrently: expected " + order.getStatus()
                + ", found " + result.getObservedStatus() + " (" + result.getOutcome() + ")";
        log.warn(reason);
        return switch (result.getOutcome()) {
            case NOT_FOUND -> TransitionResult.failure(StagingErrorType.NOT_FOUND, "Order not found: " + order.getId());
            case ARCHIVED -> TransitionResult.failure(StagingErrorType.INVALID_TRANSITION, reason);
            default -> TransitionResult.failure(StagingErrorType.STAGING_CONFLICT, reason);
        };
    }

    private static TransitionResult invalidTransition(OrderRecord order, OrderStatus target) {
        String reason = "Order " + order.getId() + " is " + order.getStatus() + "; cannot move to " + target;
        log.warn(reason);
        return TransitionResult.failure(StagingErrorType.INVALID_TRANSITION, reason);
    }

    // ==== Archival ====

    /**
     * Moves a strategy and its orders to history once every order is terminal. Safe to call
     * repeatedly; orders already archived are skipped. Failures are logged and left for the
     * next sweep, since the transition that triggered archival has already been applied.
     *
     * @return true if the strategy is in history after the call
     */
    boolean archiveIfTerminal(StrategyRecord strategy, String actor) {
        try {
            List<OrderRecord> orders = loadOrders(strategy);
            if (orders.isEmpty() || !orders.stream().allMatch(order -> order.getStatus().isTerminal())) {
                return false;
            }
            for (OrderRecord order : orders) {
                LedgerUpdateResult moved = stagingLedger.moveToHistory(order.getId());
                if (!moved.isApplied() && moved.getOutcome() != LedgerOutcome.ARCHIVED) {
                    log.warn("Order {} not archived: {}", order.getId(), moved.getOutcome());
                    return false;
                }
            }
            LedgerUpdateResult moved = stagingLedger.moveStrategyToHistory(strategy.getId());
            if (moved.isApplied()) {
                StrategyStatus status = aggregateStatus(orders);
                log.info("Strategy {} archived as {}", strategy.getId(), status);
                eventPublisherHelper.publishStrategyEvent(this, strategy, StrategyEventType.ARCHIVED, status, actor);
            }
            return true;
        } catch (LedgerUnavailableException e) {
            log.error("Archival of strategy {} failed: ledger unavailable", strategy.getId(), e);
            return false;
        }
    }

    /**
     * Archives every active strategy whose orders are all terminal. Picks up strategies whose
     * archival was interrupted by a backend failure.
     *
     * @return number of strategies archived
     */
    public int archiveTerminalStrategies(String actor) {
        int archived = 0;
        for (StrategyRecord strategy : stagingLedger.listStrategies(LedgerPartition.ACTIVE)) {
            if (archiveIfTerminal(strategy, actor)) {
                archived++;
            }
        }
        if (archived > 0) {
            log.info("Archive sweep moved {} strategies to history", archived);
        }
        return archived;
    }

    // ==== Queries ====

    /**
     * Read-only projection of a strategy, its orders and derived status, from either partition.
     * Ledger failures propagate as {@link LedgerUnavailableException}.
     */
    public Optional<StrategySnapshot> getStrategy(String strategyId) {
        Optional<StrategyRecord> active = stagingLedger.findStrategy(strategyId, LedgerPartition.ACTIVE);
        if (active.isPresent()) {
            return Optional.of(StrategySnapshot.of(active.get(), loadOrders(active.get()), false));
        }
        return stagingLedger
                .findStrategy(strategyId, LedgerPartition.HISTORY)
                .map(strategy -> StrategySnapshot.of(strategy, loadOrders(strategy), true));
    }

    public Optional<OrderRecord> getOrder(String orderId) {
        return stagingLedger.findOrder(orderId);
    }

    public List<StrategySnapshot> listStrategies(LedgerPartition partition) {
        List<StrategySnapshot> snapshots = new ArrayList<>();
        for (StrategyRecord strategy : stagingLedger.listStrategies(partition)) {
            boolean archived = partition == LedgerPartition.HISTORY
                    || (partition == LedgerPartition.ALL && stagingLedger.isArchived(strategy.getId()));
            snapshots.add(StrategySnapshot.of(strategy, loadOrders(strategy), archived));
        }
        return snapshots;
    }

    public List<OrderRecord> listOrders(LedgerFilter filter) {
        return stagingLedger.listOrders(filter);
    }

    /** Active orders ready for a broker collaborator to submit. */
    public List<OrderRecord> listApprovedOrders() {
        return stagingLedger.listOrders(LedgerFilter.byStatus(OrderStatus.APPROVED));
    }

    /** Audit entries of every order in the strategy, merged in time order. Empty if unknown. */
    public Optional<List<AuditEntry>> auditTrail(String strategyId) {
        return stagingLedger.findStrategy(strategyId).map(strategy -> loadOrders(strategy).stream()
                .flatMap(order -> order.getAuditTrail().stream())
                .sorted(Comparator.comparing(AuditEntry::getTimestamp))
                .toList());
    }

    public LedgerSummary summary() {
        List<OrderRecord> active = stagingLedger.listOrders(LedgerFilter.active());
        Map<OrderStatus, Long> byStatus = new EnumMap<>(OrderStatus.class);
        byStatus.putAll(active.stream().collect(Collectors.groupingBy(OrderRecord::getStatus, Collectors.counting())));
        return LedgerSummary.builder()
                .activeOrders(active.size())
                .activeStrategies(stagingLedger.listStrategies(LedgerPartition.ACTIVE).size())
                .activeOrdersByStatus(Collections.unmodifiableMap(byStatus))
                .historyOrders(stagingLedger.countOrders(LedgerPartition.HISTORY))
                .historyStrategies(stagingLedger.listStrategies(LedgerPartition.HISTORY).size())
                .build();
    }

    // ==== Daily loss ====

    /**
     * Records the realized P&L of a closed trade against a trade date (today, in the configured
     * trade-date zone, when {@code tradeDate} is null). Only losses are accumulated.
     *
     * @return the trade date's accumulated loss after recording
     */
    public BigDecimal recordTradeResult(LocalDate tradeDate, BigDecimal pnl) {
        LocalDate date = tradeDate != null ? tradeDate : tradeDate();
        BigDecimal total = dailyLossTracker.recordTradeResult(date, pnl);
        if (pnl != null && pnl.signum() < 0) {
            log.info("Loss of {} recorded for {}, daily total {}", pnl.abs(), date, total);
        }
        return total;
    }

    public BigDecimal dailyLoss(LocalDate tradeDate) {
        return dailyLossTracker.getDailyLoss(tradeDate != null ? tradeDate : tradeDate());
    }

    /** Today's trade date in the configured trade-date zone. */
    public LocalDate tradeDate() {
        return LocalDate.now(clock.withZone(riskLimits.getTradeDateZone()));
    }

    /** The larger of the tracked loss and the loss the portfolio service reports for the date. */
    private BigDecimal dailyLossSoFar(PortfolioSnapshot portfolio, LocalDate tradeDate) {
        BigDecimal tracked = dailyLossTracker.getDailyLoss(tradeDate);
        BigDecimal reported = portfolio != null ? portfolio.dailyRealizedLoss(tradeDate) : BigDecimal.ZERO;
        return tracked.max(reported);
    }

    // ==== Helpers ====

    /** Constituent orders in leg order. Orders missing from the ledger are left out. */
    private List<OrderRecord> loadOrders(StrategyRecord strategy) {
        List<OrderRecord> orders = new ArrayList<>();
        for (String orderId : strategy.getOrderIds()) {
            stagingLedger.findOrder(orderId).ifPresent(orders::add);
        }
        return orders;
    }

    private static StrategyStatus aggregateStatus(List<OrderRecord> orders) {
        return StrategyStatus.derive(orders.stream().map(OrderRecord::getStatus).toList());
    }

    private static AuditEntry audit(Instant timestamp, String orderId, String event, String actor, String note) {
        return AuditEntry.builder()
                .timestamp(timestamp)
                .orderId(orderId)
                .event(event)
                .actor(actor != null ? actor : DEFAULT_ACTOR)
                .note(note)
                .build();
    }
}

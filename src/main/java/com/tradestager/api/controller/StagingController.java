package com.tradestager.api.controller;

import com.tradestager.api.dto.request.FillOrderRequest;
import com.tradestager.api.dto.request.RejectStrategyRequest;
import com.tradestager.api.dto.request.StageStrategyRequest;
import com.tradestager.api.dto.request.StrategyActionRequest;
import com.tradestager.api.dto.request.SubmitOrderRequest;
import com.tradestager.api.dto.request.TradeResultRequest;
import com.tradestager.api.dto.response.DailyLossResponse;
import com.tradestager.api.dto.response.OrderResponse;
import com.tradestager.api.dto.response.StageStrategyResponse;
import com.tradestager.api.dto.response.StrategyResponse;
import com.tradestager.api.dto.response.TransitionResponse;
import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.AuditEntry;
import com.tradestager.domain.model.LedgerSummary;
import com.tradestager.domain.model.PortfolioSnapshot;
import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.exception.ResourceNotFoundException;
import com.tradestager.exception.StagingRejectedException;
import com.tradestager.mapper.StagingDtoMapper;
import com.tradestager.repository.LedgerFilter;
import com.tradestager.repository.LedgerPartition;
import com.tradestager.risk.RiskLimits;
import com.tradestager.staging.LifecycleController;
import com.tradestager.staging.StagingErrorType;
import com.tradestager.staging.StagingResult;
import com.tradestager.staging.TransitionResult;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the staging pipeline.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/staging/strategies -- validate, assess and stage a candidate</li>
 *   <li>GET /api/staging/strategies?partition= -- list strategies (ACTIVE, HISTORY or ALL)</li>
 *   <li>GET /api/staging/strategies/{id} -- strategy with orders and derived status</li>
 *   <li>GET /api/staging/strategies/{id}/audit -- merged audit trail</li>
 *   <li>POST /api/staging/strategies/{id}/approve -- approve all orders</li>
 *   <li>POST /api/staging/strategies/{id}/reject -- reject all orders (reason required)</li>
 *   <li>POST /api/staging/strategies/{id}/cancel -- cancel all orders</li>
 *   <li>GET /api/staging/orders?status=&amp;symbol=&amp;partition= -- list orders</li>
 *   <li>GET /api/staging/orders/approved -- orders ready for submission</li>
 *   <li>GET /api/staging/orders/{id} -- single order</li>
 *   <li>POST /api/staging/orders/{id}/submitted -- broker accepted the order</li>
 *   <li>POST /api/staging/orders/{id}/fills -- broker reported a fill</li>
 *   <li>GET /api/staging/summary -- ledger counts</li>
 *   <li>POST /api/staging/archive -- archive strategies whose orders are all terminal</li>
 *   <li>GET /api/staging/daily-loss?date= -- realized loss for a trade date</li>
 *   <li>POST /api/staging/daily-loss -- record a closed trade's realized P&amp;L</li>
 * </ul>
 *
 * <p>Typed failures from the lifecycle controller are turned into
 * {@link StagingRejectedException}s so they reach the client as error envelopes with every
 * reason listed.
 */
@RestController
@RequestMapping("/api/staging")
public class StagingController {

    private static final Logger log = LoggerFactory.getLogger(StagingController.class);

    private static final String API_ACTOR = "api";

    private final LifecycleController lifecycleController;
    private final RiskLimits riskLimits;
    private final StagingDtoMapper stagingDtoMapper = Mappers.getMapper(StagingDtoMapper.class);

    public StagingController(LifecycleController lifecycleController, RiskLimits riskLimits) {
        this.lifecycleController = lifecycleController;
        this.riskLimits = riskLimits;
    }

    // ==== Strategies ====

    @PostMapping("/strategies")
    @ResponseStatus(HttpStatus.CREATED)
    public StageStrategyResponse stageStrategy(@RequestBody @Valid StageStrategyRequest request) {
        StrategyCandidate candidate = stagingDtoMapper.toCandidate(request);
        PortfolioSnapshot portfolio = request.getPortfolio() != null
                ? stagingDtoMapper.toPortfolio(request.getPortfolio())
                : PortfolioSnapshot.empty();
        log.info("Staging request: {} {} ({} legs)", request.getArchetype(), request.getSymbol(),
                request.getLegs().size());

        StagingResult result = lifecycleController.stageStrategy(candidate, portfolio, actor(request.getActor()));
        if (!result.isSuccess()) {
            Map<String, Object> details = new LinkedHashMap<>();
            if (result.getAssessment() != null) {
                details.put("assessment", result.getAssessment());
            }
            throw rejected(result.getErrorType(), "Strategy was not staged", result.getReasons(), details);
        }
        return StageStrategyResponse.builder()
                .strategyId(result.getStrategyId())
                .assessment(result.getAssessment())
                .build();
    }

    @GetMapping("/strategies")
    public List<StrategyResponse> listStrategies(
            @RequestParam(defaultValue = "ACTIVE") LedgerPartition partition) {
        return stagingDtoMapper.toStrategyResponseList(lifecycleController.listStrategies(partition));
    }

    @GetMapping("/strategies/{id}")
    public StrategyResponse getStrategy(@PathVariable String id) {
        return lifecycleController
                .getStrategy(id)
                .map(stagingDtoMapper::toResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Strategy", id));
    }

    @GetMapping("/strategies/{id}/audit")
    public List<AuditEntry> getAuditTrail(@PathVariable String id) {
        return lifecycleController.auditTrail(id).orElseThrow(() -> new ResourceNotFoundException("Strategy", id));
    }

    @PostMapping("/strategies/{id}/approve")
    public TransitionResponse approveStrategy(
            @PathVariable String id, @RequestBody(required = false) StrategyActionRequest request) {
        String actor = actor(request != null ? request.getActor() : null);
        String note = request != null ? request.getNote() : null;
        return toResponse(lifecycleController.approveStrategy(id, actor, note), "Strategy was not approved");
    }

    @PostMapping("/strategies/{id}/reject")
    public TransitionResponse rejectStrategy(
            @PathVariable String id, @RequestBody @Valid RejectStrategyRequest request) {
        return toResponse(
                lifecycleController.rejectStrategy(id, request.getReason(), actor(request.getActor())),
                "Strategy was not rejected");
    }

    @PostMapping("/strategies/{id}/cancel")
    public TransitionResponse cancelStrategy(
            @PathVariable String id, @RequestBody(required = false) StrategyActionRequest request) {
        String actor = actor(request != null ? request.getActor() : null);
        String note = request != null ? request.getNote() : null;
        return toResponse(lifecycleController.cancelStrategy(id, note, actor), "Strategy was not cancelled");
    }

    // ==== Orders ====

    @GetMapping("/orders")
    public List<OrderResponse> listOrders(
            @RequestParam(required = false) Set<OrderStatus> status,
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) String strategyId,
            @RequestParam(defaultValue = "ACTIVE") LedgerPartition partition) {
        LedgerFilter filter = LedgerFilter.builder()
                .partition(partition)
                .statuses(status)
                .symbol(symbol)
                .strategyId(strategyId)
                .build();
        return stagingDtoMapper.toOrderResponseList(lifecycleController.listOrders(filter));
    }

    @GetMapping("/orders/approved")
    public List<OrderResponse> listApprovedOrders() {
        return stagingDtoMapper.toOrderResponseList(lifecycleController.listApprovedOrders());
    }

    @GetMapping("/orders/{id}")
    public OrderResponse getOrder(@PathVariable String id) {
        return lifecycleController
                .getOrder(id)
                .map(stagingDtoMapper::toResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Order", id));
    }

    @PostMapping("/orders/{id}/submitted")
    public TransitionResponse markSubmitted(@PathVariable String id, @RequestBody @Valid SubmitOrderRequest request) {
        return toResponse(
                lifecycleController.markSubmitted(id, request.getBrokerRef(), actor(request.getActor())),
                "Order was not marked submitted");
    }

    @PostMapping("/orders/{id}/fills")
    public TransitionResponse markFilled(@PathVariable String id, @RequestBody @Valid FillOrderRequest request) {
        return toResponse(
                lifecycleController.markFilled(
                        id, request.getPrice(), request.getQuantity(), actor(request.getActor())),
                "Fill was not recorded");
    }

    // ==== Ledger ====

    @GetMapping("/summary")
    public LedgerSummary summary() {
        return lifecycleController.summary();
    }

    @PostMapping("/archive")
    public Map<String, Object> archiveTerminalStrategies() {
        int archived = lifecycleController.archiveTerminalStrategies(API_ACTOR);
        return Map.of("archived", archived);
    }

    // ==== Daily loss ====

    @GetMapping("/daily-loss")
    public DailyLossResponse getDailyLoss(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate tradeDate = date != null ? date : lifecycleController.tradeDate();
        return DailyLossResponse.builder()
                .tradeDate(tradeDate)
                .loss(lifecycleController.dailyLoss(tradeDate))
                .limit(riskLimits.getMaxLossPerDay())
                .build();
    }

    @PostMapping("/daily-loss")
    public DailyLossResponse recordTradeResult(@RequestBody @Valid TradeResultRequest request) {
        LocalDate tradeDate = request.getTradeDate() != null ? request.getTradeDate() : lifecycleController.tradeDate();
        return DailyLossResponse.builder()
                .tradeDate(tradeDate)
                .loss(lifecycleController.recordTradeResult(tradeDate, request.getPnl()))
                .limit(riskLimits.getMaxLossPerDay())
                .build();
    }

    // ==== Helpers ====

    private TransitionResponse toResponse(TransitionResult result, String failureMessage) {
        if (!result.isSuccess()) {
            throw rejected(result.getErrorType(), failureMessage, result.getReasons(), null);
        }
        return TransitionResponse.builder()
                .strategyId(result.getStrategyId())
                .orderId(result.getOrderId())
                .orders(stagingDtoMapper.toOrderResponseList(result.getOrders()))
                .build();
    }

    private static StagingRejectedException rejected(
            StagingErrorType errorType, String message, List<String> reasons, Map<String, Object> details) {
        return new StagingRejectedException(
                errorType.getErrorCode(), message + ": " + errorType, reasons, errorType.isRetryable(), details);
    }

    private static String actor(String requested) {
        return requested != null && !requested.isBlank() ? requested : API_ACTOR;
    }
}

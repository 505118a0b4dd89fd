package com.tradestager.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradestager.api.controller.StagingController;
import com.tradestager.config.ApiResponseAdvice;
import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.exception.GlobalExceptionHandler;
import com.tradestager.risk.RiskAssessment;
import com.tradestager.risk.RiskLimits;
import com.tradestager.staging.LifecycleController;
import com.tradestager.staging.StagingErrorType;
import com.tradestager.staging.StagingResult;
import com.tradestager.staging.TransitionResult;
import com.tradestager.strategy.StructuralViolation;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the StagingController: success envelopes, typed failures mapped
 * to error envelopes with every reason listed, and request validation.
 */
@ExtendWith(MockitoExtension.class)
class StagingControllerTest {

    private static final String IRON_CONDOR_BODY = """
            {
              "symbol": "SPY",
              "archetype": "iron_condor",
              "declaredMaxRisk": 380,
              "legs": [
                {"side": "BUY", "optionType": "PUT", "strike": 430, "quantity": 1},
                {"side": "SELL", "optionType": "PUT", "strike": 435, "quantity": 1},
                {"side": "SELL", "optionType": "CALL", "strike": 465, "quantity": 1},
                {"side": "BUY", "optionType": "CALL", "strike": 470, "quantity": 1}
              ],
              "portfolio": {"cash": 100000}
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private LifecycleController lifecycleController;

    @BeforeEach
    void setUp() {
        RiskLimits riskLimits = RiskLimits.builder()
                .maxPositionSize(new BigDecimal("10000"))
                .maxPortfolioExposure(new BigDecimal("50000"))
                .maxLossPerTrade(new BigDecimal("1000"))
                .maxLossPerDay(new BigDecimal("5000"))
                .contractMultiplier(new BigDecimal("100"))
                .build();

        StagingController controller = new StagingController(lifecycleController, riskLimits);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    // ==============================
    // STAGING
    // ==============================

    @Nested
    @DisplayName("POST /api/staging/strategies")
    class StageStrategy {

        @Test
        @DisplayName("Staged candidate returns 201 with the strategy id in the success envelope")
        void staged_created() throws Exception {
            RiskAssessment assessment = RiskAssessment.builder()
                    .approved(true)
                    .riskScore(7.105)
                    .violations(List.of())
                    .warnings(List.of())
                    .build();
            when(lifecycleController.stageStrategy(any(), any(), eq("api")))
                    .thenReturn(StagingResult.staged("strategy-1", assessment));

            mockMvc.perform(post("/api/staging/strategies")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(IRON_CONDOR_BODY))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.strategyId").value("strategy-1"))
                    .andExpect(jsonPath("$.data.assessment.approved").value(true))
                    .andExpect(jsonPath("$.data.assessment.riskScore").value(7.105));
        }

        @Test
        @DisplayName("Structural rejection returns 422 listing every violated rule")
        void structuralError_unprocessable() throws Exception {
            when(lifecycleController.stageStrategy(any(), any(), anyString()))
                    .thenReturn(StagingResult.structuralError(List.of(
                            StructuralViolation.of(
                                    StructuralViolation.STRIKE_ORDER,
                                    "Iron condor put strikes must be below call strikes"),
                            StructuralViolation.of(
                                    StructuralViolation.SIDE_MIX, "Iron condor requires 2 BUY legs, found 1"))));

            mockMvc.perform(post("/api/staging/strategies")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(IRON_CONDOR_BODY))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("STRUCTURAL_ERROR"))
                    .andExpect(jsonPath("$.error.reasons.length()").value(2))
                    .andExpect(jsonPath("$.error.reasons[1]").value("Iron condor requires 2 BUY legs, found 1"));
        }

        @Test
        @DisplayName("Missing symbol fails request validation before reaching the lifecycle")
        void missingSymbol_badRequest() throws Exception {
            mockMvc.perform(post("/api/staging/strategies")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"archetype\": \"custom\", \"declaredMaxRisk\": 100, \"legs\": []}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.symbol").exists());

            verify(lifecycleController, never()).stageStrategy(any(), any(), anyString());
        }
    }

    // ==============================
    // TRANSITIONS
    // ==============================

    @Nested
    @DisplayName("Strategy and order transitions")
    class Transitions {

        @Test
        @DisplayName("Approval returns the updated orders")
        void approve_ok() throws Exception {
            when(lifecycleController.approveStrategy("strategy-1", "desk", null))
                    .thenReturn(TransitionResult.applied("strategy-1", List.of(order(OrderStatus.APPROVED))));

            mockMvc.perform(post("/api/staging/strategies/strategy-1/approve")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"actor\": \"desk\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.strategyId").value("strategy-1"))
                    .andExpect(jsonPath("$.data.orders[0].status").value("APPROVED"));
        }

        @Test
        @DisplayName("Partial approval conflict returns 409 flagged retryable")
        void partialApprovalConflict_retryable() throws Exception {
            when(lifecycleController.approveStrategy("strategy-1", "api", null))
                    .thenReturn(TransitionResult.failure(
                            StagingErrorType.PARTIAL_APPROVAL_CONFLICT, "Order order-3 changed concurrently"));

            mockMvc.perform(post("/api/staging/strategies/strategy-1/approve"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                    .andExpect(jsonPath("$.error.retryable").value(true))
                    .andExpect(jsonPath("$.error.reasons[0]").value("Order order-3 changed concurrently"));
        }

        @Test
        @DisplayName("Rejection without a reason is refused")
        void rejectWithoutReason_badRequest() throws Exception {
            mockMvc.perform(post("/api/staging/strategies/strategy-1/reject")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest());

            verify(lifecycleController, never()).rejectStrategy(anyString(), any(), anyString());
        }

        @Test
        @DisplayName("Backend outage returns 503 flagged retryable")
        void backendUnavailable_serviceUnavailable() throws Exception {
            when(lifecycleController.markSubmitted("order-1", "BRK-1", "api"))
                    .thenReturn(TransitionResult.failure(StagingErrorType.BACKEND_UNAVAILABLE, "Redis unreachable"));

            mockMvc.perform(post("/api/staging/orders/order-1/submitted")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"brokerRef\": \"BRK-1\"}"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error.retryable").value(true));
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Unknown strategy returns 404")
        void unknownStrategy_notFound() throws Exception {
            when(lifecycleController.getStrategy("missing")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/staging/strategies/missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Daily loss defaults to the current trade date and reports the configured limit")
        void dailyLoss_defaultsToTradeDate() throws Exception {
            LocalDate tradeDate = LocalDate.of(2026, 3, 16);
            when(lifecycleController.tradeDate()).thenReturn(tradeDate);
            when(lifecycleController.dailyLoss(tradeDate)).thenReturn(new BigDecimal("1250.00"));

            mockMvc.perform(get("/api/staging/daily-loss"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.loss").value(1250.00))
                    .andExpect(jsonPath("$.data.limit").value(5000));
        }

        @Test
        @DisplayName("Archive sweep reports the number of strategies moved")
        void archive_reportsCount() throws Exception {
            when(lifecycleController.archiveTerminalStrategies("api")).thenReturn(3);

            mockMvc.perform(post("/api/staging/archive"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.archived").value(3));
        }
    }

    private static OrderRecord order(OrderStatus status) {
        Instant now = Instant.parse("2026-03-16T14:30:00Z");
        return OrderRecord.builder()
                .id("order-1")
                .strategyId("strategy-1")
                .symbol("SPY")
                .legIndex(0)
                .leg(Leg.builder()
                        .side(OrderSide.BUY)
                        .optionType(OptionType.PUT)
                        .strike(new BigDecimal("430"))
                        .quantity(1)
                        .build())
                .status(status)
                .createdAt(now)
                .updatedAt(now)
                .auditTrail(List.of())
                .build();
    }
}

package com.tradestager.risk;

import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.PortfolioPosition;
import com.tradestager.domain.model.PortfolioSnapshot;
import com.tradestager.domain.model.StrategyCandidate;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the risk assessment for a strategy candidate against a portfolio snapshot.
 *
 * <p>Core checks (all evaluated, not short-circuited, never switched off):
 * <ol>
 *   <li>Declared risk against max position size</li>
 *   <li>Declared risk against max loss per trade</li>
 *   <li>Existing holdings plus declared risk against max portfolio exposure</li>
 *   <li>Today's realized loss plus declared risk against max loss per day</li>
 *   <li>Covered calls only: shares held against shares the sold calls require</li>
 * </ol>
 *
 * <p>Supplemental checks, each off while its limit is unset and all off when
 * {@link RiskLimits#isSupplementalChecksEnabled()} is false:
 * <ul>
 *   <li>Credit spreads only: strike distance against max spread width</li>
 *   <li>Declared risk as a percentage of account equity</li>
 *   <li>Open position count, in total and in the candidate's symbol</li>
 *   <li>Blackout symbols</li>
 *   <li>Warnings: cash below declared risk, symbol allocation above its share of equity</li>
 * </ul>
 *
 * <p>Risk score is a weighted sum of three utilisation terms, each capped at its weight
 * (40 position, 30 portfolio, 30 daily loss), with the total capped at 100. A non-positive
 * limit contributes nothing to the score but fails its check.
 *
 * <p>Deterministic and side-effect free; inputs are never mutated, so re-assessing against a
 * stale snapshot is always safe.
 */
@Service
public class RiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessor.class);

    static final double POSITION_WEIGHT = 40.0;
    static final double PORTFOLIO_WEIGHT = 30.0;
    static final double DAILY_LOSS_WEIGHT = 30.0;
    static final double MAX_SCORE = 100.0;

    public static final String HIGH_RISK_WARNING = "High risk score - proceed with caution";
    public static final String MODERATE_RISK_WARNING = "Moderate risk score";
    public static final String SUPPLEMENTAL_CHECKS_DISABLED_WARNING = "Supplemental risk checks are disabled";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskLimits riskLimits;

    public RiskAssessor(RiskLimits riskLimits) {
        this.riskLimits = riskLimits;
    }

    /**
     * Assesses a candidate.
     *
     * @param candidate      the proposal (structure is assumed already validated)
     * @param portfolio      point-in-time holdings; null is treated as an empty portfolio
     * @param dailyLossSoFar realized loss for the current trade date; null or negative counts as zero
     * @return the assessment; {@code approved} is true iff no violation fired
     */
    public RiskAssessment assess(StrategyCandidate candidate, PortfolioSnapshot portfolio, BigDecimal dailyLossSoFar) {
        PortfolioSnapshot snapshot = portfolio != null ? portfolio : PortfolioSnapshot.empty();
        BigDecimal dailyLoss = dailyLossSoFar != null && dailyLossSoFar.signum() > 0 ? dailyLossSoFar : BigDecimal.ZERO;

        List<RiskViolation> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        BigDecimal declaredMaxRisk = candidate.getDeclaredMaxRisk();
        if (declaredMaxRisk == null || declaredMaxRisk.signum() < 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_RISK_UNDECLARED,
                    "Declared max risk must be a non-negative amount, found " + declaredMaxRisk));
        }

        BigDecimal positionExposure = declaredMaxRisk != null ? declaredMaxRisk.max(BigDecimal.ZERO) : BigDecimal.ZERO;
        BigDecimal multiplier = positive(riskLimits.getContractMultiplier())
                ? riskLimits.getContractMultiplier()
                : BigDecimal.ZERO;
        BigDecimal portfolioExposure = holdingsExposure(snapshot, multiplier).add(positionExposure);
        BigDecimal potentialDailyLoss = dailyLoss.add(positionExposure);

        checkLimit(
                violations,
                RiskViolation.POSITION_SIZE_EXCEEDED,
                positionExposure,
                riskLimits.getMaxPositionSize(),
                "Position size",
                "position size limit");
        checkLimit(
                violations,
                RiskViolation.PER_TRADE_LOSS_EXCEEDED,
                positionExposure,
                riskLimits.getMaxLossPerTrade(),
                "Max loss",
                "per-trade limit");
        checkLimit(
                violations,
                RiskViolation.PORTFOLIO_EXPOSURE_EXCEEDED,
                portfolioExposure,
                riskLimits.getMaxPortfolioExposure(),
                "Portfolio exposure",
                "portfolio exposure limit");
        checkLimit(
                violations,
                RiskViolation.DAILY_LOSS_LIMIT_EXCEEDED,
                potentialDailyLoss,
                riskLimits.getMaxLossPerDay(),
                "Potential daily loss",
                "daily loss limit");

        if (!positive(riskLimits.getContractMultiplier())) {
            violations.add(RiskViolation.of(
                    RiskViolation.INVALID_CONTRACT_MULTIPLIER,
                    "Contract multiplier must be positive, configured " + riskLimits.getContractMultiplier()));
        }

        if (candidate.getArchetype() == StrategyArchetype.COVERED_CALL) {
            checkCoveringShares(candidate, snapshot, multiplier, violations);
        }

        double riskScore = riskScore(positionExposure, portfolioExposure, potentialDailyLoss);

        if (riskLimits.isSupplementalChecksEnabled()) {
            checkSupplemental(candidate, snapshot, positionExposure, multiplier, violations, warnings);
        } else {
            warnings.add(SUPPLEMENTAL_CHECKS_DISABLED_WARNING);
        }

        if (riskScore > riskLimits.getHighRiskScoreThreshold()) {
            warnings.add(HIGH_RISK_WARNING);
        } else if (riskScore > riskLimits.getModerateRiskScoreThreshold()) {
            warnings.add(MODERATE_RISK_WARNING);
        }

        RiskAssessment assessment = RiskAssessment.builder()
                .approved(violations.isEmpty())
                .riskScore(riskScore)
                .violations(List.copyOf(violations))
                .warnings(List.copyOf(warnings))
                .maxLoss(positionExposure)
                .positionExposure(positionExposure)
                .portfolioExposure(portfolioExposure)
                .build();

        log.debug(
                "Assessed {} {}: approved={}, score={}, violations={}",
                candidate.getArchetype(),
                candidate.getSymbol(),
                assessment.isApproved(),
                riskScore,
                violations);
        return assessment;
    }

    /**
     * Weighted 40/30/30 score. Each term is clamped to [0, weight] before summing and the sum
     * is clamped to [0, 100]. A non-positive limit contributes zero rather than dividing by it.
     */
    double riskScore(BigDecimal positionExposure, BigDecimal portfolioExposure, BigDecimal potentialDailyLoss) {
        double score = term(POSITION_WEIGHT, positionExposure, riskLimits.getMaxPositionSize())
                + term(PORTFOLIO_WEIGHT, portfolioExposure, riskLimits.getMaxPortfolioExposure())
                + term(DAILY_LOSS_WEIGHT, potentialDailyLoss, riskLimits.getMaxLossPerDay());
        return Math.max(0.0, Math.min(MAX_SCORE, score));
    }

    private static double term(double weight, BigDecimal amount, BigDecimal limit) {
        if (!positive(limit) || amount == null) {
            return 0.0;
        }
        double ratio = amount.divide(limit, MathContext.DECIMAL64).doubleValue();
        double weighted = weight * ratio;
        if (Double.isNaN(weighted)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(weight, weighted));
    }

    private static void checkLimit(
            List<RiskViolation> violations,
            String code,
            BigDecimal amount,
            BigDecimal limit,
            String amountLabel,
            String limitLabel) {
        if (!positive(limit)) {
            violations.add(RiskViolation.of(
                    code, "The " + limitLabel + " is not positive (" + limit + "); check fails until it is configured"));
            return;
        }
        if (amount.compareTo(limit) > 0) {
            violations.add(RiskViolation.of(
                    code,
                    amountLabel + " " + amount.toPlainString() + " exceeds " + limitLabel + " "
                            + limit.toPlainString()));
        }
    }

    /** Sum of |quantity| x averageCost x multiplier across existing holdings. */
    private static BigDecimal holdingsExposure(PortfolioSnapshot snapshot, BigDecimal multiplier) {
        if (snapshot.getPositions() == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal exposure = BigDecimal.ZERO;
        for (PortfolioPosition position : snapshot.getPositions()) {
            if (position == null || position.getAverageCost() == null) {
                continue;
            }
            exposure = exposure.add(positionExposure(position, multiplier));
        }
        return exposure;
    }

    private static BigDecimal positionExposure(PortfolioPosition position, BigDecimal multiplier) {
        return BigDecimal.valueOf(Math.abs((long) position.getQuantity()))
                .multiply(position.getAverageCost().abs())
                .multiply(multiplier);
    }

    private void checkCoveringShares(
            StrategyCandidate candidate,
            PortfolioSnapshot snapshot,
            BigDecimal multiplier,
            List<RiskViolation> violations) {
        long contracts = legs(candidate).stream()
                .filter(leg -> leg != null && leg.getSide() == OrderSide.SELL)
                .mapToLong(Leg::getQuantity)
                .sum();
        BigDecimal required = BigDecimal.valueOf(contracts).multiply(multiplier);
        long owned = snapshot.getPositions() == null
                ? 0
                : snapshot.getPositions().stream()
                        .filter(p -> p != null && p.getSymbol() != null && p.getSymbol().equalsIgnoreCase(candidate.getSymbol()))
                        .mapToLong(PortfolioPosition::getQuantity)
                        .sum();
        if (BigDecimal.valueOf(owned).compareTo(required) < 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.INSUFFICIENT_SHARES,
                    "Covered call requires " + required.toPlainString() + " shares of " + candidate.getSymbol()
                            + ", portfolio holds " + owned));
        }
    }

    private void checkSupplemental(
            StrategyCandidate candidate,
            PortfolioSnapshot snapshot,
            BigDecimal positionExposure,
            BigDecimal multiplier,
            List<RiskViolation> violations,
            List<String> warnings) {
        if (candidate.getArchetype() == StrategyArchetype.PUT_CREDIT_SPREAD
                || candidate.getArchetype() == StrategyArchetype.CALL_CREDIT_SPREAD) {
            checkSpreadWidth(candidate, violations);
        }
        checkCapitalAtRisk(snapshot, positionExposure, violations);
        checkPositionCounts(candidate, snapshot, violations);
        checkBlackout(candidate, violations);

        if (snapshot.getCash() != null && snapshot.getCash().compareTo(positionExposure) < 0) {
            warnings.add("Available cash " + snapshot.getCash().toPlainString() + " is below required margin "
                    + positionExposure.toPlainString());
        }
        symbolAllocationWarning(candidate, snapshot, positionExposure, multiplier).ifPresent(warnings::add);
    }

    private void checkSpreadWidth(StrategyCandidate candidate, List<RiskViolation> violations) {
        BigDecimal maxSpreadWidth = riskLimits.getMaxSpreadWidth();
        List<BigDecimal> strikes = legs(candidate).stream()
                .filter(Objects::nonNull)
                .map(Leg::getStrike)
                .filter(Objects::nonNull)
                .toList();
        if (maxSpreadWidth == null || strikes.size() < 2) {
            return;
        }
        BigDecimal lowest = strikes.stream().min(Comparator.naturalOrder()).orElseThrow();
        BigDecimal highest = strikes.stream().max(Comparator.naturalOrder()).orElseThrow();
        BigDecimal width = highest.subtract(lowest);
        if (width.compareTo(maxSpreadWidth) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.SPREAD_TOO_WIDE,
                    "Spread width " + width.toPlainString() + " exceeds max " + maxSpreadWidth.toPlainString()));
        }
    }

    /** Declared risk as a share of equity. Unknown or non-positive equity fails the check. */
    private void checkCapitalAtRisk(
            PortfolioSnapshot snapshot, BigDecimal positionExposure, List<RiskViolation> violations) {
        BigDecimal maxPct = riskLimits.getMaxCapitalAtRiskPerTradePct();
        if (maxPct == null) {
            return;
        }
        if (!positive(snapshot.getEquity())) {
            violations.add(RiskViolation.of(
                    RiskViolation.CAPITAL_AT_RISK_EXCEEDED,
                    "Account equity " + snapshot.getEquity() + " is not positive; capital at risk cannot be checked"));
            return;
        }
        BigDecimal pct = percentOf(positionExposure, snapshot.getEquity());
        if (pct.compareTo(maxPct) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.CAPITAL_AT_RISK_EXCEEDED,
                    "Trade risk " + pct.setScale(1, RoundingMode.HALF_UP).toPlainString()
                            + "% of equity exceeds per-trade limit " + maxPct.toPlainString() + "%"));
        }
    }

    private void checkPositionCounts(
            StrategyCandidate candidate, PortfolioSnapshot snapshot, List<RiskViolation> violations) {
        Integer maxTotal = riskLimits.getMaxTotalPositions();
        if (maxTotal != null) {
            long open = openPositions(snapshot).count();
            if (open >= maxTotal) {
                violations.add(RiskViolation.of(
                        RiskViolation.POSITION_COUNT_EXCEEDED,
                        "Total positions " + open + " at limit of " + maxTotal));
            }
        }
        Integer maxPerSymbol = riskLimits.getMaxPositionsPerSymbol();
        if (maxPerSymbol != null) {
            long open = openPositions(snapshot)
                    .filter(p -> sameSymbol(p, candidate.getSymbol()))
                    .count();
            if (open >= maxPerSymbol) {
                violations.add(RiskViolation.of(
                        RiskViolation.SYMBOL_POSITION_COUNT_EXCEEDED,
                        "Positions in " + candidate.getSymbol() + " " + open + " at limit of " + maxPerSymbol));
            }
        }
    }

    private void checkBlackout(StrategyCandidate candidate, List<RiskViolation> violations) {
        Set<String> blackout = riskLimits.getBlackoutSymbols();
        if (blackout == null || blackout.isEmpty() || candidate.getSymbol() == null) {
            return;
        }
        if (blackout.contains(candidate.getSymbol().toUpperCase(Locale.ROOT))) {
            violations.add(RiskViolation.of(
                    RiskViolation.SYMBOL_BLACKOUT, "Symbol " + candidate.getSymbol() + " is on the blackout list"));
        }
    }

    /** Existing exposure in the candidate's symbol plus the new risk, as a share of equity. */
    private Optional<String> symbolAllocationWarning(
            StrategyCandidate candidate, PortfolioSnapshot snapshot, BigDecimal positionExposure, BigDecimal multiplier) {
        BigDecimal maxPct = riskLimits.getMaxSymbolAllocationPct();
        if (maxPct == null || !positive(snapshot.getEquity())) {
            return Optional.empty();
        }
        BigDecimal symbolExposure = positionExposure;
        if (snapshot.getPositions() != null) {
            for (PortfolioPosition position : snapshot.getPositions()) {
                if (position != null && position.getAverageCost() != null && sameSymbol(position, candidate.getSymbol())) {
                    symbolExposure = symbolExposure.add(positionExposure(position, multiplier));
                }
            }
        }
        BigDecimal pct = percentOf(symbolExposure, snapshot.getEquity());
        if (pct.compareTo(maxPct) <= 0) {
            return Optional.empty();
        }
        return Optional.of("Symbol " + candidate.getSymbol() + " allocation "
                + pct.setScale(1, RoundingMode.HALF_UP).toPlainString() + "% of equity exceeds "
                + maxPct.toPlainString() + "%");
    }

    private static Stream<PortfolioPosition> openPositions(PortfolioSnapshot snapshot) {
        if (snapshot.getPositions() == null) {
            return Stream.empty();
        }
        return snapshot.getPositions().stream().filter(p -> p != null && p.getQuantity() != 0);
    }

    private static boolean sameSymbol(PortfolioPosition position, String symbol) {
        return position.getSymbol() != null && position.getSymbol().equalsIgnoreCase(symbol);
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal equity) {
        return amount.multiply(HUNDRED).divide(equity, MathContext.DECIMAL64);
    }

    private static List<Leg> legs(StrategyCandidate candidate) {
        return candidate.getLegs() != null ? candidate.getLegs() : List.of();
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}

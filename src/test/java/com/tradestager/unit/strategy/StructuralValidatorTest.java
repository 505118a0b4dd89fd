package com.tradestager.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.strategy.StructuralValidator;
import com.tradestager.strategy.StructuralViolation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StructuralValidator covering every archetype's leg composition rules,
 * leg field checks and unsupported archetypes.
 */
class StructuralValidatorTest {

    private StructuralValidator structuralValidator;

    @BeforeEach
    void setUp() {
        structuralValidator = new StructuralValidator();
    }

    // ==============================
    // IRON CONDOR
    // ==============================

    @Nested
    @DisplayName("Iron Condor")
    class IronCondor {

        @Test
        @DisplayName("Well-formed condor has no violations")
        void validCondor_noViolations() {
            assertThat(structuralValidator.validate(ironCondor())).isEmpty();
        }

        @Test
        @DisplayName("Leg order does not affect the result")
        void shuffledLegs_sameResult() {
            List<Leg> legs = new ArrayList<>(ironCondor().getLegs());
            Collections.reverse(legs);

            assertThat(structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs))).isEmpty();
        }

        @Test
        @DisplayName("Three legs reports the leg count only")
        void threeLegs_legCountViolation() {
            List<Leg> legs = ironCondor().getLegs().subList(0, 3);

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs));

            assertThat(violations).extracting(StructuralViolation::getMessage)
                    .containsExactly("iron_condor: expected 4 legs, found 3");
        }

        @Test
        @DisplayName("Three puts and one call violates the instrument mix")
        void wrongInstrumentMix_violation() {
            List<Leg> legs = List.of(
                    leg(OrderSide.SELL, OptionType.PUT, "440"),
                    leg(OrderSide.BUY, OptionType.PUT, "435"),
                    leg(OrderSide.SELL, OptionType.PUT, "430"),
                    leg(OrderSide.BUY, OptionType.CALL, "465"));

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs));

            assertThat(violations).extracting(StructuralViolation::getRule)
                    .containsExactly(StructuralViolation.INSTRUMENT_MIX);
        }

        @Test
        @DisplayName("Two sold calls violates the call side mix")
        void twoSoldCalls_sideMixViolation() {
            List<Leg> legs = List.of(
                    leg(OrderSide.SELL, OptionType.PUT, "440"),
                    leg(OrderSide.BUY, OptionType.PUT, "435"),
                    leg(OrderSide.SELL, OptionType.CALL, "460"),
                    leg(OrderSide.SELL, OptionType.CALL, "465"));

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs));

            assertThat(violations).hasSize(1);
            assertThat(violations.get(0).getRule()).isEqualTo(StructuralViolation.SIDE_MIX);
            assertThat(violations.get(0).getMessage()).startsWith("iron_condor: call legs");
        }

        @Test
        @DisplayName("Wrong call/put mix with four buys also reports the side mix")
        void wrongInstrumentMixAllBuys_bothReported() {
            List<Leg> legs = List.of(
                    leg(OrderSide.BUY, OptionType.PUT, "440"),
                    leg(OrderSide.BUY, OptionType.PUT, "435"),
                    leg(OrderSide.BUY, OptionType.PUT, "430"),
                    leg(OrderSide.BUY, OptionType.CALL, "465"));

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs));

            assertThat(violations).extracting(StructuralViolation::getMessage)
                    .containsExactly(
                            "iron_condor: expected 2 calls and 2 puts, found 1 calls and 3 puts",
                            "iron_condor: expected 2 buys and 2 sells, found 4 buys and 0 sells");
        }

        @Test
        @DisplayName("Overlapping put and call strikes violates strike order")
        void overlappingStrikes_strikeOrderViolation() {
            List<Leg> legs = List.of(
                    leg(OrderSide.SELL, OptionType.PUT, "455"),
                    leg(OrderSide.BUY, OptionType.PUT, "435"),
                    leg(OrderSide.SELL, OptionType.CALL, "450"),
                    leg(OrderSide.BUY, OptionType.CALL, "465"));

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs));

            assertThat(violations).extracting(StructuralViolation::getRule)
                    .containsExactly(StructuralViolation.STRIKE_ORDER);
        }
    }

    // ==============================
    // CREDIT SPREADS
    // ==============================

    @Nested
    @DisplayName("Credit Spreads")
    class CreditSpreads {

        @Test
        @DisplayName("Put credit spread sells the higher strike")
        void putCreditSpread_valid() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.PUT_CREDIT_SPREAD,
                    List.of(leg(OrderSide.SELL, OptionType.PUT, "440"), leg(OrderSide.BUY, OptionType.PUT, "435")));

            assertThat(structuralValidator.validate(candidate)).isEmpty();
        }

        @Test
        @DisplayName("Put spread selling the lower strike is a debit spread")
        void putDebitSpread_strikeOrderViolation() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.PUT_CREDIT_SPREAD,
                    List.of(leg(OrderSide.SELL, OptionType.PUT, "435"), leg(OrderSide.BUY, OptionType.PUT, "440")));

            List<StructuralViolation> violations = structuralValidator.validate(candidate);

            assertThat(violations).extracting(StructuralViolation::getMessage)
                    .containsExactly("put_credit_spread: sold strike 435 must be above bought strike 440");
        }

        @Test
        @DisplayName("Call credit spread sells the lower strike")
        void callCreditSpread_valid() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.CALL_CREDIT_SPREAD,
                    List.of(leg(OrderSide.BUY, OptionType.CALL, "465"), leg(OrderSide.SELL, OptionType.CALL, "460")));

            assertThat(structuralValidator.validate(candidate)).isEmpty();
        }

        @Test
        @DisplayName("Single-leg put credit spread reports the leg count")
        void singleLeg_legCountViolation() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.PUT_CREDIT_SPREAD, List.of(leg(OrderSide.SELL, OptionType.PUT, "440")));

            assertThat(structuralValidator.validate(candidate))
                    .extracting(StructuralViolation::getMessage)
                    .containsExactly("put_credit_spread: expected 2 legs, found 1");
        }

        @Test
        @DisplayName("Mixed instruments and two buys both fire")
        void mixedInstrumentsAndSides_bothReported() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.CALL_CREDIT_SPREAD,
                    List.of(leg(OrderSide.BUY, OptionType.PUT, "440"), leg(OrderSide.BUY, OptionType.CALL, "460")));

            assertThat(structuralValidator.validate(candidate))
                    .extracting(StructuralViolation::getRule)
                    .containsExactly(StructuralViolation.INSTRUMENT_MIX, StructuralViolation.SIDE_MIX);
        }
    }

    // ==============================
    // COVERED CALL, STRADDLE, CUSTOM
    // ==============================

    @Nested
    @DisplayName("Single-Shape Archetypes")
    class SingleShapeArchetypes {

        @Test
        @DisplayName("Covered call is one sold call")
        void coveredCall_valid() {
            StrategyCandidate candidate =
                    candidate(StrategyArchetype.COVERED_CALL, List.of(leg(OrderSide.SELL, OptionType.CALL, "460")));

            assertThat(structuralValidator.validate(candidate)).isEmpty();
        }

        @Test
        @DisplayName("Covered call with a bought put reports instrument and side")
        void coveredCall_boughtPut_twoViolations() {
            StrategyCandidate candidate =
                    candidate(StrategyArchetype.COVERED_CALL, List.of(leg(OrderSide.BUY, OptionType.PUT, "440")));

            assertThat(structuralValidator.validate(candidate))
                    .extracting(StructuralViolation::getRule)
                    .containsExactly(StructuralViolation.INSTRUMENT_MIX, StructuralViolation.SIDE_MIX);
        }

        @Test
        @DisplayName("Long straddle buys a call and a put at one strike")
        void longStraddle_valid() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.LONG_STRADDLE,
                    List.of(leg(OrderSide.BUY, OptionType.CALL, "450"), leg(OrderSide.BUY, OptionType.PUT, "450")));

            assertThat(structuralValidator.validate(candidate)).isEmpty();
        }

        @Test
        @DisplayName("Long straddle with different strikes violates strike match")
        void longStraddle_strikeMismatch() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.LONG_STRADDLE,
                    List.of(leg(OrderSide.BUY, OptionType.CALL, "455"), leg(OrderSide.BUY, OptionType.PUT, "450")));

            assertThat(structuralValidator.validate(candidate))
                    .extracting(StructuralViolation::getMessage)
                    .containsExactly("long_straddle: call and put strikes must match, found call 455 and put 450");
        }

        @Test
        @DisplayName("Custom accepts any composition")
        void custom_anyLegs_valid() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.CUSTOM,
                    List.of(
                            leg(OrderSide.SELL, OptionType.CALL, "455"),
                            leg(OrderSide.SELL, OptionType.CALL, "455"),
                            leg(OrderSide.BUY, OptionType.PUT, "400")));

            assertThat(structuralValidator.validate(candidate)).isEmpty();
        }

        @Test
        @DisplayName("Custom with no legs is rejected")
        void custom_noLegs_violation() {
            assertThat(structuralValidator.validate(candidate(StrategyArchetype.CUSTOM, List.of())))
                    .extracting(StructuralViolation::getRule)
                    .containsExactly(StructuralViolation.LEG_COUNT);
        }
    }

    // ==============================
    // GENERAL
    // ==============================

    @Nested
    @DisplayName("General Rules")
    class GeneralRules {

        @Test
        @DisplayName("Unrecognized archetype yields a single unsupported error")
        void nullArchetype_unsupported() {
            StrategyCandidate candidate = candidate(null, ironCondor().getLegs());

            assertThat(structuralValidator.validate(candidate))
                    .extracting(StructuralViolation::getMessage)
                    .containsExactly("unsupported archetype");
        }

        @Test
        @DisplayName("Non-positive strike and quantity are reported per leg")
        void invalidLegFields_reported() {
            Leg badLeg = Leg.builder()
                    .side(OrderSide.SELL)
                    .optionType(OptionType.CALL)
                    .strike(BigDecimal.ZERO)
                    .quantity(0)
                    .build();

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.COVERED_CALL, List.of(badLeg)));

            assertThat(violations).hasSize(2);
            assertThat(violations).allMatch(v -> v.getRule().equals(StructuralViolation.LEG_FIELDS));
            assertThat(violations.get(0).getMessage()).isEqualTo("covered_call: leg 0 strike must be positive");
        }

        @Test
        @DisplayName("Invalid leg fields do not hide the leg count rule")
        void invalidLegFieldsAndLegCount_bothReported() {
            Leg zeroQuantity = Leg.builder()
                    .side(OrderSide.SELL)
                    .optionType(OptionType.PUT)
                    .strike(new BigDecimal("440"))
                    .quantity(0)
                    .build();

            List<StructuralViolation> violations = structuralValidator.validate(
                    candidate(StrategyArchetype.PUT_CREDIT_SPREAD, List.of(zeroQuantity)));

            assertThat(violations).extracting(StructuralViolation::getRule)
                    .containsExactly(StructuralViolation.LEG_FIELDS, StructuralViolation.LEG_COUNT);
            assertThat(violations).extracting(StructuralViolation::getMessage)
                    .containsExactly(
                            "put_credit_spread: leg 0 quantity must be positive",
                            "put_credit_spread: expected 2 legs, found 1");
        }

        @Test
        @DisplayName("Missing strike still reports the leg count without comparing strikes")
        void missingStrike_legCountStillReported() {
            Leg noStrike = Leg.builder()
                    .side(OrderSide.BUY)
                    .optionType(OptionType.CALL)
                    .quantity(1)
                    .build();
            List<Leg> legs = List.of(
                    leg(OrderSide.SELL, OptionType.PUT, "440"),
                    leg(OrderSide.BUY, OptionType.PUT, "435"),
                    noStrike);

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.IRON_CONDOR, legs));

            assertThat(violations).extracting(StructuralViolation::getMessage)
                    .containsExactly(
                            "iron_condor: leg 2 strike must be positive",
                            "iron_condor: expected 4 legs, found 3");
        }

        @Test
        @DisplayName("Leg field faults and archetype faults are reported together")
        void negativeStrikeInStraddle_mergedWithShapeRules() {
            List<Leg> legs = List.of(
                    leg(OrderSide.BUY, OptionType.CALL, "-5"),
                    leg(OrderSide.SELL, OptionType.PUT, "450"));

            List<StructuralViolation> violations =
                    structuralValidator.validate(candidate(StrategyArchetype.LONG_STRADDLE, legs));

            assertThat(violations).extracting(StructuralViolation::getRule)
                    .containsExactly(
                            StructuralViolation.LEG_FIELDS,
                            StructuralViolation.SIDE_MIX,
                            StructuralViolation.STRIKE_MATCH);
        }

        @Test
        @DisplayName("Validating twice returns identical results")
        void validate_isIdempotent() {
            StrategyCandidate candidate = candidate(
                    StrategyArchetype.IRON_CONDOR, ironCondor().getLegs().subList(0, 2));

            assertThat(structuralValidator.validate(candidate)).isEqualTo(structuralValidator.validate(candidate));
        }
    }

    // ==============================
    // HELPERS
    // ==============================

    static StrategyCandidate ironCondor() {
        return candidate(
                StrategyArchetype.IRON_CONDOR,
                List.of(
                        leg(OrderSide.SELL, OptionType.PUT, "440"),
                        leg(OrderSide.BUY, OptionType.PUT, "435"),
                        leg(OrderSide.SELL, OptionType.CALL, "460"),
                        leg(OrderSide.BUY, OptionType.CALL, "465")));
    }

    static StrategyCandidate candidate(StrategyArchetype archetype, List<Leg> legs) {
        return StrategyCandidate.builder()
                .id("cand-1")
                .symbol("SPY")
                .archetype(archetype)
                .legs(legs)
                .declaredMaxRisk(new BigDecimal("290"))
                .build();
    }

    static Leg leg(OrderSide side, OptionType optionType, String strike) {
        return Leg.builder()
                .side(side)
                .optionType(optionType)
                .strike(new BigDecimal(strike))
                .quantity(1)
                .build();
    }
}

package io.shopfront.fulfillment.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.exception.OrderValidationException;

public class DeliveryChargeCalculatorTest {

    private static final List<DeliveryChargeRule> ITEM_RULES = List.of(
            rule("1000", null, "0"),
            rule("0", "499.99", "50"),
            rule("500", "999.99", "20"));

    @Nested
    @DisplayName("calculate")
    class CalculateTests {

        @Test
        @DisplayName("An empty cart pays the lowest tier and is told about the next one")
        void zeroSubtotal_firstTier() {
            DeliveryChargeQuote quote = DeliveryChargeCalculator.calculate(ITEM_RULES, BigDecimal.ZERO);

            assertThat(quote.getCharge()).isEqualByComparingTo("50");
            assertThat(quote.getNextTierInfo())
                    .isEqualTo("Add items worth Rs 500.00 more for a delivery charge of Rs 20.00.");
            assertThat(quote.getNextTier().getThreshold()).isEqualByComparingTo("500");
        }

        @Test
        void middleTier_pointsAtFreeDelivery() {
            DeliveryChargeQuote quote = DeliveryChargeCalculator.calculate(ITEM_RULES, new BigDecimal("750"));

            assertThat(quote.getCharge()).isEqualByComparingTo("20");
            assertThat(quote.getNextTierInfo()).isEqualTo("Add items worth Rs 250.00 more for FREE delivery.");
            assertThat(quote.getNextTier().isFree()).isTrue();
            assertThat(quote.getNextTier().getAmountNeeded()).isEqualByComparingTo("250");
        }

        @Test
        void inclusiveLowerBound() {
            DeliveryChargeQuote quote = DeliveryChargeCalculator.calculate(ITEM_RULES, new BigDecimal("500"));

            assertThat(quote.getCharge()).isEqualByComparingTo("20");
        }

        @Test
        void openEndedTopTier_hasNoUpsell() {
            DeliveryChargeQuote quote = DeliveryChargeCalculator.calculate(ITEM_RULES, new BigDecimal("1500"));

            assertThat(quote.getCharge()).isEqualByComparingTo("0");
            assertThat(quote.getNextTierInfo()).isNull();
            assertThat(quote.getNextTier()).isNull();
        }

        @Test
        @DisplayName("Without rules delivery is free")
        void noRules_isFree() {
            DeliveryChargeQuote quote = DeliveryChargeCalculator.calculate(Collections.emptyList(),
                    new BigDecimal("300"));

            assertThat(quote.getCharge()).isEqualByComparingTo("0");
            assertThat(quote.getNextTierInfo()).isNull();
        }

        @Test
        @DisplayName("A subtotal that falls in a gap between rules is free")
        void gap_isFree() {
            List<DeliveryChargeRule> gapped = List.of(rule("0", "99", "40"), rule("200", null, "10"));

            assertThat(DeliveryChargeCalculator.calculate(gapped, new BigDecimal("150")).getCharge())
                    .isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Overlapping rules resolve to the one with the lowest lower bound")
        void overlap_lowestLowerBoundWins() {
            List<DeliveryChargeRule> overlapping = List.of(rule("100", "300", "15"), rule("0", "200", "30"));

            assertThat(DeliveryChargeCalculator.calculate(overlapping, new BigDecimal("150")).getCharge())
                    .isEqualByComparingTo("30");
        }

        @Test
        void negativeSubtotal_isRejected() {
            assertThrows(OrderValidationException.class,
                    () -> DeliveryChargeCalculator.calculate(ITEM_RULES, new BigDecimal("-1")));
        }

        @Test
        @DisplayName("A rule without a charge is rejected as invalid")
        void ruleWithoutCharge_isRejected() {
            List<DeliveryChargeRule> rules = List.of(
                    rule("0", "500", "50"),
                    DeliveryChargeRule.builder().from(new BigDecimal("500")).build());

            OrderValidationException ex = assertThrows(OrderValidationException.class,
                    () -> DeliveryChargeCalculator.calculate(rules, new BigDecimal("100")));

            assertThat(ex.getMessage()).contains("charge");
        }

        @Test
        @DisplayName("A rule without a lower bound is rejected as invalid")
        void ruleWithoutLowerBound_isRejected() {
            List<DeliveryChargeRule> rules = List.of(
                    DeliveryChargeRule.builder().to(new BigDecimal("500")).charge(new BigDecimal("50")).build());

            OrderValidationException ex = assertThrows(OrderValidationException.class,
                    () -> DeliveryChargeCalculator.calculate(rules, new BigDecimal("100")));

            assertThat(ex.getMessage()).contains("lower bound");
        }

        @Test
        void invertedRule_isRejected() {
            assertThrows(OrderValidationException.class, () -> DeliveryChargeCalculator
                    .calculate(List.of(rule("500", "100", "20")), new BigDecimal("100")));
        }
    }

    @Nested
    @DisplayName("splitEvenly")
    class SplitEvenlyTests {

        @Test
        @DisplayName("The remainder lands on the last share")
        void remainderOnLastShare() {
            List<BigDecimal> shares = DeliveryChargeCalculator.splitEvenly(new BigDecimal("100"), 3);

            assertThat(shares).containsExactly(new BigDecimal("33.33"), new BigDecimal("33.33"),
                    new BigDecimal("33.34"));
            assertThat(shares.stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo("100");
        }

        @Test
        void singleShare_isTheWholeFee() {
            assertThat(DeliveryChargeCalculator.splitEvenly(new BigDecimal("20"), 1))
                    .containsExactly(new BigDecimal("20.00"));
        }

        @Test
        void zeroFee_givesZeroShares() {
            assertThat(DeliveryChargeCalculator.splitEvenly(BigDecimal.ZERO, 2))
                    .allSatisfy(share -> assertThat(share).isEqualByComparingTo("0"));
        }

        @Test
        void noParts_givesNoShares() {
            assertThat(DeliveryChargeCalculator.splitEvenly(new BigDecimal("20"), 0)).isEmpty();
        }
    }

    private static DeliveryChargeRule rule(String from, String to, String charge) {
        return DeliveryChargeRule.builder()
                .from(new BigDecimal(from))
                .to(to == null ? null : new BigDecimal(to))
                .charge(new BigDecimal(charge))
                .build();
    }
}

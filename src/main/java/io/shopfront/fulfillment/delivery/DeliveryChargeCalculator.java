package io.shopfront.fulfillment.delivery;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.exception.OrderValidationException;

/**
 * Tiered delivery-charge calculation. Stateless and free of side effects.
 * <p>
 * Rules are sorted by their lower bound and the first one whose inclusive
 * range contains the subtotal wins, so overlapping or gapped rule sets still
 * give a deterministic answer. A subtotal no rule covers is delivered for free.
 * </p>
 */
public final class DeliveryChargeCalculator {
    private static final Comparator<DeliveryChargeRule> BY_LOWER_BOUND = Comparator
            .comparing(DeliveryChargeRule::getFrom);

    private DeliveryChargeCalculator() {
    }

    /**
     * Computes the charge for {@code subtotal} and, when a cheaper tier lies
     * above it, how much more must be spent to reach that tier.
     *
     * @param rules    The rule set, in any order. May be empty.
     * @param subtotal The subtotal to charge, not negative.
     * @return The quote.
     * @throws OrderValidationException if the subtotal is missing or negative, or
     *                                  a rule is malformed.
     */
    public static DeliveryChargeQuote calculate(Collection<DeliveryChargeRule> rules, BigDecimal subtotal) {
        if (subtotal == null || subtotal.signum() < 0) {
            throw new OrderValidationException("Subtotal must be zero or positive, got " + subtotal);
        }
        if (rules == null || rules.isEmpty()) {
            return DeliveryChargeQuote.free();
        }
        rules.forEach(DeliveryChargeCalculator::validateRule);

        List<DeliveryChargeRule> sorted = new ArrayList<>(rules);
        sorted.sort(BY_LOWER_BOUND);

        DeliveryChargeRule selected = sorted.stream()
                .filter(rule -> covers(rule, subtotal))
                .findFirst()
                .orElse(null);

        if (selected == null) {
            return DeliveryChargeQuote.free();
        }

        DeliveryChargeRule cheaper = sorted.stream()
                .filter(rule -> rule.getFrom().compareTo(subtotal) > 0)
                .filter(rule -> rule.getCharge().compareTo(selected.getCharge()) < 0)
                .findFirst()
                .orElse(null);

        if (cheaper == null) {
            return DeliveryChargeQuote.builder().charge(selected.getCharge()).build();
        }

        DeliveryChargeQuote.NextTier nextTier = DeliveryChargeQuote.NextTier.builder()
                .threshold(cheaper.getFrom())
                .amountNeeded(cheaper.getFrom().subtract(subtotal))
                .charge(cheaper.getCharge())
                .build();

        return DeliveryChargeQuote.builder()
                .charge(selected.getCharge())
                .nextTier(nextTier)
                .nextTierInfo(describe(nextTier))
                .build();
    }

    /**
     * Checks a single rule: lower bound and charge present and not negative, and
     * an upper bound, if any, not below the lower bound.
     *
     * @throws OrderValidationException if the rule is malformed.
     */
    public static void validateRule(DeliveryChargeRule rule) {
        if (rule == null) {
            throw new OrderValidationException("Delivery rule cannot be null");
        }
        if (rule.getFrom() == null || rule.getFrom().signum() < 0) {
            throw new OrderValidationException("Delivery rule lower bound must be zero or positive: " + rule);
        }
        if (rule.getCharge() == null || rule.getCharge().signum() < 0) {
            throw new OrderValidationException("Delivery rule charge must be zero or positive: " + rule);
        }
        if (rule.getTo() != null && rule.getTo().compareTo(rule.getFrom()) < 0) {
            throw new OrderValidationException("Delivery rule upper bound is below its lower bound: " + rule);
        }
    }

    /**
     * Splits a fee into {@code parts} two-decimal shares. Any rounding
     * remainder goes to the last share, so the shares always add up to the fee.
     *
     * @param fee   The fee to split.
     * @param parts Number of shares, at least 1.
     * @return The shares, in order.
     */
    public static List<BigDecimal> splitEvenly(BigDecimal fee, int parts) {
        if (parts < 1) {
            return Collections.emptyList();
        }

        BigDecimal total = Objects.requireNonNullElse(fee, BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
        BigDecimal share = total.divide(BigDecimal.valueOf(parts), 2, RoundingMode.DOWN);

        List<BigDecimal> shares = new ArrayList<>(Collections.nCopies(parts - 1, share));
        shares.add(total.subtract(share.multiply(BigDecimal.valueOf(parts - 1))));
        return shares;
    }

    private static boolean covers(DeliveryChargeRule rule, BigDecimal subtotal) {
        return rule.getFrom().compareTo(subtotal) <= 0
                && (rule.getTo() == null || subtotal.compareTo(rule.getTo()) <= 0);
    }

    private static String describe(DeliveryChargeQuote.NextTier nextTier) {
        String amount = money(nextTier.getAmountNeeded());
        if (nextTier.isFree()) {
            return String.format("Add items worth Rs %s more for FREE delivery.", amount);
        }
        return String.format("Add items worth Rs %s more for a delivery charge of Rs %s.",
                amount, money(nextTier.getCharge()));
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}

package io.shopfront.fulfillment.delivery;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a delivery-charge calculation.
 */
@Value
@Builder
public class DeliveryChargeQuote {
    BigDecimal charge;

    /**
     * Human-readable upsell message, {@code null} when no cheaper tier is
     * reachable.
     */
    String nextTierInfo;

    /**
     * The cheaper tier the message refers to, {@code null} together with
     * {@link #nextTierInfo}.
     */
    NextTier nextTier;

    @Value
    @Builder
    public static class NextTier {
        BigDecimal threshold;
        BigDecimal amountNeeded;
        BigDecimal charge;

        public boolean isFree() {
            return charge.signum() == 0;
        }
    }

    public static DeliveryChargeQuote free() {
        return DeliveryChargeQuote.builder().charge(BigDecimal.ZERO).build();
    }
}

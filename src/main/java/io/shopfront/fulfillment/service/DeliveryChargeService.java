package io.shopfront.fulfillment.service;

import java.math.BigDecimal;
import java.util.List;

import io.shopfront.fulfillment.delivery.DeliveryChargeQuote;
import io.shopfront.fulfillment.delivery.OrderSettings;
import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.domain.DeliveryTierSet;

public interface DeliveryChargeService {
    /**
     * Computes a delivery charge against an explicit rule set. Pure: nothing is
     * read or written.
     *
     * @param rules    The rule set, in any order.
     * @param subtotal The subtotal, zero or positive.
     * @return The charge and the next-tier upsell, if any.
     */
    DeliveryChargeQuote computeDeliveryCharge(List<DeliveryChargeRule> rules, BigDecimal subtotal);

    /**
     * Computes a delivery charge against the stored rule set of the given kind.
     *
     * @param tierSet  Which rule set to apply.
     * @param subtotal The subtotal, zero or positive.
     * @return The charge and the next-tier upsell, if any.
     */
    DeliveryChargeQuote quote(DeliveryTierSet tierSet, BigDecimal subtotal);

    /**
     * @return Both stored rule sets.
     */
    OrderSettings getOrderSettings();

    /**
     * Replaces both stored rule sets.
     *
     * @param settings The new rule sets.
     * @return The stored rule sets.
     * @throws io.shopfront.fulfillment.exception.OrderValidationException if a
     *                                                                    rule is
     *                                                                    malformed.
     */
    OrderSettings updateOrderSettings(OrderSettings settings);
}

package io.shopfront.fulfillment.delivery;

import java.util.List;

import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.domain.DeliveryTierSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The two delivery-charge rule sets applied at checkout.
 */
@Value
@Builder
public class OrderSettings {
    @Singular
    List<DeliveryChargeRule> itemDeliveryRules;

    @Singular
    List<DeliveryChargeRule> printJobDeliveryRules;

    public List<DeliveryChargeRule> rulesFor(DeliveryTierSet tierSet) {
        return tierSet == DeliveryTierSet.PRINT_JOB ? printJobDeliveryRules : itemDeliveryRules;
    }
}

package io.shopfront.fulfillment.aggregation;

import java.math.BigDecimal;
import java.util.List;

import io.shopfront.fulfillment.domain.Order;
import lombok.Builder;
import lombok.Value;

/**
 * The records of one order group fulfilled by the same seller.
 */
@Value
@Builder
public class SellerOrders {
    String sellerId;
    List<Order> orders;
    BigDecimal subtotal;
    BigDecimal deliveryCharge;
    DashboardBucket bucket;
}

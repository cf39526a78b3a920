package io.shopfront.fulfillment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A status change computed by {@link OrderStatusTransitions} and about to be
 * applied to an order.
 */
@Value
@Builder
public class OrderTransition {
    OrderAction action;
    OrderStatus from;
    OrderStatus to;
    String reason;
    ReturnType returnType;
}

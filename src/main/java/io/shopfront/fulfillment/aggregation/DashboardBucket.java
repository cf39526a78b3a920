package io.shopfront.fulfillment.aggregation;

import java.util.Collection;

import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderStatus;

/**
 * Dashboard tab an order or an order group is listed under.
 */
public enum DashboardBucket {
    /**
     * Waiting for a seller decision: a new order or a return request.
     */
    NEEDS_ACTION,
    IN_PROGRESS,
    COMPLETED;

    public static DashboardBucket of(OrderStatus status) {
        if (status == OrderStatus.PENDING_CONFIRMATION || status == OrderStatus.RETURN_REQUESTED) {
            return NEEDS_ACTION;
        }
        return status.isTerminal() ? COMPLETED : IN_PROGRESS;
    }

    /**
     * A group needs action if any member does, and is completed only once every
     * member is.
     */
    public static DashboardBucket ofGroup(Collection<Order> orders) {
        boolean allCompleted = true;
        for (Order order : orders) {
            DashboardBucket bucket = of(order.getStatus());
            if (bucket == NEEDS_ACTION) {
                return NEEDS_ACTION;
            }
            allCompleted &= bucket == COMPLETED;
        }
        return allCompleted && !orders.isEmpty() ? COMPLETED : IN_PROGRESS;
    }
}

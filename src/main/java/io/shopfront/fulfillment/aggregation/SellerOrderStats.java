package io.shopfront.fulfillment.aggregation;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Per-status order counts shown at the top of the seller dashboard. The counts
 * are independent tallies and may overlap: a confirmed replacement is both
 * active and part of a return, a completed replacement is both completed and
 * part of a return.
 */
@Value
@Builder
public class SellerOrderStats {
    private static final Set<OrderStatus> ACTIVE = EnumSet.of(OrderStatus.PENDING_CONFIRMATION,
            OrderStatus.PROCESSING, OrderStatus.PACKED, OrderStatus.SHIPPED, OrderStatus.OUT_FOR_DELIVERY,
            OrderStatus.PENDING_DELIVERY_CONFIRMATION, OrderStatus.REPLACEMENT_CONFIRMED);

    private static final Set<OrderStatus> RETURNS = EnumSet.of(OrderStatus.RETURN_REQUESTED,
            OrderStatus.RETURN_APPROVED, OrderStatus.OUT_FOR_PICKUP, OrderStatus.PICKED_UP,
            OrderStatus.PENDING_RETURN_CONFIRMATION, OrderStatus.RETURN_COMPLETED, OrderStatus.RETURN_REJECTED,
            OrderStatus.REPLACEMENT_CONFIRMED, OrderStatus.PENDING_REPLACEMENT_CONFIRMATION,
            OrderStatus.REPLACEMENT_COMPLETED);

    private static final Set<OrderStatus> COMPLETED = EnumSet.of(OrderStatus.DELIVERED,
            OrderStatus.REPLACEMENT_COMPLETED);

    private static final Set<OrderStatus> SELLER_REJECTED = EnumSet.of(OrderStatus.REJECTED,
            OrderStatus.RETURN_REJECTED);

    String sellerId;
    long total;
    long active;
    long returns;
    long completed;
    long sellerRejected;
    long userCancelled;

    /**
     * Counts the seller's orders.
     *
     * @param sellerId The seller.
     * @param orders   The seller's orders.
     * @return The counts; all zero for a seller without orders.
     */
    public static SellerOrderStats of(String sellerId, Collection<Order> orders) {
        return SellerOrderStats.builder()
                .sellerId(sellerId)
                .total(orders.size())
                .active(count(orders, ACTIVE))
                .returns(count(orders, RETURNS))
                .completed(count(orders, COMPLETED))
                .sellerRejected(count(orders, SELLER_REJECTED))
                .userCancelled(count(orders, EnumSet.of(OrderStatus.CANCELLED)))
                .build();
    }

    private static long count(Collection<Order> orders, Set<OrderStatus> statuses) {
        return orders.stream().filter(order -> statuses.contains(order.getStatus())).count();
    }
}

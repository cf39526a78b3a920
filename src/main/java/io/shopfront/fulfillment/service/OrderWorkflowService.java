package io.shopfront.fulfillment.service;

import java.time.LocalDate;
import java.util.UUID;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderStatus;

/**
 * Forward-path status changes of a single order.
 * <p>
 * Every operation re-reads the order and refuses to act if it is no longer in
 * the status the caller acted on
 * ({@link io.shopfront.fulfillment.exception.StatusConflictException}).
 * </p>
 */
public interface OrderWorkflowService {
    /**
     * Seller accepts a new order: Pending Confirmation to Processing.
     */
    Order confirmOrder(UUID orderId, ActorRole role);

    /**
     * Seller turns down a new order: Pending Confirmation to Rejected.
     *
     * @param reason Shown to the customer, must not be blank.
     */
    Order rejectOrder(UUID orderId, String reason, ActorRole role);

    /**
     * Customer withdraws an order the seller has not accepted yet: Pending
     * Confirmation to Cancelled.
     *
     * @param reason Must not be blank.
     */
    Order cancelOrder(UUID orderId, String reason, ActorRole role);

    /**
     * Moves the order one step along its fulfillment or pickup path.
     *
     * @param believedStatus The status the caller saw, required.
     */
    Order advanceStatus(UUID orderId, OrderStatus believedStatus, ActorRole role);

    /**
     * Customer confirms a hand-over: delivery, return pickup or replacement.
     *
     * @param believedStatus The pending-confirmation status the caller saw,
     *                       required.
     */
    Order confirmReceipt(UUID orderId, OrderStatus believedStatus, ActorRole role);

    /**
     * Records the date the seller expects to deliver. The first date recorded is
     * kept; later calls leave it unchanged.
     *
     * @throws io.shopfront.fulfillment.exception.InvalidStatusTransitionException if the
     *         order is already in a terminal status.
     */
    Order scheduleExpectedDelivery(UUID orderId, LocalDate expectedDelivery, ActorRole role);
}

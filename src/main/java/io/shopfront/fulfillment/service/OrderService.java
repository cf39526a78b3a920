package io.shopfront.fulfillment.service;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.dto.CheckoutRequestDTO;

public interface OrderService {
    /**
     * Creates one order per checkout line, all sharing a new group ID, and
     * splits the group's delivery fees over them.
     *
     * @param request     The checkout.
     * @param checkoutKey Idempotency key of the checkout; a key seen before
     *                    returns the group it created. May be {@code null}.
     * @return The group ID.
     */
    UUID createOrderGroup(CheckoutRequestDTO request, String checkoutKey);

    Order findByOrderId(UUID orderId);

    /**
     * @return the group's orders, oldest first.
     * @throws io.shopfront.fulfillment.exception.OrderGroupNotFoundException if
     *         the group has no orders.
     */
    List<Order> getOrdersByGroup(UUID groupId);

    List<Order> getOrdersBySeller(String sellerId);

    List<Order> getOrdersByUser(String userId);

    Page<Order> findAll(Pageable pageable);

    /**
     * Marks every order of the group as having its delivery-fee share paid.
     * Orders already paid are left untouched, so the call can be repeated after
     * a partial failure.
     *
     * @throws io.shopfront.fulfillment.exception.PartialGroupFailureException if
     *         some orders could not be updated.
     */
    GroupSettlementResult markGroupDeliveryFeePaid(UUID groupId, ActorRole role);
}

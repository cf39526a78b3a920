package io.shopfront.fulfillment.service;

import java.util.UUID;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.ReturnType;

/**
 * Return and replacement requests on delivered orders.
 */
public interface ReturnWorkflowService {
    /**
     * Customer asks to return a delivered item for a refund or a replacement.
     * Print jobs cannot be returned.
     *
     * @param type   Refund or replacement, required.
     * @param reason Must not be blank.
     */
    Order requestReturn(UUID orderId, ReturnType type, String reason, ActorRole role);

    /**
     * Approves a refund request. The item then goes through pickup.
     */
    Order approveReturn(UUID orderId, ActorRole role);

    /**
     * Approves a replacement request. The item re-enters the fulfillment path at
     * Processing.
     */
    Order approveReplacement(UUID orderId, ActorRole role);

    /**
     * Turns down a return or replacement request.
     *
     * @param reason Shown to the customer, must not be blank.
     */
    Order rejectReturn(UUID orderId, String reason, ActorRole role);
}

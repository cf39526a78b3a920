package io.shopfront.fulfillment.exception;

import java.util.UUID;

import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.OrderStatus;
import lombok.Getter;

/**
 * Thrown when the requested action has no legal successor from the order's
 * current status.
 */
@Getter
public class InvalidStatusTransitionException extends RuntimeException {
    private final UUID orderId;
    private final OrderAction action;
    private final OrderStatus currentStatus;

    public InvalidStatusTransitionException(UUID orderId, OrderAction action, OrderStatus currentStatus) {
        super("Cannot " + action + " order " + orderId + " while it is \"" + currentStatus + "\"");
        this.orderId = orderId;
        this.action = action;
        this.currentStatus = currentStatus;
    }

    public InvalidStatusTransitionException(UUID orderId, OrderAction action, OrderStatus currentStatus,
            String detail) {
        super("Cannot " + action + " order " + orderId + " while it is \"" + currentStatus + "\": " + detail);
        this.orderId = orderId;
        this.action = action;
        this.currentStatus = currentStatus;
    }

    public InvalidStatusTransitionException(UUID orderId, OrderStatus currentStatus, String detail) {
        super("Cannot change order " + orderId + " while it is \"" + currentStatus + "\": " + detail);
        this.orderId = orderId;
        this.action = null;
        this.currentStatus = currentStatus;
    }
}

package io.shopfront.fulfillment.exception;

import java.util.UUID;

import io.shopfront.fulfillment.domain.OrderStatus;
import lombok.Getter;

/**
 * Thrown when the status a caller believed an order to be in no longer matches
 * the stored status. Carries the actual status so the caller can re-fetch and
 * show the operator what changed.
 */
@Getter
public class StatusConflictException extends RuntimeException {
    private final UUID orderId;
    private final OrderStatus believedStatus;
    private final OrderStatus currentStatus;

    /**
     * {@code true} when the stored status is exactly the one the caller's
     * transition would have produced, i.e. an earlier attempt already landed.
     */
    private final boolean alreadyApplied;

    public StatusConflictException(UUID orderId, OrderStatus believedStatus, OrderStatus currentStatus,
            boolean alreadyApplied) {
        super("Order " + orderId + " status was already changed to \"" + currentStatus + "\" (expected \""
                + believedStatus + "\")");
        this.orderId = orderId;
        this.believedStatus = believedStatus;
        this.currentStatus = currentStatus;
        this.alreadyApplied = alreadyApplied;
    }
}

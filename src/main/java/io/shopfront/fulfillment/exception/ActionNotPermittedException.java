package io.shopfront.fulfillment.exception;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.OrderStatus;
import lombok.Getter;

/**
 * Thrown when the acting role may not perform the requested operation.
 */
@Getter
public class ActionNotPermittedException extends RuntimeException {
    private final String operation;
    private final ActorRole role;

    public ActionNotPermittedException(String operation, ActorRole role) {
        super("Role " + role + " is not allowed to perform " + operation);
        this.operation = operation;
        this.role = role;
    }

    public ActionNotPermittedException(OrderAction action, ActorRole role) {
        this(action.name(), role);
    }

    public ActionNotPermittedException(OrderAction action, ActorRole role, OrderStatus status) {
        super("Role " + role + " is not allowed to perform " + action + " on an order in status \"" + status
                + "\"");
        this.operation = action.name();
        this.role = role;
    }
}

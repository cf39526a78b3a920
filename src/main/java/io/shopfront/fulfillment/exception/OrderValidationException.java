package io.shopfront.fulfillment.exception;

/**
 * Thrown when a request is rejected before any read or write because its input
 * is invalid, e.g. a blank rejection reason or a malformed delivery-charge
 * rule.
 */
public class OrderValidationException extends RuntimeException {
    public OrderValidationException(String message) {
        super(message);
    }
}

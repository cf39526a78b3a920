package io.shopfront.fulfillment.exception;

import java.util.UUID;

public class OrderGroupNotFoundException extends RuntimeException {
    public OrderGroupNotFoundException(UUID groupId) {
        super("No orders found for group ID: " + groupId);
    }
}

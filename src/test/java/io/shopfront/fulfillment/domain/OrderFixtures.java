package io.shopfront.fulfillment.domain;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Puts test orders into a lifecycle state as if they had been loaded from the
 * database. Production code can only reach these states through
 * {@link Order#applyTransition}.
 */
public final class OrderFixtures {

    private OrderFixtures() {
    }

    public static Order inStatus(Order order, OrderStatus status) {
        ReflectionTestUtils.setField(order, "status", status);
        return order;
    }
}

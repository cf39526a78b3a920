package io.shopfront.fulfillment.event;

import org.springframework.context.ApplicationEvent;

import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderTransition;
import lombok.Getter;

/**
 * Internal event published when an order's status has changed.
 */
@Getter
public class OrderStatusChangedEvent extends ApplicationEvent {
    private final Order order;
    private final OrderTransition transition;

    public OrderStatusChangedEvent(Object source, Order order, OrderTransition transition) {
        super(source);
        this.order = order;
        this.transition = transition;
    }
}

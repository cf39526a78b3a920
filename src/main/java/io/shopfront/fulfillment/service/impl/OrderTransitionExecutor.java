package io.shopfront.fulfillment.service.impl;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.domain.OrderStatusTransitions;
import io.shopfront.fulfillment.domain.ReturnType;
import io.shopfront.fulfillment.event.OrderStatusChangedEvent;
import io.shopfront.fulfillment.exception.ActionNotPermittedException;
import io.shopfront.fulfillment.exception.OrderValidationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a single status transition for the workflow services: request
 * validation, the guarded write, the status-change event and the transition
 * metric. Callers provide the transaction.
 */
@Component
@Slf4j
class OrderTransitionExecutor {
    private final OrderStatusGuard statusGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private final Map<OrderAction, Counter> transitionCounters = new EnumMap<>(OrderAction.class);

    OrderTransitionExecutor(OrderStatusGuard statusGuard, ApplicationEventPublisher eventPublisher,
            MeterRegistry meterRegistry) {
        this.statusGuard = statusGuard;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Validates the request without touching the store, then performs it through
     * the {@link OrderStatusGuard}.
     *
     * @param believedStatus The status the caller observed; {@code null} for
     *                       actions that can only start from one status.
     * @throws ActionNotPermittedException if the role may never perform the
     *                                     action.
     * @throws OrderValidationException    if a required reason is blank or the
     *                                     believed status is missing.
     */
    Order execute(UUID orderId, OrderStatus believedStatus, OrderAction action, ActorRole role, String reason,
            ReturnType returnType) {
        if (!action.isAllowedFor(role)) {
            log.warn("Role {} may not {} orders, rejected request for order {}", role, action, orderId);
            throw new ActionNotPermittedException(action, role);
        }

        if (action.isReasonRequired() && (reason == null || reason.isBlank())) {
            throw new OrderValidationException("A reason is required to " + describe(action));
        }

        OrderStatus believed = believedStatus != null ? believedStatus
                : OrderStatusTransitions.impliedSource(action)
                        .orElseThrow(() -> new OrderValidationException(
                                "The current status the order is believed to be in is required to "
                                        + describe(action)));

        String trimmedReason = reason == null ? null : reason.trim();

        OrderStatusGuard.AppliedTransition applied = statusGuard.transition(orderId, believed, action, role,
                trimmedReason, returnType);

        log.debug("Publishing a status change event for Order ID: {}", orderId);
        eventPublisher.publishEvent(new OrderStatusChangedEvent(this, applied.getOrder(), applied.getTransition()));

        transitionCounters.get(action).increment();

        return applied.getOrder();
    }

    private static String describe(OrderAction action) {
        return action.name().toLowerCase().replace('_', ' ') + " an order";
    }

    private void initializeMetrics(MeterRegistry registry) {
        for (OrderAction action : OrderAction.values()) {
            transitionCounters.put(action, Counter.builder("orders.transitions")
                    .description("Order status transitions applied")
                    .tag("action", action.name())
                    .register(registry));
        }
    }
}

package io.shopfront.fulfillment.service.impl;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.exception.ActionNotPermittedException;
import io.shopfront.fulfillment.exception.InvalidStatusTransitionException;
import io.shopfront.fulfillment.exception.OrderValidationException;
import io.shopfront.fulfillment.service.OrderWorkflowService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderWorkflowService} interface.
 */
@Service
@Slf4j
public class OrderWorkflowServiceImpl implements OrderWorkflowService {
    private static final String SCHEDULE_DELIVERY = "SCHEDULE_EXPECTED_DELIVERY";
    private static final Set<ActorRole> SCHEDULING_ROLES = EnumSet.of(ActorRole.SELLER, ActorRole.EMPLOYEE,
            ActorRole.ADMIN);

    private final OrderTransitionExecutor transitionExecutor;
    private final OrderStatusGuard statusGuard;

    public OrderWorkflowServiceImpl(OrderTransitionExecutor transitionExecutor, OrderStatusGuard statusGuard) {
        this.transitionExecutor = transitionExecutor;
        this.statusGuard = statusGuard;
    }

    @Override
    @Transactional
    public Order confirmOrder(UUID orderId, ActorRole role) {
        log.info("Confirming order {} as {}", orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.CONFIRM, role, null, null);
    }

    @Override
    @Transactional
    public Order rejectOrder(UUID orderId, String reason, ActorRole role) {
        log.info("Rejecting order {} as {}", orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.REJECT, role, reason, null);
    }

    @Override
    @Transactional
    public Order cancelOrder(UUID orderId, String reason, ActorRole role) {
        log.info("Cancelling order {} as {}", orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.CANCEL, role, reason, null);
    }

    @Override
    @Transactional
    public Order advanceStatus(UUID orderId, OrderStatus believedStatus, ActorRole role) {
        log.info("Advancing order {} from \"{}\" as {}", orderId, believedStatus, role);

        return transitionExecutor.execute(orderId, requireBelieved(believedStatus, OrderAction.ADVANCE),
                OrderAction.ADVANCE, role, null, null);
    }

    @Override
    @Transactional
    public Order confirmReceipt(UUID orderId, OrderStatus believedStatus, ActorRole role) {
        log.info("Confirming receipt of order {} from \"{}\" as {}", orderId, believedStatus, role);

        return transitionExecutor.execute(orderId, requireBelieved(believedStatus, OrderAction.CONFIRM_RECEIPT),
                OrderAction.CONFIRM_RECEIPT, role, null, null);
    }

    @Override
    @Transactional
    public Order scheduleExpectedDelivery(UUID orderId, LocalDate expectedDelivery, ActorRole role) {
        if (role == null || !SCHEDULING_ROLES.contains(role)) {
            throw new ActionNotPermittedException(SCHEDULE_DELIVERY, role);
        }
        if (expectedDelivery == null) {
            throw new OrderValidationException("Expected delivery date is required");
        }

        return statusGuard.update(orderId, order -> {
            if (order.getStatus().isTerminal()) {
                throw new InvalidStatusTransitionException(orderId, order.getStatus(),
                        "expected delivery cannot be scheduled on a closed order");
            }

            boolean scheduled = order.scheduleExpectedDelivery(expectedDelivery);
            if (scheduled) {
                log.info("Expected delivery of order {} set to {}", orderId, expectedDelivery);
            } else {
                log.info("Expected delivery of order {} already set to {}, keeping it", orderId,
                        order.getTracking().getExpectedDelivery());
            }
            return scheduled;
        });
    }

    private static OrderStatus requireBelieved(OrderStatus believedStatus, OrderAction action) {
        if (believedStatus == null) {
            throw new OrderValidationException("believedStatus is required for " + action);
        }
        return believedStatus;
    }
}

package io.shopfront.fulfillment.service.impl;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.function.Predicate;

import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.domain.OrderStatusTransitions;
import io.shopfront.fulfillment.domain.OrderTransition;
import io.shopfront.fulfillment.domain.ReturnType;
import io.shopfront.fulfillment.exception.ActionNotPermittedException;
import io.shopfront.fulfillment.exception.InvalidStatusTransitionException;
import io.shopfront.fulfillment.exception.OrderNotFoundException;
import io.shopfront.fulfillment.exception.StatusConflictException;
import io.shopfront.fulfillment.repository.OrderRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Compare-then-write protection for order updates.
 * <p>
 * Every update re-reads the order, checks that it is still in the status the
 * caller acted on and only then writes it with {@code saveAndFlush}. The
 * entity's version column turns the write into a conditional one, so a
 * concurrent writer that commits between the read and the write is reported as
 * a {@link StatusConflictException} as well.
 * </p>
 */
@Component
@Slf4j
public class OrderStatusGuard {
    private final OrderRepository orderRepository;
    private final TransactionTemplate freshReadTemplate;
    private final MeterRegistry meterRegistry;

    private Counter conflictCounter;

    public OrderStatusGuard(OrderRepository orderRepository, PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;
        this.meterRegistry = meterRegistry;

        this.freshReadTemplate = new TransactionTemplate(transactionManager);
        this.freshReadTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.freshReadTemplate.setReadOnly(true);

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Applies {@code action} to an order the caller believes to be in
     * {@code believedStatus}.
     *
     * @param orderId             The order to change.
     * @param believedStatus      The status the caller observed.
     * @param action              The action to perform.
     * @param role                The acting role.
     * @param reason              Reason stored with the transition, may be
     *                            {@code null}.
     * @param requestedReturnType For {@link OrderAction#REQUEST_RETURN}, the type
     *                            being requested; ignored otherwise.
     * @return The saved order together with the transition that was applied.
     * @throws OrderNotFoundException           if the order does not exist.
     * @throws StatusConflictException          if the stored status differs from
     *                                          {@code believedStatus}, or another
     *                                          writer got there first.
     * @throws ActionNotPermittedException      if the role may not act on the
     *                                          order in its current status.
     * @throws InvalidStatusTransitionException if the action is not legal from the
     *                                          current status.
     */
    public AppliedTransition transition(UUID orderId, OrderStatus believedStatus, OrderAction action, ActorRole role,
            String reason, ReturnType requestedReturnType) {
        Order order = load(orderId);
        OrderStatus current = order.getStatus();
        ReturnType returnType = action == OrderAction.REQUEST_RETURN ? requestedReturnType : order.getReturnType();

        if (current != believedStatus) {
            boolean alreadyApplied = OrderStatusTransitions.nextStatus(action, believedStatus, returnType)
                    .map(target -> target == current)
                    .orElse(false);
            throw conflict(orderId, believedStatus, current, alreadyApplied);
        }

        if (!OrderStatusTransitions.isPermitted(action, role, current)) {
            log.warn("Role {} tried to {} order {} in status {}", role, action, orderId, current);
            throw new ActionNotPermittedException(action, role, current);
        }

        if (action == OrderAction.REQUEST_RETURN && order.getCategory().isPrintJob()) {
            throw new InvalidStatusTransitionException(orderId, action, current, "print jobs cannot be returned");
        }

        OrderStatus next = OrderStatusTransitions.nextStatus(action, current, returnType)
                .orElseThrow(() -> {
                    log.warn("Rejected {} on order {} in status {} (return type {})", action, orderId, current,
                            returnType);
                    return new InvalidStatusTransitionException(orderId, action, current);
                });

        OrderTransition transition = OrderTransition.builder()
                .action(action)
                .from(current)
                .to(next)
                .reason(reason)
                .returnType(returnType)
                .build();

        order.applyTransition(transition, LocalDateTime.now());

        Order saved = write(order, believedStatus);
        log.info("Order {} moved from \"{}\" to \"{}\" by {} ({})", orderId, current, next, role, action);

        return new AppliedTransition(saved, transition);
    }

    /**
     * Applies a change that does not move the status, such as marking the
     * delivery fee paid. The order is only written if {@code change} reports
     * that it modified it.
     *
     * @param orderId The order to change.
     * @param change  Mutates the loaded order and returns {@code true} if
     *                anything changed.
     * @return The order, saved if it changed.
     * @throws OrderNotFoundException  if the order does not exist.
     * @throws StatusConflictException if another writer changed the order
     *                                 between the read and the write.
     */
    public Order update(UUID orderId, Predicate<Order> change) {
        Order order = load(orderId);
        OrderStatus observed = order.getStatus();

        if (!change.test(order)) {
            log.debug("Order {} already up to date, nothing written", orderId);
            return order;
        }

        return write(order, observed);
    }

    private Order load(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found for ID: {}", orderId);
                    return new OrderNotFoundException(orderId);
                });
    }

    private Order write(Order order, OrderStatus believedStatus) {
        try {
            return orderRepository.saveAndFlush(order);
        } catch (ObjectOptimisticLockingFailureException e) {
            OrderStatus actual = freshReadTemplate.execute(status -> orderRepository.findById(order.getId())
                    .map(Order::getStatus)
                    .orElse(null));
            throw conflict(order.getId(), believedStatus, actual, false);
        }
    }

    private StatusConflictException conflict(UUID orderId, OrderStatus believed, OrderStatus actual,
            boolean alreadyApplied) {
        conflictCounter.increment();
        log.warn("Status conflict on order {}: believed \"{}\", actual \"{}\" (already applied: {})", orderId,
                believed, actual, alreadyApplied);
        return new StatusConflictException(orderId, believed, actual, alreadyApplied);
    }

    private void initializeMetrics(MeterRegistry registry) {
        this.conflictCounter = Counter.builder("orders.status.conflicts")
                .description("Order updates refused because the order changed since it was read")
                .register(registry);
    }

    /**
     * An order as saved after a transition, with the transition itself.
     */
    @Value
    public static class AppliedTransition {
        Order order;
        OrderTransition transition;
    }
}

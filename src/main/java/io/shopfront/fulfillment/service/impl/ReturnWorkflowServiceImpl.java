package io.shopfront.fulfillment.service.impl;

import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.ReturnType;
import io.shopfront.fulfillment.exception.OrderValidationException;
import io.shopfront.fulfillment.service.ReturnWorkflowService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link ReturnWorkflowService} interface. Returns follow
 * the same guarded transition path as the forward workflow.
 */
@Service
@Slf4j
public class ReturnWorkflowServiceImpl implements ReturnWorkflowService {
    private final OrderTransitionExecutor transitionExecutor;

    public ReturnWorkflowServiceImpl(OrderTransitionExecutor transitionExecutor) {
        this.transitionExecutor = transitionExecutor;
    }

    @Override
    @Transactional
    public Order requestReturn(UUID orderId, ReturnType type, String reason, ActorRole role) {
        if (type == null) {
            throw new OrderValidationException("Return type is required");
        }
        log.info("Return ({}) requested for order {} as {}", type, orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.REQUEST_RETURN, role, reason, type);
    }

    @Override
    @Transactional
    public Order approveReturn(UUID orderId, ActorRole role) {
        log.info("Approving return of order {} as {}", orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.APPROVE_RETURN, role, null, null);
    }

    @Override
    @Transactional
    public Order approveReplacement(UUID orderId, ActorRole role) {
        log.info("Approving replacement of order {} as {}", orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.APPROVE_REPLACEMENT, role, null, null);
    }

    @Override
    @Transactional
    public Order rejectReturn(UUID orderId, String reason, ActorRole role) {
        log.info("Rejecting return of order {} as {}", orderId, role);

        return transitionExecutor.execute(orderId, null, OrderAction.REJECT_RETURN, role, reason, null);
    }
}

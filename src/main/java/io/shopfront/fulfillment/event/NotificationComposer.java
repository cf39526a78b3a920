package io.shopfront.fulfillment.event;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.domain.OrderTransition;
import io.shopfront.fulfillment.dto.OrderNotificationDTO;

/**
 * Turns a status change into the notification the customer receives, if any.
 */
@Component
public class NotificationComposer {
    static final String STATUS_UPDATED_TITLE = "Order Status Updated";
    static final String ACTION_REQUIRED_TITLE = "Action Required";

    private static final Set<OrderStatus> ANNOUNCED = EnumSet.of(
            OrderStatus.PROCESSING, OrderStatus.PACKED, OrderStatus.SHIPPED,
            OrderStatus.REJECTED, OrderStatus.RETURN_APPROVED, OrderStatus.RETURN_REJECTED,
            OrderStatus.REPLACEMENT_CONFIRMED);

    /**
     * @param order      The order after the change.
     * @param transition The change.
     * @return The notification, or empty if the new status is not announced to
     *         the customer.
     */
    public Optional<OrderNotificationDTO> compose(Order order, OrderTransition transition) {
        OrderStatus status = transition.getTo();

        String title;
        String message;
        if (status.awaitsCustomerConfirmation()) {
            title = ACTION_REQUIRED_TITLE;
            message = String.format("Your item \"%s\" is pending confirmation. "
                    + "Please go to the 'Confirmations' tab in your notifications to confirm.",
                    order.getProductName());
        } else if (ANNOUNCED.contains(status)) {
            title = STATUS_UPDATED_TITLE;
            message = String.format("Your order for \"%s\" is now %s.", order.getProductName(), status.getLabel());
            if (transition.getReason() != null && !transition.getReason().isBlank()) {
                message += " Reason: " + transition.getReason();
            }
        } else {
            return Optional.empty();
        }

        return Optional.of(OrderNotificationDTO.builder()
                .userId(order.getUserId())
                .orderId(order.getId())
                .groupId(order.getGroupId())
                .sellerId(order.getSellerId())
                .status(status)
                .title(title)
                .message(message)
                .createdAt(LocalDateTime.now())
                .build());
    }
}

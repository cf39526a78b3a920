package io.shopfront.fulfillment.event;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.dto.OrderNotificationDTO;
import lombok.extern.slf4j.Slf4j;

/**
 * Event listener component that handles {@link OrderStatusChangedEvent}.
 * Runs after the transaction that changed the status commits and appends the
 * resulting customer notification to the notifications topic.
 */
@Component
@Slf4j
public class OrderStatusChangedEventListener {
    @Autowired
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.order-notifications-topic}")
    private String notificationsTopic;

    @Autowired
    private NotificationComposer notificationComposer;

    /**
     * Composes the notification for the change and sends it keyed by the
     * customer's user ID. Send failures are logged and never reach the caller
     * whose transition already committed.
     *
     * @param event The committed status change.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        Order order = event.getOrder();

        log.debug("Received status change event for Order ID: {} ({} -> {})", order.getId(),
                event.getTransition().getFrom(), event.getTransition().getTo());

        Optional<OrderNotificationDTO> notification = notificationComposer.compose(order, event.getTransition());
        if (notification.isEmpty()) {
            log.debug("No customer notification for status {} of Order ID: {}", event.getTransition().getTo(),
                    order.getId());
            return;
        }

        String userId = order.getUserId();
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(notificationsTopic, userId,
                    notification.get());

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Published notification \"{}\" to topic {} for Order ID {}",
                            notification.get().getTitle(), notificationsTopic, order.getId());
                } else {
                    log.error("Failed to publish notification to topic {} for Order ID {}: {}",
                            notificationsTopic, order.getId(), ex.getMessage(), ex);
                }
            });
        } catch (Exception e) {
            log.error("Exception while sending notification to topic {} for Order ID {}: {}",
                    notificationsTopic, order.getId(), e.getMessage(), e);
        }
    }
}

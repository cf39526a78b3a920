package io.shopfront.fulfillment.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderAction;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.domain.OrderTransition;
import io.shopfront.fulfillment.dto.OrderNotificationDTO;

public class NotificationComposerTest {
    private final NotificationComposer composer = new NotificationComposer();

    private final Order order = Order.builder()
            .id(UUID.randomUUID())
            .groupId(UUID.randomUUID())
            .userId("user-1")
            .sellerId("seller-1")
            .productName("Graph Notebook")
            .build();

    @Test
    @DisplayName("Should announce a shipped order to its customer")
    void shipped_statusUpdated() {
        Optional<OrderNotificationDTO> notification = composer.compose(order,
                transition(OrderAction.ADVANCE, OrderStatus.PACKED, OrderStatus.SHIPPED, null));

        assertThat(notification).hasValueSatisfying(dto -> {
            assertThat(dto.getTitle()).isEqualTo(NotificationComposer.STATUS_UPDATED_TITLE);
            assertThat(dto.getMessage()).isEqualTo("Your order for \"Graph Notebook\" is now Shipped.");
            assertThat(dto.getUserId()).isEqualTo("user-1");
            assertThat(dto.getOrderId()).isEqualTo(order.getId());
            assertThat(dto.getStatus()).isEqualTo(OrderStatus.SHIPPED);
        });
    }

    @Test
    void rejected_carriesTheReason() {
        Optional<OrderNotificationDTO> notification = composer.compose(order, transition(OrderAction.REJECT,
                OrderStatus.PENDING_CONFIRMATION, OrderStatus.REJECTED, "Out of stock"));

        assertThat(notification).map(OrderNotificationDTO::getMessage)
                .contains("Your order for \"Graph Notebook\" is now Rejected. Reason: Out of stock");
    }

    @ParameterizedTest(name = "{0} asks the customer to confirm")
    @EnumSource(value = OrderStatus.class, names = { "PENDING_DELIVERY_CONFIRMATION",
            "PENDING_RETURN_CONFIRMATION", "PENDING_REPLACEMENT_CONFIRMATION" })
    void pendingConfirmation_actionRequired(OrderStatus status) {
        Optional<OrderNotificationDTO> notification = composer.compose(order,
                transition(OrderAction.ADVANCE, OrderStatus.OUT_FOR_DELIVERY, status, null));

        assertThat(notification).hasValueSatisfying(dto -> {
            assertThat(dto.getTitle()).isEqualTo(NotificationComposer.ACTION_REQUIRED_TITLE);
            assertThat(dto.getMessage()).startsWith("Your item \"Graph Notebook\" is pending confirmation.");
        });
    }

    @ParameterizedTest(name = "{0} is not announced")
    @EnumSource(value = OrderStatus.class, names = { "OUT_FOR_DELIVERY", "DELIVERED", "CANCELLED",
            "RETURN_REQUESTED", "OUT_FOR_PICKUP", "PICKED_UP", "RETURN_COMPLETED", "REPLACEMENT_COMPLETED" })
    void quietStatuses_noNotification(OrderStatus status) {
        assertThat(composer.compose(order, transition(OrderAction.ADVANCE, OrderStatus.SHIPPED, status, null)))
                .isEmpty();
    }

    private static OrderTransition transition(OrderAction action, OrderStatus from, OrderStatus to, String reason) {
        return OrderTransition.builder().action(action).from(from).to(to).reason(reason).build();
    }
}

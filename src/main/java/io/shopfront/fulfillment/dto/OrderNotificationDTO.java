package io.shopfront.fulfillment.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import io.shopfront.fulfillment.domain.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Customer notification appended to the notifications topic.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderNotificationDTO {
    private String userId;
    private UUID orderId;
    private UUID groupId;
    private String sellerId;
    private OrderStatus status;
    private String title;
    private String message;
    private LocalDateTime createdAt;
}

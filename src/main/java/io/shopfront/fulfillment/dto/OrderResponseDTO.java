package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import io.shopfront.fulfillment.domain.OrderCategory;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.domain.PrintJobConfig;
import io.shopfront.fulfillment.domain.ReturnType;
import io.shopfront.fulfillment.domain.ShippingAddress;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "orders", itemRelation = "order")
@Schema(description = "A single order line fulfilled by one seller")
public class OrderResponseDTO extends RepresentationModel<OrderResponseDTO> {
    @Schema(description = "Unique identifier of the order (UUID)", example = "a1b2c3d4-e5f6-7890-1234-567890abcdef")
    private UUID id;

    @Schema(description = "Checkout group the order belongs to", example = "f95b3574-10c9-4698-8edd-f651c14a2592")
    private UUID groupId;

    private String userId;

    private String sellerId;

    private OrderCategory category;

    private String productId;

    private String productName;

    private PrintJobConfig printJob;

    private Integer quantity;

    @Schema(description = "Unit price at order time", example = "120.00")
    private BigDecimal price;

    @Schema(description = "This order's share of the group's delivery fee", example = "25.00")
    private BigDecimal deliveryCharge;

    private boolean deliveryFeePaid;

    @Schema(description = "Current status of the order", example = "Out for Delivery")
    private OrderStatus status;

    private ReturnType returnType;

    private String rejectionReason;

    private String returnReason;

    private String cancellationReason;

    private OrderTrackingDTO tracking;

    private ShippingAddress shippingAddress;

    private String mobile;

    private List<String> altMobiles;

    @Schema(description = "Timestamp when the order was placed", example = "2024-05-01T12:00:00")
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}

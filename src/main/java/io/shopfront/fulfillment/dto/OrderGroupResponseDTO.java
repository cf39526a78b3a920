package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import io.shopfront.fulfillment.aggregation.DashboardBucket;
import io.shopfront.fulfillment.customer.CustomerProfile;
import io.shopfront.fulfillment.domain.ShippingAddress;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "orderGroups", itemRelation = "orderGroup")
@Schema(description = "All orders placed in one checkout, split by seller")
public class OrderGroupResponseDTO extends RepresentationModel<OrderGroupResponseDTO> {
    @Schema(description = "Group ID shared by the checkout's orders", example = "f95b3574-10c9-4698-8edd-f651c14a2592")
    private UUID groupId;

    private String userId;

    @Schema(description = "Customer profile, absent when the customer directory has none")
    private CustomerProfile customer;

    private LocalDateTime createdAt;

    private ShippingAddress shippingAddress;

    private String mobile;

    private List<SellerOrdersDTO> sellers;

    @Schema(description = "Sum of price x quantity over product lines", example = "450.00")
    private BigDecimal productSubtotal;

    @Schema(description = "Sum of price x quantity over print jobs", example = "60.00")
    private BigDecimal printJobSubtotal;

    @Schema(description = "Sum of the orders' delivery charges", example = "50.00")
    private BigDecimal deliveryFeeTotal;

    @Schema(description = "Subtotals plus delivery fees", example = "560.00")
    private BigDecimal grandTotal;

    @Schema(description = "True once every order's share of the delivery fee is paid")
    private boolean deliveryFeePaid;

    private DashboardBucket bucket;
}

package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;
import java.util.List;

import io.shopfront.fulfillment.aggregation.DashboardBucket;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SellerOrdersDTO {
    private String sellerId;
    private BigDecimal subtotal;
    private BigDecimal deliveryCharge;
    private DashboardBucket bucket;
    private List<OrderResponseDTO> orders;
}

package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;

import io.shopfront.fulfillment.domain.OrderCategory;
import io.shopfront.fulfillment.domain.PrintJobConfig;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutItemRequestDTO {
    @NotBlank(message = "Seller ID cannot be blank in item request")
    private String sellerId;

    @NotNull(message = "Category cannot be null in item request")
    private OrderCategory category;

    private String productId;

    private String productName;

    private PrintJobConfig printJob;

    @NotNull(message = "Quantity cannot be null in item request")
    @Min(value = 1, message = "Quantity must be at least 1 in item request")
    private Integer quantity;

    @NotNull(message = "Price cannot be null in item request")
    @DecimalMin(value = "0.00", message = "Price cannot be negative in item request")
    private BigDecimal price;
}

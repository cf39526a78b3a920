package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;

import io.shopfront.fulfillment.domain.DeliveryTierSet;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryChargeQuoteRequestDTO {
    @NotNull(message = "Tier set cannot be null")
    private DeliveryTierSet tierSet;

    @NotNull(message = "Subtotal cannot be null")
    @DecimalMin(value = "0.00", message = "Subtotal cannot be negative")
    private BigDecimal subtotal;
}

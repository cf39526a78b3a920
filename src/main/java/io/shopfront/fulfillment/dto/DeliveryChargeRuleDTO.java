package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryChargeRuleDTO {
    @Schema(accessMode = Schema.AccessMode.READ_ONLY)
    private UUID id;

    @NotNull(message = "Rule lower bound cannot be null")
    @DecimalMin(value = "0.00", message = "Rule lower bound cannot be negative")
    @Schema(example = "500.00")
    private BigDecimal from;

    @Schema(description = "Inclusive upper bound, null for unbounded", example = "999.99")
    private BigDecimal to;

    @NotNull(message = "Rule charge cannot be null")
    @DecimalMin(value = "0.00", message = "Rule charge cannot be negative")
    @Schema(example = "20.00")
    private BigDecimal charge;
}

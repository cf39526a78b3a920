package io.shopfront.fulfillment.dto;

import io.shopfront.fulfillment.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BelievedStatusRequestDTO {
    @Schema(description = "The status the caller last saw the order in", example = "Packed")
    @NotNull(message = "Believed status cannot be null")
    private OrderStatus believedStatus;
}

package io.shopfront.fulfillment.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpectedDeliveryRequestDTO {
    @NotNull(message = "Expected delivery date cannot be null")
    private LocalDate expectedDelivery;
}

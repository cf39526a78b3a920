package io.shopfront.fulfillment.dto;

import io.shopfront.fulfillment.domain.ReturnType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReturnRequestDTO {
    @NotNull(message = "Return type cannot be null")
    private ReturnType type;

    private String reason;
}

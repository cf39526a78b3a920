package io.shopfront.fulfillment.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Delivery charge for a subtotal, with the next cheaper tier if one exists")
public class DeliveryChargeQuoteResponseDTO {
    @Schema(example = "20.00")
    private BigDecimal charge;

    @Schema(example = "Add items worth Rs 250.00 more for FREE delivery.")
    private String nextTierInfo;

    @Schema(description = "Subtotal at which the cheaper tier starts", example = "1000.00")
    private BigDecimal nextTierThreshold;

    @Schema(example = "250.00")
    private BigDecimal amountNeeded;

    @Schema(example = "0.00")
    private BigDecimal nextTierCharge;
}

package io.shopfront.fulfillment.dto;

import java.util.ArrayList;
import java.util.List;

import org.springframework.hateoas.RepresentationModel;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@Schema(description = "Delivery-charge rule sets for product lines and print jobs")
public class OrderSettingsDTO extends RepresentationModel<OrderSettingsDTO> {
    @Valid
    @NotNull(message = "Item delivery rules cannot be null")
    private List<DeliveryChargeRuleDTO> itemDeliveryRules = new ArrayList<>();

    @Valid
    @NotNull(message = "Print-job delivery rules cannot be null")
    private List<DeliveryChargeRuleDTO> printJobDeliveryRules = new ArrayList<>();
}

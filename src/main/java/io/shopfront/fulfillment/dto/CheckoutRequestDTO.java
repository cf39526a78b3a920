package io.shopfront.fulfillment.dto;

import java.util.ArrayList;
import java.util.List;

import io.shopfront.fulfillment.domain.ShippingAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutRequestDTO {
    @NotBlank(message = "User ID cannot be blank in checkout request")
    private String userId;

    @Valid
    @NotNull(message = "Shipping address cannot be null in checkout request")
    private ShippingAddress shippingAddress;

    @NotBlank(message = "Mobile number cannot be blank in checkout request")
    private String mobile;

    @Builder.Default
    private List<String> altMobiles = new ArrayList<>();

    @NotNull(message = "Item list cannot be null in checkout request")
    @NotEmpty(message = "Checkout must have at least one item")
    @Valid
    private List<CheckoutItemRequestDTO> items;
}

package io.shopfront.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery address captured at checkout. It is a snapshot: later edits to the
 * customer's profile do not change placed orders.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Embeddable
public class ShippingAddress {
    public enum AddressType {
        HOME,
        WORK
    }

    @NotNull(message = "Address type cannot be null")
    @Enumerated(EnumType.STRING)
    @Column(name = "address_type", length = 10)
    private AddressType type;

    @NotBlank(message = "Address line 1 cannot be blank")
    @Column(name = "address_line1")
    private String line1;

    @Column(name = "address_line2")
    private String line2;

    @NotBlank(message = "City cannot be blank")
    @Column(name = "address_city")
    private String city;

    @NotBlank(message = "State cannot be blank")
    @Column(name = "address_state")
    private String state;

    @NotBlank(message = "Postal code cannot be blank")
    @Column(name = "address_postal_code", length = 20)
    private String postalCode;
}

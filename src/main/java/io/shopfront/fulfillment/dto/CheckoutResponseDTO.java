package io.shopfront.fulfillment.dto;

import java.util.UUID;

import org.springframework.hateoas.RepresentationModel;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@Schema(description = "Result of a checkout")
public class CheckoutResponseDTO extends RepresentationModel<CheckoutResponseDTO> {
    @Schema(description = "Group ID shared by every order created by the checkout", example = "a1b2c3d4-e5f6-7890-1234-567890abcdef")
    private UUID groupId;
}

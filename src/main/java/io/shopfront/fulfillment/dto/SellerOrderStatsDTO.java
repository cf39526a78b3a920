package io.shopfront.fulfillment.dto;

import org.springframework.hateoas.RepresentationModel;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
@Schema(description = "Order counts for the seller dashboard; a replacement can count under more than one heading")
public class SellerOrderStatsDTO extends RepresentationModel<SellerOrderStatsDTO> {
    private String sellerId;

    @Schema(description = "All of the seller's orders", example = "42")
    private long total;

    @Schema(description = "Orders on the forward path, from pending confirmation to awaiting receipt")
    private long active;

    @Schema(description = "Orders anywhere on a return or replacement path")
    private long returns;

    @Schema(description = "Delivered orders and completed replacements")
    private long completed;

    @Schema(description = "Orders or returns the seller rejected")
    private long sellerRejected;

    @Schema(description = "Orders the customer cancelled")
    private long userCancelled;
}

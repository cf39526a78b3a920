package io.shopfront.fulfillment.dto;

import java.util.List;
import java.util.UUID;

import org.springframework.hateoas.RepresentationModel;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Schema(description = "Outcome of marking a group's delivery fee as paid")
public class GroupSettlementResultDTO extends RepresentationModel<GroupSettlementResultDTO> {
    private UUID groupId;

    @Schema(description = "Orders marked paid by this request")
    private List<UUID> paidOrderIds;

    @Schema(description = "Orders that were already paid and left untouched")
    private List<UUID> alreadyPaidOrderIds;

    @Schema(description = "True when every order of the group is now paid")
    private boolean deliveryFeePaid;
}

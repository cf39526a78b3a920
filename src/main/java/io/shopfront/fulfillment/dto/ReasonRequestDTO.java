package io.shopfront.fulfillment.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of rejection, cancellation and return-rejection requests. Blank reasons
 * are refused by the workflow services.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReasonRequestDTO {
    private String reason;
}

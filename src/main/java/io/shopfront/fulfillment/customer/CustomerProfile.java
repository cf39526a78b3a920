package io.shopfront.fulfillment.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only customer details shown next to an order group.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerProfile {
    private String userId;
    private String shortId;
    private String name;
    private String email;
    private String mobile;
}

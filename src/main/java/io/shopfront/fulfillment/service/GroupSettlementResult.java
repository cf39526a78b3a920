package io.shopfront.fulfillment.service;

import java.util.List;
import java.util.UUID;

import lombok.Value;

/**
 * Outcome of a successful delivery-fee settlement over an order group.
 */
@Value
public class GroupSettlementResult {
    UUID groupId;
    List<UUID> paidOrderIds;
    List<UUID> alreadyPaidOrderIds;
}

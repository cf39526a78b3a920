package io.shopfront.fulfillment.exception;

import java.util.List;
import java.util.UUID;

import lombok.Getter;

/**
 * Thrown when a group-wide operation succeeded on some member orders and failed
 * on others. Member writes are idempotent, so retrying the operation completes
 * the remainder.
 */
@Getter
public class PartialGroupFailureException extends RuntimeException {
    private final UUID groupId;
    private final List<UUID> succeededOrderIds;
    private final List<UUID> failedOrderIds;

    public PartialGroupFailureException(UUID groupId, List<UUID> succeededOrderIds, List<UUID> failedOrderIds) {
        super("Operation on group " + groupId + " failed for " + failedOrderIds.size() + " of "
                + (succeededOrderIds.size() + failedOrderIds.size()) + " orders: " + failedOrderIds);
        this.groupId = groupId;
        this.succeededOrderIds = List.copyOf(succeededOrderIds);
        this.failedOrderIds = List.copyOf(failedOrderIds);
    }
}

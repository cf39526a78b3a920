package io.shopfront.fulfillment.service;

import java.util.List;
import java.util.UUID;

import io.shopfront.fulfillment.aggregation.DashboardBucket;
import io.shopfront.fulfillment.aggregation.OrderGroupView;
import io.shopfront.fulfillment.aggregation.SellerOrderStats;

/**
 * Read-only order group views for the order detail page and the seller and
 * customer dashboards.
 */
public interface OrderGroupQueryService {
    /**
     * @throws io.shopfront.fulfillment.exception.OrderGroupNotFoundException if
     *         the group has no orders.
     */
    OrderGroupView getGroup(UUID groupId);

    /**
     * Groups containing the seller's orders, newest first. Each view holds only
     * this seller's orders.
     *
     * @param bucket Only return groups in this dashboard bucket; {@code null}
     *               returns all.
     */
    List<OrderGroupView> getGroupsForSeller(String sellerId, DashboardBucket bucket);

    /**
     * Per-status counts over all of the seller's orders.
     */
    SellerOrderStats getSellerStats(String sellerId);

    /**
     * The customer's order history, newest group first.
     */
    List<OrderGroupView> getGroupsForCustomer(String userId);
}

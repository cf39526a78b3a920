package io.shopfront.fulfillment.service.impl;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.shopfront.fulfillment.aggregation.DashboardBucket;
import io.shopfront.fulfillment.aggregation.OrderGroupAggregator;
import io.shopfront.fulfillment.aggregation.OrderGroupView;
import io.shopfront.fulfillment.aggregation.SellerOrderStats;
import io.shopfront.fulfillment.customer.CustomerDirectory;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.service.OrderGroupQueryService;
import io.shopfront.fulfillment.service.OrderService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderGroupQueryService} interface. Views are
 * rebuilt from the stored orders on every call.
 */
@Service
@Slf4j
public class OrderGroupQueryServiceImpl implements OrderGroupQueryService {
    private final OrderService orderService;
    private final CustomerDirectory customerDirectory;

    public OrderGroupQueryServiceImpl(OrderService orderService, CustomerDirectory customerDirectory) {
        this.orderService = orderService;
        this.customerDirectory = customerDirectory;
    }

    @Override
    @Transactional(readOnly = true)
    public OrderGroupView getGroup(UUID groupId) {
        List<Order> orders = orderService.getOrdersByGroup(groupId);

        return OrderGroupAggregator.toView(groupId, orders,
                customerDirectory.findProfile(orders.get(0).getUserId()).orElse(null));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderGroupView> getGroupsForSeller(String sellerId, DashboardBucket bucket) {
        List<OrderGroupView> groups = OrderGroupAggregator.aggregate(orderService.getOrdersBySeller(sellerId),
                customerDirectory::findProfile);

        log.debug("Seller {} has {} order groups", sellerId, groups.size());

        if (bucket == null) {
            return groups;
        }

        return groups.stream()
                .filter(group -> group.getBucket() == bucket)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public SellerOrderStats getSellerStats(String sellerId) {
        SellerOrderStats stats = SellerOrderStats.of(sellerId, orderService.getOrdersBySeller(sellerId));

        log.debug("Seller {} stats: {}", sellerId, stats);

        return stats;
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderGroupView> getGroupsForCustomer(String userId) {
        return OrderGroupAggregator.aggregate(orderService.getOrdersByUser(userId), customerDirectory::findProfile);
    }
}

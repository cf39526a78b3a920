package io.shopfront.fulfillment.aggregation;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import io.shopfront.fulfillment.customer.CustomerProfile;
import io.shopfront.fulfillment.domain.Order;

/**
 * Groups order records into {@link OrderGroupView}s. Stateless; the customer
 * lookup is the only collaborator and is passed in by the caller.
 */
public final class OrderGroupAggregator {
    private static final Comparator<Order> BY_CREATION = Comparator.comparing(Order::getCreatedAt,
            Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<OrderGroupView> NEWEST_FIRST = Comparator.comparing(
            OrderGroupView::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private OrderGroupAggregator() {
    }

    /**
     * Builds one view per distinct group ID found in {@code orders}, newest group
     * first. Records inside a group keep creation order; seller sub-groups appear
     * in the order their first record was created.
     *
     * @param orders        The records to aggregate, possibly spanning several
     *                      groups.
     * @param profileLookup Resolves a user ID to its profile. An empty result
     *                      leaves {@link OrderGroupView#getCustomer()} unset.
     * @return The group views.
     */
    public static List<OrderGroupView> aggregate(List<Order> orders,
            Function<String, Optional<CustomerProfile>> profileLookup) {
        Map<UUID, List<Order>> byGroup = orders.stream()
                .sorted(BY_CREATION)
                .collect(Collectors.groupingBy(Order::getGroupId, LinkedHashMap::new, Collectors.toList()));

        Map<String, Optional<CustomerProfile>> profiles = new LinkedHashMap<>();

        List<OrderGroupView> views = new ArrayList<>();
        byGroup.forEach((groupId, members) -> {
            String userId = members.get(0).getUserId();
            Optional<CustomerProfile> profile = profiles.computeIfAbsent(userId, profileLookup);
            views.add(toView(groupId, members, profile.orElse(null)));
        });

        views.sort(NEWEST_FIRST);
        return views;
    }

    /**
     * Builds the view of a single group.
     *
     * @param groupId  The group ID.
     * @param members  All records of the group, not empty.
     * @param customer The customer's profile, or {@code null}.
     * @return The group view.
     */
    public static OrderGroupView toView(UUID groupId, List<Order> members, CustomerProfile customer) {
        List<Order> sorted = new ArrayList<>(members);
        sorted.sort(BY_CREATION);

        Order first = sorted.get(0);

        Map<String, List<Order>> bySeller = sorted.stream()
                .collect(Collectors.groupingBy(Order::getSellerId, LinkedHashMap::new, Collectors.toList()));

        List<SellerOrders> sellers = bySeller.entrySet().stream()
                .map(entry -> SellerOrders.builder()
                        .sellerId(entry.getKey())
                        .orders(List.copyOf(entry.getValue()))
                        .subtotal(sumLineTotals(entry.getValue(), order -> true))
                        .deliveryCharge(sumDeliveryCharges(entry.getValue()))
                        .bucket(DashboardBucket.ofGroup(entry.getValue()))
                        .build())
                .collect(Collectors.toList());

        BigDecimal productSubtotal = sumLineTotals(sorted, order -> !order.getCategory().isPrintJob());
        BigDecimal printJobSubtotal = sumLineTotals(sorted, order -> order.getCategory().isPrintJob());
        BigDecimal deliveryFeeTotal = sumDeliveryCharges(sorted);

        return OrderGroupView.builder()
                .groupId(groupId)
                .userId(first.getUserId())
                .customer(customer)
                .createdAt(first.getCreatedAt())
                .shippingAddress(first.getShippingAddress())
                .mobile(first.getMobile())
                .sellers(sellers)
                .productSubtotal(productSubtotal)
                .printJobSubtotal(printJobSubtotal)
                .deliveryFeeTotal(deliveryFeeTotal)
                .grandTotal(productSubtotal.add(printJobSubtotal).add(deliveryFeeTotal))
                .deliveryFeePaid(sorted.stream().allMatch(Order::isDeliveryFeePaid))
                .bucket(DashboardBucket.ofGroup(sorted))
                .build();
    }

    private static BigDecimal sumLineTotals(List<Order> orders, Predicate<Order> filter) {
        return orders.stream()
                .filter(filter)
                .map(Order::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sumDeliveryCharges(List<Order> orders) {
        return orders.stream()
                .map(Order::getDeliveryCharge)
                .filter(charge -> charge != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

package io.shopfront.fulfillment.aggregation;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import io.shopfront.fulfillment.customer.CustomerProfile;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.ShippingAddress;
import lombok.Builder;
import lombok.Value;

/**
 * Read projection of one checkout: its records split by seller, its totals and
 * its shared delivery-fee state. Recomputed on every read.
 */
@Value
@Builder
public class OrderGroupView {
    UUID groupId;
    String userId;

    /**
     * {@code null} when the customer directory has no profile for the user.
     */
    CustomerProfile customer;

    LocalDateTime createdAt;
    ShippingAddress shippingAddress;
    String mobile;
    List<SellerOrders> sellers;
    BigDecimal productSubtotal;
    BigDecimal printJobSubtotal;
    BigDecimal deliveryFeeTotal;
    BigDecimal grandTotal;
    boolean deliveryFeePaid;
    DashboardBucket bucket;

    public List<Order> getOrders() {
        return sellers.stream()
                .flatMap(seller -> seller.getOrders().stream())
                .collect(Collectors.toList());
    }
}

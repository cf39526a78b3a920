package io.shopfront.fulfillment.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One purchased line item, fulfilled by exactly one seller. Records created by
 * the same checkout share a {@code groupId}.
 * <p>
 * The status only changes through {@link #applyTransition}, which is driven by
 * {@link OrderStatusTransitions}. The builder covers the checkout fields only, so
 * every new order starts pending confirmation with an unpaid delivery fee and no
 * milestones. Records are never deleted.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "altMobiles")
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_group_id", columnList = "group_id"),
        @Index(name = "idx_order_seller_id", columnList = "seller_id"),
        @Index(name = "idx_order_user_id", columnList = "user_id"),
        @Index(name = "idx_order_checkout_key", columnList = "checkout_key"),
        @Index(name = "idx_order_status", columnList = "status")
})
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull(message = "Group ID cannot be null")
    @Column(nullable = false, updatable = false, name = "group_id")
    private UUID groupId;

    @Column(updatable = false, name = "checkout_key")
    private String checkoutKey;

    @NotBlank(message = "User ID cannot be blank")
    @Column(nullable = false, updatable = false, name = "user_id")
    private String userId;

    @NotBlank(message = "Seller ID cannot be blank")
    @Column(nullable = false, updatable = false, name = "seller_id")
    private String sellerId;

    @NotNull(message = "Category cannot be null")
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private OrderCategory category;

    @Column(updatable = false, name = "product_id")
    private String productId;

    @Column(name = "product_name")
    private String productName;

    @Embedded
    private PrintJobConfig printJob;

    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @NotNull(message = "Price cannot be null")
    @DecimalMin(value = "0.00", message = "Price cannot be negative")
    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @NotNull(message = "Delivery charge cannot be null")
    @DecimalMin(value = "0.00", message = "Delivery charge cannot be negative")
    @Column(nullable = false, updatable = false, precision = 10, scale = 2, name = "delivery_charge")
    private BigDecimal deliveryCharge = BigDecimal.ZERO;

    @Setter(AccessLevel.NONE)
    @Column(nullable = false, name = "delivery_fee_paid")
    private boolean deliveryFeePaid = false;

    @NotNull(message = "Order status cannot be null")
    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private OrderStatus status = OrderStatus.PENDING_CONFIRMATION;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(length = 20, name = "return_type")
    private ReturnType returnType;

    @Setter(AccessLevel.NONE)
    @Column(length = 1000, name = "rejection_reason")
    private String rejectionReason;

    @Setter(AccessLevel.NONE)
    @Column(length = 1000, name = "return_reason")
    private String returnReason;

    @Setter(AccessLevel.NONE)
    @Column(length = 1000, name = "cancellation_reason")
    private String cancellationReason;

    @Setter(AccessLevel.NONE)
    @Embedded
    private OrderTracking tracking = new OrderTracking();

    @Valid
    @NotNull(message = "Shipping address cannot be null")
    @Embedded
    private ShippingAddress shippingAddress;

    @NotBlank(message = "Mobile number cannot be blank")
    @Column(nullable = false, length = 20)
    private String mobile;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_alt_mobiles", joinColumns = @JoinColumn(name = "order_id"))
    @Column(name = "mobile", length = 20)
    private List<String> altMobiles = new ArrayList<>();

    @CreationTimestamp
    @Column(nullable = false, updatable = false, name = "created_at")
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(nullable = false, name = "updated_at")
    private LocalDateTime updatedAt;

    @Setter(AccessLevel.NONE)
    @Version
    private long version;

    @Builder
    private Order(UUID id, UUID groupId, String checkoutKey, String userId, String sellerId, OrderCategory category,
            String productId, String productName, PrintJobConfig printJob, Integer quantity, BigDecimal price,
            BigDecimal deliveryCharge, ShippingAddress shippingAddress, String mobile, List<String> altMobiles) {
        this.id = id;
        this.groupId = groupId;
        this.checkoutKey = checkoutKey;
        this.userId = userId;
        this.sellerId = sellerId;
        this.category = category;
        this.productId = productId;
        this.productName = productName;
        this.printJob = printJob;
        this.quantity = quantity;
        this.price = price;
        this.deliveryCharge = deliveryCharge == null ? BigDecimal.ZERO : deliveryCharge;
        this.shippingAddress = shippingAddress;
        this.mobile = mobile;
        this.altMobiles = altMobiles == null ? new ArrayList<>() : altMobiles;
    }

    /**
     * Hibernate loads an embedded value whose columns are all null as
     * {@code null}; a fresh order has no milestone yet.
     */
    public OrderTracking getTracking() {
        if (tracking == null) {
            tracking = new OrderTracking();
        }
        return tracking;
    }

    /**
     * Applies a transition computed by {@link OrderStatusTransitions}: moves the
     * status, stores the reason that belongs to the action, records the return
     * type on a return request and writes the milestone of the new status.
     *
     * @param transition The transition to apply. Its source must equal the
     *                   current status.
     * @param at         When the transition happened.
     * @throws IllegalStateException if the order is no longer in the
     *                               transition's source status.
     */
    public void applyTransition(OrderTransition transition, LocalDateTime at) {
        if (transition.getFrom() != this.status) {
            throw new IllegalStateException(
                    "Transition from " + transition.getFrom() + " applied to order " + id + " in " + status);
        }

        switch (transition.getAction()) {
            case REJECT:
            case REJECT_RETURN:
                this.rejectionReason = transition.getReason();
                break;
            case CANCEL:
                this.cancellationReason = transition.getReason();
                break;
            case REQUEST_RETURN:
                this.returnReason = transition.getReason();
                if (this.returnType == null) {
                    this.returnType = transition.getReturnType();
                }
                break;
            default:
                break;
        }

        this.status = transition.getTo();
        getTracking().markReached(transition.getTo(), at);
    }

    /**
     * Marks this record's share of the delivery fee as paid. The flag never goes
     * back to {@code false}.
     *
     * @return {@code true} if the flag changed.
     */
    public boolean markDeliveryFeePaid() {
        if (deliveryFeePaid) {
            return false;
        }
        deliveryFeePaid = true;
        return true;
    }

    /**
     * @see OrderTracking#scheduleExpectedDelivery(LocalDate)
     */
    public boolean scheduleExpectedDelivery(LocalDate date) {
        return getTracking().scheduleExpectedDelivery(date);
    }

    /**
     * @return unit price multiplied by quantity.
     */
    public BigDecimal getLineTotal() {
        if (price == null || quantity == null) {
            return BigDecimal.ZERO;
        }
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}

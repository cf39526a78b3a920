package io.shopfront.fulfillment.domain;

import static io.shopfront.fulfillment.domain.OrderFixtures.inStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Set;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

public class OrderTest {
    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private Order order;

    @BeforeAll
    public static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    public static void closeValidatorFactory() {
        if (validatorFactory != null) {
            validatorFactory.close();
        }
    }

    @BeforeEach
    void setUp() {
        order = Order.builder()
                .groupId(java.util.UUID.randomUUID())
                .userId("user-1")
                .sellerId("seller-1")
                .category(OrderCategory.BOOKS)
                .productId("book-1")
                .productName("Notebook")
                .quantity(2)
                .price(new BigDecimal("120.00"))
                .mobile("9999999999")
                .shippingAddress(ShippingAddress.builder()
                        .type(ShippingAddress.AddressType.HOME)
                        .line1("12 Main Road")
                        .city("Pune")
                        .state("MH")
                        .postalCode("411001")
                        .build())
                .build();
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("A new order starts pending confirmation with no milestones and an unpaid fee")
        void newOrder_defaults() {
            assertThat(validator.validate(order)).isEmpty();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_CONFIRMATION);
            assertThat(order.isDeliveryFeePaid()).isFalse();
            assertThat(order.getDeliveryCharge()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(order.getTracking()).isEqualTo(new OrderTracking());
        }

        @Test
        void quantityBelowOne_isInvalid() {
            order.setQuantity(0);

            Set<ConstraintViolation<Order>> violations = validator.validate(order);

            assertThat(violations).hasSize(1);
            assertThat(violations.iterator().next().getMessage()).isEqualTo("Quantity must be at least 1");
        }

        @Test
        void negativePrice_isInvalid() {
            order.setPrice(new BigDecimal("-1.00"));

            Set<ConstraintViolation<Order>> violations = validator.validate(order);

            assertThat(violations).extracting(ConstraintViolation::getMessage)
                    .containsExactly("Price cannot be negative");
        }

        @Test
        void missingAddress_isInvalid() {
            order.setShippingAddress(null);

            assertThat(validator.validate(order)).extracting(ConstraintViolation::getMessage)
                    .containsExactly("Shipping address cannot be null");
        }
    }

    @Nested
    @DisplayName("applyTransition")
    class ApplyTransitionTests {
        private final LocalDateTime now = LocalDateTime.of(2025, 5, 1, 10, 0);

        @Test
        void confirm_movesStatusAndStampsMilestone() {
            order.applyTransition(transition(OrderAction.CONFIRM, OrderStatus.PENDING_CONFIRMATION,
                    OrderStatus.PROCESSING, null, null), now);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.PROCESSING);
            assertThat(order.getTracking().getConfirmed()).isEqualTo(now);
        }

        @Test
        void reject_storesRejectionReason() {
            order.applyTransition(transition(OrderAction.REJECT, OrderStatus.PENDING_CONFIRMATION,
                    OrderStatus.REJECTED, "Out of stock", null), now);

            assertThat(order.getRejectionReason()).isEqualTo("Out of stock");
            assertThat(order.getTracking().getRejected()).isEqualTo(now);
        }

        @Test
        void cancel_storesCancellationReason() {
            order.applyTransition(transition(OrderAction.CANCEL, OrderStatus.PENDING_CONFIRMATION,
                    OrderStatus.CANCELLED, "Ordered twice", null), now);

            assertThat(order.getCancellationReason()).isEqualTo("Ordered twice");
            assertThat(order.getRejectionReason()).isNull();
        }

        @Test
        void requestReturn_recordsTypeAndReason() {
            Order delivered = inStatus(Order.builder().build(), OrderStatus.DELIVERED);

            delivered.applyTransition(transition(OrderAction.REQUEST_RETURN, OrderStatus.DELIVERED,
                    OrderStatus.RETURN_REQUESTED, "Damaged cover", ReturnType.REPLACEMENT), now);

            assertThat(delivered.getReturnType()).isEqualTo(ReturnType.REPLACEMENT);
            assertThat(delivered.getReturnReason()).isEqualTo("Damaged cover");
            assertThat(delivered.getTracking().getReturnRequested()).isEqualTo(now);
        }

        @Test
        @DisplayName("Re-entering Processing after a replacement keeps the first confirmation time")
        void replacement_keepsFirstMilestone() {
            LocalDateTime first = now.minusDays(10);
            order.applyTransition(transition(OrderAction.CONFIRM, OrderStatus.PENDING_CONFIRMATION,
                    OrderStatus.PROCESSING, null, null), first);

            inStatus(order, OrderStatus.REPLACEMENT_CONFIRMED);
            order.applyTransition(transition(OrderAction.ADVANCE, OrderStatus.REPLACEMENT_CONFIRMED,
                    OrderStatus.PROCESSING, null, ReturnType.REPLACEMENT), now);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.PROCESSING);
            assertThat(order.getTracking().getConfirmed()).isEqualTo(first);
        }

        @Test
        void staleTransition_isRefused() {
            OrderTransition stale = transition(OrderAction.ADVANCE, OrderStatus.PACKED, OrderStatus.SHIPPED, null,
                    null);

            assertThrows(IllegalStateException.class, () -> order.applyTransition(stale, now));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_CONFIRMATION);
        }
    }

    @Test
    @DisplayName("A built order starts pending confirmation with an unpaid fee and no milestones")
    void builder_startsAtInitialLifecycleState() {
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_CONFIRMATION);
        assertThat(order.isDeliveryFeePaid()).isFalse();
        assertThat(order.getReturnType()).isNull();
        assertThat(order.getTracking().getConfirmed()).isNull();
        assertThat(order.getTracking().getExpectedDelivery()).isNull();
    }

    @Test
    @DisplayName("The builder offers no way to set lifecycle fields")
    void builder_hasNoLifecycleSetters() {
        assertThat(Arrays.stream(Order.OrderBuilder.class.getMethods()).map(Method::getName))
                .doesNotContain("status", "deliveryFeePaid", "tracking", "returnType", "rejectionReason",
                        "returnReason", "cancellationReason", "version");
    }

    @Test
    void builder_defaultsDeliveryChargeAndAltMobiles() {
        Order bare = Order.builder().build();

        assertThat(bare.getDeliveryCharge()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(bare.getAltMobiles()).isEmpty();
    }

    @Test
    void markDeliveryFeePaid_isOneWay() {
        assertThat(order.markDeliveryFeePaid()).isTrue();
        assertThat(order.markDeliveryFeePaid()).isFalse();
        assertThat(order.isDeliveryFeePaid()).isTrue();
    }

    @Test
    void expectedDelivery_isSetOnce() {
        LocalDate first = LocalDate.of(2025, 5, 10);

        assertThat(order.scheduleExpectedDelivery(first)).isTrue();
        assertThat(order.scheduleExpectedDelivery(first.plusDays(3))).isFalse();
        assertThat(order.getTracking().getExpectedDelivery()).isEqualTo(first);
    }

    @Test
    void lineTotal_multipliesPriceByQuantity() {
        assertThat(order.getLineTotal()).isEqualByComparingTo("240.00");
    }

    private static OrderTransition transition(OrderAction action, OrderStatus from, OrderStatus to, String reason,
            ReturnType returnType) {
        return OrderTransition.builder()
                .action(action)
                .from(from)
                .to(to)
                .reason(reason)
                .returnType(returnType)
                .build();
    }
}

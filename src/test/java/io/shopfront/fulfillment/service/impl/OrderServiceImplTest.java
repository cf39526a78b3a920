package io.shopfront.fulfillment.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.shopfront.fulfillment.delivery.DeliveryChargeQuote;
import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.CheckoutClaim;
import io.shopfront.fulfillment.domain.DeliveryTierSet;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderCategory;
import io.shopfront.fulfillment.domain.OrderStatus;
import io.shopfront.fulfillment.domain.PrintJobConfig;
import io.shopfront.fulfillment.domain.ShippingAddress;
import io.shopfront.fulfillment.dto.CheckoutItemRequestDTO;
import io.shopfront.fulfillment.dto.CheckoutRequestDTO;
import io.shopfront.fulfillment.exception.ActionNotPermittedException;
import io.shopfront.fulfillment.exception.OrderGroupNotFoundException;
import io.shopfront.fulfillment.exception.OrderNotFoundException;
import io.shopfront.fulfillment.exception.OrderValidationException;
import io.shopfront.fulfillment.exception.PartialGroupFailureException;
import io.shopfront.fulfillment.exception.StatusConflictException;
import io.shopfront.fulfillment.mapper.OrderMapper;
import io.shopfront.fulfillment.repository.CheckoutClaimRepository;
import io.shopfront.fulfillment.repository.OrderRepository;
import io.shopfront.fulfillment.service.DeliveryChargeService;
import io.shopfront.fulfillment.service.GroupSettlementResult;
import lombok.extern.slf4j.Slf4j;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@Slf4j
public class OrderServiceImplTest {
    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderMapper orderMapper;

    @Mock
    private DeliveryChargeService deliveryChargeService;

    @Mock
    private OrderStatusGuard statusGuard;

    @Mock
    private CheckoutClaimRepository checkoutClaimRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<List<Order>> ordersCaptor;

    private MeterRegistry meterRegistry = new SimpleMeterRegistry();

    private OrderServiceImpl orderService;

    private final String CHECKOUT_KEY = UUID.randomUUID().toString();

    @BeforeEach
    public void setUp() {
        orderService = new OrderServiceImpl(orderRepository, orderMapper, deliveryChargeService, statusGuard,
                checkoutClaimRepository, transactionManager, meterRegistry);

        when(orderMapper.toEntity(any(CheckoutItemRequestDTO.class))).thenAnswer(invocation -> {
            CheckoutItemRequestDTO item = invocation.getArgument(0);
            return Order.builder()
                    .sellerId(item.getSellerId())
                    .category(item.getCategory())
                    .productId(item.getProductId())
                    .productName(item.getProductName())
                    .printJob(item.getPrintJob())
                    .quantity(item.getQuantity())
                    .price(item.getPrice())
                    .build();
        });
        when(checkoutClaimRepository.findByCheckoutKey(any())).thenReturn(Optional.empty());
        when(checkoutClaimRepository.saveAndFlush(any(CheckoutClaim.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(orderRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Nested
    @DisplayName("createOrderGroup")
    class CreateOrderGroupTests {

        @Test
        @DisplayName("Should save one pending order per line with a shared group and split delivery fees")
        void createOrderGroup_success() {
            when(deliveryChargeService.quote(eq(DeliveryTierSet.ITEM), any(BigDecimal.class)))
                    .thenReturn(DeliveryChargeQuote.builder().charge(new BigDecimal("20")).build());
            when(deliveryChargeService.quote(eq(DeliveryTierSet.PRINT_JOB), any(BigDecimal.class)))
                    .thenReturn(DeliveryChargeQuote.builder().charge(new BigDecimal("15")).build());

            CheckoutRequestDTO request = checkout(
                    product("seller-a", "book-1", 1, "300"),
                    product("seller-b", "pen-1", 4, "100"),
                    xerox("seller-b", "2.50"));

            UUID groupId = orderService.createOrderGroup(request, CHECKOUT_KEY);

            verify(orderRepository).saveAll(ordersCaptor.capture());
            List<Order> saved = ordersCaptor.getValue();

            assertThat(saved).hasSize(3);
            assertThat(saved).allSatisfy(order -> {
                assertThat(order.getGroupId()).isEqualTo(groupId);
                assertThat(order.getCheckoutKey()).isEqualTo(CHECKOUT_KEY);
                assertThat(order.getUserId()).isEqualTo("user-1");
                assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_CONFIRMATION);
                assertThat(order.isDeliveryFeePaid()).isFalse();
                assertThat(order.getShippingAddress().getCity()).isEqualTo("Pune");
            });
            assertThat(saved.get(0).getDeliveryCharge()).isEqualByComparingTo("10");
            assertThat(saved.get(1).getDeliveryCharge()).isEqualByComparingTo("10");
            assertThat(saved.get(2).getDeliveryCharge()).isEqualByComparingTo("15");

            verify(deliveryChargeService).quote(DeliveryTierSet.ITEM, new BigDecimal("700"));
            verify(deliveryChargeService).quote(DeliveryTierSet.PRINT_JOB, new BigDecimal("2.50"));
        }

        @Test
        @DisplayName("Should not price print jobs when the cart has none")
        void createOrderGroup_productsOnly() {
            when(deliveryChargeService.quote(eq(DeliveryTierSet.ITEM), any(BigDecimal.class)))
                    .thenReturn(DeliveryChargeQuote.free());

            orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")), null);

            verify(deliveryChargeService, never()).quote(eq(DeliveryTierSet.PRINT_JOB), any());
        }

        @Test
        @DisplayName("Should return the existing group for a checkout key it has already seen")
        void createOrderGroup_duplicateKey() {
            UUID existingGroup = UUID.randomUUID();
            when(checkoutClaimRepository.findByCheckoutKey(CHECKOUT_KEY))
                    .thenReturn(Optional.of(claim(existingGroup)));

            UUID groupId = orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")),
                    CHECKOUT_KEY);

            assertThat(groupId).isEqualTo(existingGroup);
            verify(checkoutClaimRepository, never()).saveAndFlush(any(CheckoutClaim.class));
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        @DisplayName("Should claim the checkout key for the group it creates")
        void createOrderGroup_claimsKey() {
            when(deliveryChargeService.quote(eq(DeliveryTierSet.ITEM), any(BigDecimal.class)))
                    .thenReturn(DeliveryChargeQuote.free());
            ArgumentCaptor<CheckoutClaim> claimCaptor = ArgumentCaptor.forClass(CheckoutClaim.class);

            UUID groupId = orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")),
                    CHECKOUT_KEY);

            verify(checkoutClaimRepository).saveAndFlush(claimCaptor.capture());
            assertThat(claimCaptor.getValue().getCheckoutKey()).isEqualTo(CHECKOUT_KEY);
            assertThat(claimCaptor.getValue().getGroupId()).isEqualTo(groupId);
        }

        @Test
        @DisplayName("Should return the winning group when a concurrent checkout claims the key first")
        void createOrderGroup_keyClaimedConcurrently() {
            UUID winningGroup = UUID.randomUUID();
            when(checkoutClaimRepository.findByCheckoutKey(CHECKOUT_KEY))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(claim(winningGroup)));
            when(checkoutClaimRepository.saveAndFlush(any(CheckoutClaim.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_checkout_claim_key"));

            UUID groupId = orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")),
                    CHECKOUT_KEY);

            assertThat(groupId).isEqualTo(winningGroup);
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        @DisplayName("Should retry the claim while a concurrent claim is uncommitted and then adopt its group")
        void createOrderGroup_claimInFlight() {
            UUID winningGroup = UUID.randomUUID();
            when(checkoutClaimRepository.findByCheckoutKey(CHECKOUT_KEY))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(claim(winningGroup)));
            when(checkoutClaimRepository.saveAndFlush(any(CheckoutClaim.class)))
                    .thenThrow(new CannotAcquireLockException("checkout_claims"));

            UUID groupId = orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")),
                    CHECKOUT_KEY);

            assertThat(groupId).isEqualTo(winningGroup);
            verify(checkoutClaimRepository, times(1)).saveAndFlush(any(CheckoutClaim.class));
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        void createOrderGroup_claimNeverSettles() {
            when(checkoutClaimRepository.saveAndFlush(any(CheckoutClaim.class)))
                    .thenThrow(new CannotAcquireLockException("checkout_claims"));

            assertThrows(CannotAcquireLockException.class,
                    () -> orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")),
                            CHECKOUT_KEY));
            verify(checkoutClaimRepository, times(5)).saveAndFlush(any(CheckoutClaim.class));
        }

        @Test
        @DisplayName("Should rethrow a constraint failure that no claim explains")
        void createOrderGroup_integrityFailureWithoutClaim() {
            when(checkoutClaimRepository.saveAndFlush(any(CheckoutClaim.class)))
                    .thenThrow(new DataIntegrityViolationException("orders_pkey"));

            assertThrows(DataIntegrityViolationException.class,
                    () -> orderService.createOrderGroup(checkout(product("seller-a", "book-1", 1, "300")),
                            CHECKOUT_KEY));
        }

        @Test
        void createOrderGroup_missingMobile() {
            CheckoutRequestDTO request = checkout(product("seller-a", "book-1", 1, "300"));
            request.setMobile(" ");

            OrderValidationException exception = assertThrows(OrderValidationException.class,
                    () -> orderService.createOrderGroup(request, CHECKOUT_KEY));

            assertThat(exception.getMessage()).contains("mobile");
            verify(checkoutClaimRepository, never()).saveAndFlush(any(CheckoutClaim.class));
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        void createOrderGroup_addressWithoutCity() {
            CheckoutRequestDTO request = checkout(product("seller-a", "book-1", 1, "300"));
            request.getShippingAddress().setCity("");

            OrderValidationException exception = assertThrows(OrderValidationException.class,
                    () -> orderService.createOrderGroup(request, null));

            assertThat(exception.getMessage()).contains("city");
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        void createOrderGroup_addressWithoutType() {
            CheckoutRequestDTO request = checkout(product("seller-a", "book-1", 1, "300"));
            request.getShippingAddress().setType(null);

            assertThrows(OrderValidationException.class, () -> orderService.createOrderGroup(request, null));
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        void createOrderGroup_addressWithoutPostalCode() {
            CheckoutRequestDTO request = checkout(product("seller-a", "book-1", 1, "300"));
            request.getShippingAddress().setPostalCode(null);

            OrderValidationException exception = assertThrows(OrderValidationException.class,
                    () -> orderService.createOrderGroup(request, null));

            assertThat(exception.getMessage()).contains("postal code");
        }

        @Test
        void createOrderGroup_emptyCart() {
            CheckoutRequestDTO request = checkout();

            assertThrows(OrderValidationException.class, () -> orderService.createOrderGroup(request, null));
            verify(orderRepository, never()).saveAll(anyList());
        }

        @Test
        void createOrderGroup_printJobWithoutConfiguration() {
            CheckoutItemRequestDTO item = xerox("seller-a", "2.00");
            item.setPrintJob(null);

            assertThrows(OrderValidationException.class,
                    () -> orderService.createOrderGroup(checkout(item), null));
            verifyNoInteractions(deliveryChargeService);
        }

        @Test
        void createOrderGroup_zeroQuantity() {
            assertThrows(OrderValidationException.class,
                    () -> orderService.createOrderGroup(checkout(product("seller-a", "book-1", 0, "300")), null));
        }

        @Test
        void createOrderGroup_productWithoutReference() {
            assertThrows(OrderValidationException.class,
                    () -> orderService.createOrderGroup(checkout(product("seller-a", " ", 1, "300")), null));
        }
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        void findByOrderId_notFound() {
            UUID orderId = UUID.randomUUID();
            when(orderRepository.findById(orderId)).thenReturn(Optional.empty());

            assertThrows(OrderNotFoundException.class, () -> orderService.findByOrderId(orderId));
        }

        @Test
        void getOrdersByGroup_unknownGroup() {
            UUID groupId = UUID.randomUUID();
            when(orderRepository.findByGroupIdOrderByCreatedAtAsc(groupId)).thenReturn(Collections.emptyList());

            assertThrows(OrderGroupNotFoundException.class, () -> orderService.getOrdersByGroup(groupId));
        }
    }

    @Nested
    @DisplayName("markGroupDeliveryFeePaid")
    class SettlementTests {
        private final UUID groupId = UUID.randomUUID();
        private Order first;
        private Order second;
        private Order paid;

        @BeforeEach
        void setUpGroup() {
            first = Order.builder().id(UUID.randomUUID()).groupId(groupId).build();
            second = Order.builder().id(UUID.randomUUID()).groupId(groupId).build();
            paid = Order.builder().id(UUID.randomUUID()).groupId(groupId).build();
            paid.markDeliveryFeePaid();

            when(orderRepository.findByGroupIdOrderByCreatedAtAsc(groupId))
                    .thenReturn(Arrays.asList(first, second, paid));
        }

        @Test
        @DisplayName("Should mark unpaid members and skip those already paid")
        @SuppressWarnings("unchecked")
        void settle_skipsPaidMembers() {
            when(statusGuard.update(any(UUID.class), any(Predicate.class))).thenReturn(first);

            GroupSettlementResult result = orderService.markGroupDeliveryFeePaid(groupId, ActorRole.SELLER);

            assertThat(result.getPaidOrderIds()).containsExactly(first.getId(), second.getId());
            assertThat(result.getAlreadyPaidOrderIds()).containsExactly(paid.getId());
            verify(statusGuard, times(2)).update(any(UUID.class), any(Predicate.class));
            verify(statusGuard, never()).update(eq(paid.getId()), any(Predicate.class));
        }

        @Test
        @DisplayName("Should attempt every member and report which ones failed")
        @SuppressWarnings("unchecked")
        void settle_partialFailure() {
            when(statusGuard.update(eq(first.getId()), any(Predicate.class)))
                    .thenThrow(new StatusConflictException(first.getId(), OrderStatus.PENDING_CONFIRMATION,
                            OrderStatus.PROCESSING, false));
            when(statusGuard.update(eq(second.getId()), any(Predicate.class))).thenReturn(second);

            PartialGroupFailureException exception = assertThrows(PartialGroupFailureException.class,
                    () -> orderService.markGroupDeliveryFeePaid(groupId, ActorRole.ADMIN));

            assertThat(exception.getFailedOrderIds()).containsExactly(first.getId());
            assertThat(exception.getSucceededOrderIds()).containsExactlyInAnyOrder(second.getId(), paid.getId());
            verify(statusGuard).update(eq(second.getId()), any(Predicate.class));
        }

        @Test
        void settle_customerNotPermitted() {
            assertThrows(ActionNotPermittedException.class,
                    () -> orderService.markGroupDeliveryFeePaid(groupId, ActorRole.CUSTOMER));

            verifyNoInteractions(statusGuard);
        }
    }

    private static CheckoutRequestDTO checkout(CheckoutItemRequestDTO... items) {
        return CheckoutRequestDTO.builder()
                .userId("user-1")
                .mobile("9999999999")
                .shippingAddress(ShippingAddress.builder()
                        .type(ShippingAddress.AddressType.HOME)
                        .line1("12 Main Road")
                        .city("Pune")
                        .state("MH")
                        .postalCode("411001")
                        .build())
                .items(Arrays.asList(items))
                .build();
    }

    private CheckoutClaim claim(UUID groupId) {
        return CheckoutClaim.builder().checkoutKey(CHECKOUT_KEY).groupId(groupId).build();
    }

    private static CheckoutItemRequestDTO product(String sellerId, String productId, int quantity, String price) {
        return CheckoutItemRequestDTO.builder()
                .sellerId(sellerId)
                .category(OrderCategory.STATIONARY)
                .productId(productId)
                .productName("Item " + productId)
                .quantity(quantity)
                .price(new BigDecimal(price))
                .build();
    }

    private static CheckoutItemRequestDTO xerox(String sellerId, String price) {
        return CheckoutItemRequestDTO.builder()
                .sellerId(sellerId)
                .category(OrderCategory.XEROX)
                .productName("Print job")
                .printJob(PrintJobConfig.builder().paperType("A4").colorOption("BW").pageCount(10).copies(1)
                        .build())
                .quantity(1)
                .price(new BigDecimal(price))
                .build();
    }
}

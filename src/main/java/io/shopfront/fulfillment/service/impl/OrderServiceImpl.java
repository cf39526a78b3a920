package io.shopfront.fulfillment.service.impl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import io.shopfront.fulfillment.delivery.DeliveryChargeCalculator;
import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.CheckoutClaim;
import io.shopfront.fulfillment.domain.DeliveryTierSet;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.ShippingAddress;
import io.shopfront.fulfillment.dto.CheckoutItemRequestDTO;
import io.shopfront.fulfillment.dto.CheckoutRequestDTO;
import io.shopfront.fulfillment.exception.ActionNotPermittedException;
import io.shopfront.fulfillment.exception.OrderGroupNotFoundException;
import io.shopfront.fulfillment.exception.OrderNotFoundException;
import io.shopfront.fulfillment.exception.OrderValidationException;
import io.shopfront.fulfillment.exception.PartialGroupFailureException;
import io.shopfront.fulfillment.mapper.OrderMapper;
import io.shopfront.fulfillment.repository.CheckoutClaimRepository;
import io.shopfront.fulfillment.repository.OrderRepository;
import io.shopfront.fulfillment.service.DeliveryChargeService;
import io.shopfront.fulfillment.service.GroupSettlementResult;
import io.shopfront.fulfillment.service.OrderService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderService} interface.
 * Handles checkout intake, order retrieval and group delivery-fee settlement.
 */
@Service
@Slf4j
public class OrderServiceImpl implements OrderService {
    private static final String SETTLE_DELIVERY_FEE = "SETTLE_DELIVERY_FEE";
    private static final int MAX_CLAIM_ATTEMPTS = 5;
    private static final long CLAIM_RETRY_PAUSE_MS = 50;
    private static final Set<ActorRole> SETTLEMENT_ROLES = EnumSet.of(ActorRole.SELLER, ActorRole.EMPLOYEE,
            ActorRole.ADMIN);

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final DeliveryChargeService deliveryChargeService;
    private final OrderStatusGuard statusGuard;
    private final CheckoutClaimRepository checkoutClaimRepository;
    private final TransactionTemplate checkoutTemplate;
    private final TransactionTemplate claimReadTemplate;
    private final MeterRegistry meterRegistry;

    private Timer checkoutTimer;

    /**
     * Constructs an instance of {@code OrderServiceImpl}.
     *
     * @param orderRepository       The repository for order data access.
     * @param orderMapper           The mapper for converting between DTOs and
     *                              entities.
     * @param deliveryChargeService Computes the group's delivery fees.
     * @param statusGuard           Conditional writes for fee settlement.
     * @param checkoutClaimRepository Claims checkout keys.
     * @param transactionManager    Runs checkout writes in their own
     *                              transaction.
     * @param meterRegistry         The registry for collecting metrics.
     */
    public OrderServiceImpl(OrderRepository orderRepository, OrderMapper orderMapper,
            DeliveryChargeService deliveryChargeService, OrderStatusGuard statusGuard,
            CheckoutClaimRepository checkoutClaimRepository, PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;
        this.orderMapper = orderMapper;
        this.deliveryChargeService = deliveryChargeService;
        this.statusGuard = statusGuard;
        this.checkoutClaimRepository = checkoutClaimRepository;
        this.meterRegistry = meterRegistry;

        this.checkoutTemplate = new TransactionTemplate(transactionManager);
        this.checkoutTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.claimReadTemplate = new TransactionTemplate(transactionManager);
        this.claimReadTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.claimReadTemplate.setReadOnly(true);

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Validates the checkout, prices delivery once for product lines and once for
     * print jobs, and saves every order in one transaction.
     * <p>
     * A non-null {@code checkoutKey} is claimed in the same transaction as the
     * orders. A repeated key, including one racing this call, returns the group
     * the first checkout created. While a racing claim is still uncommitted the
     * claim is retried a few times.
     * </p>
     *
     * @throws OrderValidationException if the checkout has no lines or a line is
     *                                  malformed.
     */
    @Override
    public UUID createOrderGroup(CheckoutRequestDTO request, String checkoutKey) {
        return this.checkoutTimer.record(() -> {
            if (checkoutKey == null) {
                validateCheckout(request);
                return checkoutTemplate.execute(status -> saveOrderGroup(request, null));
            }

            for (int attempt = 1;; attempt++) {
                Optional<UUID> existing = claimedGroup(checkoutKey);
                if (existing.isPresent()) {
                    log.info("Checkout key {} already created group {}, returning it", checkoutKey,
                            existing.get());
                    return existing.get();
                }

                validateCheckout(request);

                try {
                    return checkoutTemplate.execute(status -> saveOrderGroup(request, checkoutKey));
                } catch (DataIntegrityViolationException e) {
                    UUID winner = claimedGroup(checkoutKey).orElseThrow(() -> e);
                    log.info("Checkout key {} was claimed concurrently by group {}, returning it", checkoutKey,
                            winner);
                    return winner;
                } catch (ConcurrencyFailureException e) {
                    // the competing claim is not committed yet
                    if (attempt >= MAX_CLAIM_ATTEMPTS) {
                        throw e;
                    }
                    log.debug("Checkout key {} is being claimed concurrently (attempt {} of {}): {}", checkoutKey,
                            attempt, MAX_CLAIM_ATTEMPTS, e.getMessage());
                    pauseBeforeRetry(attempt, e);
                }
            }
        });
    }

    private static void pauseBeforeRetry(int attempt, ConcurrencyFailureException cause) {
        try {
            Thread.sleep(CLAIM_RETRY_PAUSE_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }

    private UUID saveOrderGroup(CheckoutRequestDTO request, String checkoutKey) {
        UUID groupId = UUID.randomUUID();
        log.info("Creating order group {} with {} lines for user {} (checkout key {})", groupId,
                request.getItems().size(), request.getUserId(), checkoutKey);

        if (checkoutKey != null) {
            checkoutClaimRepository.saveAndFlush(CheckoutClaim.builder()
                    .checkoutKey(checkoutKey)
                    .groupId(groupId)
                    .build());
        }

        List<Order> orders = request.getItems().stream()
                .map(item -> {
                    Order order = orderMapper.toEntity(item);
                    order.setGroupId(groupId);
                    order.setCheckoutKey(checkoutKey);
                    order.setUserId(request.getUserId());
                    order.setShippingAddress(request.getShippingAddress());
                    order.setMobile(request.getMobile());
                    order.setAltMobiles(request.getAltMobiles() == null ? new ArrayList<>()
                            : new ArrayList<>(request.getAltMobiles()));
                    return order;
                })
                .collect(Collectors.toList());

        applyDeliveryCharges(orders.stream().filter(order -> !order.getCategory().isPrintJob())
                .collect(Collectors.toList()), DeliveryTierSet.ITEM);
        applyDeliveryCharges(orders.stream().filter(order -> order.getCategory().isPrintJob())
                .collect(Collectors.toList()), DeliveryTierSet.PRINT_JOB);

        List<Order> saved = orderRepository.saveAll(orders);
        log.info("Order group {} saved with {} orders", groupId, saved.size());

        return groupId;
    }

    private Optional<UUID> claimedGroup(String checkoutKey) {
        return Optional.ofNullable(claimReadTemplate.execute(status -> checkoutClaimRepository
                .findByCheckoutKey(checkoutKey)
                .map(CheckoutClaim::getGroupId)
                .orElse(null)));
    }

    /**
     * Finds an order by its unique identifier (UUID).
     *
     * @param orderId The UUID of the order to find.
     * @return The {@link Order} entity if found.
     * @throws OrderNotFoundException If no order is found with the given ID.
     */
    @Override
    @Transactional(readOnly = true)
    public Order findByOrderId(UUID orderId) {
        log.debug("Attempting to find order by ID: {}", orderId);

        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found for ID: {}", orderId);
                    return new OrderNotFoundException(orderId);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> getOrdersByGroup(UUID groupId) {
        List<Order> orders = orderRepository.findByGroupIdOrderByCreatedAtAsc(groupId);
        if (orders.isEmpty()) {
            log.warn("No orders found for group ID: {}", groupId);
            throw new OrderGroupNotFoundException(groupId);
        }
        return orders;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> getOrdersBySeller(String sellerId) {
        log.debug("Attempting to find orders for seller {}", sellerId);

        return orderRepository.findBySellerIdOrderByCreatedAtDesc(sellerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> getOrdersByUser(String userId) {
        log.debug("Attempting to find orders for user {}", userId);

        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Retrieves a paginated list of all orders from the database.
     *
     * @param pageable The pagination information (page number, size, sort).
     * @return A {@link Page} containing the {@link Order} entities for the
     *         requested page.
     */
    @Override
    @Transactional(readOnly = true)
    public Page<Order> findAll(Pageable pageable) {
        log.debug("Attempting to find all orders with pagination: {}", pageable);

        return orderRepository.findAll(pageable);
    }

    /**
     * Each order is written on its own, so one failing order does not undo the
     * others. Failures are collected and reported together once every order has
     * been attempted.
     */
    @Override
    public GroupSettlementResult markGroupDeliveryFeePaid(UUID groupId, ActorRole role) {
        if (role == null || !SETTLEMENT_ROLES.contains(role)) {
            throw new ActionNotPermittedException(SETTLE_DELIVERY_FEE, role);
        }

        List<Order> members = getOrdersByGroup(groupId);

        List<UUID> paid = new ArrayList<>();
        List<UUID> alreadyPaid = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();

        for (Order member : members) {
            if (member.isDeliveryFeePaid()) {
                alreadyPaid.add(member.getId());
                continue;
            }

            try {
                statusGuard.update(member.getId(), Order::markDeliveryFeePaid);
                paid.add(member.getId());
            } catch (RuntimeException e) {
                log.error("Failed to mark delivery fee paid for order {} of group {}: {}", member.getId(), groupId,
                        e.getMessage(), e);
                failed.add(member.getId());
            }
        }

        if (!failed.isEmpty()) {
            List<UUID> succeeded = new ArrayList<>(alreadyPaid);
            succeeded.addAll(paid);
            throw new PartialGroupFailureException(groupId, succeeded, failed);
        }

        log.info("Delivery fee of group {} settled by {}: {} orders marked paid, {} already paid", groupId, role,
                paid.size(), alreadyPaid.size());

        return new GroupSettlementResult(groupId, paid, alreadyPaid);
    }

    private void applyDeliveryCharges(List<Order> orders, DeliveryTierSet tierSet) {
        if (orders.isEmpty()) {
            return;
        }

        BigDecimal subtotal = orders.stream()
                .map(Order::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal fee = deliveryChargeService.quote(tierSet, subtotal).getCharge();
        List<BigDecimal> shares = DeliveryChargeCalculator.splitEvenly(fee, orders.size());

        for (int i = 0; i < orders.size(); i++) {
            orders.get(i).setDeliveryCharge(shares.get(i));
        }

        log.debug("{} delivery fee {} for subtotal {} split over {} orders", tierSet, fee, subtotal, orders.size());
    }

    private void validateCheckout(CheckoutRequestDTO request) {
        if (request == null || request.getItems() == null || request.getItems().isEmpty()) {
            throw new OrderValidationException("Checkout must have at least one item");
        }
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new OrderValidationException("Checkout must name the customer");
        }
        if (request.getMobile() == null || request.getMobile().isBlank()) {
            throw new OrderValidationException("Checkout must have a mobile number");
        }
        validateAddress(request.getShippingAddress());

        for (CheckoutItemRequestDTO item : request.getItems()) {
            if (item.getSellerId() == null || item.getSellerId().isBlank()) {
                throw new OrderValidationException("Every checkout item must name its seller");
            }
            if (item.getCategory() == null) {
                throw new OrderValidationException("Every checkout item must have a category");
            }
            if (item.getQuantity() == null || item.getQuantity() < 1) {
                throw new OrderValidationException("Quantity must be at least 1, got " + item.getQuantity());
            }
            if (item.getPrice() == null || item.getPrice().signum() < 0) {
                throw new OrderValidationException("Price must be zero or positive, got " + item.getPrice());
            }
            if (item.getCategory().isPrintJob() && item.getPrintJob() == null) {
                throw new OrderValidationException("Print jobs must carry a print configuration");
            }
            if (!item.getCategory().isPrintJob() && (item.getProductId() == null || item.getProductId().isBlank())) {
                throw new OrderValidationException("Product items must reference a product");
            }
        }
    }

    private void validateAddress(ShippingAddress address) {
        if (address == null) {
            throw new OrderValidationException("Checkout must have a shipping address");
        }
        if (address.getType() == null) {
            throw new OrderValidationException("Shipping address must have a type");
        }
        requireText(address.getLine1(), "Shipping address line 1");
        requireText(address.getCity(), "Shipping address city");
        requireText(address.getState(), "Shipping address state");
        requireText(address.getPostalCode(), "Shipping address postal code");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new OrderValidationException(field + " cannot be blank");
        }
    }

    /**
     * Initializes the Micrometer metrics for the order service.
     * Registers a timer for checkout duration.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.checkoutTimer = Timer.builder("orders.checkout.time")
                .description("Time taken to turn a checkout into an order group")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }
}

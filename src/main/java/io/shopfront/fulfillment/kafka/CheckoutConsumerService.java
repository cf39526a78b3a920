package io.shopfront.fulfillment.kafka;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import io.shopfront.fulfillment.dto.CheckoutRequestDTO;
import io.shopfront.fulfillment.service.OrderService;
import io.shopfront.fulfillment.util.KafkaUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Service responsible for consuming checkouts from the checkouts topic.
 * It suppresses duplicate deliveries with a Redis marker per idempotency key
 * and delegates order group creation to the {@link OrderService}.
 */
@Service
@Slf4j
public class CheckoutConsumerService {
    private final OrderService orderService;
    private final StringRedisTemplate redisTemplate;
    private final MeterRegistry meterRegistry;

    private Counter receivedCheckoutsCounter;
    private Counter processedCheckoutsCounter;
    private Counter failedCheckoutsCounter;
    private Counter duplicateCheckoutsCounter;

    /**
     * Constructs an instance of {@code CheckoutConsumerService}.
     *
     * @param orderService  The service that creates order groups.
     * @param redisTemplate The Spring Redis template used for idempotency
     *                      markers.
     * @param meterRegistry The registry for collecting metrics.
     */
    public CheckoutConsumerService(OrderService orderService, StringRedisTemplate redisTemplate,
            MeterRegistry meterRegistry) {
        this.orderService = orderService;
        this.redisTemplate = redisTemplate;
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Kafka listener method for the checkouts topic.
     * If the idempotency key is new it delegates to
     * {@link OrderService#createOrderGroup}; a key that is being or has been
     * processed is skipped.
     *
     * @param checkout       The deserialized checkout payload.
     * @param idempotencyKey The idempotency key from the message headers.
     * @throws RuntimeException If creating the group fails (re-thrown to trigger
     *                          Kafka retries and the DLT).
     */
    @KafkaListener(topics = "${app.kafka.checkouts-topic}", groupId = "${spring.kafka.consumer.group-id}")
    public void listen(@Payload CheckoutRequestDTO checkout,
            @Header(name = KafkaUtils.IDEMPOTENCY_KEY_HEADER, required = true) String idempotencyKey) {
        log.info("Received checkout with idempotency key {}", idempotencyKey);

        receivedCheckoutsCounter.increment();

        String redisKey = KafkaUtils.IDEMPOTENCY_KEY_PREFIX + idempotencyKey;

        Boolean lockAcquired = redisTemplate.opsForValue().setIfAbsent(redisKey,
                KafkaUtils.PROCESSING_STATUS, KafkaUtils.PROCESSING_TTL);

        if (Boolean.FALSE.equals(lockAcquired)) {
            duplicateCheckoutsCounter.increment();
            handleExistingKey(idempotencyKey, redisKey);
            return;
        }

        try {
            orderService.createOrderGroup(checkout, idempotencyKey);
            redisTemplate.opsForValue().set(redisKey, KafkaUtils.PROCESSED_STATUS, KafkaUtils.PROCESSED_TTL);
            processedCheckoutsCounter.increment();
        } catch (RuntimeException e) {
            log.error("Error processing checkout for idempotency key {}: {}", idempotencyKey, e.getMessage(), e);
            failedCheckoutsCounter.increment();
            // a retry must be able to take the marker again
            redisTemplate.delete(redisKey);
            throw e;
        }
    }

    private void handleExistingKey(String idempotencyKey, String redisKey) {
        String currentStatus = redisTemplate.opsForValue().get(redisKey);

        if (KafkaUtils.PROCESSED_STATUS.equals(currentStatus)) {
            log.info("Checkout with idempotency key {} already processed, skipping", idempotencyKey);
        } else if (KafkaUtils.PROCESSING_STATUS.equals(currentStatus)) {
            // the delivery that set the marker, or its retries, owns this checkout
            log.warn("Skipping checkout {} as it is already marked as PROCESSING", idempotencyKey);
        } else {
            log.error("Skipping checkout {} due to unexpected status in Redis: {}", idempotencyKey, currentStatus);
        }
    }

    private void initializeMetrics(MeterRegistry registry) {
        this.receivedCheckoutsCounter = Counter.builder("checkouts.received")
                .description("Total number of checkouts received from Kafka")
                .register(registry);
        this.processedCheckoutsCounter = Counter.builder("checkouts.processed")
                .description("Total number of checkouts turned into order groups")
                .register(registry);
        this.failedCheckoutsCounter = Counter.builder("checkouts.failed")
                .description("Total number of checkout attempts that failed (before DLT)")
                .tag("reason", "processing_exception")
                .register(registry);
        this.duplicateCheckoutsCounter = Counter.builder("checkouts.duplicates")
                .description("Total number of redelivered checkouts skipped by idempotency key")
                .register(registry);
    }
}

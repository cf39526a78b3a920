package io.shopfront.fulfillment.kafka;

import java.nio.charset.StandardCharsets;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.shopfront.fulfillment.dto.CheckoutRequestDTO;
import io.shopfront.fulfillment.util.KafkaUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Service responsible for consuming checkouts from the Dead Letter Topic (DLT).
 * A checkout ends up here after the main consumer exhausted its retries. Nothing
 * was written for it, so the service logs the failure and releases the
 * idempotency marker, allowing the checkout to be submitted again.
 */
@Service
@Slf4j
public class DltConsumerService {
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private Counter dltMessagesReceivedCounter;
    private Counter dltMarkersReleasedCounter;
    private Counter dltProcessingErrorsCounter;

    /**
     * Constructs an instance of {@code DltConsumerService}.
     *
     * @param redisTemplate The Spring Redis template holding idempotency markers.
     * @param objectMapper  The Jackson object mapper for reading the payload.
     * @param meterRegistry The registry for collecting metrics.
     */
    public DltConsumerService(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Kafka listener method for the DLT topic.
     *
     * @param consumerRecord The failed checkout with the DLT failure headers.
     */
    @KafkaListener(topics = "${app.kafka.dlt-checkouts-topic}", groupId = "${spring.kafka.consumer.group-id}-dlt", containerFactory = "dltKafkaListenerContainerFactory")
    public void listen(ConsumerRecord<String, byte[]> consumerRecord) {
        dltMessagesReceivedCounter.increment();

        String idempotencyKey = getHeaderValue(consumerRecord.headers(), KafkaUtils.IDEMPOTENCY_KEY_HEADER);
        String failureReason = getFailureReasonFromHeaders(consumerRecord.headers());
        CheckoutRequestDTO checkout = tryToDeserializePayload(consumerRecord.value());

        log.error("Checkout with idempotency key {} for user {} moved to DLT: {}", idempotencyKey,
                checkout == null ? "<unreadable>" : checkout.getUserId(), failureReason);

        if (idempotencyKey == null) {
            log.error("Cannot release the idempotency marker, key header missing from DLT message");
            return;
        }

        releaseMarker(idempotencyKey);
    }

    /**
     * Deletes the marker unless the checkout was processed after all, e.g. by a
     * concurrent redelivery.
     */
    private void releaseMarker(String idempotencyKey) {
        String redisKey = KafkaUtils.IDEMPOTENCY_KEY_PREFIX + idempotencyKey;

        try {
            String status = redisTemplate.opsForValue().get(redisKey);
            if (KafkaUtils.PROCESSED_STATUS.equals(status)) {
                log.warn("Checkout {} is marked PROCESSED, keeping its idempotency marker", idempotencyKey);
                return;
            }

            redisTemplate.delete(redisKey);
            dltMarkersReleasedCounter.increment();
            log.info("Released idempotency marker for checkout {}", idempotencyKey);
        } catch (DataAccessException e) {
            log.error("Redis error while releasing idempotency marker for checkout {}: {}", idempotencyKey,
                    e.getMessage(), e);
            dltProcessingErrorsCounter.increment();
        }
    }

    private CheckoutRequestDTO tryToDeserializePayload(byte[] payload) {
        if (payload == null) {
            return null;
        }

        try {
            return objectMapper.readValue(payload, CheckoutRequestDTO.class);
        } catch (Exception e) {
            log.error("Could not deserialize DLT message payload: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Prefers the exception message, prefixed by the exception class name when
     * present.
     */
    private String getFailureReasonFromHeaders(Headers headers) {
        String exceptionMessage = getHeaderValue(headers, KafkaHeaders.DLT_EXCEPTION_MESSAGE);
        String exceptionFqcn = getHeaderValue(headers, KafkaHeaders.DLT_EXCEPTION_FQCN);

        if (exceptionMessage != null && !exceptionMessage.isBlank()) {
            return exceptionFqcn != null ? exceptionFqcn + ": " + exceptionMessage : exceptionMessage;
        } else if (exceptionFqcn != null) {
            return exceptionFqcn;
        }
        return "Unknown DLT Failure (Missing Exception Headers)";
    }

    private String getHeaderValue(Headers headers, String headerKey) {
        Header header = headers.lastHeader(headerKey);

        if (header != null && header.value() != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }

        return null;
    }

    private void initializeMetrics(MeterRegistry registry) {
        this.dltMessagesReceivedCounter = Counter.builder("checkouts.dlt.received")
                .description("Total number of checkouts received on the DLT")
                .register(registry);
        this.dltMarkersReleasedCounter = Counter.builder("checkouts.dlt.markers.released")
                .description("Idempotency markers released for dead-lettered checkouts")
                .register(registry);
        this.dltProcessingErrorsCounter = Counter.builder("checkouts.dlt.processing.errors")
                .description("Total number of errors during DLT processing")
                .register(registry);
    }
}

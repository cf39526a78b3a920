package io.shopfront.fulfillment.config;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.KafkaException.Level;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.util.backoff.FixedBackOff;

import io.shopfront.fulfillment.exception.OrderValidationException;
import io.shopfront.fulfillment.util.KafkaUtils;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka wiring for checkout intake: the retrying error handler of the checkout
 * listener and a separate, non-retrying container factory for its dead letter
 * topic.
 */
@Configuration
@Slf4j
public class KafkaConfig {
    @Autowired
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${spring.kafka.consumer.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id}")
    private String groupId;

    @Value("${app.kafka.dlt-checkouts-topic}")
    private String checkoutsDeadLetterTopic;

    @Value("${spring.kafka.listener.auto-startup:true}")
    private boolean autoStartup;

    @Value("${app.kafka.retry.max-retries:3}")
    private int maxRetries;

    @Value("${app.kafka.retry.initial-interval-ms:1000}")
    private long initialIntervalMs;

    @Value("${app.kafka.retry.multiplier:2.0}")
    private double multiplier;

    @Value("${app.kafka.retry.max-interval-ms:5000}")
    private long maxIntervalMs;

    /**
     * Error handler picked up by the default listener container factory, i.e. the
     * checkout listener. A failing checkout is redelivered with exponential
     * backoff and then published, key and headers intact, to the dead letter
     * topic. Invalid checkouts skip the retries.
     *
     * @return The configured DefaultErrorHandler
     */
    @Bean
    public DefaultErrorHandler checkoutErrorHandler() {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Giving up on checkout (key {}) from {}-{}@{}, sending it to {}: {}",
                            checkoutKey(consumerRecord), consumerRecord.topic(), consumerRecord.partition(),
                            consumerRecord.offset(), checkoutsDeadLetterTopic, exception.getMessage());
                    return new TopicPartition(checkoutsDeadLetterTopic, -1);
                });

        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(maxRetries);
        backOff.setInitialInterval(initialIntervalMs);
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(maxIntervalMs);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(OrderValidationException.class, ConstraintViolationException.class);
        errorHandler.setLogLevel(Level.WARN);
        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) -> log.warn(
                "Checkout (key {}) failed on delivery attempt {} of {}: {}", checkoutKey(consumerRecord),
                deliveryAttempt, maxRetries + 1, exception.getMessage()));

        log.info("Checkout error handler: {} retries starting at {} ms (x{}, max {} ms), dead letters to {}",
                maxRetries, initialIntervalMs, multiplier, maxIntervalMs, checkoutsDeadLetterTopic);

        return errorHandler;
    }

    /**
     * Consumer factory for the dead letter topic. Values stay raw bytes so that
     * unreadable payloads still arrive.
     */
    @Bean
    public ConsumerFactory<String, byte[]> dltConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId + "-dlt");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return new DefaultKafkaConsumerFactory<>(props);
    }

    /**
     * Listener container factory for the dead letter topic. A dead letter that
     * cannot be handled is logged and skipped.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, byte[]> dltKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, byte[]> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(dltConsumerFactory());
        factory.setAutoStartup(autoStartup);
        factory.setCommonErrorHandler(new DefaultErrorHandler(
                (consumerRecord, exception) -> log.error("Skipping dead letter (key {}) at offset {}: {}",
                        checkoutKey(consumerRecord), consumerRecord.offset(), exception.getMessage()),
                new FixedBackOff(0L, 0L)));
        return factory;
    }

    private static String checkoutKey(ConsumerRecord<?, ?> consumerRecord) {
        Header header = consumerRecord.headers().lastHeader(KafkaUtils.IDEMPOTENCY_KEY_HEADER);
        return header == null ? "none" : new String(header.value(), StandardCharsets.UTF_8);
    }
}

package io.shopfront.fulfillment.util;

import java.time.Duration;

public final class KafkaUtils {
    public static final String IDEMPOTENCY_KEY_HEADER = ApiHeaders.IDEMPOTENCY_KEY;
    public static final String IDEMPOTENCY_KEY_PREFIX = "idempotency:checkout:";

    public static final String PROCESSING_STATUS = "PROCESSING";
    public static final String PROCESSED_STATUS = "PROCESSED";

    public static final Duration PROCESSING_TTL = Duration.ofHours(1);
    public static final Duration PROCESSED_TTL = Duration.ofDays(1);

    private KafkaUtils() {
    }
}

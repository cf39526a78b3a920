package io.shopfront.fulfillment.util;

public final class ApiHeaders {
    public static final String ACTOR_ROLE = "X-Actor-Role";
    public static final String IDEMPOTENCY_KEY = "X-Idempotency-Key";

    private ApiHeaders() {
    }
}

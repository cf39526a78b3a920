package io.shopfront.fulfillment.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a single order record (one purchased line item).
 * The display label is the wire format used in requests, responses and
 * notifications.
 */
public enum OrderStatus {
    /**
     * Initial state. The shop has not yet accepted or rejected the order.
     */
    PENDING_CONFIRMATION("Pending Confirmation", false),

    PROCESSING("Processing", false),
    PACKED("Packed", false),
    SHIPPED("Shipped", false),
    OUT_FOR_DELIVERY("Out for Delivery", false),

    /**
     * The shop reports the item as handed over; waiting for the customer to
     * confirm receipt.
     */
    PENDING_DELIVERY_CONFIRMATION("Pending Delivery Confirmation", false),

    /**
     * Terminal for the forward path. A return or replacement may still be
     * requested from here.
     */
    DELIVERED("Delivered", true),

    REJECTED("Rejected", true), // rejected by the shop before confirmation
    CANCELLED("Cancelled", true), // cancelled by the customer before confirmation

    RETURN_REQUESTED("Return Requested", false),
    RETURN_APPROVED("Return Approved", false),
    OUT_FOR_PICKUP("Out for Pickup", false),
    PICKED_UP("Picked Up", false),
    PENDING_RETURN_CONFIRMATION("Pending Return Confirmation", false),
    RETURN_COMPLETED("Return Completed", true),
    RETURN_REJECTED("Return Rejected", true),

    /**
     * Replacement approved. The order re-enters the forward path at
     * {@link #PROCESSING}.
     */
    REPLACEMENT_CONFIRMED("Replacement Confirmed", false),
    PENDING_REPLACEMENT_CONFIRMATION("Pending Replacement Confirmation", false),
    REPLACEMENT_COMPLETED("Replacement Completed", true);

    private final String label;
    private final boolean terminal;

    OrderStatus(String label, boolean terminal) {
        this.label = label;
        this.terminal = terminal;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Statuses in which the customer is asked to confirm that a hand-over took
     * place.
     */
    public boolean awaitsCustomerConfirmation() {
        return this == PENDING_DELIVERY_CONFIRMATION || this == PENDING_RETURN_CONFIRMATION
                || this == PENDING_REPLACEMENT_CONFIRMATION;
    }

    /**
     * Resolves a status from its display label or its constant name.
     *
     * @param value The label (e.g. {@code "Out for Delivery"}) or enum name.
     * @return The matching status.
     * @throws IllegalArgumentException if nothing matches.
     */
    @JsonCreator
    public static OrderStatus fromLabel(String value) {
        return Arrays.stream(values())
                .filter(status -> status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }

    @Override
    public String toString() {
        return label;
    }
}

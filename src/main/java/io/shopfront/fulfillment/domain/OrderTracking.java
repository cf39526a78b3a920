package io.shopfront.fulfillment.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Audit trail of the milestones an order has reached, one timestamp per
 * status. A timestamp is written the first time its status is reached and is
 * never cleared or rewritten. Nothing reads these values to decide a
 * transition; {@link Order#getStatus()} is the only source of truth.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@ToString
@EqualsAndHashCode
@Embeddable
public class OrderTracking {
    @Column(name = "confirmed_at")
    private LocalDateTime confirmed;

    @Column(name = "packed_at")
    private LocalDateTime packed;

    @Column(name = "shipped_at")
    private LocalDateTime shipped;

    @Column(name = "out_for_delivery_at")
    private LocalDateTime outForDelivery;

    @Column(name = "delivery_confirmation_requested_at")
    private LocalDateTime deliveryConfirmationRequested;

    @Column(name = "delivered_at")
    private LocalDateTime delivered;

    @Column(name = "rejected_at")
    private LocalDateTime rejected;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelled;

    @Column(name = "return_requested_at")
    private LocalDateTime returnRequested;

    @Column(name = "return_approved_at")
    private LocalDateTime returnApproved;

    @Column(name = "return_rejected_at")
    private LocalDateTime returnRejected;

    @Column(name = "out_for_pickup_at")
    private LocalDateTime outForPickup;

    @Column(name = "picked_up_at")
    private LocalDateTime pickedUp;

    @Column(name = "return_confirmation_requested_at")
    private LocalDateTime returnConfirmationRequested;

    @Column(name = "return_completed_at")
    private LocalDateTime returnCompleted;

    @Column(name = "replacement_confirmed_at")
    private LocalDateTime replacementConfirmed;

    @Column(name = "replacement_confirmation_requested_at")
    private LocalDateTime replacementConfirmationRequested;

    @Column(name = "replacement_completed_at")
    private LocalDateTime replacementCompleted;

    @Column(name = "expected_delivery")
    private LocalDate expectedDelivery;

    /**
     * Records that {@code status} was reached at {@code at}, unless its
     * milestone is already set.
     *
     * @return {@code true} if a new timestamp was written.
     */
    public boolean markReached(OrderStatus status, LocalDateTime at) {
        switch (status) {
            case PROCESSING:
                if (confirmed != null) {
                    return false;
                }
                confirmed = at;
                return true;
            case PACKED:
                if (packed != null) {
                    return false;
                }
                packed = at;
                return true;
            case SHIPPED:
                if (shipped != null) {
                    return false;
                }
                shipped = at;
                return true;
            case OUT_FOR_DELIVERY:
                if (outForDelivery != null) {
                    return false;
                }
                outForDelivery = at;
                return true;
            case PENDING_DELIVERY_CONFIRMATION:
                if (deliveryConfirmationRequested != null) {
                    return false;
                }
                deliveryConfirmationRequested = at;
                return true;
            case DELIVERED:
                if (delivered != null) {
                    return false;
                }
                delivered = at;
                return true;
            case REJECTED:
                if (rejected != null) {
                    return false;
                }
                rejected = at;
                return true;
            case CANCELLED:
                if (cancelled != null) {
                    return false;
                }
                cancelled = at;
                return true;
            case RETURN_REQUESTED:
                if (returnRequested != null) {
                    return false;
                }
                returnRequested = at;
                return true;
            case RETURN_APPROVED:
                if (returnApproved != null) {
                    return false;
                }
                returnApproved = at;
                return true;
            case RETURN_REJECTED:
                if (returnRejected != null) {
                    return false;
                }
                returnRejected = at;
                return true;
            case OUT_FOR_PICKUP:
                if (outForPickup != null) {
                    return false;
                }
                outForPickup = at;
                return true;
            case PICKED_UP:
                if (pickedUp != null) {
                    return false;
                }
                pickedUp = at;
                return true;
            case PENDING_RETURN_CONFIRMATION:
                if (returnConfirmationRequested != null) {
                    return false;
                }
                returnConfirmationRequested = at;
                return true;
            case RETURN_COMPLETED:
                if (returnCompleted != null) {
                    return false;
                }
                returnCompleted = at;
                return true;
            case REPLACEMENT_CONFIRMED:
                if (replacementConfirmed != null) {
                    return false;
                }
                replacementConfirmed = at;
                return true;
            case PENDING_REPLACEMENT_CONFIRMATION:
                if (replacementConfirmationRequested != null) {
                    return false;
                }
                replacementConfirmationRequested = at;
                return true;
            case REPLACEMENT_COMPLETED:
                if (replacementCompleted != null) {
                    return false;
                }
                replacementCompleted = at;
                return true;
            default:
                return false;
        }
    }

    /**
     * Sets the expected delivery date once.
     *
     * @return {@code true} if the date was written, {@code false} if one was
     *         already scheduled.
     */
    public boolean scheduleExpectedDelivery(LocalDate date) {
        if (expectedDelivery != null) {
            return false;
        }
        expectedDelivery = date;
        return true;
    }
}

package io.shopfront.fulfillment.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Milestones an order has reached. Unreached milestones are omitted.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderTrackingDTO {
    private LocalDateTime confirmed;
    private LocalDateTime packed;
    private LocalDateTime shipped;
    private LocalDateTime outForDelivery;
    private LocalDateTime deliveryConfirmationRequested;
    private LocalDateTime delivered;
    private LocalDateTime rejected;
    private LocalDateTime cancelled;
    private LocalDateTime returnRequested;
    private LocalDateTime returnApproved;
    private LocalDateTime returnRejected;
    private LocalDateTime outForPickup;
    private LocalDateTime pickedUp;
    private LocalDateTime returnConfirmationRequested;
    private LocalDateTime returnCompleted;
    private LocalDateTime replacementConfirmed;
    private LocalDateTime replacementConfirmationRequested;
    private LocalDateTime replacementCompleted;
    private LocalDate expectedDelivery;
}

package io.shopfront.fulfillment.domain;

import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Records which order group a checkout key produced. The key is unique, so of
 * two concurrent checkouts with the same key only one can commit its orders.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "checkout_claims", uniqueConstraints = {
        @UniqueConstraint(name = "uk_checkout_claim_key", columnNames = "checkout_key")
})
public class CheckoutClaim {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "checkout_key", nullable = false, updatable = false)
    private String checkoutKey;

    @Column(name = "group_id", nullable = false, updatable = false)
    private UUID groupId;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

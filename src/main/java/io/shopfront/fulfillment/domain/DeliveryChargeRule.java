package io.shopfront.fulfillment.domain;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A delivery-charge tier: subtotals in {@code [from, to]} pay {@code charge}.
 * A {@code null} upper bound means unbounded.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "delivery_charge_rules", indexes = {
        @Index(name = "idx_delivery_rule_tier_set", columnList = "tier_set")
})
public class DeliveryChargeRule {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, name = "tier_set")
    private DeliveryTierSet tierSet;

    @NotNull
    @Column(nullable = false, precision = 10, scale = 2, name = "range_from")
    private BigDecimal from;

    @Column(precision = 10, scale = 2, name = "range_to")
    private BigDecimal to;

    @NotNull
    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal charge;
}

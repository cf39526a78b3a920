package io.shopfront.fulfillment.repository;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import io.shopfront.fulfillment.domain.CheckoutClaim;

@Repository
public interface CheckoutClaimRepository extends JpaRepository<CheckoutClaim, UUID> {
    Optional<CheckoutClaim> findByCheckoutKey(String checkoutKey);
}

package io.shopfront.fulfillment.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.domain.DeliveryTierSet;

@Repository
public interface DeliveryChargeRuleRepository extends JpaRepository<DeliveryChargeRule, UUID> {
    List<DeliveryChargeRule> findByTierSet(DeliveryTierSet tierSet);

    void deleteByTierSet(DeliveryTierSet tierSet);
}

package io.shopfront.fulfillment.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import io.shopfront.fulfillment.domain.Order;

/**
 * Repository interface for managing {@link Order} records.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {
    /**
     * Finds every record created by one checkout, oldest first.
     *
     * @param groupId the checkout's group ID
     * @return the group's records, empty if the group does not exist
     */
    List<Order> findByGroupIdOrderByCreatedAtAsc(UUID groupId);

    /**
     * Finds every record fulfilled by a seller, newest first.
     *
     * @param sellerId the seller (shop) ID
     * @return the seller's records
     */
    List<Order> findBySellerIdOrderByCreatedAtDesc(String sellerId);

    /**
     * Finds every record placed by a customer, newest first.
     *
     * @param userId the customer's user ID
     * @return the customer's records
     */
    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * Finds the records created by the checkout carrying the given idempotency
     * key.
     *
     * @param checkoutKey the checkout idempotency key
     * @return the records, empty if the key was never used
     */
    List<Order> findByCheckoutKey(String checkoutKey);
}

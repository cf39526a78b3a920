package io.shopfront.fulfillment.customer;

import java.util.Optional;

/**
 * Lookup of customer profiles owned by the user service.
 */
public interface CustomerDirectory {
    /**
     * Finds the profile of a customer.
     *
     * @param userId The customer's user ID.
     * @return The profile, or empty if the customer is unknown or the directory
     *         cannot be reached.
     */
    Optional<CustomerProfile> findProfile(String userId);
}

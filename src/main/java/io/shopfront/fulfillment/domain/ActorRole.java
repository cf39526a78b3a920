package io.shopfront.fulfillment.domain;

/**
 * Role of the party invoking an operation.
 */
public enum ActorRole {
    CUSTOMER,
    SELLER,
    EMPLOYEE,
    ADMIN
}

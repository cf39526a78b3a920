package io.shopfront.fulfillment.domain;

/**
 * Kind of after-delivery request raised by a customer.
 */
public enum ReturnType {
    REFUND,
    REPLACEMENT
}

package io.shopfront.fulfillment.domain;

/**
 * Product category of an order line. {@link #XEROX} lines are print jobs and
 * carry a {@link PrintJobConfig} instead of a catalog product reference.
 */
public enum OrderCategory {
    STATIONARY,
    BOOKS,
    ELECTRONICS,
    XEROX;

    public boolean isPrintJob() {
        return this == XEROX;
    }
}

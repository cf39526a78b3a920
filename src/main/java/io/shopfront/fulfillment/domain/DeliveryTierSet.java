package io.shopfront.fulfillment.domain;

/**
 * Independent delivery-charge rule sets. Product lines and print jobs are
 * charged separately and the two fees are added, never merged.
 */
public enum DeliveryTierSet {
    ITEM,
    PRINT_JOB;

    public static DeliveryTierSet forCategory(OrderCategory category) {
        return category != null && category.isPrintJob() ? PRINT_JOB : ITEM;
    }
}

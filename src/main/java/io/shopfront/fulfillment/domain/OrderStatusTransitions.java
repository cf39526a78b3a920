package io.shopfront.fulfillment.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The order status state machine.
 * <p>
 * Every method is a pure function of its arguments; the lookup tables are
 * built once and cannot be modified.
 * </p>
 *
 * <pre>
 * Pending Confirmation -> Processing -> Packed -> Shipped -> Out for Delivery
 *     -> Pending Delivery Confirmation -> Delivered
 * Pending Confirmation -> Rejected | Cancelled
 * Delivered -> Return Requested -> Return Approved -> Out for Pickup -> Picked Up
 *     -> Pending Return Confirmation -> Return Completed
 * Return Requested -> Replacement Confirmed -> Processing -> ... -> Out for Delivery
 *     -> Pending Replacement Confirmation -> Replacement Completed
 * Return Requested -> Return Rejected
 * </pre>
 */
public final class OrderStatusTransitions {

    private static final Map<OrderStatus, OrderStatus> ADVANCE_PATH;
    private static final Map<OrderStatus, OrderStatus> RECEIPT_CONFIRMATIONS;
    private static final Map<OrderAction, OrderStatus> IMPLIED_SOURCE;

    static {
        Map<OrderStatus, OrderStatus> advance = new EnumMap<>(OrderStatus.class);
        advance.put(OrderStatus.PROCESSING, OrderStatus.PACKED);
        advance.put(OrderStatus.PACKED, OrderStatus.SHIPPED);
        advance.put(OrderStatus.SHIPPED, OrderStatus.OUT_FOR_DELIVERY);
        advance.put(OrderStatus.OUT_FOR_DELIVERY, OrderStatus.PENDING_DELIVERY_CONFIRMATION);
        advance.put(OrderStatus.RETURN_APPROVED, OrderStatus.OUT_FOR_PICKUP);
        advance.put(OrderStatus.OUT_FOR_PICKUP, OrderStatus.PICKED_UP);
        advance.put(OrderStatus.PICKED_UP, OrderStatus.PENDING_RETURN_CONFIRMATION);
        advance.put(OrderStatus.REPLACEMENT_CONFIRMED, OrderStatus.PROCESSING);
        ADVANCE_PATH = Collections.unmodifiableMap(advance);

        Map<OrderStatus, OrderStatus> receipts = new EnumMap<>(OrderStatus.class);
        receipts.put(OrderStatus.PENDING_DELIVERY_CONFIRMATION, OrderStatus.DELIVERED);
        receipts.put(OrderStatus.PENDING_RETURN_CONFIRMATION, OrderStatus.RETURN_COMPLETED);
        receipts.put(OrderStatus.PENDING_REPLACEMENT_CONFIRMATION, OrderStatus.REPLACEMENT_COMPLETED);
        RECEIPT_CONFIRMATIONS = Collections.unmodifiableMap(receipts);

        Map<OrderAction, OrderStatus> implied = new EnumMap<>(OrderAction.class);
        implied.put(OrderAction.CONFIRM, OrderStatus.PENDING_CONFIRMATION);
        implied.put(OrderAction.REJECT, OrderStatus.PENDING_CONFIRMATION);
        implied.put(OrderAction.CANCEL, OrderStatus.PENDING_CONFIRMATION);
        implied.put(OrderAction.REQUEST_RETURN, OrderStatus.DELIVERED);
        implied.put(OrderAction.APPROVE_RETURN, OrderStatus.RETURN_REQUESTED);
        implied.put(OrderAction.APPROVE_REPLACEMENT, OrderStatus.RETURN_REQUESTED);
        implied.put(OrderAction.REJECT_RETURN, OrderStatus.RETURN_REQUESTED);
        IMPLIED_SOURCE = Collections.unmodifiableMap(implied);
    }

    private OrderStatusTransitions() {
    }

    /**
     * Computes the single legal successor of {@code current} for the given
     * action.
     *
     * @param action     The requested action.
     * @param current    The status the order is in.
     * @param returnType The order's return type; for
     *                   {@link OrderAction#REQUEST_RETURN} the type being
     *                   requested. May be {@code null}.
     * @return The next status, or empty if the action is not legal from
     *         {@code current}.
     */
    public static Optional<OrderStatus> nextStatus(OrderAction action, OrderStatus current, ReturnType returnType) {
        if (action == null || current == null) {
            return Optional.empty();
        }

        switch (action) {
            case ADVANCE:
                if (current == OrderStatus.OUT_FOR_DELIVERY && returnType == ReturnType.REPLACEMENT) {
                    return Optional.of(OrderStatus.PENDING_REPLACEMENT_CONFIRMATION);
                }
                return Optional.ofNullable(ADVANCE_PATH.get(current));
            case CONFIRM_RECEIPT:
                return Optional.ofNullable(RECEIPT_CONFIRMATIONS.get(current));
            case CONFIRM:
                return from(current, OrderStatus.PENDING_CONFIRMATION, OrderStatus.PROCESSING);
            case REJECT:
                return from(current, OrderStatus.PENDING_CONFIRMATION, OrderStatus.REJECTED);
            case CANCEL:
                return from(current, OrderStatus.PENDING_CONFIRMATION, OrderStatus.CANCELLED);
            case REQUEST_RETURN:
                return returnType == null ? Optional.empty()
                        : from(current, OrderStatus.DELIVERED, OrderStatus.RETURN_REQUESTED);
            case APPROVE_RETURN:
                return returnType == ReturnType.REFUND
                        ? from(current, OrderStatus.RETURN_REQUESTED, OrderStatus.RETURN_APPROVED)
                        : Optional.empty();
            case APPROVE_REPLACEMENT:
                return returnType == ReturnType.REPLACEMENT
                        ? from(current, OrderStatus.RETURN_REQUESTED, OrderStatus.REPLACEMENT_CONFIRMED)
                        : Optional.empty();
            case REJECT_RETURN:
                return from(current, OrderStatus.RETURN_REQUESTED, OrderStatus.RETURN_REJECTED);
            default:
                return Optional.empty();
        }
    }

    /**
     * Returns the status an action can only start from, for actions whose
     * source is fixed. {@link OrderAction#ADVANCE} and
     * {@link OrderAction#CONFIRM_RECEIPT} have several sources and return
     * empty; callers must name the status they believe holds.
     */
    public static Optional<OrderStatus> impliedSource(OrderAction action) {
        return Optional.ofNullable(IMPLIED_SOURCE.get(action));
    }

    /**
     * Checks whether {@code role} may perform {@code action} on an order
     * currently in {@code current}. Employees may not pack an order, that step
     * belongs to the shop.
     */
    public static boolean isPermitted(OrderAction action, ActorRole role, OrderStatus current) {
        if (action == null || !action.isAllowedFor(role)) {
            return false;
        }

        return !(role == ActorRole.EMPLOYEE && action == OrderAction.ADVANCE && current == OrderStatus.PROCESSING);
    }

    private static Optional<OrderStatus> from(OrderStatus current, OrderStatus required, OrderStatus next) {
        return current == required ? Optional.of(next) : Optional.empty();
    }
}

package io.shopfront.fulfillment.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Operations that move an order from one status to another, together with the
 * roles allowed to perform them.
 */
public enum OrderAction {
    CONFIRM(false, ActorRole.SELLER, ActorRole.ADMIN),
    REJECT(true, ActorRole.SELLER, ActorRole.ADMIN),
    CANCEL(true, ActorRole.CUSTOMER, ActorRole.ADMIN),
    ADVANCE(false, ActorRole.SELLER, ActorRole.EMPLOYEE, ActorRole.ADMIN),
    CONFIRM_RECEIPT(false, ActorRole.CUSTOMER, ActorRole.ADMIN),
    REQUEST_RETURN(true, ActorRole.CUSTOMER),
    APPROVE_RETURN(false, ActorRole.SELLER, ActorRole.EMPLOYEE, ActorRole.ADMIN),
    APPROVE_REPLACEMENT(false, ActorRole.SELLER, ActorRole.EMPLOYEE, ActorRole.ADMIN),
    REJECT_RETURN(true, ActorRole.SELLER, ActorRole.EMPLOYEE, ActorRole.ADMIN);

    private final boolean reasonRequired;
    private final Set<ActorRole> allowedRoles;

    OrderAction(boolean reasonRequired, ActorRole first, ActorRole... rest) {
        this.reasonRequired = reasonRequired;
        this.allowedRoles = EnumSet.of(first, rest);
    }

    public boolean isReasonRequired() {
        return reasonRequired;
    }

    public boolean isAllowedFor(ActorRole role) {
        return role != null && allowedRoles.contains(role);
    }
}

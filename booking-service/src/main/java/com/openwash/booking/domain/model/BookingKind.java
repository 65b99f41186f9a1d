package com.openwash.booking.domain.model;

import com.openwash.capacity.domain.model.ResourceKind;

/**
 * Where the wash happens: at one of our bays, or at the customer's location by a mobile team.
 */
public enum BookingKind {
    STATIONARY(ResourceKind.WASH_BAY),
    MOBILE(ResourceKind.MOBILE_TEAM);

    private final ResourceKind resourceKind;

    BookingKind(ResourceKind resourceKind) {
        this.resourceKind = resourceKind;
    }

    public ResourceKind resourceKind() {
        return resourceKind;
    }
}

package com.openwash.capacity.domain.model;

/**
 * Physical resource a booking occupies.
 */
public enum ResourceKind {
    /** Fixed bay at the wash site. */
    WASH_BAY,
    /** Travelling crew that comes to the customer. */
    MOBILE_TEAM
}

package com.openwash.capacity.domain.model;

/**
 * Result of assessing or reserving one resource for one window.
 * When only assessing, {@link #RESERVED} means nothing blocks the reservation.
 */
public enum ReserveOutcome {
    RESERVED,
    OVERLAP,
    DAILY_CAP_REACHED;

    public boolean isReserved() {
        return this == RESERVED;
    }
}

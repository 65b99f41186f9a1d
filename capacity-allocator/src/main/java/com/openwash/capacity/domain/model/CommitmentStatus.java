package com.openwash.capacity.domain.model;

public enum CommitmentStatus {
    /** Blocks the window and counts toward the daily cap. */
    HELD,
    /** Job done; no longer blocks the window but still counts toward the daily cap. */
    FULFILLED,
    /** Booking cancelled, no-show or moved; ignored. */
    RELEASED
}

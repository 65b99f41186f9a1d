package com.openwash.capacity.domain.model;

import java.time.Duration;
import java.util.UUID;

/**
 * One attempt to commit one resource to one booking.
 *
 * @param window booking window as stored on the commitment
 * @param buffer gap kept free on both sides of the window
 */
public record ReservationRequest(ResourceCandidate resource, UUID bookingId, TimeWindow window, Duration buffer) {

    /**
     * Window used for conflict detection.
     */
    public TimeWindow guardWindow() {
        return window.expandedBy(buffer);
    }

    public ResourceRef ref() {
        return resource.ref();
    }
}

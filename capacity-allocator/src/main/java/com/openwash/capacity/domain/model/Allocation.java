package com.openwash.capacity.domain.model;

/**
 * Resource committed to a booking.
 */
public record Allocation(ResourceRef resource, TimeWindow window) {
}

package com.openwash.capacity.domain.model;

/**
 * Start time with at least one free resource.
 */
public record OpenSlot(TimeWindow window, int freeResources) {
}

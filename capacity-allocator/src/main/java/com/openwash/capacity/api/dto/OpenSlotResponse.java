package com.openwash.capacity.api.dto;

import com.openwash.capacity.domain.model.OpenSlot;

import java.time.Instant;

/**
 * Start time with free capacity, as listed to customers.
 */
public record OpenSlotResponse(
        Instant start,
        Instant end,
        int freeResources
) {
    public static OpenSlotResponse from(OpenSlot slot) {
        return new OpenSlotResponse(slot.window().start(), slot.window().end(), slot.freeResources());
    }
}

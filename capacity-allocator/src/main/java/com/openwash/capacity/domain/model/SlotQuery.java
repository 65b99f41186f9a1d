package com.openwash.capacity.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Range scan for open start times.
 */
@Builder
public record SlotQuery(
        ResourceKind kind,
        Instant from,
        Instant to,
        int durationMinutes,
        VehicleSize vehicleSize,
        GeoLocation customerLocation,
        int intervalMinutes
) {
}

package com.openwash.capacity.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

/**
 * What the allocator needs to place one booking.
 *
 * @param vehicleSize         required for bays
 * @param customerLocation    required for mobile teams
 * @param earliestAlternative alternatives starting before this instant are never suggested
 * @param latestAlternative   alternatives starting after this instant are never suggested
 */
@Builder(toBuilder = true)
public record AllocationRequest(
        UUID bookingId,
        ResourceKind kind,
        Instant scheduledAt,
        int durationMinutes,
        VehicleSize vehicleSize,
        GeoLocation customerLocation,
        Instant earliestAlternative,
        Instant latestAlternative
) {
    public TimeWindow window() {
        return TimeWindow.of(scheduledAt, durationMinutes);
    }

    public AllocationRequest startingAt(Instant start) {
        return toBuilder().scheduledAt(start).build();
    }
}

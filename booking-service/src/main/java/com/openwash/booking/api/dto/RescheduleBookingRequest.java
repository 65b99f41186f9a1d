package com.openwash.booking.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record RescheduleBookingRequest(
        @NotNull(message = "New scheduled time cannot be null")
        Instant newScheduledAt
) {
}

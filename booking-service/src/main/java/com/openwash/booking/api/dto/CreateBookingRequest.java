package com.openwash.booking.api.dto;

import com.openwash.booking.domain.model.BookingKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record CreateBookingRequest(
        @NotNull(message = "Customer ID cannot be null")
        Long customerId,

        @NotNull(message = "Vehicle ID cannot be null")
        Long vehicleId,

        @NotEmpty(message = "At least one service is required")
        @Size(max = 10, message = "At most 10 services per booking")
        List<@NotNull Long> serviceIds,

        @NotNull(message = "Scheduled time cannot be null")
        Instant scheduledAt,

        @NotNull(message = "Booking kind cannot be null")
        BookingKind kind,

        @Valid
        Location location,

        @Size(max = 500, message = "Notes must not exceed 500 characters")
        String notes
) {
    public record Location(
            @NotNull @DecimalMin("-90.0") @DecimalMax("90.0")
            Double latitude,

            @NotNull @DecimalMin("-180.0") @DecimalMax("180.0")
            Double longitude
    ) {
    }
}

package com.openwash.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CancelBookingRequest(
        @NotBlank(message = "Actor cannot be blank")
        @Size(max = 100)
        String actor,

        @Size(max = 500, message = "Reason must not exceed 500 characters")
        String reason
) {
}

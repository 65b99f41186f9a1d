package com.openwash.booking.api.dto;

import jakarta.validation.constraints.Size;

public record UpdateNotesRequest(
        @Size(max = 500, message = "Notes must not exceed 500 characters")
        String notes
) {
}

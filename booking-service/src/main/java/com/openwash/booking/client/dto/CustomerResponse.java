package com.openwash.booking.client.dto;

public record CustomerResponse(
        Long id,
        String fullName,
        boolean active
) {
}

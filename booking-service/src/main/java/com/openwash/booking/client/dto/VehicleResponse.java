package com.openwash.booking.client.dto;

import com.openwash.capacity.domain.model.VehicleSize;

public record VehicleResponse(
        Long id,
        Long customerId,
        VehicleSize sizeClass,
        boolean active
) {
}

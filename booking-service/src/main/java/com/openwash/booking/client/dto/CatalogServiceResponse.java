package com.openwash.booking.client.dto;

import java.math.BigDecimal;

public record CatalogServiceResponse(
        Long id,
        String name,
        Integer durationMinutes,
        BigDecimal price,
        boolean active
) {
}

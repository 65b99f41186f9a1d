package com.openwash.booking.api.dto;

import com.openwash.booking.domain.model.BookingStatus;
import lombok.Builder;

import java.time.Instant;

/**
 * Optional filters for booking listings; a null field matches everything.
 *
 * @param from earliest scheduled start, inclusive
 * @param to   latest scheduled start, inclusive
 */
@Builder
public record BookingSearchCriteria(
        Long customerId,
        BookingStatus status,
        Instant from,
        Instant to
) {
}

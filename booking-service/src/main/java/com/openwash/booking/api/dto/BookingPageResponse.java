package com.openwash.booking.api.dto;

import com.openwash.booking.domain.model.Booking;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of a booking listing. {@code page} is 1-based.
 */
public record BookingPageResponse(
        List<BookingResponse> bookings,
        int page,
        int limit,
        long totalCount,
        boolean hasNext
) {
    public static BookingPageResponse from(Page<Booking> result) {
        return new BookingPageResponse(
                result.getContent().stream().map(BookingResponse::from).toList(),
                result.getNumber() + 1,
                result.getSize(),
                result.getTotalElements(),
                result.hasNext());
    }
}

package com.openwash.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a booking change commits.
 * Consumed by notification and analytics consumers outside this service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingStatusChangedEvent {
    private BookingEventType eventType;
    private UUID bookingId;
    private Long customerId;
    private String status;
    private Instant scheduledAt;
    private Instant occurredAt;
}

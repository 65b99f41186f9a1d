package com.openwash.booking.events;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Post-commit booking events, one Kafka topic each.
 */
@Getter
@RequiredArgsConstructor
public enum BookingEventType {
    CREATED("booking-created"),
    CONFIRMED("booking-confirmed"),
    STARTED("booking-started"),
    COMPLETED("booking-completed"),
    CANCELLED("booking-cancelled"),
    NO_SHOW("booking-no-show"),
    RESCHEDULED("booking-rescheduled"),
    UPDATED("booking-updated");

    private final String topic;
}

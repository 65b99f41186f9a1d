package com.openwash.booking.exception;

import com.openwash.common.exception.ServiceUnavailableException;

import java.time.Duration;

/**
 * The caller's request deadline ran out before the allocating transaction could commit.
 * The transaction was rolled back; nothing about the booking changed.
 */
public class BookingDeadlineExceededException extends ServiceUnavailableException {

    public static final String ERROR_CODE = "BOOKING_DEADLINE_EXCEEDED";

    public BookingDeadlineExceededException(String operation, Duration budget) {
        this(operation, budget, null);
    }

    public BookingDeadlineExceededException(String operation, Duration budget, Throwable cause) {
        super(String.format("%s did not complete within %d ms", operation, budget.toMillis()), cause, ERROR_CODE);
    }
}

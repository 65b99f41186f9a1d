package com.openwash.booking.domain.policy;

import com.openwash.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Money and timing rules attached to booking transitions.
 *
 * Pure functions: nothing here reads the clock, callers pass {@code now}.
 *
 * Cancellation tiers by notice (scheduled start minus cancellation time), lower bound inclusive:
 * - 24h or more: 0%
 * - 6h up to 24h: 25%
 * - 2h up to 6h: 50%
 * - under 2h, or after the start: 100%
 */
public final class BookingFeePolicy {

    public static final Duration NO_SHOW_GRACE = Duration.ofMinutes(30);
    public static final BigDecimal OVERTIME_RATE_PER_MINUTE = new BigDecimal("1.00");

    private static final Duration FREE_CANCELLATION_NOTICE = Duration.ofHours(24);
    private static final Duration QUARTER_FEE_NOTICE = Duration.ofHours(6);
    private static final Duration HALF_FEE_NOTICE = Duration.ofHours(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private BookingFeePolicy() {
        // Utility class
    }

    public static int cancellationFeePercent(Duration notice) {
        if (notice.compareTo(FREE_CANCELLATION_NOTICE) >= 0) {
            return 0;
        }
        if (notice.compareTo(QUARTER_FEE_NOTICE) >= 0) {
            return 25;
        }
        if (notice.compareTo(HALF_FEE_NOTICE) >= 0) {
            return 50;
        }
        return 100;
    }

    public static BigDecimal cancellationFee(BigDecimal totalPrice, Duration notice) {
        return totalPrice.multiply(BigDecimal.valueOf(cancellationFeePercent(notice)))
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    public static boolean isNoShowEligible(Instant scheduledAt, Instant now, BookingStatus status) {
        return status == BookingStatus.CONFIRMED && !now.isBefore(scheduledAt.plus(NO_SHOW_GRACE));
    }

    public static BigDecimal noShowFee(BigDecimal totalPrice) {
        return totalPrice.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Whole minutes the job ran past its plan. Partial minutes are not charged.
     */
    public static long overtimeMinutes(int plannedMinutes, Instant actualStart, Instant actualEnd) {
        long actualMinutes = Duration.between(actualStart, actualEnd).toMinutes();
        return Math.max(0, actualMinutes - plannedMinutes);
    }

    public static BigDecimal overtimeCharge(long minutesOverPlanned) {
        return OVERTIME_RATE_PER_MINUTE.multiply(BigDecimal.valueOf(Math.max(0, minutesOverPlanned)))
                .setScale(2, RoundingMode.HALF_UP);
    }
}

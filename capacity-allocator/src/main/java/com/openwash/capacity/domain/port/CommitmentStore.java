package com.openwash.capacity.domain.port;

import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.TimeWindow;

import java.util.List;
import java.util.UUID;

/**
 * Persistent record of which resource is committed to which booking window.
 *
 * All methods join the caller's transaction. {@link #reserve} is the only write path
 * for new commitments and is serialized per resource by the configured strategy.
 */
public interface CommitmentStore {

    /**
     * Windows of HELD commitments on the resource touching {@code window}.
     */
    List<TimeWindow> findOverlapping(ResourceRef resource, TimeWindow window);

    /**
     * Check-and-insert under the configured concurrency control.
     *
     * @throws com.openwash.common.exception.ConcurrencyConflictException when the guard
     *         row could not be locked in time or moved under us
     */
    ReserveOutcome reserve(ReservationRequest request);

    /**
     * Same checks as {@link #reserve} without locking or writing.
     */
    boolean isFree(ReservationRequest request);

    /**
     * Drops the HELD commitment of the booking, if any. Returns whether one was released.
     */
    boolean release(UUID bookingId);

    /**
     * Marks the HELD commitment of the booking as FULFILLED, if any.
     */
    boolean fulfil(UUID bookingId);
}

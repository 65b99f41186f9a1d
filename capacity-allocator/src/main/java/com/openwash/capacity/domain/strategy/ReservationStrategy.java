package com.openwash.capacity.domain.strategy;

import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;

/**
 * Strategy interface for committing a resource window with different concurrency control mechanisms.
 *
 * Implementations:
 * - PessimisticLockReservationStrategy: database-level SELECT FOR UPDATE on the schedule row
 * - OptimisticLockReservationStrategy: guarded sequence bump after the insert
 * - DistributedLockReservationStrategy: Redisson lock per resource plus the guarded bump
 *
 * Every implementation joins the caller's transaction so the commitment and the booking
 * are written atomically.
 */
public interface ReservationStrategy {

    /**
     * Checks the resource for overlaps and the daily cap and records a HELD commitment when free.
     *
     * @return RESERVED when the commitment was written, otherwise the reason it was not
     * @throws com.openwash.common.exception.ConcurrencyConflictException when another
     *         transaction won the race for the resource
     */
    ReserveOutcome reserve(ReservationRequest request);

    /**
     * Returns the strategy type name for identification.
     *
     * @return Strategy type (PESSIMISTIC_LOCK, OPTIMISTIC_LOCK, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}

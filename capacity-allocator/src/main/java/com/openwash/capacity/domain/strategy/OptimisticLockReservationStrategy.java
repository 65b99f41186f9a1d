package com.openwash.capacity.domain.strategy;

import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceSchedule;
import com.openwash.capacity.domain.repository.ResourceScheduleRepository;
import com.openwash.capacity.domain.service.CommitmentLedger;
import com.openwash.common.exception.ConcurrencyConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reservation strategy using sequence-based conflict detection.
 *
 * Flow:
 * 1. Read the schedule sequence
 * 2. Check overlaps and the daily cap, insert the commitment
 * 3. UPDATE ... SET sequence_no = sequence_no + 1 WHERE sequence_no = :seen
 * 4. 0 rows updated: a concurrent reservation committed first, the caller retries
 *
 * No retry happens here; the whole booking transaction has to be replayed.
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticLockReservationStrategy implements ReservationStrategy {

    private final CommitmentLedger ledger;
    private final ResourceScheduleRepository scheduleRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ReserveOutcome reserve(ReservationRequest request) {
        ResourceSchedule schedule = ledger.scheduleFor(request.ref());
        long seen = scheduleRepository.currentSequence(schedule.getId());

        ReserveOutcome outcome = ledger.checkAndRecord(request);
        if (!outcome.isReserved()) {
            return outcome;
        }

        int updatedRows = scheduleRepository.advanceSequenceAtomically(schedule.getId(), seen);
        if (updatedRows == 0) {
            log.warn("Schedule of {} moved past sequence {} while reserving booking {}",
                    request.ref(), seen, request.bookingId());
            throw new ConcurrencyConflictException(
                    "Resource " + request.ref() + " was reserved concurrently");
        }
        return outcome;
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}

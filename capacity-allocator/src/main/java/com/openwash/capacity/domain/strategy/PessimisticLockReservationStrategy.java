package com.openwash.capacity.domain.strategy;

import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceSchedule;
import com.openwash.capacity.domain.service.CommitmentLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reservation strategy using pessimistic lock (SELECT FOR UPDATE).
 *
 * Flow:
 * 1. Lock the resource schedule row (bounded wait)
 * 2. Look for overlapping HELD commitments and the daily cap
 * 3. Insert the commitment
 * 4. Caller commits (releases the row lock)
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockReservationStrategy implements ReservationStrategy {

    private final CommitmentLedger ledger;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ReserveOutcome reserve(ReservationRequest request) {
        ResourceSchedule schedule = ledger.lockScheduleFor(request.ref());
        log.debug("Locked schedule {} for {}", schedule.getId(), request.ref());
        return ledger.checkAndRecord(request);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}

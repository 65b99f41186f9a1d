package com.openwash.capacity.domain.strategy;

import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.ResourceSchedule;
import com.openwash.capacity.domain.repository.ResourceScheduleRepository;
import com.openwash.capacity.domain.service.CommitmentLedger;
import com.openwash.common.exception.ConcurrencyConflictException;
import com.openwash.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.TimeUnit;

/**
 * Reservation strategy using a distributed lock (Redis/Redisson) + a guarded sequence bump.
 *
 * The Redisson lock keeps booking-service instances from checking the same resource at the
 * same time. It is released before the surrounding transaction commits, so the database
 * still has the final word:
 *
 *   UPDATE resource_schedules
 *   SET sequence_no = sequence_no + 1
 *   WHERE id = :id AND sequence_no = :seen;
 *
 * If the UPDATE affects 0 rows, a reservation committed in between and we report a conflict.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "capacity.reservation.strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedLockReservationStrategy implements ReservationStrategy {

    private final CommitmentLedger ledger;
    private final ResourceScheduleRepository scheduleRepository;
    private final RedissonClient redissonClient;

    @Value("${capacity.reservation.lock.wait-ms:3000}")
    private long lockWaitMs;

    @Value("${capacity.reservation.lock.lease-ms:30000}")
    private long lockLeaseMs;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ReserveOutcome reserve(ReservationRequest request) {
        String lockKey = buildLockKey(request.ref());
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitMs, lockLeaseMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new ConcurrencyConflictException(
                        "Unable to acquire lock for " + request.ref() + ". Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return reserveWithGuardedBump(request);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Reservation interrupted", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private ReserveOutcome reserveWithGuardedBump(ReservationRequest request) {
        ResourceSchedule schedule = ledger.scheduleFor(request.ref());
        long seen = scheduleRepository.currentSequence(schedule.getId());

        ReserveOutcome outcome = ledger.checkAndRecord(request);
        if (outcome.isReserved()
                && scheduleRepository.advanceSequenceAtomically(schedule.getId(), seen) == 0) {
            throw new ConcurrencyConflictException(
                    "Resource " + request.ref() + " was reserved concurrently");
        }
        return outcome;
    }

    private String buildLockKey(ResourceRef ref) {
        return Constants.LOCK_PREFIX + ref.kind() + ":" + ref.id();
    }
}

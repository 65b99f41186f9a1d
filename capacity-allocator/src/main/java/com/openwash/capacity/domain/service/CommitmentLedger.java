package com.openwash.capacity.domain.service;

import com.openwash.capacity.domain.model.CommitmentStatus;
import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceCommitment;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.ResourceSchedule;
import com.openwash.capacity.domain.model.TimeWindow;
import com.openwash.capacity.domain.repository.ResourceCommitmentRepository;
import com.openwash.capacity.domain.repository.ResourceScheduleRepository;
import com.openwash.common.exception.ConcurrencyConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Check-then-insert steps shared by the reservation strategies.
 * Callers decide how the steps are serialized per resource.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommitmentLedger {

    private static final Set<CommitmentStatus> DAILY_CAP_STATUSES =
            EnumSet.of(CommitmentStatus.HELD, CommitmentStatus.FULFILLED);

    /** Availability checks carry no booking; the nil UUID never matches a stored commitment. */
    private static final UUID NO_BOOKING = new UUID(0L, 0L);

    private final ResourceCommitmentRepository commitmentRepository;
    private final ResourceScheduleRepository scheduleRepository;

    @Value("${capacity.business-zone:UTC}")
    private String businessZone;

    @Value("${capacity.reservation.lock.wait-ms:3000}")
    private long lockWaitMs;

    /**
     * Guard row of the resource, created on first use.
     * Two transactions creating the same row race on the unique constraint; the loser gets a conflict.
     */
    public ResourceSchedule scheduleFor(ResourceRef ref) {
        return scheduleRepository.findByResourceKindAndResourceId(ref.kind(), ref.id())
                .orElseGet(() -> createSchedule(ref));
    }

    /**
     * Guard row of the resource, locked FOR UPDATE until the surrounding transaction ends.
     * Waits at most {@code capacity.reservation.lock.wait-ms} for a competing holder.
     */
    public ResourceSchedule lockScheduleFor(ResourceRef ref) {
        scheduleFor(ref);
        scheduleRepository.limitLockWait(lockWaitMs + "ms");
        try {
            return scheduleRepository.findWithLock(ref.kind(), ref.id())
                    .orElseThrow(() -> new IllegalStateException("Schedule row vanished for " + ref));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Timed out waiting for schedule lock on {}", ref);
            throw new ConcurrencyConflictException("Resource " + ref + " is locked by another booking", e);
        }
    }

    public ReserveOutcome assess(ReservationRequest request) {
        ResourceRef ref = request.ref();
        TimeWindow guard = request.guardWindow();
        UUID excluded = request.bookingId() != null ? request.bookingId() : NO_BOOKING;

        boolean overlapping = !commitmentRepository.findHeldOverlappingExcluding(
                ref.kind(), ref.id(), guard.start(), guard.end(), excluded).isEmpty();
        if (overlapping) {
            return ReserveOutcome.OVERLAP;
        }

        if (request.resource().hasDailyCap()) {
            long jobs = commitmentRepository.countForServiceDate(
                    ref.kind(), ref.id(), serviceDate(request.window().start()),
                    DAILY_CAP_STATUSES, excluded);
            if (jobs >= request.resource().dailyCapacity()) {
                return ReserveOutcome.DAILY_CAP_REACHED;
            }
        }
        return ReserveOutcome.RESERVED;
    }

    /**
     * Assesses the request and, when nothing blocks it, records a HELD commitment.
     * Must run while the caller holds whatever serializes writes on the resource.
     */
    public ReserveOutcome checkAndRecord(ReservationRequest request) {
        ReserveOutcome outcome = assess(request);
        if (!outcome.isReserved()) {
            log.debug("Resource {} rejected booking {}: {}", request.ref(), request.bookingId(), outcome);
            return outcome;
        }

        ResourceRef ref = request.ref();
        commitmentRepository.save(ResourceCommitment.builder()
                .resourceKind(ref.kind())
                .resourceId(ref.id())
                .bookingId(request.bookingId())
                .windowStart(request.window().start())
                .windowEnd(request.window().end())
                .serviceDate(serviceDate(request.window().start()))
                .status(CommitmentStatus.HELD)
                .build());
        log.debug("Recorded commitment of {} to booking {} for {}", ref, request.bookingId(), request.window());
        return outcome;
    }

    public LocalDate serviceDate(Instant start) {
        return LocalDate.ofInstant(start, ZoneId.of(businessZone));
    }

    private ResourceSchedule createSchedule(ResourceRef ref) {
        try {
            return scheduleRepository.saveAndFlush(ResourceSchedule.builder()
                    .resourceKind(ref.kind())
                    .resourceId(ref.id())
                    .sequence(0L)
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Schedule for " + ref + " was created concurrently", e);
        }
    }
}

package com.openwash.capacity.domain.service;

import com.openwash.capacity.domain.model.Allocation;
import com.openwash.capacity.domain.model.AllocationRequest;
import com.openwash.capacity.domain.model.OpenSlot;
import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceCandidate;
import com.openwash.capacity.domain.model.SlotQuery;
import com.openwash.capacity.domain.model.TimeWindow;
import com.openwash.capacity.domain.port.CommitmentStore;
import com.openwash.capacity.domain.port.ResourceDirectory;
import com.openwash.common.exception.InvalidInputException;
import com.openwash.common.exception.NoCapacityAvailableException;
import com.openwash.common.exception.NoCompatibleResourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Places bookings on bays and mobile teams without double-booking them.
 *
 * Candidates come from the {@link ResourceDirectory} in ascending id order and are tried one by one;
 * the first one the {@link CommitmentStore} reserves wins. The requested window is widened by the
 * turnaround buffer on both sides before it is compared with existing commitments.
 *
 * {@link #allocate} joins the caller's transaction, so the commitment commits or rolls back together
 * with the booking that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapacityAllocator {

    private final ResourceDirectory resourceDirectory;
    private final CommitmentStore commitmentStore;

    @Value("${capacity.buffer-minutes:15}")
    private int bufferMinutes;

    @Value("${capacity.alternatives.step-minutes:30}")
    private int alternativeStepMinutes;

    @Value("${capacity.alternatives.scan-steps:16}")
    private int alternativeScanSteps;

    @Value("${capacity.alternatives.max-results:3}")
    private int maxAlternatives;

    @Value("${capacity.slots.max-range-days:7}")
    private int maxSlotRangeDays;

    /**
     * Commits the first free compatible resource to the booking.
     *
     * @throws NoCompatibleResourceException no ACTIVE resource can take the job at all
     * @throws NoCapacityAvailableException  every compatible resource is busy; carries alternatives
     * @throws com.openwash.common.exception.ConcurrencyConflictException lost a race, caller may retry
     */
    @Transactional
    public Allocation allocate(AllocationRequest request) {
        validate(request);
        List<ResourceCandidate> candidates = compatibleCandidates(request);
        TimeWindow window = request.window();

        for (ResourceCandidate candidate : candidates) {
            ReserveOutcome outcome = commitmentStore.reserve(
                    new ReservationRequest(candidate, request.bookingId(), window, buffer()));
            if (outcome.isReserved()) {
                log.info("Allocated {} to booking {} for {}", candidate.ref(), request.bookingId(), window);
                return new Allocation(candidate.ref(), window);
            }
            log.debug("Candidate {} unavailable for booking {}: {}", candidate.ref(), request.bookingId(), outcome);
        }

        List<Instant> alternatives = findAlternatives(request, candidates);
        log.info("No capacity for booking {} at {} across {} candidate(s); {} alternative(s)",
                request.bookingId(), request.scheduledAt(), candidates.size(), alternatives.size());
        throw new NoCapacityAvailableException(request.scheduledAt(), alternatives);
    }

    /**
     * Start times near the requested one where at least one compatible resource is free.
     * Read-only; used after a lost race, when the original transaction is already gone.
     */
    @Transactional(readOnly = true)
    public List<Instant> suggestAlternatives(AllocationRequest request) {
        validate(request);
        List<ResourceCandidate> candidates = resourceDirectory.listCompatible(
                request.kind(), request.vehicleSize(), request.customerLocation());
        return candidates.isEmpty() ? List.of() : findAlternatives(request, candidates);
    }

    /**
     * Frees the booking's held resource, e.g. on cancel or before re-allocating. No-op if none is held.
     */
    @Transactional
    public boolean release(UUID bookingId) {
        return commitmentStore.release(bookingId);
    }

    /**
     * Keeps the booking's commitment on record as served, so it still counts toward daily caps.
     */
    @Transactional
    public boolean fulfil(UUID bookingId) {
        return commitmentStore.fulfil(bookingId);
    }

    @Transactional(readOnly = true)
    public boolean isAvailable(AllocationRequest request) {
        validate(request);
        List<ResourceCandidate> candidates = resourceDirectory.listCompatible(
                request.kind(), request.vehicleSize(), request.customerLocation());
        return anyFree(candidates, request.bookingId(), request.window());
    }

    /**
     * Start times in [from, to] at the given interval whose whole window fits before {@code to}
     * and where at least one compatible resource is free.
     */
    @Transactional(readOnly = true)
    public List<OpenSlot> findOpenSlots(SlotQuery query) {
        validate(query);
        List<ResourceCandidate> candidates = resourceDirectory.listCompatible(
                query.kind(), query.vehicleSize(), query.customerLocation());
        if (candidates.isEmpty()) {
            return List.of();
        }

        int interval = query.intervalMinutes() > 0 ? query.intervalMinutes() : alternativeStepMinutes;
        List<OpenSlot> slots = new ArrayList<>();
        for (Instant start = query.from();
             !start.plus(Duration.ofMinutes(query.durationMinutes())).isAfter(query.to());
             start = start.plus(Duration.ofMinutes(interval))) {
            TimeWindow window = TimeWindow.of(start, query.durationMinutes());
            int free = 0;
            for (ResourceCandidate candidate : candidates) {
                if (commitmentStore.isFree(new ReservationRequest(candidate, null, window, buffer()))) {
                    free++;
                }
            }
            if (free > 0) {
                slots.add(new OpenSlot(window, free));
            }
        }
        log.debug("Found {} open {} slot(s) between {} and {}", slots.size(), query.kind(), query.from(), query.to());
        return slots;
    }

    private List<ResourceCandidate> compatibleCandidates(AllocationRequest request) {
        List<ResourceCandidate> candidates = resourceDirectory.listCompatible(
                request.kind(), request.vehicleSize(), request.customerLocation());
        if (candidates.isEmpty()) {
            log.warn("No compatible {} for booking {}", request.kind(), request.bookingId());
            throw new NoCompatibleResourceException(
                    String.format("No active %s can serve this booking", request.kind()));
        }
        return candidates;
    }

    /**
     * Scans outward from the requested start: +1 step, -1 step, +2 steps, ... up to the scan limit.
     * Starts outside [earliestAlternative, latestAlternative] are skipped.
     */
    private List<Instant> findAlternatives(AllocationRequest request, List<ResourceCandidate> candidates) {
        Duration step = Duration.ofMinutes(alternativeStepMinutes);
        Instant requested = request.scheduledAt();
        List<Instant> found = new ArrayList<>();

        for (int distance = 1; distance <= alternativeScanSteps && found.size() < maxAlternatives; distance++) {
            Duration offset = step.multipliedBy(distance);
            for (Instant start : List.of(requested.plus(offset), requested.minus(offset))) {
                if (found.size() >= maxAlternatives) {
                    break;
                }
                if (request.earliestAlternative() != null && start.isBefore(request.earliestAlternative())) {
                    continue;
                }
                if (request.latestAlternative() != null && start.isAfter(request.latestAlternative())) {
                    continue;
                }
                if (anyFree(candidates, request.bookingId(), TimeWindow.of(start, request.durationMinutes()))) {
                    found.add(start);
                }
            }
        }
        return found;
    }

    private boolean anyFree(List<ResourceCandidate> candidates, UUID bookingId, TimeWindow window) {
        return candidates.stream()
                .anyMatch(candidate -> commitmentStore.isFree(
                        new ReservationRequest(candidate, bookingId, window, buffer())));
    }

    private Duration buffer() {
        return Duration.ofMinutes(bufferMinutes);
    }

    private void validate(AllocationRequest request) {
        if (request.kind() == null || request.scheduledAt() == null) {
            throw new InvalidInputException("Resource kind and start time are required");
        }
        if (request.durationMinutes() <= 0) {
            throw new InvalidInputException("Duration must be positive, got " + request.durationMinutes());
        }
    }

    private void validate(SlotQuery query) {
        if (query.kind() == null || query.from() == null || query.to() == null) {
            throw new InvalidInputException("Resource kind and time range are required");
        }
        if (!query.to().isAfter(query.from())) {
            throw new InvalidInputException("Range end must be after range start");
        }
        if (Duration.between(query.from(), query.to()).compareTo(Duration.ofDays(maxSlotRangeDays)) > 0) {
            throw new InvalidInputException("Range must not exceed " + maxSlotRangeDays + " days");
        }
        if (query.durationMinutes() <= 0) {
            throw new InvalidInputException("Duration must be positive, got " + query.durationMinutes());
        }
    }
}

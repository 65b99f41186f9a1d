package com.openwash.booking.orchestration;

import com.openwash.booking.api.dto.BookingSearchCriteria;
import com.openwash.booking.api.dto.CreateBookingRequest;
import com.openwash.booking.client.dto.VehicleResponse;
import com.openwash.booking.domain.model.Booking;
import com.openwash.booking.domain.model.BookingKind;
import com.openwash.booking.domain.model.BookingServiceLine;
import com.openwash.booking.domain.model.BookingStatus;
import com.openwash.booking.domain.policy.BookingFeePolicy;
import com.openwash.booking.domain.repository.BookingRepository;
import com.openwash.booking.domain.repository.BookingSpecification;
import com.openwash.booking.events.BookingEventPublisher;
import com.openwash.booking.events.BookingEventType;
import com.openwash.booking.exception.BookingDeadlineExceededException;
import com.openwash.capacity.domain.model.Allocation;
import com.openwash.capacity.domain.model.AllocationRequest;
import com.openwash.capacity.domain.model.GeoLocation;
import com.openwash.capacity.domain.model.VehicleSize;
import com.openwash.capacity.domain.service.CapacityAllocator;
import com.openwash.common.exception.ConcurrencyConflictException;
import com.openwash.common.exception.InvalidInputException;
import com.openwash.common.exception.NoCapacityAvailableException;
import com.openwash.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Coordinates booking writes: collaborator checks, allocation, the aggregate transition and the
 * post-commit event.
 *
 * Flow for every write:
 * 1. Read-only collaborator checks, outside any transaction
 * 2. One transaction that loads or creates the booking, applies the transition and, when the
 *    window changes, releases the old commitment and allocates a new one
 * 3. After commit, publish the status event (fire-and-forget)
 *
 * Allocating writes (create, reschedule, service changes) run against the caller's deadline:
 * the transaction timeout is the time left, and the deadline is checked again before commit.
 * A lost reservation race is retried once in a fresh transaction; a second loss is reported as
 * {@link NoCapacityAvailableException} with alternatives.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingOrchestrator {

    public static final int MAX_PAGE_SIZE = 100;

    /** Stands in for an empty exclusion list; never a real booking id. */
    private static final UUID NO_BOOKING = new UUID(0L, 0L);

    private final BookingRepository bookingRepository;
    private final CapacityAllocator capacityAllocator;
    private final ExternalReferenceValidator referenceValidator;
    private final BookingEventPublisher eventPublisher;
    private final PlatformTransactionManager transactionManager;
    private final RetryTemplate allocationRetryTemplate;
    private final Clock clock;

    @Value("${booking.allocation.default-timeout:5s}")
    private Duration defaultTimeout;

    @Value("${booking.allocation.max-timeout:30s}")
    private Duration maxTimeout;

    /**
     * @param requestedTimeoutMs caller budget in milliseconds, or null for the default
     */
    public Booking createBooking(CreateBookingRequest request, Long requestedTimeoutMs) {
        Deadline deadline = startDeadline("Create booking", requestedTimeoutMs);
        log.info("Creating {} booking for customer {}, vehicle {} at {}",
                request.kind(), request.customerId(), request.vehicleId(), request.scheduledAt());

        referenceValidator.requireCustomer(request.customerId());
        VehicleResponse vehicle = referenceValidator.requireVehicleOf(request.vehicleId(), request.customerId());
        List<BookingServiceLine> lines = referenceValidator.resolveServices(request.serviceIds());
        GeoLocation location = toLocation(request.location());
        Instant now = clock.instant();

        Supplier<AllocationRequest> requestFor = () -> allocationRequest(null, request.kind(), request.scheduledAt(),
                lines.stream().mapToInt(BookingServiceLine::getDurationMinutes).sum(),
                vehicle.sizeClass(), location, now, now);

        Booking created = inAllocatingTransaction(deadline, requestFor, status -> {
            Booking booking = Booking.create(request.customerId(), request.vehicleId(), vehicle.sizeClass(),
                    lines, request.scheduledAt(), request.kind(), location, request.notes(), now);
            allocate(booking, now, now);
            return bookingRepository.save(booking);
        });

        log.info("Booking {} created on {}", created.getId(), created.assignedResource());
        eventPublisher.publish(BookingEventType.CREATED, created);
        return created;
    }

    public Booking confirmBooking(UUID bookingId) {
        return transition(bookingId, BookingEventType.CONFIRMED, booking -> booking.confirm(clock.instant()));
    }

    public Booking startBooking(UUID bookingId) {
        return transition(bookingId, BookingEventType.STARTED, booking -> booking.start(clock.instant()));
    }

    public Booking completeBooking(UUID bookingId) {
        return transition(bookingId, BookingEventType.COMPLETED, booking -> {
            booking.complete(clock.instant());
            capacityAllocator.fulfil(booking.getId());
        });
    }

    public Booking cancelBooking(UUID bookingId, String actor, String reason) {
        return transition(bookingId, BookingEventType.CANCELLED, booking -> {
            booking.cancel(clock.instant(), actor, reason);
            capacityAllocator.release(booking.getId());
        });
    }

    public Booking markNoShow(UUID bookingId) {
        return transition(bookingId, BookingEventType.NO_SHOW, booking -> {
            booking.markNoShow(clock.instant());
            capacityAllocator.release(booking.getId());
        });
    }

    public Booking rateBooking(UUID bookingId, int score, String feedback) {
        return transition(bookingId, BookingEventType.UPDATED,
                booking -> booking.rate(score, feedback, clock.instant()));
    }

    /**
     * Moves the booking to a new start. If nothing is free at the new time the booking keeps its
     * old time and resource.
     */
    public Booking rescheduleBooking(UUID bookingId, Instant newScheduledAt, Long requestedTimeoutMs) {
        Deadline deadline = startDeadline("Reschedule booking " + bookingId, requestedTimeoutMs);
        Instant now = clock.instant();
        Booking current = getBooking(bookingId);
        log.info("Rescheduling booking {} from {} to {}", bookingId, current.getScheduledAt(), newScheduledAt);

        Supplier<AllocationRequest> requestFor = () -> allocationRequest(bookingId, current.getKind(), newScheduledAt,
                current.getTotalDurationMinutes(), current.getVehicleSize(), current.customerLocation(),
                now.plus(Booking.MIN_RESCHEDULE_NOTICE), now);

        Booking rescheduled = inAllocatingTransaction(deadline, requestFor, status -> {
            Booking booking = load(bookingId);
            booking.reschedule(newScheduledAt, now);
            allocate(booking, now, now.plus(Booking.MIN_RESCHEDULE_NOTICE));
            return bookingRepository.save(booking);
        });

        eventPublisher.publish(BookingEventType.RESCHEDULED, rescheduled);
        return rescheduled;
    }

    public Booking addService(UUID bookingId, Long serviceId, Long requestedTimeoutMs) {
        Deadline deadline = startDeadline("Add service to booking " + bookingId, requestedTimeoutMs);
        BookingServiceLine line = referenceValidator.resolveServices(List.of(serviceId)).get(0);
        return changeServices(bookingId, deadline, line.getDurationMinutes(),
                (booking, now) -> booking.addService(line, now));
    }

    public Booking removeService(UUID bookingId, Long serviceId, Long requestedTimeoutMs) {
        Deadline deadline = startDeadline("Remove service from booking " + bookingId, requestedTimeoutMs);
        return changeServices(bookingId, deadline, 0,
                (booking, now) -> booking.removeService(serviceId, now));
    }

    public Booking getBooking(UUID bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    public Page<Booking> listCustomerBookings(Long customerId, int page, int limit) {
        return searchBookings(BookingSearchCriteria.builder().customerId(customerId).build(), page, limit);
    }

    /**
     * Bookings matching every non-null filter, latest start first.
     *
     * @param page  1-based
     * @param limit 1 to {@value #MAX_PAGE_SIZE}
     */
    public Page<Booking> searchBookings(BookingSearchCriteria criteria, int page, int limit) {
        if (page < 1) {
            throw new InvalidInputException("Page must be at least 1, got " + page);
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidInputException("Limit must be between 1 and " + MAX_PAGE_SIZE + ", got " + limit);
        }
        if (criteria.from() != null && criteria.to() != null && criteria.from().isAfter(criteria.to())) {
            throw new InvalidInputException("Range start " + criteria.from() + " is after range end " + criteria.to());
        }
        PageRequest pageable = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "scheduledAt"));
        return bookingRepository.findAll(BookingSpecification.withCriteria(criteria), pageable);
    }

    /**
     * Replaces the customer's notes. Allowed until the wash starts; a null clears them.
     */
    public Booking updateNotes(UUID bookingId, String notes) {
        return transition(bookingId, BookingEventType.UPDATED,
                booking -> booking.updateNotes(notes, clock.instant()));
    }

    /**
     * CONFIRMED bookings whose no-show grace period is over, oldest first.
     */
    public List<UUID> findDueNoShows(int limit) {
        return findDueNoShows(limit, Set.of());
    }

    /**
     * @param skipped bookings to leave out, e.g. ones the sweep has given up on
     */
    public List<UUID> findDueNoShows(int limit, Collection<UUID> skipped) {
        Instant cutoff = clock.instant().minus(BookingFeePolicy.NO_SHOW_GRACE);
        Collection<UUID> excluded = skipped.isEmpty() ? Set.of(NO_BOOKING) : skipped;
        return bookingRepository.findIdsByStatusScheduledBefore(
                BookingStatus.CONFIRMED, cutoff, excluded, PageRequest.of(0, limit));
    }

    private Booking changeServices(UUID bookingId, Deadline deadline, int addedMinutes, ServiceChange change) {
        Instant now = clock.instant();
        Booking current = getBooking(bookingId);
        Supplier<AllocationRequest> requestFor = () -> allocationRequest(bookingId, current.getKind(),
                current.getScheduledAt(), current.getTotalDurationMinutes() + addedMinutes,
                current.getVehicleSize(), current.customerLocation(), now, now);

        Booking updated = inAllocatingTransaction(deadline, requestFor, status -> {
            Booking booking = load(bookingId);
            change.apply(booking, now);
            allocate(booking, now, now);
            return bookingRepository.save(booking);
        });

        log.info("Booking {} services changed: {} minutes, total {}",
                bookingId, updated.getTotalDurationMinutes(), updated.getTotalPrice());
        eventPublisher.publish(BookingEventType.UPDATED, updated);
        return updated;
    }

    private Booking transition(UUID bookingId, BookingEventType eventType, Consumer<Booking> change) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        Booking saved;
        try {
            saved = tx.execute(status -> {
                Booking booking = load(bookingId);
                change.accept(booking);
                return bookingRepository.save(booking);
            });
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Booking " + bookingId + " was modified concurrently", e);
        }
        log.info("Booking {} is now {}", bookingId, saved.getStatus());
        eventPublisher.publish(eventType, saved);
        return saved;
    }

    /**
     * Drops whatever the booking holds and places it again for its current window.
     */
    private void allocate(Booking booking, Instant now, Instant earliestAlternative) {
        capacityAllocator.release(booking.getId());
        Allocation allocation = capacityAllocator.allocate(allocationRequest(booking.getId(), booking.getKind(),
                booking.getScheduledAt(), booking.getTotalDurationMinutes(), booking.getVehicleSize(),
                booking.customerLocation(), earliestAlternative, now));
        booking.assignResource(allocation.resource());
    }

    /**
     * @param requestFor what to search alternatives for if the race is lost twice
     */
    private Booking inAllocatingTransaction(Deadline deadline, Supplier<AllocationRequest> requestFor,
                                            TransactionCallback<Booking> work) {
        try {
            return allocationRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("{}: retrying after concurrency conflict", deadline.operation());
                }
                return runBeforeDeadline(deadline, work);
            });
        } catch (ConcurrencyConflictException e) {
            log.warn("{}: lost the allocation race again, reporting no capacity", deadline.operation());
            AllocationRequest request = requestFor.get();
            List<Instant> alternatives = capacityAllocator.suggestAlternatives(request);
            throw new NoCapacityAvailableException(request.scheduledAt(), alternatives, e);
        }
    }

    private Booking runBeforeDeadline(Deadline deadline, TransactionCallback<Booking> work) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setTimeout(remainingSeconds(deadline));
        try {
            return tx.execute(status -> {
                Booking result = work.doInTransaction(status);
                bookingRepository.flush();
                if (clock.instant().isAfter(deadline.expiresAt())) {
                    log.warn("{}: deadline passed before commit, rolling back", deadline.operation());
                    throw new BookingDeadlineExceededException(deadline.operation(), deadline.budget());
                }
                return result;
            });
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            log.warn("{}: transaction timed out: {}", deadline.operation(), e.getMessage());
            throw new BookingDeadlineExceededException(deadline.operation(), deadline.budget(), e);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(deadline.operation() + ": booking was modified concurrently", e);
        }
    }

    private int remainingSeconds(Deadline deadline) {
        long remainingMs = Duration.between(clock.instant(), deadline.expiresAt()).toMillis();
        if (remainingMs <= 0) {
            throw new BookingDeadlineExceededException(deadline.operation(), deadline.budget());
        }
        return (int) Math.max(1, (remainingMs + 999) / 1000);
    }

    private Deadline startDeadline(String operation, Long requestedTimeoutMs) {
        Duration budget;
        if (requestedTimeoutMs == null) {
            budget = defaultTimeout;
        } else if (requestedTimeoutMs <= 0) {
            throw new InvalidInputException("Request timeout must be positive, got " + requestedTimeoutMs);
        } else {
            budget = Duration.ofMillis(requestedTimeoutMs);
        }
        if (budget.compareTo(maxTimeout) > 0) {
            budget = maxTimeout;
        }
        return new Deadline(operation, clock.instant().plus(budget), budget);
    }

    private Booking load(UUID bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private static AllocationRequest allocationRequest(UUID bookingId, BookingKind kind, Instant start,
                                                       int durationMinutes, VehicleSize vehicleSize,
                                                       GeoLocation location, Instant earliestAlternative,
                                                       Instant now) {
        return AllocationRequest.builder()
                .bookingId(bookingId)
                .kind(kind.resourceKind())
                .scheduledAt(start)
                .durationMinutes(durationMinutes)
                .vehicleSize(vehicleSize)
                .customerLocation(location)
                .earliestAlternative(earliestAlternative)
                .latestAlternative(now.plus(Booking.MAX_ADVANCE))
                .build();
    }

    private static GeoLocation toLocation(CreateBookingRequest.Location location) {
        if (location == null) {
            return null;
        }
        return new GeoLocation(location.latitude(), location.longitude());
    }

    private record Deadline(String operation, Instant expiresAt, Duration budget) {
    }

    @FunctionalInterface
    private interface ServiceChange {
        void apply(Booking booking, Instant now);
    }
}

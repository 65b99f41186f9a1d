package com.openwash.booking.orchestration;

import com.openwash.booking.api.dto.BookingSearchCriteria;
import com.openwash.booking.api.dto.CreateBookingRequest;
import com.openwash.booking.client.dto.VehicleResponse;
import com.openwash.booking.config.RetryConfig;
import com.openwash.booking.domain.model.Booking;
import com.openwash.booking.domain.model.BookingFixtures;
import com.openwash.booking.domain.model.BookingKind;
import com.openwash.booking.domain.model.BookingStatus;
import com.openwash.booking.domain.repository.BookingRepository;
import com.openwash.booking.events.BookingEventPublisher;
import com.openwash.booking.events.BookingEventType;
import com.openwash.booking.exception.BookingDeadlineExceededException;
import com.openwash.capacity.domain.model.Allocation;
import com.openwash.capacity.domain.model.AllocationRequest;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.VehicleSize;
import com.openwash.capacity.domain.service.CapacityAllocator;
import com.openwash.common.exception.ConcurrencyConflictException;
import com.openwash.common.exception.InvalidInputException;
import com.openwash.common.exception.InvalidTransitionException;
import com.openwash.common.exception.NoCapacityAvailableException;
import com.openwash.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.openwash.booking.domain.model.BookingFixtures.CUSTOMER_ID;
import static com.openwash.booking.domain.model.BookingFixtures.NOW;
import static com.openwash.booking.domain.model.BookingFixtures.VEHICLE_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link BookingOrchestrator}.
 *
 * Verifies:
 * - create: collaborator checks, allocation inside one transaction, event after commit
 * - one retry on a lost reservation race, then NO_CAPACITY_AVAILABLE with alternatives
 * - the request deadline bounds the transaction and is checked before commit
 * - status transitions release or fulfil the commitment and publish the matching event
 */
@ExtendWith(MockitoExtension.class)
class BookingOrchestratorTest {

    private static final Instant IN_TWO_DAYS = NOW.plus(Duration.ofDays(2));

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private CapacityAllocator capacityAllocator;

    @Mock
    private ExternalReferenceValidator referenceValidator;

    @Mock
    private BookingEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private MutableClock clock;

    private BookingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        RetryConfig retryConfig = new RetryConfig();
        ReflectionTestUtils.setField(retryConfig, "conflictAttempts", 2);

        orchestrator = new BookingOrchestrator(bookingRepository, capacityAllocator, referenceValidator,
                eventPublisher, transactionManager, retryConfig.allocationRetryTemplate(), clock);
        ReflectionTestUtils.setField(orchestrator, "defaultTimeout", Duration.ofSeconds(5));
        ReflectionTestUtils.setField(orchestrator, "maxTimeout", Duration.ofSeconds(30));

        lenient().when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        lenient().when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("createBooking happy path: validate -> allocate -> save -> commit -> publish CREATED")
    void createBooking_success() {
        // given
        givenValidReferences();
        given(capacityAllocator.allocate(any())).willAnswer(inv -> allocationOn(ResourceRef.washBay(7L), inv.getArgument(0)));

        // when
        Booking booking = orchestrator.createBooking(createRequest(), null);

        // then
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.assignedResource()).isEqualTo(ResourceRef.washBay(7L));
        assertThat(booking.getTotalPrice()).isEqualByComparingTo("100.00");

        ArgumentCaptor<AllocationRequest> requestCaptor = ArgumentCaptor.forClass(AllocationRequest.class);
        verify(capacityAllocator).allocate(requestCaptor.capture());
        AllocationRequest sent = requestCaptor.getValue();
        assertThat(sent.bookingId()).isEqualTo(booking.getId());
        assertThat(sent.kind()).isEqualTo(ResourceKind.WASH_BAY);
        assertThat(sent.scheduledAt()).isEqualTo(IN_TWO_DAYS);
        assertThat(sent.durationMinutes()).isEqualTo(60);
        assertThat(sent.vehicleSize()).isEqualTo(VehicleSize.STANDARD);
        assertThat(sent.earliestAlternative()).isEqualTo(NOW);
        assertThat(sent.latestAlternative()).isEqualTo(NOW.plus(Booking.MAX_ADVANCE));

        InOrder order = inOrder(referenceValidator, transactionManager, capacityAllocator, eventPublisher);
        order.verify(referenceValidator).requireCustomer(CUSTOMER_ID);
        order.verify(transactionManager).getTransaction(any());
        order.verify(capacityAllocator).allocate(any());
        order.verify(transactionManager).commit(any());
        order.verify(eventPublisher).publish(BookingEventType.CREATED, booking);
    }

    @Test
    @DisplayName("createBooking uses the default timeout, and caps the header at the maximum")
    void createBooking_transactionTimeout() {
        // given
        givenValidReferences();
        given(capacityAllocator.allocate(any())).willAnswer(inv -> allocationOn(ResourceRef.washBay(7L), inv.getArgument(0)));

        // when
        orchestrator.createBooking(createRequest(), null);
        orchestrator.createBooking(createRequest(), 120_000L);

        // then
        ArgumentCaptor<TransactionDefinition> definitions = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager, times(2)).getTransaction(definitions.capture());
        assertThat(definitions.getAllValues()).extracting(TransactionDefinition::getTimeout).containsExactly(5, 30);
    }

    @Test
    @DisplayName("createBooking rejects a non-positive timeout header before calling anything")
    void createBooking_badTimeout() {
        assertThatThrownBy(() -> orchestrator.createBooking(createRequest(), 0L))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(referenceValidator, capacityAllocator, eventPublisher);
    }

    @Test
    @DisplayName("createBooking: collaborator failures surface before any transaction opens")
    void createBooking_unknownCustomer() {
        // given
        willThrow(new ResourceNotFoundException("Customer", CUSTOMER_ID))
                .given(referenceValidator).requireCustomer(CUSTOMER_ID);

        // when / then
        assertThatThrownBy(() -> orchestrator.createBooking(createRequest(), null))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(transactionManager, never()).getTransaction(any());
        verifyNoInteractions(capacityAllocator, eventPublisher);
    }

    @Test
    @DisplayName("createBooking retries once after a concurrency conflict and then succeeds")
    void createBooking_conflictThenSuccess() {
        // given
        givenValidReferences();
        given(capacityAllocator.allocate(any()))
                .willThrow(new ConcurrencyConflictException("bay 7 moved"))
                .willAnswer(inv -> allocationOn(ResourceRef.washBay(8L), inv.getArgument(0)));

        // when
        Booking booking = orchestrator.createBooking(createRequest(), null);

        // then
        assertThat(booking.assignedResource()).isEqualTo(ResourceRef.washBay(8L));
        verify(capacityAllocator, times(2)).allocate(any());
        verify(transactionManager).rollback(any());
        verify(transactionManager).commit(any());
        verify(eventPublisher).publish(BookingEventType.CREATED, booking);
    }

    @Test
    @DisplayName("createBooking: a second concurrency conflict becomes NO_CAPACITY_AVAILABLE with alternatives")
    void createBooking_conflictTwice() {
        // given
        givenValidReferences();
        List<Instant> alternatives = List.of(IN_TWO_DAYS.plus(Duration.ofMinutes(30)));
        given(capacityAllocator.allocate(any())).willThrow(new ConcurrencyConflictException("lost race"));
        given(capacityAllocator.suggestAlternatives(any())).willReturn(alternatives);

        // when / then
        assertThatThrownBy(() -> orchestrator.createBooking(createRequest(), null))
                .isInstanceOfSatisfying(NoCapacityAvailableException.class, ex -> {
                    assertThat(ex.getRequestedStart()).isEqualTo(IN_TWO_DAYS);
                    assertThat(ex.getAlternatives()).isEqualTo(alternatives);
                    assertThat(ex.getCause()).isInstanceOf(ConcurrencyConflictException.class);
                });

        verify(capacityAllocator, times(2)).allocate(any());
        verify(transactionManager, times(2)).rollback(any());
        verify(transactionManager, never()).commit(any());
        verify(eventPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("createBooking: NO_CAPACITY_AVAILABLE from the allocator passes through without retry")
    void createBooking_noCapacity() {
        // given
        givenValidReferences();
        given(capacityAllocator.allocate(any()))
                .willThrow(new NoCapacityAvailableException(IN_TWO_DAYS, List.of()));

        // when / then
        assertThatThrownBy(() -> orchestrator.createBooking(createRequest(), null))
                .isInstanceOf(NoCapacityAvailableException.class);
        verify(capacityAllocator, times(1)).allocate(any());
        verify(bookingRepository, never()).save(any());
        verify(transactionManager).rollback(any());
        verify(eventPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("createBooking: a deadline that passes before commit rolls back with BOOKING_DEADLINE_EXCEEDED")
    void createBooking_deadlineExceeded() {
        // given
        givenValidReferences();
        given(capacityAllocator.allocate(any())).willAnswer(inv -> {
            clock.advance(Duration.ofMillis(1500));
            return allocationOn(ResourceRef.washBay(7L), inv.getArgument(0));
        });

        // when / then
        assertThatThrownBy(() -> orchestrator.createBooking(createRequest(), 1000L))
                .isInstanceOfSatisfying(BookingDeadlineExceededException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo("BOOKING_DEADLINE_EXCEEDED"));
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
        verify(eventPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("cancelBooking applies the fee, releases the resource and publishes CANCELLED")
    void cancelBooking_releases() {
        // given
        Booking booking = BookingFixtures.confirmed(NOW.plus(Duration.ofHours(10)));
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));

        // when
        Booking result = orchestrator.cancelBooking(booking.getId(), "customer:100", "Plans changed");

        // then
        assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(result.getCancellationFee()).isEqualByComparingTo("25.00");
        verify(capacityAllocator).release(booking.getId());
        verify(transactionManager).commit(any());
        verify(eventPublisher).publish(BookingEventType.CANCELLED, booking);
    }

    @Test
    @DisplayName("completeBooking fulfils the commitment and publishes COMPLETED")
    void completeBooking_fulfils() {
        // given
        Booking booking = BookingFixtures.inProgress(IN_TWO_DAYS);
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));
        clock.advance(Duration.between(NOW, IN_TWO_DAYS.plus(Duration.ofMinutes(72))));

        // when
        Booking result = orchestrator.completeBooking(booking.getId());

        // then
        assertThat(result.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(result.getOvertimeCharge()).isEqualByComparingTo("12.00");
        verify(capacityAllocator).fulfil(booking.getId());
        verify(capacityAllocator, never()).release(any());
        verify(eventPublisher).publish(BookingEventType.COMPLETED, booking);
    }

    @Test
    @DisplayName("an illegal transition rolls back and publishes nothing")
    void transition_invalid() {
        // given
        Booking booking = BookingFixtures.pendingIn(Duration.ofHours(5));
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));

        // when / then
        assertThatThrownBy(() -> orchestrator.startBooking(booking.getId()))
                .isInstanceOf(InvalidTransitionException.class);
        verify(transactionManager).rollback(any());
        verify(eventPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("a concurrent update of the booking row surfaces as CONCURRENCY_CONFLICT")
    void transition_optimisticLockFailure() {
        // given
        Booking booking = BookingFixtures.pendingIn(Duration.ofHours(5));
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));
        given(bookingRepository.save(booking)).willThrow(new OptimisticLockingFailureException("stale version"));

        // when / then
        assertThatThrownBy(() -> orchestrator.confirmBooking(booking.getId()))
                .isInstanceOf(ConcurrencyConflictException.class);
        verify(eventPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("markNoShow releases the resource and publishes NO_SHOW")
    void markNoShow_releases() {
        // given
        Booking booking = BookingFixtures.confirmed(NOW.plus(Duration.ofHours(3)));
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));
        clock.advance(Duration.ofHours(4));

        // when
        Booking result = orchestrator.markNoShow(booking.getId());

        // then
        assertThat(result.getStatus()).isEqualTo(BookingStatus.NO_SHOW);
        assertThat(result.getCancellationFee()).isEqualByComparingTo("100.00");
        verify(capacityAllocator).release(booking.getId());
        verify(eventPublisher).publish(BookingEventType.NO_SHOW, booking);
    }

    @Test
    @DisplayName("rescheduleBooking releases the old commitment before allocating the new window")
    void rescheduleBooking_reallocates() {
        // given
        Booking booking = BookingFixtures.confirmed(IN_TWO_DAYS);
        Instant newTime = IN_TWO_DAYS.plus(Duration.ofDays(1));
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));
        given(capacityAllocator.allocate(any())).willAnswer(inv -> allocationOn(ResourceRef.washBay(9L), inv.getArgument(0)));

        // when
        Booking result = orchestrator.rescheduleBooking(booking.getId(), newTime, null);

        // then
        assertThat(result.getScheduledAt()).isEqualTo(newTime);
        assertThat(result.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(result.assignedResource()).isEqualTo(ResourceRef.washBay(9L));

        InOrder order = inOrder(capacityAllocator);
        order.verify(capacityAllocator).release(booking.getId());
        ArgumentCaptor<AllocationRequest> requestCaptor = ArgumentCaptor.forClass(AllocationRequest.class);
        order.verify(capacityAllocator).allocate(requestCaptor.capture());
        assertThat(requestCaptor.getValue().scheduledAt()).isEqualTo(newTime);
        assertThat(requestCaptor.getValue().earliestAlternative()).isEqualTo(NOW.plus(Duration.ofHours(2)));
        verify(eventPublisher).publish(BookingEventType.RESCHEDULED, booking);
    }

    @Test
    @DisplayName("rescheduleBooking with less than 2 hours notice fails before allocating")
    void rescheduleBooking_shortNotice() {
        // given
        Booking booking = BookingFixtures.confirmed(IN_TWO_DAYS);
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));

        // when / then
        assertThatThrownBy(() -> orchestrator.rescheduleBooking(booking.getId(), NOW.plus(Duration.ofMinutes(90)), null))
                .isInstanceOf(InvalidInputException.class);
        verify(capacityAllocator, never()).allocate(any());
        verify(eventPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("addService prices the service from the catalog and re-allocates the longer window")
    void addService_reallocates() {
        // given
        Booking booking = BookingFixtures.pending(IN_TWO_DAYS);
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));
        given(referenceValidator.resolveServices(List.of(3L)))
                .willReturn(List.of(BookingFixtures.line(3L, "35.00", 30)));
        given(capacityAllocator.allocate(any())).willAnswer(inv -> allocationOn(ResourceRef.washBay(7L), inv.getArgument(0)));

        // when
        Booking result = orchestrator.addService(booking.getId(), 3L, null);

        // then
        assertThat(result.getTotalPrice()).isEqualByComparingTo("135.00");
        ArgumentCaptor<AllocationRequest> requestCaptor = ArgumentCaptor.forClass(AllocationRequest.class);
        verify(capacityAllocator).allocate(requestCaptor.capture());
        assertThat(requestCaptor.getValue().durationMinutes()).isEqualTo(90);
        verify(eventPublisher).publish(BookingEventType.UPDATED, booking);
    }

    @Test
    @DisplayName("getBooking throws RESOURCE_NOT_FOUND for unknown ids")
    void getBooking_unknown() {
        UUID id = UUID.randomUUID();
        given(bookingRepository.findById(id)).willReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.getBooking(id)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("findDueNoShows looks for CONFIRMED bookings that started more than 30 minutes ago")
    void findDueNoShows_cutoff() {
        // given
        List<UUID> due = List.of(UUID.randomUUID());
        given(bookingRepository.findIdsByStatusScheduledBefore(
                eq(BookingStatus.CONFIRMED), eq(NOW.minus(Duration.ofMinutes(30))),
                eq(Set.of(new UUID(0L, 0L))), any(Pageable.class)))
                .willReturn(due);

        // when / then
        assertThat(orchestrator.findDueNoShows(50)).isEqualTo(due);
    }

    @Test
    @DisplayName("findDueNoShows passes the skipped bookings on as exclusions")
    void findDueNoShows_excludesSkipped() {
        // given
        UUID skipped = UUID.randomUUID();
        given(bookingRepository.findIdsByStatusScheduledBefore(
                eq(BookingStatus.CONFIRMED), any(Instant.class), eq(Set.of(skipped)), any(Pageable.class)))
                .willReturn(List.of());

        // when / then
        assertThat(orchestrator.findDueNoShows(50, Set.of(skipped))).isEmpty();
    }

    @Test
    @DisplayName("searchBookings turns the 1-based page into a request sorted by start, latest first")
    @SuppressWarnings("unchecked")
    void searchBookings_pages() {
        // given
        Booking booking = BookingFixtures.confirmed(IN_TWO_DAYS);
        given(bookingRepository.findAll(any(Specification.class), any(Pageable.class)))
                .willAnswer(inv -> new PageImpl<>(List.of(booking), inv.getArgument(1), 41));
        BookingSearchCriteria criteria = BookingSearchCriteria.builder()
                .customerId(CUSTOMER_ID)
                .status(BookingStatus.CONFIRMED)
                .from(NOW)
                .to(NOW.plus(Duration.ofDays(7)))
                .build();

        // when
        Page<Booking> page = orchestrator.searchBookings(criteria, 3, 20);

        // then
        ArgumentCaptor<Pageable> pageableCaptor = ArgumentCaptor.forClass(Pageable.class);
        verify(bookingRepository).findAll(any(Specification.class), pageableCaptor.capture());
        assertThat(pageableCaptor.getValue().getPageNumber()).isEqualTo(2);
        assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(20);
        assertThat(pageableCaptor.getValue().getSort().getOrderFor("scheduledAt").getDirection())
                .isEqualTo(Sort.Direction.DESC);
        assertThat(page.getContent()).containsExactly(booking);
        assertThat(page.getTotalElements()).isEqualTo(41);
        assertThat(page.hasNext()).isFalse();
    }

    @Test
    @DisplayName("searchBookings rejects a page below 1, a limit above 100 and a reversed range")
    void searchBookings_rejectsBadPaging() {
        BookingSearchCriteria none = BookingSearchCriteria.builder().build();
        BookingSearchCriteria reversed = BookingSearchCriteria.builder()
                .from(NOW.plus(Duration.ofDays(1)))
                .to(NOW)
                .build();

        assertThatThrownBy(() -> orchestrator.searchBookings(none, 0, 20)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> orchestrator.searchBookings(none, 1, 101)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> orchestrator.searchBookings(reversed, 1, 20)).isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(bookingRepository);
    }

    @Test
    @DisplayName("updateNotes replaces the notes without touching capacity and publishes UPDATED")
    void updateNotes_publishesUpdated() {
        // given
        Booking booking = BookingFixtures.confirmed(IN_TWO_DAYS);
        given(bookingRepository.findById(booking.getId())).willReturn(Optional.of(booking));

        // when
        Booking result = orchestrator.updateNotes(booking.getId(), "Gate code 4321");

        // then
        assertThat(result.getNotes()).isEqualTo("Gate code 4321");
        verifyNoInteractions(capacityAllocator);
        verify(transactionManager).commit(any());
        verify(eventPublisher).publish(BookingEventType.UPDATED, booking);
    }

    private void givenValidReferences() {
        given(referenceValidator.requireVehicleOf(VEHICLE_ID, CUSTOMER_ID))
                .willReturn(new VehicleResponse(VEHICLE_ID, CUSTOMER_ID, VehicleSize.STANDARD, true));
        given(referenceValidator.resolveServices(List.of(1L, 2L))).willReturn(BookingFixtures.defaultLines());
    }

    private static CreateBookingRequest createRequest() {
        return new CreateBookingRequest(CUSTOMER_ID, VEHICLE_ID, List.of(1L, 2L), IN_TWO_DAYS,
                BookingKind.STATIONARY, null, null);
    }

    private static Allocation allocationOn(ResourceRef resource, AllocationRequest request) {
        return new Allocation(resource, request.window());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

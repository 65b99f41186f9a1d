package com.openwash.capacity.domain.repository;

import com.openwash.capacity.domain.model.CommitmentStatus;
import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceCandidate;
import com.openwash.capacity.domain.model.ResourceCommitment;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.ResourceSchedule;
import com.openwash.capacity.domain.model.TimeWindow;
import com.openwash.capacity.domain.service.CommitmentLedger;
import com.openwash.capacity.domain.strategy.OptimisticLockReservationStrategy;
import com.openwash.capacity.domain.strategy.PessimisticLockReservationStrategy;
import com.openwash.capacity.domain.strategy.ReservationStrategy;
import com.openwash.common.exception.ConcurrencyConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration test for the guard row and commitment queries behind the reservation strategies.
 *
 * Uses @DataJpaTest so only the JPA layer plus the ledger and strategies are loaded (no Redisson).
 * Testcontainers provides a real PostgreSQL instance; skipped when Docker is unavailable.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({CommitmentLedger.class, PessimisticLockReservationStrategy.class, OptimisticLockReservationStrategy.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class ResourceScheduleRepositoryIntegrationTest {

    private static final Instant START = Instant.parse("2026-06-01T10:00:00Z");

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("wash_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create"); // no Flyway in this module
        registry.add("capacity.reservation.lock.wait-ms", () -> "500");
    }

    @Autowired
    private ResourceScheduleRepository scheduleRepository;

    @Autowired
    private ResourceCommitmentRepository commitmentRepository;

    @Autowired
    private CommitmentLedger ledger;

    @Autowired
    private PessimisticLockReservationStrategy pessimistic;

    @Autowired
    private OptimisticLockReservationStrategy optimistic;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @AfterEach
    void cleanUp() {
        commitmentRepository.deleteAll();
        scheduleRepository.deleteAll();
    }

    @Test
    @DisplayName("advanceSequenceAtomically should succeed once per observed sequence")
    void advanceSequenceAtomically_succeedsOncePerSeenValue() {
        ResourceSchedule schedule = scheduleRepository.saveAndFlush(ResourceSchedule.builder()
                .resourceKind(ResourceKind.WASH_BAY).resourceId(1L).sequence(0L).build());
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        int first = tx.execute(status -> scheduleRepository.advanceSequenceAtomically(schedule.getId(), 0L));
        int second = tx.execute(status -> scheduleRepository.advanceSequenceAtomically(schedule.getId(), 0L));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(scheduleRepository.currentSequence(schedule.getId())).isEqualTo(1L);
    }

    @Test
    @DisplayName("pessimistic strategy should refuse windows inside the buffer and accept windows past it")
    void pessimistic_bufferBoundary() {
        ReservationRequest first = bayRequest(1L, START, 60);
        ReservationRequest fifteenAfter = bayRequest(1L, START.plus(Duration.ofMinutes(75)), 30);
        ReservationRequest sixteenAfter = bayRequest(1L, START.plus(Duration.ofMinutes(76)), 30);

        assertThat(reserveInNewTransaction(pessimistic, first)).isEqualTo(ReserveOutcome.RESERVED);
        assertThat(reserveInNewTransaction(pessimistic, fifteenAfter)).isEqualTo(ReserveOutcome.OVERLAP);
        assertThat(reserveInNewTransaction(pessimistic, sixteenAfter)).isEqualTo(ReserveOutcome.RESERVED);
    }

    @Test
    @DisplayName("a released commitment no longer blocks its window")
    void releasedCommitment_freesWindow() {
        ReservationRequest first = bayRequest(2L, START, 60);
        assertThat(reserveInNewTransaction(pessimistic, first)).isEqualTo(ReserveOutcome.RESERVED);

        new TransactionTemplate(transactionManager).executeWithoutResult(status ->
                commitmentRepository.findByBookingIdAndStatus(first.bookingId(), CommitmentStatus.HELD)
                        .orElseThrow()
                        .release());

        assertThat(reserveInNewTransaction(pessimistic, bayRequest(2L, START, 60)))
                .isEqualTo(ReserveOutcome.RESERVED);
    }

    @Test
    @DisplayName("daily count should include HELD and FULFILLED but not RELEASED commitments")
    void countForServiceDate_ignoresReleased() {
        LocalDate day = LocalDate.of(2026, 6, 1);
        commitmentRepository.saveAll(List.of(
                commitment(CommitmentStatus.HELD, day),
                commitment(CommitmentStatus.FULFILLED, day),
                commitment(CommitmentStatus.RELEASED, day),
                commitment(CommitmentStatus.HELD, day.plusDays(1))));

        long count = commitmentRepository.countForServiceDate(ResourceKind.MOBILE_TEAM, 5L, day,
                EnumSet.of(CommitmentStatus.HELD, CommitmentStatus.FULFILLED), new UUID(0L, 0L));

        assertThat(count).isEqualTo(2L);
    }

    @Test
    @DisplayName("concurrent reservations of one bay never leave two HELD commitments on overlapping windows")
    void concurrentReservations_neverDoubleBook() throws Exception {
        scheduleRepository.saveAndFlush(ResourceSchedule.builder()
                .resourceKind(ResourceKind.WASH_BAY).resourceId(3L).sequence(0L).build());

        for (ReservationStrategy strategy : List.of(pessimistic, optimistic)) {
            commitmentRepository.deleteAll();
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    ReservationRequest request = bayRequest(3L, START.plus(Duration.ofMinutes(5L * i)), 60);
                    results.add(executor.submit(() -> {
                        go.await();
                        try {
                            return reserveInNewTransaction(strategy, request).isReserved();
                        } catch (ConcurrencyConflictException e) {
                            return false;
                        }
                    }));
                }
                go.countDown();

                int reserved = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(30, TimeUnit.SECONDS)) {
                        reserved++;
                    }
                }

                assertThat(reserved).as(strategy.getStrategyType()).isEqualTo(1);
                assertThat(commitmentRepository.findAll())
                        .filteredOn(c -> c.getStatus() == CommitmentStatus.HELD)
                        .hasSize(1);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("a reservation waiting on a held schedule lock gives up after the configured wait")
    void pessimistic_lockWaitIsBounded() throws Exception {
        ResourceRef bay = ResourceRef.washBay(4L);
        scheduleRepository.saveAndFlush(ResourceSchedule.builder()
                .resourceKind(ResourceKind.WASH_BAY).resourceId(4L).sequence(0L).build());
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> new TransactionTemplate(transactionManager)
                    .executeWithoutResult(status -> {
                        ledger.lockScheduleFor(bay);
                        locked.countDown();
                        try {
                            done.await(30, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }));
            assertThat(locked.await(10, TimeUnit.SECONDS)).isTrue();

            long started = System.nanoTime();
            assertThatThrownBy(() -> reserveInNewTransaction(pessimistic, bayRequest(4L, START, 60)))
                    .isInstanceOf(ConcurrencyConflictException.class);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));

            done.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            done.countDown();
            executor.shutdownNow();
        }
    }

    private ReserveOutcome reserveInNewTransaction(ReservationStrategy strategy, ReservationRequest request) {
        return new TransactionTemplate(transactionManager).execute(status -> strategy.reserve(request));
    }

    private static ReservationRequest bayRequest(Long bayId, Instant start, int minutes) {
        return new ReservationRequest(
                new ResourceCandidate(ResourceRef.washBay(bayId), null),
                UUID.randomUUID(),
                TimeWindow.of(start, minutes),
                Duration.ofMinutes(15));
    }

    private static ResourceCommitment commitment(CommitmentStatus status, LocalDate day) {
        Instant start = day.atTime(9, 0).toInstant(java.time.ZoneOffset.UTC);
        return ResourceCommitment.builder()
                .resourceKind(ResourceKind.MOBILE_TEAM)
                .resourceId(5L)
                .bookingId(UUID.randomUUID())
                .windowStart(start)
                .windowEnd(start.plus(Duration.ofHours(1)))
                .serviceDate(day)
                .status(status)
                .build();
    }
}

package com.openwash.capacity.domain.service;

import com.openwash.capacity.domain.model.CommitmentStatus;
import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ReserveOutcome;
import com.openwash.capacity.domain.model.ResourceCommitment;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.TimeWindow;
import com.openwash.capacity.domain.port.CommitmentStore;
import com.openwash.capacity.domain.repository.ResourceCommitmentRepository;
import com.openwash.capacity.domain.strategy.ReservationStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Commitment store backed by the relational database.
 *
 * Writes go through a {@link ReservationStrategy} picked by bean name:
 * - pessimistic: SELECT FOR UPDATE on the resource schedule row
 * - optimistic: guarded sequence bump
 * - distributed: Redisson lock + guarded sequence bump (bean only exists when configured)
 *
 * Configuration:
 * capacity.reservation.strategy: pessimistic | optimistic | distributed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaCommitmentStore implements CommitmentStore {

    private static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, ReservationStrategy> reservationStrategies;
    private final ResourceCommitmentRepository commitmentRepository;
    private final CommitmentLedger ledger;

    @Value("${capacity.reservation.strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        ReservationStrategy strategy = getReservationStrategy();
        log.info("Initialized JpaCommitmentStore with strategy: {}", strategy.getStrategyType());
    }

    @Override
    @Transactional(readOnly = true)
    public List<TimeWindow> findOverlapping(ResourceRef resource, TimeWindow window) {
        return commitmentRepository
                .findHeldOverlapping(resource.kind(), resource.id(), window.start(), window.end())
                .stream()
                .map(ResourceCommitment::window)
                .toList();
    }

    @Override
    @Transactional
    public ReserveOutcome reserve(ReservationRequest request) {
        ReservationStrategy strategy = getReservationStrategy();
        log.debug("Reserving {} for booking {} using strategy: {}",
                request.ref(), request.bookingId(), strategy.getStrategyType());
        return strategy.reserve(request);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isFree(ReservationRequest request) {
        return ledger.assess(request).isReserved();
    }

    @Override
    @Transactional
    public boolean release(UUID bookingId) {
        Optional<ResourceCommitment> held = commitmentRepository.findByBookingIdAndStatus(bookingId, CommitmentStatus.HELD);
        held.ifPresent(commitment -> {
            commitment.release();
            // the status change must hit the partial unique index before a re-allocation inserts
            commitmentRepository.saveAndFlush(commitment);
            log.info("Released {} from booking {}", commitment.resource(), bookingId);
        });
        return held.isPresent();
    }

    @Override
    @Transactional
    public boolean fulfil(UUID bookingId) {
        Optional<ResourceCommitment> held = commitmentRepository.findByBookingIdAndStatus(bookingId, CommitmentStatus.HELD);
        held.ifPresent(commitment -> {
            commitment.fulfil();
            log.info("Fulfilled commitment of {} to booking {}", commitment.resource(), bookingId);
        });
        return held.isPresent();
    }

    /**
     * Looks the configured strategy up by bean name, falling back to pessimistic.
     */
    private ReservationStrategy getReservationStrategy() {
        String strategyKey = strategyType.toLowerCase();
        ReservationStrategy strategy = reservationStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, reservationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = reservationStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: "
                                + reservationStrategies.keySet());
            }
        }
        return strategy;
    }
}

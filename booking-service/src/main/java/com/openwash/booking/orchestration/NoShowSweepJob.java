package com.openwash.booking.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marks CONFIRMED bookings as NO_SHOW once their grace period is over.
 * Each booking goes through the orchestrator on its own, so one failure does not stop the batch.
 *
 * A booking that fails {@code booking.no-show.max-attempts} sweeps in a row is skipped from then on,
 * so it cannot hold a slot in every batch and starve newer due bookings. The skip list lives in
 * memory and is cleared on restart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NoShowSweepJob {

    private final BookingOrchestrator orchestrator;

    private final Map<UUID, Integer> failedAttempts = new ConcurrentHashMap<>();
    private final Set<UUID> skipped = ConcurrentHashMap.newKeySet();

    @Value("${booking.no-show.sweep-enabled:true}")
    private boolean sweepEnabled;

    @Value("${booking.no-show.batch-size:100}")
    private int batchSize;

    @Value("${booking.no-show.max-attempts:3}")
    private int maxAttempts;

    @Scheduled(fixedDelayString = "${booking.no-show.sweep-interval-ms:60000}")
    public void sweepNoShows() {
        if (!sweepEnabled) return;
        List<UUID> due = orchestrator.findDueNoShows(batchSize, Set.copyOf(skipped));
        if (due.isEmpty()) return;
        log.info("No-show sweep: found {} booking(s) past grace period", due.size());
        int marked = 0;
        for (UUID bookingId : due) {
            try {
                orchestrator.markNoShow(bookingId);
                failedAttempts.remove(bookingId);
                marked++;
            } catch (Exception e) {
                recordFailure(bookingId, e);
            }
        }
        log.info("No-show sweep: marked {} of {} booking(s)", marked, due.size());
    }

    Set<UUID> skippedBookings() {
        return Set.copyOf(skipped);
    }

    private void recordFailure(UUID bookingId, Exception e) {
        int attempts = failedAttempts.merge(bookingId, 1, Integer::sum);
        if (attempts >= maxAttempts) {
            failedAttempts.remove(bookingId);
            skipped.add(bookingId);
            log.error("No-show sweep giving up on booking {} after {} failed attempt(s)", bookingId, attempts, e);
        } else {
            log.error("No-show sweep failed for booking {} (attempt {} of {})", bookingId, attempts, maxAttempts, e);
        }
    }
}

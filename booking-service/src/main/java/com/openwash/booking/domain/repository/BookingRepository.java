package com.openwash.booking.domain.repository;

import com.openwash.booking.domain.model.Booking;
import com.openwash.booking.domain.model.BookingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface BookingRepository extends JpaRepository<Booking, UUID>, JpaSpecificationExecutor<Booking> {

    /**
     * For the no-show sweep: bookings in the given status scheduled at or before the cutoff, oldest first.
     * {@code excludedIds} must not be empty.
     */
    @Query("""
           SELECT b.id FROM Booking b
           WHERE b.status = :status
             AND b.scheduledAt <= :cutoff
             AND b.id NOT IN :excludedIds
           ORDER BY b.scheduledAt ASC
           """)
    List<UUID> findIdsByStatusScheduledBefore(@Param("status") BookingStatus status,
                                              @Param("cutoff") Instant cutoff,
                                              @Param("excludedIds") Collection<UUID> excludedIds,
                                              Pageable pageable);
}

package com.openwash.capacity.domain.repository;

import com.openwash.capacity.domain.model.CommitmentStatus;
import com.openwash.capacity.domain.model.ResourceCommitment;
import com.openwash.capacity.domain.model.ResourceKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ResourceCommitmentRepository extends JpaRepository<ResourceCommitment, Long> {

    @Query("""
           SELECT c FROM ResourceCommitment c
           WHERE c.resourceKind = :kind
             AND c.resourceId = :resourceId
             AND c.status = com.openwash.capacity.domain.model.CommitmentStatus.HELD
             AND c.windowStart <= :to
             AND c.windowEnd >= :from
           ORDER BY c.windowStart
           """)
    List<ResourceCommitment> findHeldOverlapping(@Param("kind") ResourceKind kind,
                                                 @Param("resourceId") Long resourceId,
                                                 @Param("from") Instant from,
                                                 @Param("to") Instant to);

    /**
     * HELD commitments of a resource whose window touches [from, to] (closed intervals).
     * Commitments of {@code excludeBookingId} are ignored.
     */
    @Query("""
           SELECT c FROM ResourceCommitment c
           WHERE c.resourceKind = :kind
             AND c.resourceId = :resourceId
             AND c.status = com.openwash.capacity.domain.model.CommitmentStatus.HELD
             AND c.windowStart <= :to
             AND c.windowEnd >= :from
             AND c.bookingId <> :excludeBookingId
           ORDER BY c.windowStart
           """)
    List<ResourceCommitment> findHeldOverlappingExcluding(@Param("kind") ResourceKind kind,
                                                          @Param("resourceId") Long resourceId,
                                                          @Param("from") Instant from,
                                                          @Param("to") Instant to,
                                                          @Param("excludeBookingId") UUID excludeBookingId);

    /**
     * Jobs a resource already carries on a calendar day, for the daily cap.
     */
    @Query("""
           SELECT COUNT(c) FROM ResourceCommitment c
           WHERE c.resourceKind = :kind
             AND c.resourceId = :resourceId
             AND c.serviceDate = :serviceDate
             AND c.status IN :statuses
             AND c.bookingId <> :excludeBookingId
           """)
    long countForServiceDate(@Param("kind") ResourceKind kind,
                             @Param("resourceId") Long resourceId,
                             @Param("serviceDate") LocalDate serviceDate,
                             @Param("statuses") Collection<CommitmentStatus> statuses,
                             @Param("excludeBookingId") UUID excludeBookingId);

    Optional<ResourceCommitment> findByBookingIdAndStatus(UUID bookingId, CommitmentStatus status);
}

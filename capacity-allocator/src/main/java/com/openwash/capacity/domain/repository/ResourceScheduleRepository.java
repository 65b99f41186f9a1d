package com.openwash.capacity.domain.repository;

import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.ResourceSchedule;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Guard rows for the reservation strategies.
 */
public interface ResourceScheduleRepository extends JpaRepository<ResourceSchedule, Long> {

    Optional<ResourceSchedule> findByResourceKindAndResourceId(ResourceKind resourceKind, Long resourceId);

    /**
     * SELECT FOR UPDATE on the guard row. How long it waits for a competing holder is bounded by
     * {@link #limitLockWait} when called earlier in the same transaction, otherwise only by the
     * transaction timeout.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ResourceSchedule s WHERE s.resourceKind = :kind AND s.resourceId = :resourceId")
    Optional<ResourceSchedule> findWithLock(@Param("kind") ResourceKind kind,
                                            @Param("resourceId") Long resourceId);

    /**
     * Sets PostgreSQL's lock_timeout for the rest of the current transaction, e.g. "3000ms".
     * A lock wait past it fails with lock_not_available (55P03).
     */
    @Query(value = "SELECT set_config('lock_timeout', :timeout, true)", nativeQuery = true)
    String limitLockWait(@Param("timeout") String timeout);

    /**
     * Reads the sequence from the database, bypassing the persistence context,
     * which may hold a value older than the last guarded UPDATE.
     */
    @Query("SELECT s.sequence FROM ResourceSchedule s WHERE s.id = :id")
    long currentSequence(@Param("id") Long id);

    /**
     * Advances the sequence only if nobody else did since we read it.
     *
     * Returns the number of rows affected:
     * - 1: our check-then-insert stands
     * - 0: another transaction committed a reservation on this resource first
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE ResourceSchedule s
           SET s.sequence = s.sequence + 1
           WHERE s.id = :id
             AND s.sequence = :expectedSequence
           """)
    int advanceSequenceAtomically(@Param("id") Long id,
                                  @Param("expectedSequence") long expectedSequence);
}

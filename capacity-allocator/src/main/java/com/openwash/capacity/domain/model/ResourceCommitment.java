package com.openwash.capacity.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Window a resource is committed to one booking.
 * At most one HELD commitment exists per booking (partial unique index in the schema).
 */
@Entity
@Table(name = "resource_commitments", indexes = {
        @Index(name = "idx_commitment_resource_window", columnList = "resource_kind,resource_id,window_start"),
        @Index(name = "idx_commitment_resource_day", columnList = "resource_kind,resource_id,service_date"),
        @Index(name = "idx_commitment_booking", columnList = "booking_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceCommitment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_kind", nullable = false, length = 20)
    private ResourceKind resourceKind;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Column(name = "booking_id", nullable = false)
    private UUID bookingId;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false)
    private Instant windowEnd;

    @Column(name = "service_date", nullable = false)
    private LocalDate serviceDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CommitmentStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) {
            status = CommitmentStatus.HELD;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public ResourceRef resource() {
        return new ResourceRef(resourceKind, resourceId);
    }

    public TimeWindow window() {
        return new TimeWindow(windowStart, windowEnd);
    }

    public void release() {
        this.status = CommitmentStatus.RELEASED;
    }

    public void fulfil() {
        this.status = CommitmentStatus.FULFILLED;
    }
}

package com.openwash.capacity.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Guard row per resource. Reservation strategies serialize on it: either by locking the row
 * (SELECT FOR UPDATE) or by advancing {@code sequence} with a guarded UPDATE.
 */
@Entity
@Table(name = "resource_schedules", uniqueConstraints = {
        @UniqueConstraint(name = "uk_schedule_resource", columnNames = {"resource_kind", "resource_id"})
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_kind", nullable = false, length = 20)
    private ResourceKind resourceKind;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Column(name = "sequence_no", nullable = false)
    private Long sequence;
}

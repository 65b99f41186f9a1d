package com.openwash.capacity.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Fixed wash bay. Maintained by facility management; read-only here.
 */
@Entity
@Immutable
@Table(name = "wash_bays")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WashBay {
    @Id
    private Long id;

    @Column(name = "bay_number", nullable = false)
    private String bayNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "max_vehicle_size", nullable = false, length = 20)
    private VehicleSize maxVehicleSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ResourceStatus status;

    public boolean canAccommodate(VehicleSize vehicleSize) {
        return status == ResourceStatus.ACTIVE && vehicleSize.fitsWithin(maxVehicleSize);
    }
}

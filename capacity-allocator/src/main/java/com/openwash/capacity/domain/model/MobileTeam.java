package com.openwash.capacity.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * Mobile crew operating around a base location. Read-only here.
 */
@Entity
@Immutable
@Table(name = "mobile_teams")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MobileTeam {
    @Id
    private Long id;

    @Column(name = "team_name", nullable = false)
    private String teamName;

    @Column(name = "base_latitude", nullable = false)
    private Double baseLatitude;

    @Column(name = "base_longitude", nullable = false)
    private Double baseLongitude;

    @Column(name = "service_radius_km", nullable = false, precision = 8, scale = 2)
    private BigDecimal serviceRadiusKm;

    @Column(name = "daily_capacity", nullable = false)
    private Integer dailyCapacity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ResourceStatus status;

    public GeoLocation baseLocation() {
        return new GeoLocation(baseLatitude, baseLongitude);
    }

    public boolean canServe(GeoLocation customerLocation) {
        return status == ResourceStatus.ACTIVE
                && baseLocation().distanceKmTo(customerLocation) <= serviceRadiusKm.doubleValue();
    }
}

package com.openwash.capacity.domain.port;

import com.openwash.capacity.domain.model.GeoLocation;
import com.openwash.capacity.domain.model.ResourceCandidate;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.VehicleSize;

import java.util.List;

/**
 * Read-only view of the bays and mobile teams owned by facility management.
 */
public interface ResourceDirectory {

    /**
     * ACTIVE resources of the kind able to take the job, ordered by ascending id.
     *
     * @param vehicleSize      required for {@link ResourceKind#WASH_BAY}
     * @param customerLocation required for {@link ResourceKind#MOBILE_TEAM}
     */
    List<ResourceCandidate> listCompatible(ResourceKind kind, VehicleSize vehicleSize, GeoLocation customerLocation);
}

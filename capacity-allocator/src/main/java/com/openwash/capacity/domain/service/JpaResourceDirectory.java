package com.openwash.capacity.domain.service;

import com.openwash.capacity.domain.model.GeoLocation;
import com.openwash.capacity.domain.model.ResourceCandidate;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.ResourceStatus;
import com.openwash.capacity.domain.model.VehicleSize;
import com.openwash.capacity.domain.port.ResourceDirectory;
import com.openwash.capacity.domain.repository.MobileTeamRepository;
import com.openwash.capacity.domain.repository.WashBayRepository;
import com.openwash.common.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class JpaResourceDirectory implements ResourceDirectory {

    private final WashBayRepository washBayRepository;
    private final MobileTeamRepository mobileTeamRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ResourceCandidate> listCompatible(ResourceKind kind, VehicleSize vehicleSize,
                                                  GeoLocation customerLocation) {
        return switch (kind) {
            case WASH_BAY -> compatibleBays(vehicleSize);
            case MOBILE_TEAM -> teamsInRange(customerLocation);
        };
    }

    private List<ResourceCandidate> compatibleBays(VehicleSize vehicleSize) {
        if (vehicleSize == null) {
            throw new InvalidInputException("Vehicle size is required to find a wash bay");
        }
        return washBayRepository
                .findByStatusAndMaxVehicleSizeInOrderByIdAsc(ResourceStatus.ACTIVE, vehicleSize.compatibleBaySizes())
                .stream()
                .map(bay -> new ResourceCandidate(ResourceRef.washBay(bay.getId()), null))
                .toList();
    }

    private List<ResourceCandidate> teamsInRange(GeoLocation customerLocation) {
        if (customerLocation == null) {
            throw new InvalidInputException("Customer location is required to find a mobile team");
        }
        return mobileTeamRepository.findByStatusOrderByIdAsc(ResourceStatus.ACTIVE)
                .stream()
                .filter(team -> team.canServe(customerLocation))
                .map(team -> new ResourceCandidate(ResourceRef.mobileTeam(team.getId()), team.getDailyCapacity()))
                .toList();
    }
}

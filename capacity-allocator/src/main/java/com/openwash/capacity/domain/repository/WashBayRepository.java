package com.openwash.capacity.domain.repository;

import com.openwash.capacity.domain.model.ResourceStatus;
import com.openwash.capacity.domain.model.VehicleSize;
import com.openwash.capacity.domain.model.WashBay;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface WashBayRepository extends JpaRepository<WashBay, Long> {

    List<WashBay> findByStatusAndMaxVehicleSizeInOrderByIdAsc(ResourceStatus status, Collection<VehicleSize> sizes);
}

package com.openwash.booking.client;

import com.openwash.booking.client.dto.VehicleResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(name = "vehicle-service", url = "${booking.clients.vehicle-service.url}", path = "/api/v1/vehicles")
public interface VehicleRegistryClient {

    @GetMapping("/{vehicleId}")
    VehicleResponse getVehicle(@PathVariable("vehicleId") Long vehicleId);
}

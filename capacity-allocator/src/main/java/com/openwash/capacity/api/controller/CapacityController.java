package com.openwash.capacity.api.controller;

import com.openwash.capacity.api.dto.OpenSlotResponse;
import com.openwash.capacity.domain.model.GeoLocation;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.SlotQuery;
import com.openwash.capacity.domain.model.VehicleSize;
import com.openwash.capacity.domain.service.CapacityAllocator;
import com.openwash.common.dto.BaseResponse;
import com.openwash.common.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only capacity queries. Allocation itself only happens through booking operations.
 */
@RestController
@RequestMapping("/api/v1/capacity")
@RequiredArgsConstructor
public class CapacityController {

    private final CapacityAllocator capacityAllocator;

    /**
     * Lists start times between {@code from} and {@code to} with at least one free resource.
     * Bays need {@code vehicleSize}; mobile teams need {@code lat} and {@code lng}.
     */
    @GetMapping("/slots")
    public ResponseEntity<BaseResponse<List<OpenSlotResponse>>> listOpenSlots(
            @RequestParam ResourceKind kind,
            @RequestParam Instant from,
            @RequestParam Instant to,
            @RequestParam int durationMinutes,
            @RequestParam(required = false) VehicleSize vehicleSize,
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lng,
            @RequestParam(defaultValue = "30") int intervalMinutes) {
        SlotQuery query = SlotQuery.builder()
                .kind(kind)
                .from(from)
                .to(to)
                .durationMinutes(durationMinutes)
                .vehicleSize(vehicleSize)
                .customerLocation(toLocation(lat, lng))
                .intervalMinutes(intervalMinutes)
                .build();
        List<OpenSlotResponse> slots = capacityAllocator.findOpenSlots(query).stream()
                .map(OpenSlotResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(slots));
    }

    private GeoLocation toLocation(Double lat, Double lng) {
        if (lat == null && lng == null) {
            return null;
        }
        if (lat == null || lng == null) {
            throw new InvalidInputException("Both lat and lng are required for a location");
        }
        return new GeoLocation(lat, lng);
    }
}

package com.openwash.capacity.domain.strategy;

import com.openwash.capacity.domain.model.ReservationRequest;
import com.openwash.capacity.domain.model.ResourceCandidate;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.ResourceSchedule;
import com.openwash.capacity.domain.model.TimeWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

final class ReservationFixtures {

    static final ResourceRef BAY = ResourceRef.washBay(3L);

    private ReservationFixtures() {
    }

    static ReservationRequest bayRequest() {
        return new ReservationRequest(
                new ResourceCandidate(BAY, null),
                UUID.randomUUID(),
                TimeWindow.of(Instant.parse("2026-04-01T09:00:00Z"), 60),
                Duration.ofMinutes(15));
    }

    static ResourceSchedule schedule(long id, long sequence) {
        return ResourceSchedule.builder()
                .id(id)
                .resourceKind(ResourceKind.WASH_BAY)
                .resourceId(BAY.id())
                .sequence(sequence)
                .build();
    }
}

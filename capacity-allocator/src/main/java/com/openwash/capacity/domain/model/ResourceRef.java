package com.openwash.capacity.domain.model;

import java.util.Objects;

/**
 * Reference to a bay or mobile team owned by facility management.
 */
public record ResourceRef(ResourceKind kind, Long id) {

    public ResourceRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static ResourceRef washBay(Long id) {
        return new ResourceRef(ResourceKind.WASH_BAY, id);
    }

    public static ResourceRef mobileTeam(Long id) {
        return new ResourceRef(ResourceKind.MOBILE_TEAM, id);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}

package com.openwash.capacity.domain.model;

public enum ResourceStatus {
    ACTIVE,
    INACTIVE,
    MAINTENANCE
}

package com.openwash.capacity.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Vehicle size classes, smallest first. A bay accepts every class up to its maximum.
 */
public enum VehicleSize {
    COMPACT,
    STANDARD,
    LARGE,
    OVERSIZED;

    public boolean fitsWithin(VehicleSize maximum) {
        return this.ordinal() <= maximum.ordinal();
    }

    /**
     * Bay maximums able to take a vehicle of this class.
     */
    public List<VehicleSize> compatibleBaySizes() {
        return Arrays.stream(values())
                .filter(this::fitsWithin)
                .toList();
    }
}

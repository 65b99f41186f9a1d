package com.openwash.capacity.domain.model;

/**
 * A compatible resource as returned by the directory.
 *
 * @param dailyCapacity jobs per calendar day for mobile teams, {@code null} for bays (no cap)
 */
public record ResourceCandidate(ResourceRef ref, Integer dailyCapacity) {

    public boolean hasDailyCap() {
        return dailyCapacity != null;
    }
}

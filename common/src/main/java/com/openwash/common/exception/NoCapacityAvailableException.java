package com.openwash.common.exception;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Every compatible resource is busy at the requested time.
 * Carries nearby start times where at least one resource is free.
 */
@Getter
public class NoCapacityAvailableException extends BusinessException {

    public static final String ERROR_CODE = "NO_CAPACITY_AVAILABLE";

    private final Instant requestedStart;
    private final List<Instant> alternatives;

    public NoCapacityAvailableException(Instant requestedStart, List<Instant> alternatives) {
        this(requestedStart, alternatives, null);
    }

    public NoCapacityAvailableException(Instant requestedStart, List<Instant> alternatives, Throwable cause) {
        super(String.format("No capacity available at %s (%d alternative slot(s) found)",
                requestedStart, alternatives.size()), cause, ERROR_CODE);
        this.requestedStart = requestedStart;
        this.alternatives = List.copyOf(alternatives);
    }
}

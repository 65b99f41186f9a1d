package com.openwash.common.util;

/**
 * Constants shared by the capacity and booking modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:resource:";

    /** Caller-supplied budget, in milliseconds, for create and reschedule requests. */
    public static final String REQUEST_TIMEOUT_HEADER = "X-Request-Timeout-Ms";
}

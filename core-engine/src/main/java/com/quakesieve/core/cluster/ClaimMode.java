package com.quakesieve.core.cluster;

import java.util.Locale;
import java.util.Objects;

/**
 * How a window declusterer resolves events covered by more than one
 * triggering window.
 *
 * @since 1.0.0
 */
public enum ClaimMode {

    /**
     * The first qualifying trigger in processing order keeps the event;
     * dependent events are not re-evaluated.
     */
    SINGLE,

    /**
     * Every qualifying trigger is considered; the one closest in time wins,
     * then the spatially closer one, then the earliest processed.
     */
    NEAREST;

    /**
     * Parse a configuration value, case-insensitively.
     *
     * @param value "single" or "nearest"
     * @return the matching mode
     * @throws IllegalArgumentException for unknown values
     */
    public static ClaimMode parse(String value) {
        Objects.requireNonNull(value, "Claim mode must not be null");
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "single" -> SINGLE;
            case "nearest" -> NEAREST;
            default -> throw new IllegalArgumentException(
                    "Unknown claim mode: '" + value + "'. Supported: single, nearest");
        };
    }
}

package com.sampleci.tracker.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Immutable read-side view of one {@link RunEvent}.
 *
 * The timestamp is always UTC-qualified, whatever the JDBC driver or
 * session time zone handed back.
 */
public record StageEvent(Stage stage, OffsetDateTime timestamp, String message) {

    public static StageEvent of(Stage stage, Instant timestamp, String message) {
        return new StageEvent(stage, timestamp.atOffset(ZoneOffset.UTC), message);
    }
}

package com.sampleci.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Lifecycle stages of a test run.
 *
 * Happy path:
 *   PREPARATION → BUILDING → TESTING → COMPLETED
 *
 * CANCELED can follow any non-terminal stage and ends the run. It has no
 * position in {@link #orderedStages()}; it is compared by identity only.
 */
public enum Stage {
    PREPARATION("preparation", "Preparation"),
    BUILDING   ("building",    "Building"),
    TESTING    ("testing",     "Testing"),
    COMPLETED  ("completed",   "Completed"),
    CANCELED   ("canceled",    "Canceled/Error");

    // Built once; the progress bar in the UI is drawn from this list.
    private static final List<Stage> ORDERED = List.of(PREPARATION, BUILDING, TESTING, COMPLETED);

    private final String value;
    private final String label;

    Stage(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String value() { return value; }
    public String label() { return label; }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED;
    }

    /** The progress stages in order. CANCELED is not one of them. */
    public static List<Stage> orderedStages() {
        return ORDERED;
    }

    /**
     * Position of a stage in {@link #orderedStages()}.
     *
     * @return 0..3, or -1 for CANCELED and null
     */
    public static int indexOf(Stage stage) {
        return stage == null ? -1 : ORDERED.indexOf(stage);
    }

    /**
     * Parse the wire value ("preparation", "canceled", ...). Case-insensitive.
     *
     * @throws IllegalArgumentException if the value names no stage
     */
    @JsonCreator
    public static Stage fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Stage stage : values()) {
                if (stage.value.equals(normalized)) {
                    return stage;
                }
            }
        }
        throw new IllegalArgumentException("Unknown stage: '" + value + "'");
    }
}

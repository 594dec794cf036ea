package com.sampleci.tracker.diff;

import java.util.Locale;

/**
 * How a diff will be shown: embedded in a page, or saved as its own file.
 */
public enum RenderMode {
    INLINE_VIEW("view"),
    DOWNLOAD("download");

    private final String value;

    RenderMode(String value) {
        this.value = value;
    }

    public String value() { return value; }

    /**
     * Parse "view" or "download" (case-insensitive).
     *
     * @throws IllegalArgumentException for anything else
     */
    public static RenderMode fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (RenderMode mode : values()) {
                if (mode.value.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown render mode: '" + value + "'");
    }
}

package com.sampleci.tracker.progress;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall health shown next to the progress bar.
 */
public enum ProgressState {
    OK("ok"),
    ERROR("error");

    private final String value;

    ProgressState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }
}

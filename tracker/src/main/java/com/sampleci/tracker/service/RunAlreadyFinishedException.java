package com.sampleci.tracker.service;

import com.sampleci.tracker.model.Stage;

import java.util.UUID;

/**
 * Thrown when an event is appended to a run whose log already ends with
 * COMPLETED or CANCELED.
 */
public class RunAlreadyFinishedException extends RuntimeException {
    public RunAlreadyFinishedException(UUID runId, Stage last) {
        super("Run " + runId + " already ended with " + last.value());
    }
}

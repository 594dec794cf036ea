package com.sampleci.tracker.api.dto;

/**
 * Request body for POST /runs/{id}/events.
 *
 * stage is the wire value: preparation, building, testing, completed or canceled.
 */
public record RecordEventRequest(String stage, String message) {}

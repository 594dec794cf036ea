package com.sampleci.tracker.api.dto;

import com.sampleci.tracker.model.Stage;
import com.sampleci.tracker.model.StageEvent;

import java.time.OffsetDateTime;

public record EventResponse(Stage stage, OffsetDateTime timestamp, String message) {

    public static EventResponse from(StageEvent e) {
        return new EventResponse(e.stage(), e.timestamp(), e.message());
    }
}

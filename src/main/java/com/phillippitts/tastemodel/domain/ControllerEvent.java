package com.phillippitts.tastemodel.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Usage telemetry reported by the controller front end (e.g. a preview or skip action).
 *
 * @param type       event type, {@code "unknown"} when absent
 * @param attributes free-form payload
 * @param receivedAt when the pipeline accepted the event
 */
public record ControllerEvent(String type, Map<String, Object> attributes, Instant receivedAt) {

    public ControllerEvent {
        if (type == null || type.isBlank()) {
            type = "unknown";
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }
}

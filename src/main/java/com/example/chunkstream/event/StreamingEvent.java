package com.example.chunkstream.event;

import java.time.Instant;
import java.util.Map;

/**
 * One notification published on an {@link EventChannel}.
 *
 * @param type      what happened
 * @param source    simple name of the publishing component
 * @param timestamp publication time
 * @param details   event payload, never null
 */
public record StreamingEvent(
        StreamingEventType type,
        String source,
        Instant timestamp,
        Map<String, Object> details
) {
    public StreamingEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Returns a typed payload value, or null when absent.
     */
    public <T> T detail(String key, Class<T> valueType) {
        Object value = details.get(key);
        return value == null ? null : valueType.cast(value);
    }
}

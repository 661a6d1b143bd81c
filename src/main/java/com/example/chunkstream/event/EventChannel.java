package com.example.chunkstream.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to registered listeners on the publishing thread. A failing listener is logged
 * and does not prevent delivery to the others or disturb the publisher.
 */
public final class EventChannel {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventChannel.class);

    private final String source;
    private final Clock clock;
    private final List<StreamingEventListener> listeners = new CopyOnWriteArrayList<>();

    public EventChannel(String source) {
        this(source, Clock.systemUTC());
    }

    public EventChannel(String source, Clock clock) {
        this.source = source;
        this.clock = clock;
    }

    public void addListener(StreamingEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(StreamingEventListener listener) {
        listeners.remove(listener);
    }

    public void clear() {
        listeners.clear();
    }

    public void publish(StreamingEventType type) {
        publish(type, Map.of());
    }

    public void publish(StreamingEventType type, Map<String, Object> details) {
        if (listeners.isEmpty()) {
            return;
        }
        StreamingEvent event = new StreamingEvent(type, source, clock.instant(), details);
        for (StreamingEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                LOGGER.warn("Listener failed while handling {} from {}", type, source, ex);
            }
        }
    }

    /**
     * Builds a payload from alternating keys and values, dropping null values.
     */
    public static Map<String, Object> details(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("details requires key/value pairs");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                details.put(String.valueOf(keyValues[i]), value);
            }
        }
        return details;
    }
}

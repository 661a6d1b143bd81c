package com.example.chunkstream.event;

@FunctionalInterface
public interface StreamingEventListener {
    void onEvent(StreamingEvent event);

    static StreamingEventListener noop() {
        return event -> {
        };
    }
}

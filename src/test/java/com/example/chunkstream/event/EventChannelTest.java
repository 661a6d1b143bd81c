package com.example.chunkstream.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventChannelTest {
    @Test
    void failingListenerDoesNotStopDelivery() {
        EventChannel channel = new EventChannel("test");
        List<StreamingEvent> received = new ArrayList<>();
        channel.addListener(event -> {
            throw new IllegalStateException("boom");
        });
        channel.addListener(received::add);

        channel.publish(StreamingEventType.CHUNK_COMPLETED, EventChannel.details("chunkIndex", 4));

        assertEquals(1, received.size());
        StreamingEvent event = received.get(0);
        assertEquals(StreamingEventType.CHUNK_COMPLETED, event.type());
        assertEquals("test", event.source());
        assertEquals(4, event.detail("chunkIndex", Integer.class));
    }

    @Test
    void removedListenerReceivesNothing() {
        EventChannel channel = new EventChannel("test");
        List<StreamingEvent> received = new ArrayList<>();
        StreamingEventListener listener = received::add;
        channel.addListener(listener);
        channel.removeListener(listener);

        channel.publish(StreamingEventType.STATISTICS_RESET);

        assertEquals(0, received.size());
    }

    @Test
    void detailsDropNullValues() {
        Map<String, Object> details = EventChannel.details("error", null, "chunkIndex", 2);

        assertFalse(details.containsKey("error"));
        assertEquals(2, details.get("chunkIndex"));
        assertThrows(IllegalArgumentException.class, () -> EventChannel.details("dangling"));
    }
}

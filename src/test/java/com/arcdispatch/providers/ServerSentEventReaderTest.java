package com.arcdispatch.providers;

import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServerSentEventReaderTest {

    private static ServerSentEventReader reader(String... lines) {
        return new ServerSentEventReader(List.of(lines).iterator());
    }

    @Test
    void readsNamedEvents() throws Exception {
        ServerSentEventReader reader = reader("event: a", "data: {\"x\":1}", "", "event: b", "data: 2", "");

        ServerSentEventReader.ServerSentEvent first = reader.next();
        assertEquals("a", first.getEvent());
        assertEquals("{\"x\":1}", first.getData());
        assertEquals("b", reader.next().getEvent());
        assertNull(reader.next());
        assertTrue(reader.isDone());
    }

    @Test
    void joinsMultiLineDataAndSkipsComments() throws Exception {
        ServerSentEventReader reader = reader(": keep-alive", "data: line one", "data: line two", "");

        ServerSentEventReader.ServerSentEvent event = reader.next();
        assertNull(event.getEvent());
        assertEquals("line one\nline two", event.getData());
    }

    @Test
    void stopsAtDone() throws Exception {
        ServerSentEventReader reader = reader("data: 1", "", "data: [DONE]", "", "data: 2", "");

        assertEquals("1", reader.next().getData());
        assertNull(reader.next());
        assertNull(reader.next());
    }

    @Test
    void emitsTrailingEventWithoutBlankLine() throws Exception {
        ServerSentEventReader reader = reader("data: tail");

        assertEquals("tail", reader.next().getData());
        assertNull(reader.next());
    }

    @Test
    void interruptedThreadStopsReading() {
        ServerSentEventReader reader = reader("data: 1", "");
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedIOException.class, reader::next);
        } finally {
            Thread.interrupted();
        }
    }
}

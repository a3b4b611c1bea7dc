package uncharted.events;

import org.junit.jupiter.api.Test;
import uncharted.codec.JsonCodec;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesEventListenerTest {

    @Test
    void shouldWriteOneLinePerEvent() {
        // Given
        StringWriter out = new StringWriter();
        JsonLinesEventListener listener = new JsonLinesEventListener(out, new JsonCodec());

        // When
        listener.onEvent(EngineEvent.builder(EventType.DISASTER_WARNING, "s1", 10L)
            .with("severity", 40)
            .build());
        listener.onEvent(EngineEvent.builder(EventType.DISASTER_RESOLVED, "s2", 20L).build());

        // Then
        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].contains("\"disaster-warning\""));
        assertTrue(lines[0].contains("\"severity\":40"));
        assertTrue(lines[1].contains("\"s2\""));
    }

    @Test
    void shouldSurfaceWriteFailures() {
        // Given
        Writer broken = new Writer() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        JsonLinesEventListener listener = new JsonLinesEventListener(broken, new JsonCodec());

        // When & Then
        assertThrows(UncheckedIOException.class,
            () -> listener.onEvent(EngineEvent.builder(EventType.RESOURCE_TICK, "s1", 1L).build()));
    }
}

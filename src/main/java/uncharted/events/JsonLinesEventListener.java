package uncharted.events;

import uncharted.codec.JsonCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes each event as one line of JSON, for log shipping or a downstream notifier.
 */
public class JsonLinesEventListener implements EventListener {

    private final Writer writer;
    private final JsonCodec codec;

    public JsonLinesEventListener(Writer writer, JsonCodec codec) {
        if (writer == null) {
            throw new IllegalArgumentException("Writer cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("Codec cannot be null");
        }
        this.writer = writer;
        this.codec = codec;
    }

    @Override
    public synchronized void onEvent(EngineEvent event) {
        String line = codec.encodeToString(event);
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write event " + event.type().wireName(), e);
        }
    }
}

package uncharted.codec;

import org.junit.jupiter.api.Test;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.world.TileInfo;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

    private final JsonCodec codec = new JsonCodec();

    @Test
    void shouldWriteEventTypeByWireName() {
        // Given
        EngineEvent event = EngineEvent.builder(EventType.SETTLER_ARRIVED, "s1", 42L)
            .with("count", 3)
            .build();

        // When
        String json = codec.encodeToString(event);

        // Then
        assertTrue(json.contains("\"type\":\"settler-arrived\""), json);
        assertTrue(json.contains("\"settlementId\":\"s1\""), json);
        assertTrue(json.contains("\"count\":3"), json);
        assertFalse(json.contains("\n"));
    }

    @Test
    void shouldIgnoreUnknownProperties() {
        // Given
        byte[] json = "{\"tileId\":\"t1\",\"biome\":\"FOREST\",\"quality\":{\"WOOD\":80.0},\"plotCapacity\":4,\"legacy\":1}"
            .getBytes(StandardCharsets.UTF_8);

        // When
        TileInfo tile = codec.decode(json, TileInfo.class);

        // Then
        assertEquals("t1", tile.tileId());
        assertEquals(4, tile.plotCapacity());
    }

    @Test
    void shouldWrapFailures() {
        // When & Then
        assertThrows(CodecException.class, () -> codec.encode(null));
        assertThrows(CodecException.class, () -> codec.decode(null, TileInfo.class));
        assertThrows(CodecException.class, () -> codec.decode("[1,2".getBytes(StandardCharsets.UTF_8), Map.class));
    }
}

package uncharted.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class JsonCodec implements Codec {

    private final ObjectMapper objectMapper;

    public JsonCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    /**
     * Creates an ObjectMapper for settlement documents, tiles, the catalog and events.
     * Unknown properties are ignored so older documents stay readable after a field is dropped.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    @Override
    public byte[] encode(Object obj) {
        if (obj == null) {
            throw new CodecException("Cannot encode null object");
        }
        try {
            return objectMapper.writeValueAsBytes(obj);
        } catch (Exception e) {
            throw new CodecException("Failed to encode " + obj.getClass().getSimpleName(), e);
        }
    }

    /**
     * Encodes an object as a single line of JSON text.
     */
    public String encodeToString(Object obj) {
        if (obj == null) {
            throw new CodecException("Cannot encode null object");
        }
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (Exception e) {
            throw new CodecException("Failed to encode " + obj.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        if (data == null) {
            throw new CodecException("Cannot decode null data to " + type.getSimpleName());
        }
        try {
            return objectMapper.readValue(data, type);
        } catch (Exception e) {
            throw new CodecException("Failed to decode to " + type.getSimpleName(), e);
        }
    }
}

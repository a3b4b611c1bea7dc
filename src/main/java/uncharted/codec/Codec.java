package uncharted.codec;

public interface Codec {

    /**
     * Encodes any object into a byte array for storage or for the event stream.
     *
     * @param obj the object to encode
     * @return the encoded object as bytes
     * @throws CodecException if encoding fails or obj is null
     */
    byte[] encode(Object obj);

    /**
     * Decodes a byte array back into an object of the specified type.
     *
     * @param data the encoded bytes
     * @param type the target class type
     * @return the decoded object
     * @throws CodecException if decoding fails
     */
    <T> T decode(byte[] data, Class<T> type);
}

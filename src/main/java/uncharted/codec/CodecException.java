package uncharted.codec;

/**
 * Raised when an object cannot be written to or read from its encoded form.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

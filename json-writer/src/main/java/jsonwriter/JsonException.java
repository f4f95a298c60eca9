package jsonwriter;

import java.io.IOException;

/**
 * Base exception for everything that can go wrong while writing JSON.
 *
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsonException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the underlying {@link Appendable} rejects an append.
     *
     * <p> The output written so far is incomplete and should be discarded by the caller.
     */
    public static class WriteException extends JsonException {
        public WriteException(String message, IOException cause) {
            super(message, cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }

    /**
     * Thrown when a builder or writer is used out of order: a terminated builder, a parent while one of its children
     * is still open, or a value written where none is expected.
     *
     * <p> This is a programming error, not a recoverable I/O condition.
     */
    public static class BuilderStateException extends JsonException {
        public BuilderStateException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a record component or bean property cannot be read.
     */
    public static class EncodeException extends JsonException {
        private final Class<?> sourceType;

        public EncodeException(String message, Class<?> sourceType, Throwable cause) {
            super(String.format("%s (type: %s)", message, sourceType.getName()), cause);
            this.sourceType = sourceType;
        }

        public Class<?> getSourceType() {
            return sourceType;
        }
    }
}

package io.streamingmarkdown.core;

/**
 * Base class for streaming Markdown exceptions.
 *
 * <p>Malformed markup never raises these; they signal misuse of the API or its configuration,
 * and codec failures.
 */
public abstract class MarkdownStreamException extends RuntimeException {

    protected MarkdownStreamException(String message) {
        super(message);
    }

    protected MarkdownStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when input is pushed after {@code complete()} without an intervening {@code reset()}.
     */
    public static class StreamCompleted extends MarkdownStreamException {
        public StreamCompleted(String message) {
            super(message);
        }
    }

    /**
     * Raised when configuration options contradict each other.
     */
    public static class InvalidConfiguration extends MarkdownStreamException {
        public InvalidConfiguration(String message) {
            super(message);
        }
    }

    /**
     * Raised when an event cannot be encoded or decoded.
     */
    public static class EventCodecException extends MarkdownStreamException {
        public EventCodecException(String message) {
            super(message);
        }

        public EventCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.Map;
import java.util.Objects;

/**
 * Result of classifying the text at a line start.
 */
public sealed interface Detection permits Detection.Matched, Detection.NeedMoreInput, Detection.NoMatch {

    /** Shared instance for "the prefix could still become a marker". */
    Detection NEED_MORE_INPUT = new NeedMoreInput();

    /** Shared instance for "the prefix cannot start this construct". */
    Detection NO_MATCH = new NoMatch();

    /**
     * A construct was recognized.
     *
     * @param type element type to open
     * @param startMarker the marker text that opened the element
     * @param endMarker the marker that closes it, or {@code null} when it ends at a line/paragraph boundary
     * @param metadata metadata for the {@code Begin} event
     * @param matchLength number of characters of the prefix consumed by the marker
     * @param content immediate content for single-line elements, or {@code null} for elements that accumulate
     * @param matcher name of the matcher that produced the result
     */
    record Matched(ElementType type,
                   String startMarker,
                   String endMarker,
                   Map<String, Object> metadata,
                   int matchLength,
                   String content,
                   String matcher) implements Detection {
        public Matched {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(startMarker, "startMarker");
            metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
            if (matchLength < 0) {
                throw new IllegalArgumentException("matchLength must be >= 0");
            }
        }

        /**
         * Whether the element is complete once opened (headers, rules, single-line custom elements).
         *
         * @return true if {@link #content()} carries the whole element
         */
        public boolean singleLine() {
            return content != null;
        }
    }

    /** The prefix is ambiguous; wait for more input. */
    record NeedMoreInput() implements Detection {
    }

    /** The prefix definitively cannot start the construct. */
    record NoMatch() implements Detection {
    }
}

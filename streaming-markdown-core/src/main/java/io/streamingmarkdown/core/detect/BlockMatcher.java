package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

/**
 * Recognizes one kind of block at the start of a line.
 */
public interface BlockMatcher {

    /**
     * Unique name of this matcher.
     *
     * @return the name
     */
    String name();

    /**
     * Priority; higher values are evaluated first.
     *
     * @return the priority
     */
    int priority();

    /**
     * Type of the elements this matcher opens.
     *
     * @return the element type
     */
    ElementType elementType();

    /**
     * Classifies text starting at a line start.
     *
     * @param text unconsumed text beginning at a line start; may end mid-line
     * @param endOfInput true when no further input will arrive, so ambiguity must be resolved
     * @return the detection; never {@link Detection.NeedMoreInput} when {@code endOfInput} is true
     */
    Detection detect(CharSequence text, boolean endOfInput);

    /**
     * Whether this matcher is one of the parser's own.
     *
     * @return true for built-in matchers
     */
    default boolean builtIn() {
        return false;
    }
}

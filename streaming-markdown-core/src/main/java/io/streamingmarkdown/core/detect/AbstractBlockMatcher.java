package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.Objects;

/**
 * Base class for the parser's own matchers.
 */
abstract class AbstractBlockMatcher implements BlockMatcher {

    private final String name;
    private final int priority;
    private final ElementType elementType;

    AbstractBlockMatcher(String name, int priority, ElementType elementType) {
        this.name = Objects.requireNonNull(name, "name");
        this.priority = priority;
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public ElementType elementType() {
        return elementType;
    }

    @Override
    public boolean builtIn() {
        return true;
    }

    /**
     * Up to three leading spaces, or -1 when the text is indented further.
     */
    static int smallIndent(CharSequence text) {
        int i = 0;
        while (i < text.length() && i < 4 && text.charAt(i) == ' ') i++;
        return i > 3 ? -1 : i;
    }

    static Detection waitOrReject(boolean endOfInput) {
        return endOfInput ? Detection.NO_MATCH : Detection.NEED_MORE_INPUT;
    }

    @Override
    public String toString() {
        return name + "(" + priority + ")";
    }
}

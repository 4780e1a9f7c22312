package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.Map;

/**
 * Block quotes. Also used to decide whether a line continues an open quote.
 */
public final class BlockquoteMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 400;

    public BlockquoteMatcher() {
        super("blockquote", PRIORITY, ElementType.QUOTE);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return Detection.NO_MATCH;
        if (indent == text.length()) return waitOrReject(endOfInput);
        if (text.charAt(indent) != '>') return Detection.NO_MATCH;
        return new Detection.Matched(ElementType.QUOTE, ">", null, Map.of(), indent + 1, null, name());
    }
}

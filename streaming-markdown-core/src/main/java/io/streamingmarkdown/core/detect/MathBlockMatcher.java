package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.Map;

/**
 * Display math delimited by {@code $$}.
 *
 * <p>Either a line {@code $$ x^2 $$} (single-line element) or a {@code $$} line opening a block that
 * runs until the next {@code $$} line.
 */
public final class MathBlockMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 650;
    public static final String DELIMITER = "$$";

    public MathBlockMatcher() {
        super("math-block", PRIORITY, ElementType.MATH);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return Detection.NO_MATCH;
        if (indent == text.length()) return waitOrReject(endOfInput);
        if (text.charAt(indent) != '$') return Detection.NO_MATCH;
        if (indent + 1 == text.length()) return waitOrReject(endOfInput);
        if (text.charAt(indent + 1) != '$') return Detection.NO_MATCH;
        if (Lines.lineEnd(text) < 0 && !endOfInput) return Detection.NEED_MORE_INPUT;

        String line = Lines.firstLine(text);
        String rest = line.substring(indent + 2).trim();
        int matchLength = Lines.firstLineLength(text);
        Map<String, Object> metadata = Map.of("inline", false);

        if (rest.isEmpty()) {
            return new Detection.Matched(ElementType.MATH, DELIMITER, DELIMITER, metadata, matchLength, null, name());
        }
        if (rest.endsWith(DELIMITER)) {
            String content = rest.substring(0, rest.length() - DELIMITER.length()).trim();
            return new Detection.Matched(ElementType.MATH, DELIMITER, DELIMITER, metadata, matchLength, content, name());
        }
        return Detection.NO_MATCH;
    }

    /**
     * Decides whether a line inside an open math block closes it.
     */
    public static FenceClose closes(CharSequence text, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return FenceClose.CONTENT;
        int i = indent;
        int dollars = 0;
        while (i < text.length() && text.charAt(i) == '$' && dollars < 2) {
            i++;
            dollars++;
        }
        if (i == text.length()) return endOfInput ? (dollars == 2 ? FenceClose.CLOSE : FenceClose.CONTENT) : FenceClose.NEED_MORE_INPUT;
        if (dollars < 2) return FenceClose.CONTENT;

        int lineEnd = Lines.lineEnd(text);
        int stop = lineEnd < 0 ? text.length() : lineEnd;
        for (int j = i; j < stop; j++) {
            char c = text.charAt(j);
            if (!Lines.isBlank(c) && c != '\r') return FenceClose.CONTENT;
        }
        if (lineEnd < 0 && !endOfInput) return FenceClose.NEED_MORE_INPUT;
        return FenceClose.CLOSE;
    }
}

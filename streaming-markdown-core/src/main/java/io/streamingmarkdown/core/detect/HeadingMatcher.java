package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.Map;

/**
 * ATX headings, {@code #} through {@code ######}. Needs the complete line.
 */
public final class HeadingMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 600;

    public HeadingMatcher() {
        super("heading", PRIORITY, ElementType.HEADER);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return Detection.NO_MATCH;
        if (indent == text.length()) return waitOrReject(endOfInput);
        if (text.charAt(indent) != '#') return Detection.NO_MATCH;

        int level = Lines.run(text, indent, '#');
        if (level > 6) return Detection.NO_MATCH;
        int afterMarker = indent + level;
        if (afterMarker == text.length()) return waitOrReject(endOfInput);
        if (!Lines.isBlank(text.charAt(afterMarker))) return Detection.NO_MATCH;
        if (Lines.lineEnd(text) < 0 && !endOfInput) return Detection.NEED_MORE_INPUT;

        String line = Lines.firstLine(text);
        String content = stripClosingSequence(line.substring(afterMarker).trim());
        if (content.isEmpty()) return Detection.NO_MATCH;

        return new Detection.Matched(ElementType.HEADER, "#".repeat(level), null, Map.of("level", level),
                Lines.firstLineLength(text), content, name());
    }

    private static String stripClosingSequence(String content) {
        int end = content.length();
        while (end > 0 && content.charAt(end - 1) == '#') end--;
        if (end == content.length()) return content;
        if (end == 0) return "";
        if (!Lines.isBlank(content.charAt(end - 1))) return content;
        return content.substring(0, end).trim();
    }
}

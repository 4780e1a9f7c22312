package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * List items: {@code -}, {@code *}, {@code +} or {@code <digits>.} followed by a blank.
 *
 * <p>Each line is its own {@code list} element; {@code level} is derived from the indentation
 * (two columns per level, tabs advancing to the next multiple of four).
 */
public final class ListItemMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 500;
    private static final int MAX_DIGITS = 9;

    public ListItemMatcher() {
        super("list-item", PRIORITY, ElementType.LIST);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = Lines.leadingBlanks(text);
        if (indent == text.length()) return waitOrReject(endOfInput);

        char c = text.charAt(indent);
        int markerEnd;
        boolean ordered;
        if (c == '-' || c == '*' || c == '+') {
            markerEnd = indent + 1;
            ordered = false;
        } else if (isAsciiDigit(c)) {
            int digits = 0;
            while (indent + digits < text.length() && isAsciiDigit(text.charAt(indent + digits))) {
                digits++;
            }
            if (digits > MAX_DIGITS) return Detection.NO_MATCH;
            if (indent + digits == text.length()) return waitOrReject(endOfInput);
            char delimiter = text.charAt(indent + digits);
            if (delimiter != '.' && delimiter != ')') return Detection.NO_MATCH;
            markerEnd = indent + digits + 1;
            ordered = true;
        } else {
            return Detection.NO_MATCH;
        }

        if (markerEnd == text.length()) return waitOrReject(endOfInput);
        if (!Lines.isBlank(text.charAt(markerEnd))) return Detection.NO_MATCH;

        String marker = text.subSequence(indent, markerEnd).toString();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ordered", ordered);
        metadata.put("level", Lines.columns(text, indent) / 2 + 1);
        if (ordered) {
            metadata.put("number", Integer.parseInt(marker.substring(0, marker.length() - 1)));
        }
        return new Detection.Matched(ElementType.LIST, marker, null, metadata, markerEnd + 1, null, name());
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

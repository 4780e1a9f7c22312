package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.Map;

/**
 * Thematic breaks: a run of three or more {@code -}, {@code _} or {@code *}.
 */
public final class HorizontalRuleMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 200;

    public HorizontalRuleMatcher() {
        super("horizontal-rule", PRIORITY, ElementType.HORIZONTAL_RULE);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return Detection.NO_MATCH;
        if (indent == text.length()) return waitOrReject(endOfInput);

        char c = text.charAt(indent);
        if (c != '-' && c != '_' && c != '*') return Detection.NO_MATCH;
        int run = Lines.run(text, indent, c);
        int afterRun = indent + run;
        if (afterRun == text.length() && !endOfInput) return Detection.NEED_MORE_INPUT;
        if (run < 3) return Detection.NO_MATCH;

        int lineEnd = Lines.lineEnd(text);
        int stop = lineEnd < 0 ? text.length() : lineEnd;
        for (int i = afterRun; i < stop; i++) {
            char ch = text.charAt(i);
            if (!Lines.isBlank(ch) && ch != '\r') return Detection.NO_MATCH;
        }
        if (lineEnd < 0 && !endOfInput) return Detection.NEED_MORE_INPUT;

        String rule = String.valueOf(c).repeat(run);
        return new Detection.Matched(ElementType.HORIZONTAL_RULE, rule, null, Map.of("marker", String.valueOf(c)),
                Lines.firstLineLength(text), rule, name());
    }
}

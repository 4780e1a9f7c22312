package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fenced code blocks opened by three or more backticks or tildes.
 *
 * <p>The first token of the info string becomes {@code metadata.language} ({@code text} when absent).
 * A fence is closed by a line holding at least as many of the same fence character and nothing else.
 */
public final class CodeFenceMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 700;
    public static final String DEFAULT_LANGUAGE = "text";

    public CodeFenceMatcher() {
        super("code-fence", PRIORITY, ElementType.CODE);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return Detection.NO_MATCH;
        if (indent == text.length()) return waitOrReject(endOfInput);

        char fenceChar = text.charAt(indent);
        if (fenceChar != '`' && fenceChar != '~') return Detection.NO_MATCH;

        int fenceLength = Lines.run(text, indent, fenceChar);
        int afterFence = indent + fenceLength;
        if (afterFence == text.length() && !endOfInput) return Detection.NEED_MORE_INPUT;
        if (fenceLength < 3) return Detection.NO_MATCH;
        if (Lines.lineEnd(text) < 0 && !endOfInput) return Detection.NEED_MORE_INPUT;

        String line = Lines.firstLine(text);
        String info = line.substring(afterFence).trim();
        if (fenceChar == '`' && info.indexOf('`') >= 0) return Detection.NO_MATCH;

        String fence = String.valueOf(fenceChar).repeat(fenceLength);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("language", info.isEmpty() ? DEFAULT_LANGUAGE : info.split("\\s+", 2)[0]);
        metadata.put("fenceChar", String.valueOf(fenceChar));
        metadata.put("fenceLength", fenceLength);
        return new Detection.Matched(ElementType.CODE, line, fence, metadata, Lines.firstLineLength(text), null, name());
    }

    /**
     * Decides whether a line inside an open fence closes it.
     *
     * @param text unconsumed text starting at the line start
     * @param fenceChar the opening fence character
     * @param fenceLength the opening fence length
     * @param endOfInput whether more input can arrive
     * @return the verdict
     */
    public static FenceClose closes(CharSequence text, char fenceChar, int fenceLength, boolean endOfInput) {
        int indent = smallIndent(text);
        if (indent < 0) return FenceClose.CONTENT;
        if (indent == text.length()) return endOfInput ? FenceClose.CONTENT : FenceClose.NEED_MORE_INPUT;
        if (text.charAt(indent) != fenceChar) return FenceClose.CONTENT;

        int run = Lines.run(text, indent, fenceChar);
        int afterFence = indent + run;
        if (afterFence == text.length()) {
            if (!endOfInput) return FenceClose.NEED_MORE_INPUT;
            return run >= fenceLength ? FenceClose.CLOSE : FenceClose.CONTENT;
        }
        if (run < fenceLength) return FenceClose.CONTENT;

        int lineEnd = Lines.lineEnd(text);
        int stop = lineEnd < 0 ? text.length() : lineEnd;
        for (int i = afterFence; i < stop; i++) {
            char c = text.charAt(i);
            if (!Lines.isBlank(c) && c != '\r') return FenceClose.CONTENT;
        }
        if (lineEnd < 0 && !endOfInput) return FenceClose.NEED_MORE_INPUT;
        return FenceClose.CLOSE;
    }
}

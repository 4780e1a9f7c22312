package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.List;
import java.util.Map;

/**
 * Pipe tables: a header row followed by a separator row with the same number of columns.
 *
 * <p>The match covers both lines; body rows are handled by the engine as the table streams.
 */
public final class TableMatcher extends AbstractBlockMatcher {

    public static final int PRIORITY = 300;

    public TableMatcher() {
        super("table", PRIORITY, ElementType.TABLE);
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        int indent = Lines.leadingBlanks(text);
        if (indent == text.length()) return waitOrReject(endOfInput);
        if (text.charAt(indent) != '|') return Detection.NO_MATCH;

        int headerEnd = Lines.lineEnd(text);
        if (headerEnd < 0) return waitOrReject(endOfInput);
        String header = Lines.firstLine(text).trim();
        if (!TableRows.isRow(header)) return Detection.NO_MATCH;

        CharSequence rest = text.subSequence(headerEnd + 1, text.length());
        if (rest.length() == 0) return waitOrReject(endOfInput);
        int separatorEnd = Lines.lineEnd(rest);
        if (separatorEnd < 0 && !endOfInput) {
            return TableRows.couldBeSeparator(rest) ? Detection.NEED_MORE_INPUT : Detection.NO_MATCH;
        }

        String separator = Lines.firstLine(rest).trim();
        List<String> alignments = TableRows.alignments(separator);
        if (alignments == null) return Detection.NO_MATCH;
        if (TableRows.cells(header).size() != alignments.size()) return Detection.NO_MATCH;

        int matchLength = headerEnd + 1 + Lines.firstLineLength(rest);
        Map<String, Object> metadata = Map.of("alignments", alignments, "columns", alignments.size());
        return new Detection.Matched(ElementType.TABLE, header, null, metadata, matchLength, null, name());
    }

    /**
     * Header row text (first line, trimmed) of a matched table.
     */
    public static String headerLine(CharSequence text) {
        return Lines.firstLine(text).trim();
    }

    /**
     * Separator row text (second line, trimmed) of a matched table.
     */
    public static String separatorLine(CharSequence text) {
        int headerEnd = Lines.lineEnd(text);
        return Lines.firstLine(text.subSequence(headerEnd + 1, text.length())).trim();
    }
}

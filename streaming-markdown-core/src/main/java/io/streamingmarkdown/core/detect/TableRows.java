package io.streamingmarkdown.core.detect;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipe-table line parsing.
 */
public final class TableRows {

    public static final String ALIGN_LEFT = "left";
    public static final String ALIGN_CENTER = "center";
    public static final String ALIGN_RIGHT = "right";
    public static final String ALIGN_NONE = "none";

    private TableRows() {}

    /**
     * A row starts and ends with a pipe once trimmed.
     */
    public static boolean isRow(String line) {
        String trimmed = line.trim();
        return trimmed.length() >= 2 && trimmed.startsWith("|") && trimmed.endsWith("|");
    }

    /**
     * Splits a row into trimmed cells. The outer pipes are optional.
     */
    public static List<String> cells(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("|")) trimmed = trimmed.substring(1);
        if (trimmed.endsWith("|")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        List<String> cells = new ArrayList<>();
        for (String cell : trimmed.split("\\|", -1)) {
            cells.add(cell.trim());
        }
        return cells;
    }

    /**
     * Parses a separator row such as {@code |:---|:---:|---:|---|}.
     *
     * @return one alignment per column, or {@code null} if the line is not a separator row
     */
    public static List<String> alignments(String line) {
        if (!isRow(line)) return null;
        List<String> alignments = new ArrayList<>();
        for (String col : cells(line)) {
            if (!col.matches(":?-+:?")) return null;
            boolean left = col.startsWith(":");
            boolean right = col.endsWith(":");
            if (left && right) {
                alignments.add(ALIGN_CENTER);
            } else if (left) {
                alignments.add(ALIGN_LEFT);
            } else if (right) {
                alignments.add(ALIGN_RIGHT);
            } else {
                alignments.add(ALIGN_NONE);
            }
        }
        return alignments;
    }

    /**
     * Whether a partial separator line can still grow into a valid one.
     */
    static boolean couldBeSeparator(CharSequence partial) {
        for (int i = 0; i < partial.length(); i++) {
            char c = partial.charAt(i);
            if (c != '|' && c != ':' && c != '-' && !Lines.isBlank(c) && c != '\r') return false;
        }
        return true;
    }
}

package io.streamingmarkdown.core.detect;

/**
 * Line helpers shared by the matchers.
 */
public final class Lines {

    private Lines() {}

    /**
     * Index of the first line feed, or -1.
     */
    public static int lineEnd(CharSequence text) {
        return indexOf(text, '\n', 0);
    }

    public static int indexOf(CharSequence text, char c, int from) {
        for (int i = Math.max(0, from); i < text.length(); i++) {
            if (text.charAt(i) == c) return i;
        }
        return -1;
    }

    /**
     * Text of the first line, without its terminator (and without a trailing carriage return).
     */
    public static String firstLine(CharSequence text) {
        int end = lineEnd(text);
        String line = (end < 0 ? text : text.subSequence(0, end)).toString();
        return stripCarriageReturn(line);
    }

    /**
     * Length of the first line including its line feed, or the whole text when it has none.
     */
    public static int firstLineLength(CharSequence text) {
        int end = lineEnd(text);
        return end < 0 ? text.length() : end + 1;
    }

    public static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Number of leading spaces and tabs.
     */
    public static int leadingBlanks(CharSequence text) {
        int i = 0;
        while (i < text.length() && isBlank(text.charAt(i))) i++;
        return i;
    }

    /**
     * Width of {@code text[0, end)} in columns, with tab stops every four columns.
     */
    public static int columns(CharSequence text, int end) {
        int col = 0;
        for (int i = 0; i < end; i++) {
            col = text.charAt(i) == '\t' ? (col / 4 + 1) * 4 : col + 1;
        }
        return col;
    }

    public static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    /**
     * True when the text holds only spaces, tabs and carriage returns.
     */
    public static boolean isBlankLine(CharSequence line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r') return false;
        }
        return true;
    }

    /**
     * Counts how many times {@code c} repeats from {@code from}.
     */
    public static int run(CharSequence text, int from, char c) {
        int i = from;
        while (i < text.length() && text.charAt(i) == c) i++;
        return i - from;
    }
}

package io.streamingmarkdown.core.engine;

import io.streamingmarkdown.core.Annotation;
import io.streamingmarkdown.core.ElementType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of the element currently being parsed.
 *
 * <p>{@code emitted} holds exactly what has been sent as deltas and becomes the final content.
 * Whitespace that may turn out to be trailing is held back until more content follows it.
 */
final class ParsingState {

    /**
     * Result of {@link #write(CharSequence)}.
     *
     * @param delta text appended to the content
     * @param start offset of the first non-blank character written, or -1
     * @param end offset after the last non-blank character written, or -1
     */
    record Written(String delta, int start, int end) {
        static final Written NONE = new Written("", -1, -1);
    }

    final ElementType type;
    final String id;
    final Map<String, Object> metadata;
    final String startMarker;
    final String endMarker;

    private final boolean dropLeading;
    private final boolean holdWhitespace;
    private final boolean flushHeldOnClose;

    private final StringBuilder emitted = new StringBuilder();
    private final StringBuilder held = new StringBuilder();

    /** Source text of the line being read, after the block marker. */
    final StringBuilder line = new StringBuilder();
    /** Offset in {@link #line} up to which inline content has been processed. */
    int scanned;
    int lines;
    boolean skipLeadingBlanks;
    final List<Annotation> citations = new ArrayList<>();

    // fenced blocks
    char fenceChar;
    int fenceLength;

    // structured tables
    List<String> alignments = List.of();
    String tbodyId;
    final StringBuilder tbody = new StringBuilder();
    int rows;

    ParsingState(ElementType type, String id, Map<String, Object> metadata, String startMarker, String endMarker,
                 boolean preserveWhitespace) {
        this.type = type;
        this.id = id;
        this.metadata = metadata;
        this.startMarker = startMarker;
        this.endMarker = endMarker;
        boolean verbatim = type == ElementType.CODE || type == ElementType.MATH;
        this.dropLeading = !preserveWhitespace && !verbatim;
        this.holdWhitespace = !preserveWhitespace;
        this.flushHeldOnClose = preserveWhitespace && verbatim;
    }

    boolean isFenced() {
        return endMarker != null && (type == ElementType.CODE || type == ElementType.MATH);
    }

    /**
     * Starts a new source line. Separators are written lazily, once content follows them.
     *
     * @param separators line feeds between the previous line and this one
     */
    void beginLine(int separators) {
        if (lines > 0 && !(dropLeading && emitted.length() == 0)) {
            for (int i = 0; i < separators; i++) held.append('\n');
        }
        lines++;
        line.setLength(0);
        scanned = 0;
    }

    Written write(CharSequence text) {
        if (text.length() == 0) return Written.NONE;
        StringBuilder out = new StringBuilder();
        int base = emitted.length();
        int first = -1;
        int last = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ' || c == '\t' || c == '\n') {
                if (dropLeading && base + out.length() == 0) continue;
                if (holdWhitespace || held.length() > 0) {
                    held.append(c);
                } else {
                    out.append(c);
                }
                continue;
            }
            out.append(held);
            held.setLength(0);
            if (first < 0) first = base + out.length();
            out.append(c);
            last = base + out.length();
        }
        emitted.append(out);
        return new Written(out.toString(), first, last);
    }

    /**
     * Drops held whitespace, or releases it for verbatim blocks that preserve whitespace.
     *
     * @return content to append before the element ends
     */
    String finish() {
        String tail = flushHeldOnClose ? held.toString() : "";
        held.setLength(0);
        emitted.append(tail);
        return tail;
    }

    String content() {
        return emitted.toString();
    }

    CharSequence contentView() {
        return emitted;
    }

    @Override
    public String toString() {
        return type.wireName() + "(" + id + ")";
    }
}

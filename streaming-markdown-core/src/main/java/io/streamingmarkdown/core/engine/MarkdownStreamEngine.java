package io.streamingmarkdown.core.engine;

import io.streamingmarkdown.core.Annotation;
import io.streamingmarkdown.core.ElementIdGenerator;
import io.streamingmarkdown.core.ElementType;
import io.streamingmarkdown.core.InlineEmphasisMode;
import io.streamingmarkdown.core.MarkdownParserConfig;
import io.streamingmarkdown.core.ParseEvent;
import io.streamingmarkdown.core.TableOutputMode;
import io.streamingmarkdown.core.detect.BlockTypeDetector;
import io.streamingmarkdown.core.detect.BlockquoteMatcher;
import io.streamingmarkdown.core.detect.CodeFenceMatcher;
import io.streamingmarkdown.core.detect.Detection;
import io.streamingmarkdown.core.detect.FenceClose;
import io.streamingmarkdown.core.detect.Lines;
import io.streamingmarkdown.core.detect.MathBlockMatcher;
import io.streamingmarkdown.core.detect.TableMatcher;
import io.streamingmarkdown.core.detect.TableRows;
import io.streamingmarkdown.core.inline.AnnotationExtractor;
import io.streamingmarkdown.core.inline.InlineScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.CharBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line-oriented incremental parser.
 *
 * <p>Input is appended to a private buffer; {@link #next()} advances over it one decision at a time.
 * A decision is only taken when the consumed text determines it: a line start that could still grow
 * into a different block waits for more input, and so does inline markup that might still close.
 * Because of that the events, and every element's final content, do not depend on how the input
 * was split into chunks.
 *
 * <p>Each iteration either consumes input, changes state or emits an event. When none of these is
 * possible the pending content is flushed and {@link #next()} returns {@code null}.
 */
public final class MarkdownStreamEngine {

    private static final Logger log = LoggerFactory.getLogger(MarkdownStreamEngine.class);

    private static final BlockquoteMatcher QUOTE = new BlockquoteMatcher();
    private static final List<ElementType> STRUCTURE =
            List.of(ElementType.THEAD, ElementType.TBODY, ElementType.ROW, ElementType.COL);

    private final MarkdownParserConfig config;
    private final BlockTypeDetector detector;
    private final InlineScanner scanner;
    private final AnnotationExtractor annotations;
    private final ElementIdGenerator ids;
    private final boolean ownsIds;
    private final boolean structuredTables;
    private final Deque<ParseEvent> queue = new ArrayDeque<>();
    private final ElementStateMachine elements;

    private final StringBuilder buffer = new StringBuilder();
    private int pos;
    private boolean lineStart = true;
    private boolean endOfInput;
    private ParsingState current;
    private int blankLines;

    public MarkdownStreamEngine(MarkdownParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.detector = BlockTypeDetector.create(config.enabledElements(), config.customMatchers());
        this.scanner = new InlineScanner(config.enabledElements());
        this.annotations = new AnnotationExtractor(config.annotationDetectors());
        this.ids = config.newIdGenerator();
        this.ownsIds = !config.sharesIdGenerator();
        this.structuredTables = structuredTables(config);
        this.elements = new ElementStateMachine(config.maxDeltaChunkSize(), queue::add);
    }

    private static boolean structuredTables(MarkdownParserConfig config) {
        if (config.tableOutputMode() != TableOutputMode.STRUCTURED) return false;
        for (ElementType part : STRUCTURE) {
            if (!config.isEnabled(part)) {
                log.warn("Structured tables need {} to be enabled; emitting tables as text", part);
                return false;
            }
        }
        return true;
    }

    /**
     * Appends input. Line endings are normalized to {@code \n}.
     *
     * @param chunk the next chunk
     */
    public void append(CharSequence chunk) {
        if (chunk.length() == 0) return;
        int last = buffer.length() - 1;
        if (last >= pos && buffer.charAt(last) == '\r' && chunk.charAt(0) == '\n') {
            buffer.setLength(last);
        }
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (c == '\r' && i + 1 < chunk.length() && chunk.charAt(i + 1) == '\n') continue;
            buffer.append(c);
        }
    }

    /**
     * Marks the input as complete; the remaining buffer and the open element are flushed by {@link #next()}.
     */
    public void finish() {
        endOfInput = true;
    }

    public boolean isFinished() {
        return endOfInput;
    }

    /**
     * Whether an element is open or input is waiting for a decision.
     */
    public boolean hasPendingInput() {
        return current != null || pos < buffer.length();
    }

    /**
     * Returns the next event, or {@code null} when nothing more can be produced from the input so far.
     */
    public ParseEvent next() {
        while (queue.isEmpty()) {
            if (step()) continue;
            if (endOfInput && current != null) {
                closeCurrent();
                continue;
            }
            elements.flushAll();
            compact();
            break;
        }
        return queue.poll();
    }

    /**
     * Discards buffered input, the open element and pending events, and restarts id generation
     * unless the generator is shared.
     */
    public void reset() {
        buffer.setLength(0);
        pos = 0;
        lineStart = true;
        endOfInput = false;
        current = null;
        blankLines = 0;
        queue.clear();
        elements.reset();
        annotations.clear();
        if (ownsIds) ids.reset();
        log.debug("Engine reset");
    }

    private boolean step() {
        if (pos >= buffer.length()) return false;
        return lineStart ? startLine() : continueLine();
    }

    private CharSequence view() {
        return CharBuffer.wrap(buffer, pos, buffer.length());
    }

    private boolean overflow(CharSequence view) {
        if (view.length() <= config.maxBufferSize()) return false;
        log.warn("Unconsumed input of {} chars exceeds maxBufferSize {}; resolving it as plain content",
                view.length(), config.maxBufferSize());
        return true;
    }

    // ---- line starts

    private boolean startLine() {
        CharSequence view = view();
        if (current != null && current.isFenced()) {
            return fencedLineStart(view);
        }

        int blanks = Lines.leadingBlanks(view);
        if (blanks == view.length()) {
            if (!endOfInput && !overflow(view)) return false;
            pos += blanks;
            onBlankLine();
            return true;
        }
        char first = view.charAt(blanks);
        if (first == '\r' && blanks + 1 == view.length() && !endOfInput) return false;
        if (first == '\n') {
            pos += blanks + 1;
            onBlankLine();
            return true;
        }

        if (current != null && current.type == ElementType.QUOTE) return quoteLineStart(view);
        if (current != null && current.type == ElementType.TABLE) return tableLineStart(blanks);

        boolean forced = false;
        Detection detection = detector.detect(view, endOfInput);
        if (detection instanceof Detection.NeedMoreInput) {
            if (!overflow(view)) return false;
            detection = Detection.NO_MATCH;
            forced = true;
        }
        if (detection instanceof Detection.Matched matched && matched.singleLine() && matched.matchLength() == 0) {
            log.warn("Matcher {} matched without consuming input; treating the line as text", matched.matcher());
            detection = Detection.NO_MATCH;
        }
        if (detection instanceof Detection.Matched matched) {
            if (current != null) closeCurrent();
            open(matched, view);
            return true;
        }

        if (current != null && current.type == ElementType.TEXT) {
            current.beginLine(1 + blankLines);
            blankLines = 0;
        } else {
            if (current != null) closeCurrent();
            openText(forced);
        }
        current.skipLeadingBlanks = !config.preserveWhitespace();
        lineStart = false;
        return true;
    }

    private boolean fencedLineStart(CharSequence view) {
        FenceClose verdict = current.type == ElementType.CODE
                ? CodeFenceMatcher.closes(view, current.fenceChar, current.fenceLength, endOfInput)
                : MathBlockMatcher.closes(view, endOfInput);
        if (verdict == FenceClose.NEED_MORE_INPUT) {
            if (!overflow(view)) return false;
            verdict = FenceClose.CONTENT;
        }
        if (verdict == FenceClose.CLOSE) {
            pos += Lines.firstLineLength(view);
            closeCurrent();
            return true;
        }
        current.beginLine(1);
        lineStart = false;
        return true;
    }

    private boolean quoteLineStart(CharSequence view) {
        if (QUOTE.detect(view, endOfInput) instanceof Detection.Matched matched) {
            pos += matched.matchLength();
            current.beginLine(1);
            current.skipLeadingBlanks = true;
            lineStart = false;
        } else {
            closeCurrent();
        }
        return true;
    }

    private boolean tableLineStart(int blanks) {
        if (buffer.charAt(pos + blanks) != '|') {
            closeCurrent();
            return true;
        }
        pos += blanks;
        current.beginLine(1);
        current.skipLeadingBlanks = true;
        lineStart = false;
        return true;
    }

    private void onBlankLine() {
        if (current == null) return;
        if (current.type == ElementType.TEXT && !config.splitParagraphs()) {
            blankLines++;
            return;
        }
        closeCurrent();
    }

    // ---- opening elements

    private void open(Detection.Matched matched, CharSequence view) {
        ElementType type = matched.type();
        if (type == ElementType.TABLE) {
            String header = TableMatcher.headerLine(view);
            String separator = TableMatcher.separatorLine(view);
            pos += matched.matchLength();
            openTable(matched, header, separator);
            lineStart = true;
            return;
        }

        pos += matched.matchLength();
        ParsingState state = begin(type, matched.metadata(), matched.startMarker(), matched.endMarker());
        log.debug("Opened {} via {}", state, matched.matcher());

        if (matched.singleLine()) {
            state.beginLine(0);
            if (type == ElementType.HEADER) {
                state.line.append(matched.content());
                scanInline(state, true);
            } else {
                writeVerbatim(state, matched.content());
            }
            close(state);
            lineStart = true;
            return;
        }

        current = state;
        if (state.isFenced()) {
            if (type == ElementType.CODE && !matched.endMarker().isEmpty()) {
                state.fenceChar = matched.endMarker().charAt(0);
                state.fenceLength = matched.endMarker().length();
            }
            lineStart = true;
            return;
        }
        state.beginLine(0);
        state.skipLeadingBlanks = true;
        lineStart = false;
    }

    private void openText(boolean forced) {
        Map<String, Object> metadata = forced ? Map.of("forcedFlush", true) : Map.of();
        current = begin(ElementType.TEXT, metadata, "", null);
        current.beginLine(0);
        log.debug("Opened {}", current);
    }

    private void openTable(Detection.Matched matched, String header, String separator) {
        ParsingState state = begin(ElementType.TABLE, matched.metadata(), matched.startMarker(), null);
        log.debug("Opened {} via {}", state, matched.matcher());
        boolean structured = structuredTables;

        state.beginLine(0);
        forward(state, state.write(header), !structured);
        state.beginLine(1);
        forward(state, state.write(separator), !structured);

        if (structured) {
            List<String> alignments = TableRows.alignments(separator);
            state.alignments = alignments == null ? List.of() : alignments;
            String theadId = ids.nextId(ElementType.THEAD);
            elements.begin(ElementType.THEAD, theadId, Map.of("parentId", state.id));
            String headerText = emitRow(state, TableRows.cells(header), 0);
            elements.delta(theadId, headerText);
            elements.end(theadId, headerText);
            state.tbodyId = ids.nextId(ElementType.TBODY);
            elements.begin(ElementType.TBODY, state.tbodyId, Map.of("parentId", state.id));
        }
        current = state;
    }

    private ParsingState begin(ElementType type, Map<String, Object> metadata, String startMarker, String endMarker) {
        String id = ids.nextId(type);
        ParsingState state = new ParsingState(type, id, metadata, startMarker, endMarker, config.preserveWhitespace());
        elements.begin(type, id, metadata);
        return state;
    }

    // ---- line content

    private boolean continueLine() {
        CharSequence view = view();
        int newline = Lines.lineEnd(view);
        int end = newline < 0 ? view.length() : newline;
        if (newline < 0 && !endOfInput) {
            char last = view.charAt(end - 1);
            // Wait for the rest of a CRLF pair or of a surrogate pair.
            if (last == '\r' || Character.isHighSurrogate(last)) end--;
            if (end == 0) return false;
        }
        CharSequence slice = view.subSequence(0, end);
        boolean closed = newline >= 0 || endOfInput;
        pos += newline >= 0 ? end + 1 : end;

        ParsingState state = current;
        if (state.skipLeadingBlanks && state.line.length() == 0) {
            slice = slice.subSequence(Lines.leadingBlanks(slice), slice.length());
        }

        switch (state.type) {
            case CODE, MATH -> writeVerbatim(state, slice);
            case TABLE -> tableContent(state, slice, closed);
            default -> {
                state.line.append(slice);
                scanInline(state, closed);
            }
        }

        if (newline >= 0) {
            lineStart = true;
            if (isLineScoped(state.type)) {
                closeCurrent();
            } else {
                extractAnnotations(state, false);
            }
        }
        return true;
    }

    private static boolean isLineScoped(ElementType type) {
        return switch (type) {
            case TEXT, QUOTE, TABLE, CODE, MATH -> false;
            default -> true;
        };
    }

    private void writeVerbatim(ParsingState state, CharSequence text) {
        forward(state, state.write(text), true);
    }

    private void forward(ParsingState state, ParsingState.Written written, boolean emit) {
        if (emit && !written.delta().isEmpty()) {
            elements.delta(state.id, written.delta());
        }
    }

    private void tableContent(ParsingState state, CharSequence slice, boolean closed) {
        boolean structured = structuredTables;
        state.line.append(slice);
        forward(state, state.write(slice), !structured);
        if (structured && closed) {
            appendBodyRow(state);
        }
    }

    private void appendBodyRow(ParsingState state) {
        String rowText = emitRow(state, TableRows.cells(state.line.toString()), state.rows);
        String delta = state.rows == 0 ? rowText : "\n" + rowText;
        state.tbody.append(delta);
        elements.delta(state.tbodyId, delta);
        state.rows++;
        state.line.setLength(0);
    }

    private String emitRow(ParsingState table, List<String> cells, int index) {
        String rowId = ids.nextId(ElementType.ROW);
        elements.begin(ElementType.ROW, rowId, Map.of("index", index));
        for (int i = 0; i < cells.size(); i++) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("index", i);
            if (i < table.alignments.size() && !TableRows.ALIGN_NONE.equals(table.alignments.get(i))) {
                metadata.put("alignment", table.alignments.get(i));
            }
            String colId = ids.nextId(ElementType.COL);
            String cell = cells.get(i);
            elements.begin(ElementType.COL, colId, metadata);
            elements.delta(colId, cell);
            elements.end(colId, cell);
        }
        String rowText = String.join(" | ", cells);
        elements.delta(rowId, rowText);
        elements.end(rowId, rowText);
        return rowText;
    }

    // ---- inline content

    private void scanInline(ParsingState state, boolean closed) {
        int unscanned = state.line.length() - state.scanned;
        if (unscanned == 0) return;
        if (!closed && unscanned > config.maxBufferSize()) {
            log.warn("Unresolved inline markup spans {} chars, over maxBufferSize {}; treating it as plain text",
                    unscanned, config.maxBufferSize());
            closed = true;
        }
        if (!scanner.isActive()) {
            writeVerbatim(state, state.line.subSequence(state.scanned, state.line.length()));
            state.scanned = state.line.length();
            return;
        }
        InlineScanner.ScanResult result = scanner.scan(state.line, state.scanned, closed);
        for (InlineScanner.Token token : result.tokens()) {
            if (token instanceof InlineScanner.Plain plain) {
                writeVerbatim(state, plain.text());
            } else if (token instanceof InlineScanner.Span span) {
                emitSpan(state, span);
            }
        }
        state.scanned = result.stableEnd();
    }

    private void emitSpan(ParsingState parent, InlineScanner.Span span) {
        Map<String, Object> metadata = new LinkedHashMap<>(span.metadata());
        metadata.put("parentId", parent.id);
        String childId = ids.nextId(span.type());
        elements.begin(span.type(), childId, metadata);
        elements.delta(childId, span.inner());
        elements.end(childId, span.inner());

        ParsingState.Written label;
        if (config.inlineEmphasisMode() == InlineEmphasisMode.PRESERVE) {
            String raw = span.raw();
            int innerEnd = span.innerOffset() + span.inner().length();
            writeVerbatim(parent, raw.substring(0, span.innerOffset()));
            label = parent.write(span.inner());
            forward(parent, label, true);
            writeVerbatim(parent, raw.substring(innerEnd));
        } else {
            label = parent.write(span.inner());
            forward(parent, label, true);
        }

        if (span.type() == ElementType.LINK && label.start() >= 0) {
            parent.citations.add(Annotation.urlCitation(
                    (String) span.metadata().get("url"), (String) span.metadata().get("title"),
                    label.start(), label.end()));
            extractAnnotations(parent, false);
        }
    }

    private void extractAnnotations(ParsingState state, boolean finalView) {
        if (state.citations.isEmpty() && !annotations.hasDetectors()) return;
        List<Annotation> found = annotations.extract(state.id, state.contentView(), state.citations, finalView);
        state.citations.clear();
        for (Annotation annotation : found) {
            elements.annotate(state.id, annotation);
        }
    }

    // ---- closing elements

    private void closeCurrent() {
        ParsingState state = current;
        current = null;
        blankLines = 0;
        close(state);
    }

    private void close(ParsingState state) {
        if (state.scanned < state.line.length() && state.type != ElementType.TABLE && !state.isFenced()) {
            scanInline(state, true);
        }
        forward(state, new ParsingState.Written(state.finish(), -1, -1), true);

        boolean structuredTable = state.type == ElementType.TABLE && state.tbodyId != null;
        if (structuredTable) {
            if (state.line.length() > 0) appendBodyRow(state);
            elements.delta(state.id, state.content());
        }
        extractAnnotations(state, true);
        if (structuredTable) {
            elements.end(state.tbodyId, state.tbody.toString());
        }
        elements.end(state.id, state.content());
        annotations.release(state.id);
        log.debug("Closed {} with {} chars", state, state.content().length());
    }

    private void compact() {
        if (pos == 0) return;
        buffer.delete(0, pos);
        pos = 0;
    }
}

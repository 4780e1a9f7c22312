package io.streamingmarkdown.core.engine;

import io.streamingmarkdown.core.Annotation;
import io.streamingmarkdown.core.ElementType;
import io.streamingmarkdown.core.ParseEvent;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Tracks the begin/delta/end lifecycle of every element and coalesces content into deltas.
 *
 * <p>Content is buffered per element and released at flush points: before any {@code Begin},
 * {@code Annotation} or {@code End}, and whenever {@link #flushAll()} is called. With a positive
 * chunk size, full chunks are released as soon as they are available.
 */
public final class ElementStateMachine {

    private final int maxDeltaChunkSize;
    private final Consumer<ParseEvent> sink;
    private final Map<String, StringBuilder> open = new LinkedHashMap<>();
    private final Set<String> seen = new HashSet<>();

    /**
     * @param maxDeltaChunkSize characters per delta, or {@code 0} for one delta per flush point
     * @param sink receives the events in order
     */
    public ElementStateMachine(int maxDeltaChunkSize, Consumer<ParseEvent> sink) {
        this.maxDeltaChunkSize = Math.max(0, maxDeltaChunkSize);
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void begin(ElementType type, String id, Map<String, Object> metadata) {
        if (!seen.add(id)) {
            throw new IllegalStateException("element id already used: " + id);
        }
        flushAll();
        open.put(id, new StringBuilder());
        sink.accept(new ParseEvent.Begin(type, id, metadata));
    }

    public void delta(String id, CharSequence content) {
        StringBuilder outbox = outbox(id);
        if (content.length() == 0) return;
        outbox.append(content);
        if (maxDeltaChunkSize > 0) {
            while (outbox.length() >= maxDeltaChunkSize) {
                emitChunk(id, outbox);
            }
        }
    }

    public void annotate(String id, Annotation annotation) {
        outbox(id);
        flushAll();
        sink.accept(new ParseEvent.Annotated(id, annotation));
    }

    public void end(String id, String finalContent) {
        outbox(id);
        flushAll();
        open.remove(id);
        sink.accept(new ParseEvent.End(id, finalContent));
    }

    /**
     * Releases the buffered content of every open element, in the order the elements were opened.
     */
    public void flushAll() {
        for (Map.Entry<String, StringBuilder> e : open.entrySet()) {
            StringBuilder outbox = e.getValue();
            while (outbox.length() > 0) {
                if (maxDeltaChunkSize > 0) {
                    emitChunk(e.getKey(), outbox);
                } else {
                    sink.accept(new ParseEvent.Delta(e.getKey(), outbox.toString()));
                    outbox.setLength(0);
                }
            }
        }
    }

    public boolean isOpen(String id) {
        return open.containsKey(id);
    }

    public int openCount() {
        return open.size();
    }

    public void reset() {
        open.clear();
        seen.clear();
    }

    private StringBuilder outbox(String id) {
        StringBuilder outbox = open.get(id);
        if (outbox == null) {
            throw new IllegalStateException(seen.contains(id)
                    ? "element already ended: " + id
                    : "element not begun: " + id);
        }
        return outbox;
    }

    private void emitChunk(String id, StringBuilder outbox) {
        int n = Math.min(maxDeltaChunkSize, outbox.length());
        // Keep surrogate pairs in one delta.
        if (n < outbox.length() && Character.isHighSurrogate(outbox.charAt(n - 1))) {
            n = n > 1 ? n - 1 : n + 1;
        }
        sink.accept(new ParseEvent.Delta(id, outbox.substring(0, n)));
        outbox.delete(0, n);
    }
}

package io.streamingmarkdown.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Folds parse events into {@link MarkdownBlock}s, in the order the elements began.
 *
 * <p>Usable as a live view: blocks can be read at any time while events are still arriving.
 */
public final class MarkdownDocumentBuilder implements Consumer<ParseEvent> {

    private static final class Entry {
        final String id;
        final ElementType type;
        final Map<String, Object> metadata;
        final StringBuilder content = new StringBuilder();
        final List<Annotation> annotations = new ArrayList<>();
        boolean complete;

        Entry(ParseEvent.Begin begin) {
            this.id = begin.elementId();
            this.type = begin.elementType();
            this.metadata = begin.metadata();
        }

        MarkdownBlock toBlock() {
            return new MarkdownBlock(id, type, content.toString(), metadata, annotations, complete);
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Folds a complete event sequence.
     */
    public static List<MarkdownBlock> build(Iterable<? extends ParseEvent> events) {
        MarkdownDocumentBuilder builder = new MarkdownDocumentBuilder();
        events.forEach(builder);
        return builder.blocks();
    }

    /**
     * Applies one event.
     *
     * @throws IllegalStateException if the event does not fit the element's lifecycle
     */
    @Override
    public void accept(ParseEvent event) {
        if (event instanceof ParseEvent.Begin begin) {
            if (entries.containsKey(begin.elementId())) {
                throw new IllegalStateException("element begun twice: " + begin.elementId());
            }
            entries.put(begin.elementId(), new Entry(begin));
        } else if (event instanceof ParseEvent.Delta delta) {
            openEntry(delta.elementId()).content.append(delta.content());
        } else if (event instanceof ParseEvent.Annotated annotated) {
            openEntry(annotated.elementId()).annotations.add(annotated.annotation());
        } else if (event instanceof ParseEvent.End end) {
            Entry entry = openEntry(end.elementId());
            entry.content.setLength(0);
            entry.content.append(end.finalContent());
            entry.complete = true;
        }
    }

    /**
     * All elements, including inline and table-structure children.
     */
    public List<MarkdownBlock> blocks() {
        List<MarkdownBlock> blocks = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            blocks.add(entry.toBlock());
        }
        return blocks;
    }

    /**
     * Elements without a parent.
     */
    public List<MarkdownBlock> topLevelBlocks() {
        List<MarkdownBlock> blocks = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (!entry.metadata.containsKey("parentId")) blocks.add(entry.toBlock());
        }
        return blocks;
    }

    /**
     * Direct children of an element.
     */
    public List<MarkdownBlock> children(String parentId) {
        List<MarkdownBlock> blocks = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (parentId.equals(entry.metadata.get("parentId"))) blocks.add(entry.toBlock());
        }
        return blocks;
    }

    public Optional<MarkdownBlock> block(String id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.toBlock());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private Entry openEntry(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new IllegalStateException("element not begun: " + id);
        }
        if (entry.complete) {
            throw new IllegalStateException("element already ended: " + id);
        }
        return entry;
    }
}

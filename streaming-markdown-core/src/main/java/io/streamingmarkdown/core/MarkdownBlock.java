package io.streamingmarkdown.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An element folded from its events.
 *
 * @param id the element id
 * @param type the element type
 * @param content content received so far; the final content once {@code complete}
 * @param metadata metadata from the {@code Begin} event
 * @param annotations annotations reported for the element
 * @param complete whether the {@code End} event was seen
 */
public record MarkdownBlock(String id,
                            ElementType type,
                            String content,
                            Map<String, Object> metadata,
                            List<Annotation> annotations,
                            boolean complete) {
    public MarkdownBlock {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(content, "content");
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
        annotations = (annotations == null) ? List.of() : List.copyOf(annotations);
    }

    /**
     * Id of the enclosing element for inline and table-structure elements.
     *
     * @return the parent id, or {@code null} for top-level blocks
     */
    public String parentId() {
        Object parent = metadata.get("parentId");
        return parent == null ? null : parent.toString();
    }
}

package io.streamingmarkdown.core;

import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle events emitted by the streaming parser.
 *
 * <p>Every element goes through {@code Begin}, zero or more {@code Delta}/{@code Annotation}
 * events and exactly one {@code End}. The deltas of an element concatenate to its final content.
 */
public sealed interface ParseEvent permits ParseEvent.Begin, ParseEvent.Delta, ParseEvent.End, ParseEvent.Annotated {

    /**
     * Id of the element this event refers to.
     *
     * @return the element id
     */
    String elementId();

    /**
     * An element was recognized.
     *
     * @param elementType the element type
     * @param elementId the element id, unique within a document
     * @param metadata type-specific metadata (never null)
     */
    record Begin(ElementType elementType, String elementId, Map<String, Object> metadata) implements ParseEvent {
        public Begin {
            Objects.requireNonNull(elementType, "elementType");
            Objects.requireNonNull(elementId, "elementId");
            metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
        }
    }

    /**
     * Content appended to an open element.
     *
     * @param elementId the element id
     * @param content the appended content
     */
    record Delta(String elementId, String content) implements ParseEvent {
        public Delta {
            Objects.requireNonNull(elementId, "elementId");
            Objects.requireNonNull(content, "content");
        }
    }

    /**
     * The element is finished.
     *
     * @param elementId the element id
     * @param finalContent the complete content of the element
     */
    record End(String elementId, String finalContent) implements ParseEvent {
        public End {
            Objects.requireNonNull(elementId, "elementId");
            Objects.requireNonNull(finalContent, "finalContent");
        }
    }

    /**
     * An annotation found in an open element.
     *
     * @param elementId the owning element id
     * @param annotation the annotation
     */
    record Annotated(String elementId, Annotation annotation) implements ParseEvent {
        public Annotated {
            Objects.requireNonNull(elementId, "elementId");
            Objects.requireNonNull(annotation, "annotation");
        }
    }
}

package io.streamingmarkdown.core;

import java.util.Map;
import java.util.Objects;

/**
 * Inline marker detected within the content of an element.
 *
 * <p>Offsets are relative to the owning element's final content: {@code startIndex} inclusive,
 * {@code endIndex} exclusive.
 *
 * @param type annotation type, e.g. {@value #URL_CITATION}
 * @param startIndex start offset within the element content
 * @param endIndex end offset within the element content
 * @param attributes type-specific attributes
 */
public record Annotation(String type, int startIndex, int endIndex, Map<String, Object> attributes) {

    /** Type of annotations produced for Markdown links. */
    public static final String URL_CITATION = "url_citation";

    public Annotation {
        Objects.requireNonNull(type, "type");
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException("invalid range [" + startIndex + ", " + endIndex + ")");
        }
        attributes = (attributes == null) ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Creates a link citation annotation.
     *
     * @param url link target
     * @param title link title (the label when no explicit title was given)
     * @param startIndex start offset within the element content
     * @param endIndex end offset within the element content
     * @return the annotation
     */
    public static Annotation urlCitation(String url, String title, int startIndex, int endIndex) {
        return new Annotation(URL_CITATION, startIndex, endIndex, Map.of("url", url, "title", title));
    }

    /** @return the {@code url} attribute, or {@code null} */
    public String url() {
        Object v = attributes.get("url");
        return v == null ? null : v.toString();
    }

    /** @return the {@code title} attribute, or {@code null} */
    public String title() {
        Object v = attributes.get("title");
        return v == null ? null : v.toString();
    }
}

package io.streamingmarkdown.core;

/**
 * How inline markers (emphasis, strong, strikethrough, inline code, links) appear in block content.
 */
public enum InlineEmphasisMode {
    /** Markers are removed; block content carries the inner text only. */
    STRIP,
    /** Markers are kept so downstream renderers can re-parse them. */
    PRESERVE
}

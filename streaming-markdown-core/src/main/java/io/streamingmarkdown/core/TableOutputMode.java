package io.streamingmarkdown.core;

/**
 * How tables are reported.
 */
public enum TableOutputMode {
    /** A single {@code table} element carrying the table text. */
    TEXT,
    /** The {@code table} element additionally gets nested {@code thead}/{@code tbody}/{@code row}/{@code col} elements. */
    STRUCTURED
}

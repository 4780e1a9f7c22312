package io.streamingmarkdown.core.detect;

/**
 * Verdict for a line inside a fenced block.
 */
public enum FenceClose {
    /** The line closes the block. */
    CLOSE,
    /** The line is body content. */
    CONTENT,
    /** The line could still become a closing fence. */
    NEED_MORE_INPUT
}

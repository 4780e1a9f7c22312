/**
 * Inline span recognition and annotation extraction.
 *
 * <p>Spans (code, strikethrough, strong, emphasis, links) never cross a line break and are only
 * reported once no further input can change how they are recognized.
 */
package io.streamingmarkdown.core.inline;

/**
 * The incremental parsing engine.
 *
 * <p>{@link io.streamingmarkdown.core.engine.MarkdownStreamEngine} owns the unconsumed input and
 * the open element, and produces events on demand. It is not thread-safe.
 */
package io.streamingmarkdown.core.engine;

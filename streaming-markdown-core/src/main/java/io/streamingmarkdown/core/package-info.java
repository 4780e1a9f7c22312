/**
 * Streaming Markdown core.
 *
 * <p>This module is deliberately framework-neutral. It contains:
 * <ul>
 *   <li>The event model ({@link io.streamingmarkdown.core.ParseEvent}) and element types</li>
 *   <li>The parser facade and its immutable configuration</li>
 *   <li>A small block-document builder folding events into blocks</li>
 *   <li>The {@link io.streamingmarkdown.core.EventCodec} SPI for event transport</li>
 * </ul>
 *
 * <p>JSON bindings live in other modules.
 */
package io.streamingmarkdown.core;

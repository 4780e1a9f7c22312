package io.streamingmarkdown.core;

/**
 * Supplies element ids.
 *
 * <p>Ids must be unique within a document. The default generator is a per-parser counter.
 */
@FunctionalInterface
public interface ElementIdGenerator {

    /**
     * Returns the id for a new element.
     *
     * @param type the type of the element being opened
     * @return a unique id
     */
    String nextId(ElementType type);

    /**
     * Restarts the sequence. Called when the owning parser is reset; never called on a generator
     * shared through {@link MarkdownParserConfig.Builder#idGenerator(ElementIdGenerator)}.
     */
    default void reset() {
    }

    /**
     * Counter-backed generator producing {@code prefix-1}, {@code prefix-2}, ...
     *
     * @param prefix id prefix
     * @return a new generator owning its own counter
     */
    static ElementIdGenerator counter(String prefix) {
        return new ElementIdGenerator() {
            private long next = 0;

            @Override
            public String nextId(ElementType type) {
                return prefix + "-" + (++next);
            }

            @Override
            public void reset() {
                next = 0;
            }
        };
    }
}

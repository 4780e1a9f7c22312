package io.streamingmarkdown.core;

import io.streamingmarkdown.core.engine.MarkdownStreamEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Incremental Markdown parser.
 *
 * <p>Feed text with {@link #processChunk(CharSequence)} as it arrives and finish the document with
 * {@link #complete()}. The events depend only on the concatenated input, never on how it was split.
 *
 * <pre>{@code
 * StreamingMarkdownParser parser = StreamingMarkdownParser.create();
 * for (String token : tokens) {
 *     for (ParseEvent event : parser.processChunk(token)) {
 *         render(event);
 *     }
 * }
 * parser.complete().forEach(this::render);
 * }</pre>
 *
 * <p>Instances are not thread-safe. Each owns its buffer, open elements and id counter.
 */
public final class StreamingMarkdownParser {

    private static final Logger log = LoggerFactory.getLogger(StreamingMarkdownParser.class);

    private final MarkdownParserConfig config;
    private final MarkdownStreamEngine engine;
    private boolean streaming;
    private boolean completed;
    private long generation;

    private StreamingMarkdownParser(MarkdownParserConfig config) {
        this.config = config;
        this.engine = new MarkdownStreamEngine(config);
    }

    public static StreamingMarkdownParser create() {
        return create(MarkdownParserConfig.defaults());
    }

    public static StreamingMarkdownParser create(MarkdownParserConfig config) {
        return new StreamingMarkdownParser(Objects.requireNonNull(config, "config"));
    }

    public MarkdownParserConfig config() {
        return config;
    }

    /**
     * Appends a chunk of the document.
     *
     * @param chunk text of any length, split anywhere
     * @return the events made available by this chunk
     * @throws MarkdownStreamException.StreamCompleted if {@link #complete()} was called without a reset
     */
    public EventSequence processChunk(CharSequence chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (completed) {
            throw new MarkdownStreamException.StreamCompleted(
                    "processChunk called after complete(); call reset() to parse a new document");
        }
        engine.append(chunk);
        streaming = true;
        return sequence();
    }

    /**
     * Ends the document, closing every open element with the content it has accumulated.
     * Calling it again has no further effect.
     *
     * @return the remaining events
     */
    public EventSequence complete() {
        engine.finish();
        streaming = false;
        completed = true;
        return sequence();
    }

    /**
     * Parses a sequence of chunks followed by completion. The chunks are pulled as the returned
     * sequence is iterated.
     *
     * @param chunks the document chunks
     * @return every event of the document
     */
    public EventSequence processStream(Iterable<? extends CharSequence> chunks) {
        Objects.requireNonNull(chunks, "chunks");
        if (completed) {
            throw new MarkdownStreamException.StreamCompleted(
                    "processStream called after complete(); call reset() to parse a new document");
        }
        Iterator<? extends CharSequence> it = chunks.iterator();
        long gen = ++generation;
        return new EventSequence(() -> {
            if (gen != generation) return null;
            while (true) {
                ParseEvent event = engine.next();
                if (event != null) return event;
                if (it.hasNext()) {
                    engine.append(it.next());
                    streaming = true;
                } else if (!engine.isFinished()) {
                    engine.finish();
                    streaming = false;
                    completed = true;
                } else {
                    return null;
                }
            }
        });
    }

    /**
     * Parses a whole document.
     *
     * @param markdown the document
     * @return all events
     */
    public List<ParseEvent> parse(String markdown) {
        List<ParseEvent> events = new ArrayList<>(processChunk(markdown).toList());
        events.addAll(complete().toList());
        return events;
    }

    /**
     * Discards all buffered input and open elements, and restarts id generation unless the
     * configuration shares one generator, so the instance can parse a new document.
     */
    public void reset() {
        engine.reset();
        streaming = false;
        completed = false;
        generation++;
        log.debug("Parser reset");
    }

    /**
     * Whether input has been received since creation or the last reset, and the document is not complete.
     */
    public boolean isStreaming() {
        return streaming;
    }

    public boolean isCompleted() {
        return completed;
    }

    private EventSequence sequence() {
        long gen = ++generation;
        return new EventSequence(() -> gen == generation ? engine.next() : null);
    }
}

package io.streamingmarkdown.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Transport encoding of parse events.
 *
 * <p>Each event is one JSON object carrying a {@code type} discriminator: {@code begin},
 * {@code delta}, {@code end} or {@code annotation}. Streams of events are written as NDJSON,
 * one object per line. Implementations live in binding modules and are discovered with
 * {@link ServiceLoader}.
 */
public interface EventCodec {

    /**
     * Encodes an event as a single-line JSON object.
     *
     * @throws MarkdownStreamException.EventCodecException if the event cannot be encoded
     */
    String encode(ParseEvent event);

    /**
     * Decodes a JSON object produced by {@link #encode(ParseEvent)}.
     *
     * @throws MarkdownStreamException.EventCodecException if the input is not a valid event
     */
    ParseEvent decode(String json);

    /**
     * Writes events as NDJSON. The writer is flushed but not closed.
     */
    default void writeAll(Iterable<? extends ParseEvent> events, Writer out) {
        try {
            for (ParseEvent event : events) {
                out.write(encode(event));
                out.write('\n');
            }
            out.flush();
        } catch (IOException e) {
            throw new MarkdownStreamException.EventCodecException("Failed to write events", e);
        }
    }

    /**
     * Reads NDJSON events until the end of the reader; blank lines are skipped.
     */
    default List<ParseEvent> readAll(Reader in) {
        BufferedReader reader = in instanceof BufferedReader br ? br : new BufferedReader(in);
        List<ParseEvent> events = new ArrayList<>();
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                events.add(decode(line));
            }
        } catch (IOException e) {
            throw new MarkdownStreamException.EventCodecException("Failed to read events", e);
        }
        return events;
    }

    /**
     * Loads the first implementation registered on the class path.
     *
     * @throws MarkdownStreamException.EventCodecException if none is registered
     */
    static EventCodec load() {
        return ServiceLoader.load(EventCodec.class).findFirst()
                .orElseThrow(() -> new MarkdownStreamException.EventCodecException(
                        "No EventCodec implementation found on the class path"));
    }
}

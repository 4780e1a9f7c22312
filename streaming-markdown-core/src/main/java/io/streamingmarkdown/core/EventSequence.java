package io.streamingmarkdown.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-use sequence of parse events.
 *
 * <p>Events are produced while the sequence is iterated. A caller may stop at any point: events it
 * did not consume are delivered by the next sequence the parser returns. Once the parser hands out a
 * newer sequence, older ones yield nothing further.
 */
public final class EventSequence implements Iterable<ParseEvent> {

    private static final EventSequence EMPTY = new EventSequence(() -> null);

    private final Supplier<ParseEvent> source;
    private boolean iterated;

    /**
     * @param source returns the next event, or {@code null} when the sequence is exhausted
     */
    EventSequence(Supplier<ParseEvent> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static EventSequence empty() {
        return EMPTY;
    }

    /**
     * Returns the iterator of this sequence.
     *
     * @throws IllegalStateException if the sequence has already been iterated
     */
    @Override
    public Iterator<ParseEvent> iterator() {
        if (this != EMPTY) {
            if (iterated) {
                throw new IllegalStateException("EventSequence can only be iterated once");
            }
            iterated = true;
        }
        return new Iterator<>() {
            private ParseEvent next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next != null) return true;
                if (done) return false;
                next = source.get();
                if (next == null) done = true;
                return next != null;
            }

            @Override
            public ParseEvent next() {
                if (!hasNext()) throw new NoSuchElementException();
                ParseEvent event = next;
                next = null;
                return event;
            }
        };
    }

    public Stream<ParseEvent> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Drains the sequence into a list.
     */
    public List<ParseEvent> toList() {
        List<ParseEvent> events = new ArrayList<>();
        forEach(events::add);
        return events;
    }
}

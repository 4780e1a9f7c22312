package io.streamingmarkdown.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Folds events into elements while checking the lifecycle rules every event stream must follow.
 */
public final class ParsedElements {

    public record Element(ElementType type, String id, Map<String, Object> metadata, String content,
                          List<Annotation> annotations, boolean ended) {
    }

    private ParsedElements() {}

    /**
     * Folds events in begin order, asserting that ids are begun once, that nothing follows an end
     * and that the deltas of each element add up to its final content.
     */
    public static List<Element> collect(List<ParseEvent> events) {
        Map<String, ElementType> types = new LinkedHashMap<>();
        Map<String, Map<String, Object>> metadata = new LinkedHashMap<>();
        Map<String, StringBuilder> deltas = new LinkedHashMap<>();
        Map<String, List<Annotation>> annotations = new LinkedHashMap<>();
        Map<String, String> finals = new LinkedHashMap<>();

        for (ParseEvent event : events) {
            String id = event.elementId();
            if (event instanceof ParseEvent.Begin begin) {
                assertThat(types).as("begin of %s", id).doesNotContainKey(id);
                types.put(id, begin.elementType());
                metadata.put(id, begin.metadata());
                deltas.put(id, new StringBuilder());
                annotations.put(id, new ArrayList<>());
                continue;
            }
            assertThat(types).as("%s references an element that was not begun", event).containsKey(id);
            assertThat(finals).as("%s follows the end of its element", event).doesNotContainKey(id);
            if (event instanceof ParseEvent.Delta delta) {
                assertThat(delta.content()).as("delta of %s", id).isNotEmpty();
                deltas.get(id).append(delta.content());
            } else if (event instanceof ParseEvent.Annotated annotated) {
                annotations.get(id).add(annotated.annotation());
            } else if (event instanceof ParseEvent.End end) {
                assertThat(end.finalContent()).as("final content of %s", id).isEqualTo(deltas.get(id).toString());
                finals.put(id, end.finalContent());
            }
        }

        List<Element> elements = new ArrayList<>();
        for (Map.Entry<String, ElementType> e : types.entrySet()) {
            String id = e.getKey();
            boolean ended = finals.containsKey(id);
            String content = ended ? finals.get(id) : deltas.get(id).toString();
            elements.add(new Element(e.getValue(), id, metadata.get(id), content, annotations.get(id), ended));
        }
        return elements;
    }

    /**
     * Like {@link #collect(List)}, additionally asserting that every element was ended.
     */
    public static List<Element> collectCompleted(List<ParseEvent> events) {
        List<Element> elements = collect(events);
        assertThat(elements).allSatisfy(el -> assertThat(el.ended()).as("%s ended", el.id()).isTrue());
        return elements;
    }

    public static List<Element> ofType(List<Element> elements, ElementType type) {
        return elements.stream().filter(e -> e.type() == type).collect(Collectors.toList());
    }

    /**
     * {@code type:content} pairs in begin order.
     */
    public static List<String> summary(List<Element> elements) {
        return elements.stream().map(e -> e.type().wireName() + ":" + e.content()).collect(Collectors.toList());
    }

    public static List<ParseEvent> parse(MarkdownParserConfig config, String markdown) {
        return StreamingMarkdownParser.create(config).parse(markdown);
    }

    /**
     * Feeds the document in chunks of {@code size} characters, then completes it.
     */
    public static List<ParseEvent> parseInChunks(MarkdownParserConfig config, String markdown, int size) {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create(config);
        List<ParseEvent> events = new ArrayList<>();
        for (int i = 0; i < markdown.length(); i += size) {
            events.addAll(parser.processChunk(markdown.substring(i, Math.min(markdown.length(), i + size))).toList());
        }
        events.addAll(parser.complete().toList());
        return events;
    }
}

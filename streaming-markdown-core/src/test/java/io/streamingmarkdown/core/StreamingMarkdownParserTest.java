package io.streamingmarkdown.core;

import io.streamingmarkdown.core.ParsedElements.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static io.streamingmarkdown.core.ParsedElements.collectCompleted;
import static io.streamingmarkdown.core.ParsedElements.ofType;
import static io.streamingmarkdown.core.ParsedElements.parseInChunks;
import static io.streamingmarkdown.core.ParsedElements.summary;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamingMarkdownParserTest {

    private static final String LINK_SENTENCE = "Check out [OpenAI](https://openai.com) for more info.\n";

    @Test
    void linkSentenceProducesTextWithLinkChildAndCitation() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().parse(LINK_SENTENCE));

        assertThat(summary(elements)).containsExactly(
                "text:Check out OpenAI for more info.",
                "link:OpenAI");
        Element text = elements.get(0);
        Element link = elements.get(1);
        assertThat(link.metadata())
                .containsEntry("url", "https://openai.com")
                .containsEntry("title", "OpenAI")
                .containsEntry("parentId", text.id());
        assertThat(text.annotations()).singleElement().satisfies(a -> {
            assertThat(a.type()).isEqualTo(Annotation.URL_CITATION);
            assertThat(a.url()).isEqualTo("https://openai.com");
            assertThat(text.content().substring(a.startIndex(), a.endIndex())).isEqualTo("OpenAI");
        });
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 5, 10})
    void chunkedLinkSentenceMatchesSingleCall(int chunkSize) {
        List<Element> whole = collectCompleted(StreamingMarkdownParser.create().parse(LINK_SENTENCE));
        List<Element> chunked = collectCompleted(parseInChunks(MarkdownParserConfig.defaults(), LINK_SENTENCE, chunkSize));

        assertThat(summary(chunked)).isEqualTo(summary(whole));
        assertThat(chunked).isEqualTo(whole);
    }

    @Test
    void codeFenceCapturesLanguage() {
        List<Element> elements = collectCompleted(
                StreamingMarkdownParser.create().parse("```typescript\nconst x = 1;\n```"));

        assertThat(elements).hasSize(1);
        Element code = elements.get(0);
        assertThat(code.type()).isEqualTo(ElementType.CODE);
        assertThat(code.metadata()).containsEntry("language", "typescript");
        assertThat(code.content()).isEqualTo("const x = 1;");
    }

    @Test
    void codeFenceBodyIsNotInlineProcessed() {
        List<Element> elements = collectCompleted(
                StreamingMarkdownParser.create().parse("```\n**not bold** [x](y)\n```\n"));

        assertThat(summary(elements)).containsExactly("code:**not bold** [x](y)");
        assertThat(elements.get(0).metadata()).containsEntry("language", "text");
    }

    @Test
    void bulletListItemsAreUnordered() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().parse("- item 1\n- item 2"));

        assertThat(summary(elements)).containsExactly("list:item 1", "list:item 2");
        assertThat(elements).allSatisfy(e -> assertThat(e.metadata()).containsEntry("ordered", false));
    }

    @Test
    void numberedListItemIsOrdered() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().parse("1. item"));

        assertThat(summary(elements)).containsExactly("list:item");
        assertThat(elements.get(0).metadata())
                .containsEntry("ordered", true)
                .containsEntry("number", 1)
                .containsEntry("level", 1);
    }

    @Test
    void headerAndParagraphAreSeparateElements() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().parse("# Hello\n\nWorld"));

        assertThat(summary(elements)).containsExactly("header:Hello", "text:World");
        assertThat(elements.get(0).metadata()).containsEntry("level", 1);
    }

    @Test
    void unterminatedFenceIsClosedByComplete() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        List<ParseEvent> events = new ArrayList<>(parser.processChunk("```python\nprint(1)").toList());

        assertThat(events).noneMatch(e -> e instanceof ParseEvent.End);

        List<ParseEvent> completion = parser.complete().toList();
        events.addAll(completion);
        assertThat(completion).filteredOn(e -> e instanceof ParseEvent.End).singleElement()
                .isEqualTo(new ParseEvent.End("md-1", "print(1)"));
        assertThat(summary(collectCompleted(events))).containsExactly("code:print(1)");
    }

    @Test
    void emptyUnterminatedFenceEndsWithEmptyContent() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().parse("```"));

        assertThat(summary(elements)).containsExactly("code:");
    }

    @Test
    void completeIsIdempotent() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        parser.processChunk("Hello").toList();
        assertThat(parser.isStreaming()).isTrue();

        assertThat(parser.complete().toList()).isNotEmpty();
        assertThat(parser.complete().toList()).isEmpty();
        assertThat(parser.isStreaming()).isFalse();
        assertThat(parser.isCompleted()).isTrue();
    }

    @Test
    void processChunkAfterCompleteIsRejected() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        parser.parse("done");

        assertThatThrownBy(() -> parser.processChunk("more"))
                .isInstanceOf(MarkdownStreamException.StreamCompleted.class)
                .hasMessageContaining("reset()");
    }

    @Test
    void resetBehavesLikeAFreshInstance() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        parser.processChunk("```js\nunclosed").toList();
        parser.reset();

        List<ParseEvent> afterReset = parser.parse("# Title\nbody");
        List<ParseEvent> fresh = StreamingMarkdownParser.create().parse("# Title\nbody");

        assertThat(afterReset).isEqualTo(fresh);
        assertThat(afterReset.get(0)).isEqualTo(new ParseEvent.Begin(ElementType.HEADER, "md-1", java.util.Map.of("level", 1)));
    }

    @Test
    void resetAfterCompleteAllowsNewDocument() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        parser.parse("first");
        parser.reset();

        assertThat(parser.isCompleted()).isFalse();
        assertThat(summary(collectCompleted(parser.parse("second")))).containsExactly("text:second");
    }

    @Test
    void processStreamPullsChunksLazily() {
        List<String> chunks = List.of("# Ti", "tle\n", "- a", "\n- b");
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().processStream(chunks).toList());

        assertThat(summary(elements)).containsExactly("header:Title", "list:a", "list:b");
    }

    @Test
    void abandonedSequenceEventsAreDeliveredByTheNextCall() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        List<ParseEvent> events = new ArrayList<>();
        EventSequence first = parser.processChunk("# A\n# B\n");
        events.add(first.iterator().next());

        events.addAll(parser.processChunk("").toList());
        events.addAll(parser.complete().toList());

        assertThat(events).isEqualTo(StreamingMarkdownParser.create().parse("# A\n# B\n"));
    }

    @Test
    void blankLineRunsDoNotProduceElements() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create().parse("\n\n\n  \nA\n\n\n\nB\n\n"));

        assertThat(summary(elements)).containsExactly("text:A", "text:B");
    }

    @Test
    void inlineSpansBecomeChildElements() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create()
                .parse("This is **bold** and *it* and ~~gone~~ and `code`.\n"));

        assertThat(summary(elements)).containsExactly(
                "text:This is bold and it and gone and code.",
                "strong:bold",
                "emphasis:it",
                "strikethrough:gone",
                "code:code");
        String parentId = elements.get(0).id();
        assertThat(elements.subList(1, elements.size()))
                .allSatisfy(e -> assertThat(e.metadata()).containsEntry("parentId", parentId));
        assertThat(elements.get(4).metadata()).containsEntry("inline", true);
    }

    @Test
    void preserveModeKeepsMarkersInParentContent() {
        MarkdownParserConfig config = MarkdownParserConfig.builder()
                .inlineEmphasisMode(InlineEmphasisMode.PRESERVE)
                .build();
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create(config)
                .parse("See **this** and [docs](https://x.io \"The Docs\").\n"));

        assertThat(summary(elements)).containsExactly(
                "text:See **this** and [docs](https://x.io \"The Docs\").",
                "strong:this",
                "link:docs");
        Element text = elements.get(0);
        assertThat(elements.get(2).metadata()).containsEntry("title", "The Docs");
        assertThat(text.annotations()).singleElement().satisfies(a -> {
            assertThat(text.content().substring(a.startIndex(), a.endIndex())).isEqualTo("docs");
            assertThat(a.title()).isEqualTo("The Docs");
        });
    }

    @Test
    void underscoresInsideWordsAreLiteral() {
        List<Element> elements = collectCompleted(StreamingMarkdownParser.create()
                .parse("use snake_case_name and __strong__\n"));

        assertThat(summary(elements)).containsExactly("text:use snake_case_name and strong", "strong:strong");
    }

    @Test
    void partialLinkIsNotCommittedBeforeItCloses() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        List<ParseEvent> events = new ArrayList<>(parser.processChunk("Read [the docs](https://exa").toList());

        assertThat(events).noneMatch(e -> e instanceof ParseEvent.Begin b && b.elementType() == ElementType.LINK);
        assertThat(events).filteredOn(e -> e instanceof ParseEvent.Delta)
                .extracting(e -> ((ParseEvent.Delta) e).content())
                .containsExactly("Read");

        events.addAll(parser.processChunk("mple.com) now").toList());
        events.addAll(parser.complete().toList());
        List<Element> elements = collectCompleted(events);
        assertThat(summary(elements)).containsExactly("text:Read the docs now", "link:the docs");
        assertThat(ofType(elements, ElementType.LINK).get(0).metadata())
                .containsEntry("url", "https://example.com");
    }
}

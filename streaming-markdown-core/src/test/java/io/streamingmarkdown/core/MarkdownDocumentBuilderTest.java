package io.streamingmarkdown.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkdownDocumentBuilderTest {

    @Test
    void foldsEventsIntoBlocksInBeginOrder() {
        List<MarkdownBlock> blocks = MarkdownDocumentBuilder.build(StreamingMarkdownParser.create()
                .parse("# Title\n\nSee [site](https://example.com).\n\n```sh\nls\n```\n"));

        assertThat(blocks).extracting(MarkdownBlock::type).containsExactly(
                ElementType.HEADER, ElementType.TEXT, ElementType.LINK, ElementType.CODE);
        assertThat(blocks).extracting(MarkdownBlock::content).containsExactly("Title", "See site.", "site", "ls");
        assertThat(blocks).allMatch(MarkdownBlock::complete);

        MarkdownBlock text = blocks.get(1);
        assertThat(text.annotations()).singleElement()
                .satisfies(a -> assertThat(a.url()).isEqualTo("https://example.com"));
        assertThat(blocks.get(2).parentId()).isEqualTo(text.id());
        assertThat(blocks.get(3).metadata()).containsEntry("language", "sh");
    }

    @Test
    void exposesPartialContentWhileStreaming() {
        StreamingMarkdownParser parser = StreamingMarkdownParser.create();
        MarkdownDocumentBuilder builder = new MarkdownDocumentBuilder();

        parser.processChunk("Streaming par").forEach(builder);

        assertThat(builder.blocks()).singleElement().satisfies(b -> {
            assertThat(b.complete()).isFalse();
            assertThat(b.content()).isEqualTo("Streaming par");
        });

        parser.processChunk("tial text").forEach(builder);
        parser.complete().forEach(builder);

        assertThat(builder.topLevelBlocks()).singleElement().satisfies(b -> {
            assertThat(b.complete()).isTrue();
            assertThat(b.content()).isEqualTo("Streaming partial text");
        });
    }

    @Test
    void childrenAndLookupById() {
        MarkdownDocumentBuilder builder = new MarkdownDocumentBuilder();
        StreamingMarkdownParser.create().parse("a **b** `c`\n").forEach(builder);

        assertThat(builder.size()).isEqualTo(3);
        assertThat(builder.topLevelBlocks()).hasSize(1);
        assertThat(builder.children("md-1")).extracting(MarkdownBlock::content).containsExactly("b", "c");
        assertThat(builder.block("md-2")).hasValueSatisfying(b -> assertThat(b.type()).isEqualTo(ElementType.STRONG));
        assertThat(builder.block("missing")).isEmpty();

        builder.clear();
        assertThat(builder.blocks()).isEmpty();
    }

    @Test
    void rejectsEventsOutsideTheLifecycle() {
        MarkdownDocumentBuilder builder = new MarkdownDocumentBuilder();
        builder.accept(new ParseEvent.Begin(ElementType.TEXT, "t", Map.of()));
        builder.accept(new ParseEvent.End("t", ""));

        assertThatThrownBy(() -> builder.accept(new ParseEvent.Delta("t", "late")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already ended");
        assertThatThrownBy(() -> builder.accept(new ParseEvent.Delta("u", "x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not begun");
        assertThatThrownBy(() -> builder.accept(new ParseEvent.Begin(ElementType.TEXT, "t", Map.of())))
                .isInstanceOf(IllegalStateException.class);
    }
}

package io.streamingmarkdown.core.inline;

import io.streamingmarkdown.core.ElementType;
import io.streamingmarkdown.core.inline.InlineScanner.Plain;
import io.streamingmarkdown.core.inline.InlineScanner.ScanResult;
import io.streamingmarkdown.core.inline.InlineScanner.Span;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InlineScannerTest {

    private final InlineScanner scanner = new InlineScanner(EnumSet.allOf(ElementType.class));

    @Test
    void splitsClosedLineIntoPlainAndSpans() {
        ScanResult result = scanner.scan("a **b** c", 0, true);

        assertThat(result.stableEnd()).isEqualTo(9);
        assertThat(result.tokens()).containsExactly(
                new Plain("a "),
                new Span(ElementType.STRONG, "**b**", "b", 2, Map.of()),
                new Plain(" c"));
    }

    @Test
    void stopsAtMarkerThatMightStillClose() {
        ScanResult result = scanner.scan("a **bo", 0, false);

        assertThat(result.stableEnd()).isEqualTo(2);
        assertThat(result.tokens()).containsExactly(new Plain("a "));
    }

    @Test
    void unclosedMarkerIsPlainOnceLineCloses() {
        ScanResult result = scanner.scan("a **bo", 0, true);

        assertThat(result.stableEnd()).isEqualTo(6);
        assertThat(result.tokens()).containsExactly(new Plain("a **bo"));
    }

    @Test
    void scanResumesFromOffset() {
        ScanResult result = scanner.scan("done ~~gone~~", 5, false);

        assertThat(result.tokens()).singleElement()
                .isInstanceOfSatisfying(Span.class, s -> {
                    assertThat(s.type()).isEqualTo(ElementType.STRIKETHROUGH);
                    assertThat(s.inner()).isEqualTo("gone");
                });
    }

    @Test
    void underscoresInsideWordsAreText() {
        ScanResult result = scanner.scan("snake_case_name", 0, false);

        assertThat(result.stableEnd()).isEqualTo(15);
        assertThat(result.tokens()).containsExactly(new Plain("snake_case_name"));
    }

    @Test
    void linkCarriesUrlAndTitle() {
        ScanResult result = scanner.scan("[site](https://x.io \"Home\") end", 0, true);

        Span link = (Span) result.tokens().get(0);
        assertThat(link.type()).isEqualTo(ElementType.LINK);
        assertThat(link.inner()).isEqualTo("site");
        assertThat(link.innerOffset()).isEqualTo(1);
        assertThat(link.metadata())
                .containsEntry("url", "https://x.io")
                .containsEntry("title", "Home");
        assertThat(result.tokens().get(1)).isEqualTo(new Plain(" end"));
    }

    @Test
    void linkTitleDefaultsToLabel() {
        Span link = (Span) scanner.scan("[ docs ](/d)", 0, true).tokens().get(0);

        assertThat(link.metadata()).containsEntry("title", "docs").containsEntry("url", "/d");
    }

    @Test
    void incompleteLinkWaits() {
        ScanResult result = scanner.scan("see [site](https://x", 0, false);

        assertThat(result.stableEnd()).isEqualTo(4);
    }

    @Test
    void inlineCodeIsMarked() {
        Span code = (Span) scanner.scan("`x = 1`", 0, true).tokens().get(0);

        assertThat(code.type()).isEqualTo(ElementType.CODE);
        assertThat(code.inner()).isEqualTo("x = 1");
        assertThat(code.metadata()).containsEntry("inline", true);
    }

    @Test
    void disabledSpanTypesAreNotRecognized() {
        InlineScanner textOnly = new InlineScanner(EnumSet.of(ElementType.TEXT));

        assertThat(textOnly.isActive()).isFalse();
        assertThat(textOnly.scan("**b**", 0, false).tokens()).containsExactly(new Plain("**b**"));
    }
}

package io.streamingmarkdown.core.engine;

import io.streamingmarkdown.core.Annotation;
import io.streamingmarkdown.core.ElementType;
import io.streamingmarkdown.core.ParseEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementStateMachineTest {

    private final List<ParseEvent> events = new ArrayList<>();

    @Test
    void coalescesDeltasUntilAFlushPoint() {
        ElementStateMachine machine = new ElementStateMachine(0, events::add);

        machine.begin(ElementType.TEXT, "a", Map.of());
        machine.delta("a", "ab");
        machine.delta("a", "");
        machine.delta("a", "c");
        machine.end("a", "abc");

        assertThat(events).containsExactly(
                new ParseEvent.Begin(ElementType.TEXT, "a", Map.of()),
                new ParseEvent.Delta("a", "abc"),
                new ParseEvent.End("a", "abc"));
    }

    @Test
    void beginAndAnnotateFlushOpenElementsFirst() {
        ElementStateMachine machine = new ElementStateMachine(0, events::add);
        Annotation citation = Annotation.urlCitation("https://x.io", "x", 0, 1);

        machine.begin(ElementType.TEXT, "a", Map.of());
        machine.delta("a", "x");
        machine.begin(ElementType.LINK, "b", Map.of("parentId", "a"));
        machine.delta("b", "x");
        machine.annotate("a", citation);

        assertThat(events).containsExactly(
                new ParseEvent.Begin(ElementType.TEXT, "a", Map.of()),
                new ParseEvent.Delta("a", "x"),
                new ParseEvent.Begin(ElementType.LINK, "b", Map.of("parentId", "a")),
                new ParseEvent.Delta("b", "x"),
                new ParseEvent.Annotated("a", citation));
        assertThat(machine.openCount()).isEqualTo(2);
    }

    @Test
    void splitsDeltasWithoutBreakingSurrogatePairs() {
        ElementStateMachine machine = new ElementStateMachine(2, events::add);

        machine.begin(ElementType.TEXT, "a", Map.of());
        machine.delta("a", "a😀b");
        machine.flushAll();

        assertThat(events).filteredOn(ParseEvent.Delta.class::isInstance)
                .extracting(e -> ((ParseEvent.Delta) e).content())
                .containsExactly("a", "😀", "b");
    }

    @Test
    void rejectsLifecycleViolations() {
        ElementStateMachine machine = new ElementStateMachine(0, events::add);
        machine.begin(ElementType.TEXT, "a", Map.of());
        machine.end("a", "");

        assertThatThrownBy(() -> machine.begin(ElementType.TEXT, "a", Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already used");
        assertThatThrownBy(() -> machine.delta("a", "late"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("element already ended: a");
        assertThatThrownBy(() -> machine.end("z", ""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("element not begun: z");
    }

    @Test
    void resetForgetsIds() {
        ElementStateMachine machine = new ElementStateMachine(0, events::add);
        machine.begin(ElementType.TEXT, "a", Map.of());

        machine.reset();

        assertThat(machine.isOpen("a")).isFalse();
        machine.begin(ElementType.TEXT, "a", Map.of());
        assertThat(machine.isOpen("a")).isTrue();
    }
}

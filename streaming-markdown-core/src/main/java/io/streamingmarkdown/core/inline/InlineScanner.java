package io.streamingmarkdown.core.inline;

import io.streamingmarkdown.core.ElementType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one line of inline content into plain text and recognized spans.
 *
 * <p>The scanner only reports the <em>stable</em> prefix of a line that is still growing: a marker
 * whose span might still close (an unterminated {@code **bo} or a link missing its closing
 * parenthesis) stops the scan, and the caller retries once more of the line is known. A closed
 * line is scanned to the end; unmatched markers are then plain text.
 */
public final class InlineScanner {

    /**
     * A piece of scanned content.
     */
    public sealed interface Token permits Plain, Span {
    }

    /**
     * Text without recognized markup.
     *
     * @param text the text
     */
    public record Plain(String text) implements Token {
    }

    /**
     * A recognized span.
     *
     * @param type element type of the span
     * @param raw the source text including markers
     * @param inner the text between the markers (the label for links)
     * @param innerOffset offset of {@code inner} within {@code raw}
     * @param metadata metadata for the child element
     */
    public record Span(ElementType type, String raw, String inner, int innerOffset, Map<String, Object> metadata)
            implements Token {
        public Span {
            metadata = Map.copyOf(metadata);
        }
    }

    /**
     * Scan output.
     *
     * @param tokens tokens covering {@code [from, stableEnd)}
     * @param stableEnd end of the scanned region; text beyond it must be rescanned later
     */
    public record ScanResult(List<Token> tokens, int stableEnd) {
    }

    private record Rule(ElementType type, char trigger, Pattern pattern) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(ElementType.CODE, '`', Pattern.compile("``([^`\\n]+)``")),
            new Rule(ElementType.CODE, '`', Pattern.compile("`([^`\\n]+)`")),
            new Rule(ElementType.STRIKETHROUGH, '~', Pattern.compile("~~([^~\\n]+)~~")),
            new Rule(ElementType.STRONG, '*', Pattern.compile("\\*\\*([^*\\n]+)\\*\\*")),
            new Rule(ElementType.STRONG, '_', Pattern.compile("__([^_\\n]+)__")),
            new Rule(ElementType.EMPHASIS, '*', Pattern.compile("\\*(?!\\*)([^*\\n]+)\\*")),
            new Rule(ElementType.EMPHASIS, '_', Pattern.compile("_(?!_)([^_\\n]+)_")),
            new Rule(ElementType.LINK, '[',
                    Pattern.compile("\\[([^\\]\\n]+)\\]\\(([^)\\s]+)(?:[ \\t]+\"([^\"\\n]*)\")?\\)")));

    private final List<Rule> rules;

    /**
     * Creates a scanner recognizing the span types contained in {@code enabled}.
     * Inline code is governed by {@link ElementType#CODE}.
     *
     * @param enabled enabled element types
     */
    public InlineScanner(Set<ElementType> enabled) {
        Objects.requireNonNull(enabled, "enabled");
        List<Rule> active = new ArrayList<>();
        for (Rule rule : RULES) {
            if (enabled.contains(rule.type())) active.add(rule);
        }
        this.rules = List.copyOf(active);
    }

    /**
     * Whether at least one span type is enabled.
     */
    public boolean isActive() {
        return !rules.isEmpty();
    }

    /**
     * Scans {@code line} from {@code from}.
     *
     * @param line the line so far (no line feed)
     * @param from first unscanned offset
     * @param closed whether the line is complete
     * @return the tokens of the stable region
     */
    public ScanResult scan(CharSequence line, int from, boolean closed) {
        List<Token> tokens = new ArrayList<>();
        int plainStart = from;
        int i = from;
        int n = line.length();
        while (i < n) {
            char c = line.charAt(i);
            if (!isTrigger(c) || (c == '_' && i > 0 && Character.isLetterOrDigit(line.charAt(i - 1)))) {
                i++;
                continue;
            }
            Span span = null;
            boolean pending = false;
            for (Rule rule : rules) {
                if (rule.trigger() != c) continue;
                Matcher m = rule.pattern().matcher(line);
                m.region(i, n);
                boolean found = m.lookingAt();
                if (!closed && m.hitEnd()) {
                    pending = true;
                    break;
                }
                if (found) {
                    span = toSpan(rule.type(), m);
                    break;
                }
            }
            if (pending) {
                addPlain(tokens, line, plainStart, i);
                return new ScanResult(tokens, i);
            }
            if (span == null) {
                i++;
                continue;
            }
            addPlain(tokens, line, plainStart, i);
            tokens.add(span);
            i += span.raw().length();
            plainStart = i;
        }
        addPlain(tokens, line, plainStart, n);
        return new ScanResult(tokens, n);
    }

    private boolean isTrigger(char c) {
        for (Rule rule : rules) {
            if (rule.trigger() == c) return true;
        }
        return false;
    }

    private static Span toSpan(ElementType type, Matcher m) {
        String raw = m.group();
        String inner = m.group(1);
        int innerOffset = m.start(1) - m.start();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (type == ElementType.LINK) {
            metadata.put("url", m.group(2));
            metadata.put("title", m.group(3) != null ? m.group(3) : inner.trim());
        } else if (type == ElementType.CODE) {
            metadata.put("inline", true);
        }
        return new Span(type, raw, inner, innerOffset, metadata);
    }

    private static void addPlain(List<Token> tokens, CharSequence line, int start, int end) {
        if (end > start) tokens.add(new Plain(line.subSequence(start, end).toString()));
    }
}

package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based matcher registered through configuration.
 *
 * <p>The pattern must match a whole line. The matched line becomes a single-line element whose
 * content is group 1 when the pattern has groups, and the trimmed line otherwise.
 * While the line is incomplete the matcher asks for more input unless the pattern already failed
 * on the characters seen so far.
 *
 * <pre>{@code
 * CustomMatcher callout = CustomMatcher.builder("callout", "!!!\\s*(.+)")
 *     .priority(550)
 *     .metadata(m -> Map.of("kind", "note"))
 *     .build();
 * }</pre>
 */
public final class CustomMatcher implements BlockMatcher {

    private final String name;
    private final int priority;
    private final Pattern pattern;
    private final ElementType elementType;
    private final Function<MatchResult, Map<String, Object>> metadata;

    private CustomMatcher(Builder builder) {
        this.name = builder.name;
        this.priority = builder.priority;
        this.pattern = builder.pattern;
        this.elementType = builder.elementType;
        this.metadata = builder.metadata;
    }

    /**
     * Creates a matcher with default priority and element type.
     *
     * @param name unique matcher name
     * @param regex pattern matching a whole line
     * @return the matcher
     */
    public static CustomMatcher of(String name, String regex) {
        return builder(name, regex).build();
    }

    public static Builder builder(String name, String regex) {
        return new Builder(name, Pattern.compile(Objects.requireNonNull(regex, "regex")));
    }

    public static Builder builder(String name, Pattern pattern) {
        return new Builder(name, pattern);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public ElementType elementType() {
        return elementType;
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    public Detection detect(CharSequence text, boolean endOfInput) {
        String line = Lines.firstLine(text);
        Matcher m = pattern.matcher(line);
        boolean matches = m.matches();
        if (Lines.lineEnd(text) < 0 && !endOfInput) {
            return (matches || m.hitEnd()) ? Detection.NEED_MORE_INPUT : Detection.NO_MATCH;
        }
        if (!matches) return Detection.NO_MATCH;

        String content = m.groupCount() >= 1 && m.group(1) != null ? m.group(1).trim() : line.trim();
        Map<String, Object> meta = new LinkedHashMap<>();
        Map<String, Object> extra = metadata.apply(m.toMatchResult());
        if (extra != null) {
            extra.forEach((key, value) -> {
                if (key != null && value != null) meta.put(key, value);
            });
        }
        meta.put("matcher", name);
        return new Detection.Matched(elementType, line, null, meta, Lines.firstLineLength(text), content, name);
    }

    @Override
    public String toString() {
        return name + "(" + priority + ", /" + pattern.pattern() + "/)";
    }

    /**
     * Builder for {@link CustomMatcher}.
     */
    public static final class Builder {
        private final String name;
        private final Pattern pattern;
        private int priority = 0;
        private ElementType elementType = ElementType.CUSTOM;
        private Function<MatchResult, Map<String, Object>> metadata = m -> Map.of();

        private Builder(String name, Pattern pattern) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("matcher name must not be null or blank");
            }
            this.name = name;
            this.pattern = Objects.requireNonNull(pattern, "pattern");
        }

        /**
         * Priority relative to the built-in matchers (code fence 700 ... horizontal rule 200).
         * A custom matcher wins ties with a built-in.
         */
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder elementType(ElementType elementType) {
            this.elementType = Objects.requireNonNull(elementType, "elementType");
            return this;
        }

        /**
         * Derives extra {@code Begin} metadata from the match. Entries with a null key or value are dropped.
         */
        public Builder metadata(Function<MatchResult, Map<String, Object>> metadata) {
            this.metadata = Objects.requireNonNull(metadata, "metadata");
            return this;
        }

        public CustomMatcher build() {
            return new CustomMatcher(this);
        }
    }
}

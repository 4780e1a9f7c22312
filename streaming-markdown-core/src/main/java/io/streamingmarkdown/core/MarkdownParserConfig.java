package io.streamingmarkdown.core;

import io.streamingmarkdown.core.detect.BlockMatcher;
import io.streamingmarkdown.core.detect.BlockTypeDetector;
import io.streamingmarkdown.core.inline.AnnotationDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable parser configuration.
 *
 * <p>Out-of-range scalar values fall back to their defaults with a warning. Options that contradict
 * each other are rejected by {@link Builder#build()} with
 * {@link MarkdownStreamException.InvalidConfiguration}.
 */
public final class MarkdownParserConfig {

    private static final Logger log = LoggerFactory.getLogger(MarkdownParserConfig.class);

    public static final int DEFAULT_MAX_BUFFER_SIZE = 10_000;
    public static final String DEFAULT_ID_PREFIX = "md";

    private static final MarkdownParserConfig DEFAULTS = builder().build();

    private final Set<ElementType> enabledElements;
    private final List<BlockMatcher> customMatchers;
    private final List<AnnotationDetector> annotationDetectors;
    private final boolean preserveWhitespace;
    private final boolean splitParagraphs;
    private final int maxBufferSize;
    private final int maxDeltaChunkSize;
    private final InlineEmphasisMode inlineEmphasisMode;
    private final TableOutputMode tableOutputMode;
    private final String idPrefix;
    private final Supplier<ElementIdGenerator> idGenerators;
    private final boolean sharedIdGenerator;

    private MarkdownParserConfig(Builder b) {
        this.enabledElements = Collections.unmodifiableSet(EnumSet.copyOf(b.enabledElements));
        this.customMatchers = List.copyOf(b.customMatchers);
        this.annotationDetectors = List.copyOf(b.annotationDetectors);
        this.preserveWhitespace = b.preserveWhitespace;
        this.splitParagraphs = b.splitParagraphs;
        this.maxBufferSize = b.maxBufferSize;
        this.maxDeltaChunkSize = b.maxDeltaChunkSize;
        this.inlineEmphasisMode = b.inlineEmphasisMode;
        this.tableOutputMode = b.tableOutputMode;
        this.idPrefix = b.idPrefix;
        this.idGenerators = b.idGenerators;
        this.sharedIdGenerator = b.sharedIdGenerator;
    }

    public static MarkdownParserConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Element types the parser may open; disabled block types fall back to text.
     * Always contains {@link ElementType#TEXT}.
     */
    public Set<ElementType> enabledElements() {
        return enabledElements;
    }

    public boolean isEnabled(ElementType type) {
        return enabledElements.contains(type);
    }

    /**
     * Custom block matchers, in registration order.
     */
    public List<BlockMatcher> customMatchers() {
        return customMatchers;
    }

    public List<AnnotationDetector> annotationDetectors() {
        return annotationDetectors;
    }

    /**
     * Keep leading and trailing whitespace of element content.
     */
    public boolean preserveWhitespace() {
        return preserveWhitespace;
    }

    /**
     * Close text elements at blank lines. When false, blank lines are kept inside the open text element.
     */
    public boolean splitParagraphs() {
        return splitParagraphs;
    }

    /**
     * Largest ambiguous tail kept waiting for more input before it is resolved as plain content.
     */
    public int maxBufferSize() {
        return maxBufferSize;
    }

    /**
     * Characters per {@code Delta}; {@code 0} emits one delta per element per flush point.
     */
    public int maxDeltaChunkSize() {
        return maxDeltaChunkSize;
    }

    public InlineEmphasisMode inlineEmphasisMode() {
        return inlineEmphasisMode;
    }

    public TableOutputMode tableOutputMode() {
        return tableOutputMode;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * Returns the generator for a new parser: the shared generator, one from the configured factory,
     * or a new counter over {@link #idPrefix()}.
     */
    public ElementIdGenerator newIdGenerator() {
        if (idGenerators == null) return ElementIdGenerator.counter(idPrefix);
        return Objects.requireNonNull(idGenerators.get(), "idGenerators returned null");
    }

    /**
     * Whether every parser uses the same caller-owned generator. A shared generator is never reset by a parser.
     */
    public boolean sharesIdGenerator() {
        return sharedIdGenerator;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.enabledElements = EnumSet.copyOf(enabledElements);
        b.customMatchers.addAll(customMatchers);
        b.annotationDetectors.addAll(annotationDetectors);
        b.preserveWhitespace = preserveWhitespace;
        b.splitParagraphs = splitParagraphs;
        b.maxBufferSize = maxBufferSize;
        b.maxDeltaChunkSize = maxDeltaChunkSize;
        b.inlineEmphasisMode = inlineEmphasisMode;
        b.tableOutputMode = tableOutputMode;
        b.idPrefix = idPrefix;
        b.idPrefixSet = idGenerators == null && !DEFAULT_ID_PREFIX.equals(idPrefix);
        b.idGenerators = idGenerators;
        b.sharedIdGenerator = sharedIdGenerator;
        return b;
    }

    @Override
    public String toString() {
        return "MarkdownParserConfig{"
                + "enabledElements=" + enabledElements
                + ", customMatchers=" + customMatchers
                + ", preserveWhitespace=" + preserveWhitespace
                + ", splitParagraphs=" + splitParagraphs
                + ", maxBufferSize=" + maxBufferSize
                + ", maxDeltaChunkSize=" + maxDeltaChunkSize
                + ", inlineEmphasisMode=" + inlineEmphasisMode
                + ", tableOutputMode=" + tableOutputMode
                + ", idPrefix='" + idPrefix + '\''
                + '}';
    }

    /**
     * Builder for {@link MarkdownParserConfig}.
     */
    public static final class Builder {
        private Set<ElementType> enabledElements = EnumSet.allOf(ElementType.class);
        private final List<BlockMatcher> customMatchers = new ArrayList<>();
        private final List<AnnotationDetector> annotationDetectors = new ArrayList<>();
        private boolean preserveWhitespace = false;
        private boolean splitParagraphs = true;
        private int maxBufferSize = DEFAULT_MAX_BUFFER_SIZE;
        private int maxDeltaChunkSize = 0;
        private InlineEmphasisMode inlineEmphasisMode = InlineEmphasisMode.STRIP;
        private TableOutputMode tableOutputMode = TableOutputMode.TEXT;
        private String idPrefix = DEFAULT_ID_PREFIX;
        private boolean idPrefixSet;
        private Supplier<ElementIdGenerator> idGenerators;
        private boolean sharedIdGenerator;

        private Builder() {}

        /**
         * Restricts the element types the parser opens. Text is always enabled.
         */
        public Builder enabledElements(Collection<ElementType> types) {
            if (types == null || types.isEmpty()) {
                log.warn("Empty enabledElements; only text will be produced");
                this.enabledElements = EnumSet.of(ElementType.TEXT);
                return this;
            }
            EnumSet<ElementType> set = EnumSet.copyOf(types);
            set.add(ElementType.TEXT);
            this.enabledElements = set;
            return this;
        }

        public Builder enabledElements(ElementType first, ElementType... rest) {
            return enabledElements(EnumSet.of(first, rest));
        }

        public Builder customMatcher(BlockMatcher matcher) {
            this.customMatchers.add(Objects.requireNonNull(matcher, "matcher"));
            return this;
        }

        public Builder customMatchers(Collection<? extends BlockMatcher> matchers) {
            matchers.forEach(this::customMatcher);
            return this;
        }

        public Builder annotationDetector(AnnotationDetector detector) {
            this.annotationDetectors.add(Objects.requireNonNull(detector, "detector"));
            return this;
        }

        public Builder preserveWhitespace(boolean preserveWhitespace) {
            this.preserveWhitespace = preserveWhitespace;
            return this;
        }

        public Builder splitParagraphs(boolean splitParagraphs) {
            this.splitParagraphs = splitParagraphs;
            return this;
        }

        public Builder maxBufferSize(int maxBufferSize) {
            if (maxBufferSize <= 0) {
                log.warn("Ignoring maxBufferSize {}; using {}", maxBufferSize, DEFAULT_MAX_BUFFER_SIZE);
                this.maxBufferSize = DEFAULT_MAX_BUFFER_SIZE;
            } else {
                this.maxBufferSize = maxBufferSize;
            }
            return this;
        }

        public Builder maxDeltaChunkSize(int maxDeltaChunkSize) {
            if (maxDeltaChunkSize < 0) {
                log.warn("Ignoring maxDeltaChunkSize {}; using 0", maxDeltaChunkSize);
                this.maxDeltaChunkSize = 0;
            } else {
                this.maxDeltaChunkSize = maxDeltaChunkSize;
            }
            return this;
        }

        public Builder inlineEmphasisMode(InlineEmphasisMode mode) {
            if (mode == null) {
                log.warn("Ignoring null inlineEmphasisMode; using {}", InlineEmphasisMode.STRIP);
                this.inlineEmphasisMode = InlineEmphasisMode.STRIP;
            } else {
                this.inlineEmphasisMode = mode;
            }
            return this;
        }

        public Builder tableOutputMode(TableOutputMode mode) {
            if (mode == null) {
                log.warn("Ignoring null tableOutputMode; using {}", TableOutputMode.TEXT);
                this.tableOutputMode = TableOutputMode.TEXT;
            } else {
                this.tableOutputMode = mode;
            }
            return this;
        }

        public Builder idPrefix(String idPrefix) {
            if (idPrefix == null || idPrefix.isBlank()) {
                log.warn("Ignoring blank idPrefix; using '{}'", DEFAULT_ID_PREFIX);
                this.idPrefix = DEFAULT_ID_PREFIX;
                return this;
            }
            this.idPrefix = idPrefix;
            this.idPrefixSet = true;
            return this;
        }

        /**
         * Replaces the default counter with a generator shared by every parser created from the config.
         * The caller owns it: {@link StreamingMarkdownParser#reset()} does not restart it.
         */
        public Builder idGenerator(ElementIdGenerator idGenerator) {
            Objects.requireNonNull(idGenerator, "idGenerator");
            this.idGenerators = () -> idGenerator;
            this.sharedIdGenerator = true;
            return this;
        }

        /**
         * Replaces the default counter with a factory called once per parser. Each parser owns the
         * generator it gets and restarts it on reset.
         */
        public Builder idGenerators(Supplier<ElementIdGenerator> factory) {
            this.idGenerators = Objects.requireNonNull(factory, "factory");
            this.sharedIdGenerator = false;
            return this;
        }

        public MarkdownParserConfig build() {
            if (idPrefixSet && idGenerators != null) {
                throw new MarkdownStreamException.InvalidConfiguration(
                        "idPrefix and idGenerator are mutually exclusive");
            }
            Set<String> names = new HashSet<>();
            for (BlockMatcher m : BlockTypeDetector.builtInMatchers()) {
                names.add(m.name());
            }
            for (BlockMatcher m : customMatchers) {
                if (!names.add(m.name())) {
                    throw new MarkdownStreamException.InvalidConfiguration(
                            "duplicate matcher name: " + m.name());
                }
            }
            return new MarkdownParserConfig(this);
        }
    }
}

package io.streamingmarkdown.core.detect;

import io.streamingmarkdown.core.ElementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Classifies the text at a line start by evaluating matchers in descending priority.
 *
 * <p>The first matcher that does not answer {@link Detection.NoMatch} decides: a lower-priority
 * match is only reported once every higher-priority matcher has ruled itself out. On equal
 * priority custom matchers are evaluated before built-ins. The order is fixed at construction.
 */
public final class BlockTypeDetector {

    private static final Logger log = LoggerFactory.getLogger(BlockTypeDetector.class);

    private static final Comparator<BlockMatcher> ORDER = Comparator
            .comparingInt(BlockMatcher::priority).reversed()
            .thenComparing(BlockMatcher::builtIn);

    private final List<BlockMatcher> matchers;

    /**
     * Creates a detector over the given matchers; the list is sorted (stably) by priority.
     *
     * @param matchers built-in and custom matchers
     */
    public BlockTypeDetector(List<? extends BlockMatcher> matchers) {
        List<BlockMatcher> sorted = new ArrayList<>(matchers);
        sorted.sort(ORDER);
        this.matchers = List.copyOf(sorted);
    }

    /**
     * Creates a detector from the built-ins plus custom matchers, keeping only enabled element types.
     *
     * @param enabled enabled element types
     * @param custom custom matchers, in registration order
     * @return the detector
     */
    public static BlockTypeDetector create(Set<ElementType> enabled, List<? extends BlockMatcher> custom) {
        List<BlockMatcher> all = new ArrayList<>();
        for (BlockMatcher m : builtInMatchers()) {
            if (enabled.contains(m.elementType())) all.add(m);
        }
        for (BlockMatcher m : custom) {
            if (enabled.contains(m.elementType())) {
                all.add(m);
            } else {
                log.debug("Skipping custom matcher {}: element type {} is not enabled", m.name(), m.elementType());
            }
        }
        return new BlockTypeDetector(all);
    }

    /**
     * The built-in matchers, highest priority first.
     */
    public static List<BlockMatcher> builtInMatchers() {
        return List.of(
                new CodeFenceMatcher(),
                new MathBlockMatcher(),
                new HeadingMatcher(),
                new ListItemMatcher(),
                new BlockquoteMatcher(),
                new TableMatcher(),
                new HorizontalRuleMatcher());
    }

    /**
     * Evaluation order of the matchers.
     */
    public List<BlockMatcher> matchers() {
        return matchers;
    }

    /**
     * Classifies text beginning at a line start.
     *
     * @param prefix unconsumed text at a line start
     * @param endOfInput whether the text is final
     * @return the detection; never {@link Detection.NeedMoreInput} when {@code endOfInput} is true
     */
    public Detection detect(CharSequence prefix, boolean endOfInput) {
        if (prefix.length() == 0) {
            return endOfInput ? Detection.NO_MATCH : Detection.NEED_MORE_INPUT;
        }
        for (BlockMatcher matcher : matchers) {
            Detection d = matcher.detect(prefix, endOfInput);
            if (d instanceof Detection.NoMatch) continue;
            if (d instanceof Detection.NeedMoreInput && endOfInput) {
                log.warn("Matcher {} asked for more input at end of input; treating as no match", matcher.name());
                continue;
            }
            return d;
        }
        return Detection.NO_MATCH;
    }
}

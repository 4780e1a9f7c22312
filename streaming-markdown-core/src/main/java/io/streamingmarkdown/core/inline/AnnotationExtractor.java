package io.streamingmarkdown.core.inline;

import io.streamingmarkdown.core.Annotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects annotations for open elements and reports each one once.
 *
 * <p>Content is rescanned as it grows; annotations already reported for an earlier, shorter view of
 * the same element are filtered out by {@code (type, startIndex, endIndex)}.
 */
public final class AnnotationExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnnotationExtractor.class);

    private record Key(String type, int start, int end) {
    }

    private final List<AnnotationDetector> detectors;
    private final Map<String, Set<Key>> reported = new HashMap<>();

    public AnnotationExtractor(List<AnnotationDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Returns the annotations of an element that have not been reported yet.
     *
     * @param elementId the owning element
     * @param content the element content so far
     * @param citations link citations already located by the inline scanner
     * @param finalView whether {@code content} is the element's final content
     * @return the new annotations, citations first
     */
    public List<Annotation> extract(String elementId, CharSequence content, List<Annotation> citations,
                                    boolean finalView) {
        Set<Key> seen = reported.computeIfAbsent(elementId, k -> new HashSet<>());
        List<Annotation> fresh = new ArrayList<>();
        for (Annotation a : citations) {
            accept(a, content, seen, fresh);
        }
        for (AnnotationDetector detector : detectors) {
            for (Annotation a : detector.detect(content, finalView)) {
                accept(a, content, seen, fresh);
            }
        }
        return fresh;
    }

    /**
     * Forgets an element once it has ended.
     */
    public void release(String elementId) {
        reported.remove(elementId);
    }

    public void clear() {
        reported.clear();
    }

    public boolean hasDetectors() {
        return !detectors.isEmpty();
    }

    private static void accept(Annotation a, CharSequence content, Set<Key> seen, List<Annotation> out) {
        if (a.endIndex() > content.length()) {
            log.debug("Dropping annotation {} [{}, {}) outside of content length {}",
                    a.type(), a.startIndex(), a.endIndex(), content.length());
            return;
        }
        if (seen.add(new Key(a.type(), a.startIndex(), a.endIndex()))) {
            out.add(a);
        }
    }
}

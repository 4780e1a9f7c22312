package io.streamingmarkdown.core.inline;

import io.streamingmarkdown.core.Annotation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Custom annotation source run over element content.
 *
 * <p>Detectors see the content emitted so far. When {@code finalView} is false the content may
 * still grow, and a detector must not report a match whose extent could change with more input.
 * Reporting the same annotation again on a later view is harmless; duplicates are dropped.
 */
public interface AnnotationDetector {

    /**
     * Detector name, used in log messages.
     *
     * @return the name
     */
    String name();

    /**
     * Finds annotations in {@code content}.
     *
     * @param content element content so far
     * @param finalView whether the content is complete
     * @return the annotations found; offsets are within {@code content}
     */
    List<Annotation> detect(CharSequence content, boolean finalView);

    /**
     * Regex detector producing one annotation of {@code type} per match, with the matched text under
     * the {@code text} attribute and every named group listed in {@code groupNames} as an attribute.
     *
     * @param type annotation type
     * @param pattern pattern searched with {@link Matcher#find()}
     * @param groupNames named groups copied into the attributes
     * @return the detector
     */
    static AnnotationDetector pattern(String type, Pattern pattern, String... groupNames) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(pattern, "pattern");
        List<String> groups = List.of(groupNames);
        return new AnnotationDetector() {
            @Override
            public String name() {
                return type;
            }

            @Override
            public List<Annotation> detect(CharSequence content, boolean finalView) {
                List<Annotation> found = new ArrayList<>();
                Matcher m = pattern.matcher(content);
                while (m.find()) {
                    // The match could still extend or move once more text arrives.
                    if (!finalView && m.hitEnd()) break;
                    if (m.end() == m.start()) continue;
                    Map<String, Object> attributes = new LinkedHashMap<>();
                    attributes.put("text", m.group());
                    for (String g : groups) {
                        String value = m.group(g);
                        if (value != null) attributes.put(g, value);
                    }
                    found.add(new Annotation(type, m.start(), m.end(), attributes));
                }
                return found;
            }

            @Override
            public String toString() {
                return "AnnotationDetector(" + type + ", /" + pattern.pattern() + "/)";
            }
        };
    }
}

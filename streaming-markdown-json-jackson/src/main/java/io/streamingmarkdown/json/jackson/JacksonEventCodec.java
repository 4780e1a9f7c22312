package io.streamingmarkdown.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.streamingmarkdown.core.Annotation;
import io.streamingmarkdown.core.ElementType;
import io.streamingmarkdown.core.EventCodec;
import io.streamingmarkdown.core.MarkdownStreamException.EventCodecException;
import io.streamingmarkdown.core.ParseEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of {@link EventCodec}.
 *
 * <pre>{@code
 * {"type":"begin","elementType":"code","elementId":"md-1","metadata":{"language":"java"}}
 * {"type":"delta","elementId":"md-1","content":"int x;"}
 * {"type":"annotation","elementId":"md-2","annotation":{"type":"url_citation","startIndex":0,"endIndex":6,"attributes":{...}}}
 * {"type":"end","elementId":"md-1","finalContent":"int x;"}
 * }</pre>
 */
public final class JacksonEventCodec implements EventCodec {

    static final String TYPE_BEGIN = "begin";
    static final String TYPE_DELTA = "delta";
    static final String TYPE_END = "end";
    static final String TYPE_ANNOTATION = "annotation";

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    /**
     * Creates a codec with a default ObjectMapper.
     */
    public JacksonEventCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonEventCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String encode(ParseEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            return mapper.writeValueAsString(toTree(event));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventCodecException("Failed to encode " + event.getClass().getSimpleName()
                    + " event for element " + event.elementId(), e);
        }
    }

    @Override
    public ParseEvent decode(String json) {
        Objects.requireNonNull(json, "json");
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Failed to parse event JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new EventCodecException("Event JSON must be an object");
        }
        try {
            return fromTree(node);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new EventCodecException("Invalid event: " + e.getMessage(), e);
        }
    }

    ObjectNode toTree(ParseEvent event) {
        ObjectNode node = mapper.createObjectNode();
        if (event instanceof ParseEvent.Begin begin) {
            node.put("type", TYPE_BEGIN);
            node.put("elementType", begin.elementType().wireName());
            node.put("elementId", begin.elementId());
            node.set("metadata", mapper.valueToTree(begin.metadata()));
        } else if (event instanceof ParseEvent.Delta delta) {
            node.put("type", TYPE_DELTA);
            node.put("elementId", delta.elementId());
            node.put("content", delta.content());
        } else if (event instanceof ParseEvent.End end) {
            node.put("type", TYPE_END);
            node.put("elementId", end.elementId());
            node.put("finalContent", end.finalContent());
        } else if (event instanceof ParseEvent.Annotated annotated) {
            Annotation a = annotated.annotation();
            node.put("type", TYPE_ANNOTATION);
            node.put("elementId", annotated.elementId());
            ObjectNode annotation = node.putObject("annotation");
            annotation.put("type", a.type());
            annotation.put("startIndex", a.startIndex());
            annotation.put("endIndex", a.endIndex());
            annotation.set("attributes", mapper.valueToTree(a.attributes()));
        }
        return node;
    }

    private ParseEvent fromTree(JsonNode node) {
        String type = requiredText(node, "type");
        String elementId = requiredText(node, "elementId");
        switch (type) {
            case TYPE_BEGIN:
                return new ParseEvent.Begin(ElementType.fromWireName(requiredText(node, "elementType")),
                        elementId, toMap(node.get("metadata")));
            case TYPE_DELTA:
                return new ParseEvent.Delta(elementId, requiredText(node, "content"));
            case TYPE_END:
                return new ParseEvent.End(elementId, requiredText(node, "finalContent"));
            case TYPE_ANNOTATION:
                JsonNode a = node.get("annotation");
                if (a == null || !a.isObject()) {
                    throw new EventCodecException("Missing annotation object");
                }
                return new ParseEvent.Annotated(elementId, new Annotation(requiredText(a, "type"),
                        requiredInt(a, "startIndex"), requiredInt(a, "endIndex"), toMap(a.get("attributes"))));
            default:
                throw new EventCodecException("Unknown event type: " + type);
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull()) return Map.of();
        if (!node.isObject()) {
            throw new EventCodecException("Expected a JSON object but got " + node.getNodeType());
        }
        Map<String, Object> map = new LinkedHashMap<>(mapper.convertValue(node, MAP));
        map.values().removeIf(Objects::isNull);
        return map;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new EventCodecException("Missing or non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new EventCodecException("Missing or non-integer field '" + field + "'");
        }
        return value.intValue();
    }
}

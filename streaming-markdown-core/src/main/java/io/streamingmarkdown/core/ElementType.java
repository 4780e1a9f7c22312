package io.streamingmarkdown.core;

import java.util.Locale;

/**
 * Kinds of Markdown elements reported by the parser.
 *
 * <p>Each constant has a lower-case wire name (e.g. {@code horizontal_rule}) used when events are
 * serialized.
 */
public enum ElementType {
    TEXT,
    CODE,
    HEADER,
    LIST,
    QUOTE,
    TABLE,
    THEAD,
    TBODY,
    ROW,
    COL,
    TFOOT,
    MATH,
    LINK,
    EMPHASIS,
    STRONG,
    STRIKETHROUGH,
    HORIZONTAL_RULE,
    CUSTOM;

    /**
     * Wire name of this type.
     *
     * @return the lower-case name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire name back to its type.
     *
     * @param wireName the lower-case name, case-insensitive
     * @return the element type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ElementType fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            throw new IllegalArgumentException("element type must not be blank");
        }
        return valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Whether elements of this type only ever appear nested inside a block element.
     *
     * @return true for inline and table-structure types
     */
    public boolean isNested() {
        switch (this) {
            case THEAD:
            case TBODY:
            case ROW:
            case COL:
            case TFOOT:
            case LINK:
            case EMPHASIS:
            case STRONG:
            case STRIKETHROUGH:
                return true;
            default:
                return false;
        }
    }
}

package org.dxworks.cobolscope.ast;

import java.util.Locale;

public enum NodeType {
    PROGRAM("program"),
    DIVISION("division"),
    SECTION("section"),
    PARAGRAPH("paragraph"),
    STATEMENT("statement"),
    DATA_ITEM("data_item"),
    CONDITION("condition"),
    EXPRESSION("expression");

    private final String name;

    NodeType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Decodes the parser's type tag. Accepts {@code data_item}, {@code data-item} and {@code dataitem}.
     *
     * @throws IllegalArgumentException for a tag outside the closed set
     */
    public static NodeType fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Missing node type");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("dataitem")) {
            return DATA_ITEM;
        }
        for (NodeType type : values()) {
            if (type.name.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + tag);
    }
}

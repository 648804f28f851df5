package org.dxworks.cobolscope.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable COBOL AST node as delivered by the external parser.
 * <p>
 * Children are owned exclusively by their node; no parent pointers are stored (see {@link AstAccessor#parent}).
 * Attribute reads are tolerant: a missing or malformed optional attribute resolves to 0, "" or an empty list
 * instead of failing, so a single odd node never aborts a traversal.
 */
public final class AstNode {

    public static final String STATEMENT_TYPE = "statement_type";
    public static final String END_LINE = "end_line";
    public static final String PERFORM_TYPE = "perform_type";

    private final NodeType type;
    private final String value;
    private final List<AstNode> children;
    private final Map<String, Object> attributes;
    private final int line;
    private final int column;
    private final StatementKind statementKind;

    private AstNode(Builder builder) {
        this.type = builder.type;
        this.value = builder.value == null ? "" : builder.value;
        this.children = Collections.unmodifiableList(new ArrayList<>(builder.children));
        this.attributes = Collections.unmodifiableMap(attributesOf(builder));
        this.line = builder.line;
        this.column = builder.column;
        this.statementKind = type == NodeType.STATEMENT
                ? StatementKind.fromTag(text(STATEMENT_TYPE))
                : null;
    }

    // a combined tag such as "PERFORM UNTIL" stands in for a missing perform_type
    private static Map<String, Object> attributesOf(Builder builder) {
        Map<String, Object> out = new LinkedHashMap<>(builder.attributes);
        if (builder.type == NodeType.STATEMENT && !out.containsKey(PERFORM_TYPE)) {
            Object tag = out.get(STATEMENT_TYPE);
            String variant = tag == null ? null : StatementKind.performVariant(tag.toString());
            if (variant != null) {
                out.put(PERFORM_TYPE, variant);
            }
        }
        return out;
    }

    public static Builder builder(NodeType type) {
        return new Builder(type);
    }

    public NodeType getType() {
        return type;
    }

    public boolean is(NodeType other) {
        return type == other;
    }

    /** Decoded verb of a statement node; {@code null} for every other node type. */
    public StatementKind getStatementKind() {
        return statementKind;
    }

    public boolean isStatement(StatementKind kind) {
        return statementKind == kind;
    }

    public String getValue() {
        return value;
    }

    /** Trimmed value, the name of divisions, sections, paragraphs and data items. */
    public String name() {
        return value.trim();
    }

    public List<AstNode> getChildren() {
        return children;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return intAttribute(END_LINE);
    }

    public boolean hasAttribute(String key) {
        Object raw = attributes.get(key);
        if (raw == null) {
            return false;
        }
        if (raw instanceof String s) {
            return !s.isBlank();
        }
        if (raw instanceof List<?> list) {
            return !list.isEmpty();
        }
        return true;
    }

    /** Raw attribute value, {@code null} when absent. */
    public Object rawAttribute(String key) {
        return attributes.get(key);
    }

    /** String form of a scalar attribute, "" when absent. */
    public String text(String key) {
        Object raw = attributes.get(key);
        if (raw == null || raw instanceof List<?> || raw instanceof Map<?, ?>) {
            return "";
        }
        return raw.toString().trim();
    }

    /** Integer attribute, 0 when absent or not numeric. */
    public int intAttribute(String key) {
        Object raw = attributes.get(key);
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    public boolean boolAttribute(String key) {
        Object raw = attributes.get(key);
        if (raw instanceof Boolean b) {
            return b;
        }
        return raw instanceof String s && Boolean.parseBoolean(s.trim());
    }

    /**
     * List attribute as strings. A scalar becomes a one-element list; blank and nested
     * structured entries are skipped.
     */
    public List<String> listAttribute(String key) {
        Object raw = attributes.get(key);
        if (raw == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !(item instanceof List<?>) && !(item instanceof Map<?, ?>)) {
                    String text = item.toString().trim();
                    if (!text.isEmpty()) {
                        out.add(text);
                    }
                }
            }
        } else if (!(raw instanceof Map<?, ?>)) {
            String text = raw.toString().trim();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return out;
    }

    public AstNode firstChild(NodeType childType) {
        for (AstNode child : children) {
            if (child.type == childType) {
                return child;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        String label = statementKind != null ? statementKind.name() : value;
        return type.getName() + "(" + label + ")@" + line;
    }

    public static final class Builder {
        private final NodeType type;
        private String value;
        private final List<AstNode> children = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private int line;
        private int column;

        private Builder(NodeType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder attribute(String key, Object attributeValue) {
            if (key != null && attributeValue != null) {
                attributes.put(key, attributeValue);
            }
            return this;
        }

        public Builder attributes(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::attribute);
            }
            return this;
        }

        public Builder statementType(String verb) {
            return attribute(STATEMENT_TYPE, verb);
        }

        public Builder endLine(int endLine) {
            return attribute(END_LINE, endLine);
        }

        public Builder child(AstNode child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        public Builder children(List<AstNode> nodes) {
            if (nodes != null) {
                nodes.forEach(this::child);
            }
            return this;
        }

        public Builder line(int line) {
            this.line = Math.max(0, line);
            return this;
        }

        public Builder column(int column) {
            this.column = Math.max(0, column);
            return this;
        }

        public AstNode build() {
            return new AstNode(this);
        }
    }
}

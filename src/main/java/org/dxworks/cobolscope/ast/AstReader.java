package org.dxworks.cobolscope.ast;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the parser's JSON AST into {@link AstNode}s. Type tags and statement verbs are decoded into enums here,
 * once; everything downstream works on the enums.
 * <p>
 * The document is converted bottom-up with an explicit work stack so very deep trees do not overflow. Every AST
 * level is two JSON levels (the node object and its {@code children} array), so the parser's nesting limit is
 * raised well past Jackson's default of 1000.
 */
public class AstReader {

    private static final int MAX_JSON_NESTING = 1_000_000;

    private static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(MAX_JSON_NESTING).build())
            .build());

    public AstNode read(Path file) {
        try {
            return read(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AstReadException("Cannot read AST file " + file + ": " + e.getMessage(), e);
        }
    }

    public AstNode read(String json) {
        if (json.startsWith("\uFEFF")) {
            json = json.substring(1);
        }
        JsonNode document;
        try {
            document = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstReadException("Malformed AST JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new AstReadException("AST document must be a JSON object");
        }
        return convert(document);
    }

    private AstNode convert(JsonNode document) {
        // Post-order conversion: a frame is finished once all of its children are built.
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(document));
        AstNode result = null;
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.pending.hasNext()) {
                JsonNode child = frame.pending.next();
                if (child != null && child.isObject()) {
                    stack.push(new Frame(child));
                }
                continue;
            }
            stack.pop();
            AstNode built = frame.build();
            if (stack.isEmpty()) {
                result = built;
            } else {
                stack.peek().children.add(built);
            }
        }
        return result;
    }

    private static NodeType decodeType(JsonNode json) {
        String tag = json.path("type").asText(json.path("node_type").asText(null));
        try {
            return NodeType.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw new AstReadException(e.getMessage() + " at line " + json.path("line").asInt(0), e);
        }
    }

    private static Map<String, Object> decodeAttributes(JsonNode json) {
        JsonNode attributes = json.path("attributes");
        if (!attributes.isObject()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Object value = toValue(field.getValue());
            if (value != null) {
                out.put(field.getKey(), value);
            }
        }
        return out;
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonNode item : node) {
                Object value = toValue(item);
                if (value != null) {
                    items.add(value);
                }
            }
            return Collections.unmodifiableList(items);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            Object value = toValue(e.getValue());
            if (value != null) {
                map.put(e.getKey(), value);
            }
        });
        return Collections.unmodifiableMap(map);
    }

    private static final class Frame {
        private final JsonNode json;
        private final Iterator<JsonNode> pending;
        private final List<AstNode> children = new ArrayList<>();

        Frame(JsonNode json) {
            this.json = json;
            JsonNode kids = json.path("children");
            this.pending = kids.isArray() ? kids.elements() : Collections.emptyIterator();
        }

        AstNode build() {
            JsonNode value = json.path("value");
            if (value.isMissingNode() || value.isNull()) {
                value = json.path("name");
            }
            AstNode.Builder builder = AstNode.builder(decodeType(json))
                    .value(value.isValueNode() && !value.isNull() ? value.asText() : "")
                    .attributes(decodeAttributes(json))
                    .line(json.path("line").asInt(json.path("source_line").asInt(0)))
                    .column(json.path("column").asInt(0))
                    .children(children);
            // statement_type and end_line are accepted at node level as well
            for (String key : List.of(AstNode.STATEMENT_TYPE, AstNode.END_LINE)) {
                JsonNode direct = json.path(key);
                if (direct.isValueNode() && !direct.isNull()) {
                    builder.attribute(key, toValue(direct));
                }
            }
            return builder.build();
        }
    }
}

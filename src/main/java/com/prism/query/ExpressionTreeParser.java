package com.prism.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Converts a request expression tree, as received in JSON, into the typed AST.
 *
 * Recognized leaves:
 * - a two-element array of strings {@code [column, view]}; {@code ["*", view]} is a wildcard.
 *   The parsed elements stay attached, since the pair may be an operator and its operand
 * - an object {@code {"kind": "column", "view": ..., "column": ...}} ({@code "type"} is
 *   accepted in place of {@code "kind"})
 * - a dotted string {@code "column.view"}, read as the pair form; only the first two
 *   segments count
 *
 * Everything else becomes a {@link RawNode} whose children are the parsed array
 * elements or object field values, in document order.
 */
@Component
public class ExpressionTreeParser {

    static final String COLUMN_KIND = "column";

    private final ObjectMapper objectMapper;

    public ExpressionTreeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExpressionNode parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed expression tree: " + e.getOriginalMessage(), e);
        }
    }

    public ExpressionNode parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RawNode.leaf(null);
        }
        if (node.isArray()) {
            return parseArray(node);
        }
        if (node.isObject()) {
            return parseObject(node);
        }
        if (node.isTextual()) {
            return parseText(node.asText());
        }
        return RawNode.leaf(node.asText());
    }

    /**
     * Read a dotted string as a column pair; anything without a dot stays opaque
     */
    public static ExpressionNode parseText(String text) {
        int dot = text.indexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            return RawNode.leaf(text);
        }
        String column = text.substring(0, dot);
        String rest = text.substring(dot + 1);
        int next = rest.indexOf('.');
        String view = next < 0 ? rest : rest.substring(0, next);
        if (view.isEmpty()) {
            return RawNode.leaf(text);
        }
        return columnLeaf(column, view);
    }

    private ExpressionNode parseArray(JsonNode node) {
        List<ExpressionNode> children = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            children.add(parse(element));
        }
        if (node.size() == 2 && node.get(0).isTextual() && node.get(1).isTextual()) {
            String column = node.get(0).asText();
            String view = node.get(1).asText();
            return Wildcard.SYMBOL.equals(column) ? new Wildcard(view, children) : new ColumnRef(column, view, children);
        }
        return new RawNode(null, children);
    }

    private ExpressionNode parseObject(JsonNode node) {
        String kind = node.hasNonNull("kind") ? node.get("kind").asText() : node.path("type").asText(null);
        if (COLUMN_KIND.equals(kind) && node.path("column").isTextual() && node.path("view").isTextual()) {
            return columnLeaf(node.get("column").asText(), node.get("view").asText());
        }
        List<ExpressionNode> children = new ArrayList<>(node.size());
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            children.add(parse(values.next()));
        }
        return new RawNode(null, children);
    }

    private static ExpressionNode columnLeaf(String column, String view) {
        return Wildcard.SYMBOL.equals(column) ? new Wildcard(view) : new ColumnRef(column, view);
    }
}

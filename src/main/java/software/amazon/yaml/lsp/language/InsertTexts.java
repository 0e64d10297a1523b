/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.schema.JsonSchema;
import software.amazon.yaml.lsp.schema.NodeValues;
import software.amazon.yaml.lsp.schema.ResolvedSchema;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * Builds the snippet text inserted by completions.
 *
 * <p>Text spanning multiple lines is indented absolutely: every line after
 * the first starts with the indentation it needs in the document, so items
 * must be inserted as-is.
 */
final class InsertTexts {
    private static final int MAX_DEPTH = 8;
    private static final Pattern NEEDS_QUOTES = Pattern.compile(
            "^[\\s\\-?:,\\[\\]{}#&*!|>'\"%@`]|\\s$|: |:$| #|[\\n\\r\\t]");

    private final ResolvedSchema resolved;
    private final String unit;
    private final Set<JsonSchema> expanding = Collections.newSetFromMap(new IdentityHashMap<>());
    private int tabStop = 1;

    /**
     * @param resolved The schema references are resolved against
     * @param unit One level of indentation
     */
    InsertTexts(ResolvedSchema resolved, String unit) {
        this.resolved = resolved;
        this.unit = unit;
    }

    /**
     * @param name The property name
     * @param schema The property's schema
     * @param indent The indentation of the line the property is on
     * @return The snippet for the property and a skeleton of its value
     */
    String property(String name, JsonSchema schema, String indent) {
        tabStop = 1;
        return propertyText(name, schema, indent, 0, false);
    }

    /**
     * @param value A value to insert after a key
     * @param indent The indentation of the line of the key
     * @return The snippet for the value
     */
    String value(Node value, String indent) {
        if (value.isObjectNode() && !value.expectObjectNode().isEmpty()
                || value.isArrayNode() && !value.expectArrayNode().isEmpty()) {
            return "\n" + indent + unit + escape(block(value, indent + unit));
        }
        return escape(scalar(value));
    }

    /**
     * @param body The body of a schema's default snippet
     * @param indent The indentation of the line the snippet is inserted on
     * @return The snippet for the body, with its strings taken as snippet syntax
     */
    String snippetBody(Node body, String indent) {
        if (body.isStringNode()) {
            return body.expectStringNode().getValue();
        }
        return rawBlock(body, indent);
    }

    /**
     * @param text Text to insert literally
     * @return {@code text}, with the characters that mean something in
     *  snippets escaped
     */
    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("$", "\\$").replace("}", "\\}");
    }

    /**
     * @param value A scalar value
     * @return The value as a YAML scalar, quoted only where it has to be
     */
    static String scalar(Node value) {
        if (value.isStringNode()) {
            String string = value.expectStringNode().getValue();
            if (!string.isEmpty() && Syntax.isPlainString(string) && !NEEDS_QUOTES.matcher(string).find()) {
                return string;
            }
            return Node.printJson(value);
        } else if (value.isNumberNode()) {
            return NodeValues.formatNumber(value.expectNumberNode().getValue());
        } else if (value.isBooleanNode()) {
            return String.valueOf(value.expectBooleanNode().getValue());
        } else if (value.isNullNode()) {
            return "null";
        } else if (value.isObjectNode()) {
            return "{}";
        }
        return "[]";
    }

    /**
     * @param text Text to indent
     * @param indent The indentation to add to every line but the first
     * @return The indented text
     */
    static String indentLines(String text, String indent) {
        return text.replace("\n", "\n" + indent);
    }

    private String propertyText(String name, JsonSchema raw, String indent, int depth, boolean withConst) {
        JsonSchema schema = resolveOrTrue(raw);
        String key = escape(name) + ":";

        if (withConst && schema.constValue() != null) {
            return key + " " + escape(scalar(schema.constValue()));
        }
        Node defaultValue = schema.defaultValue();
        if (defaultValue != null) {
            if (isCollection(defaultValue)) {
                return key + value(defaultValue, indent);
            }
            return key + " ${" + nextTabStop() + ":" + escape(scalar(defaultValue)) + "}";
        }

        String type = typeOf(schema);
        if (depth >= MAX_DEPTH || !expanding.add(schema)) {
            return key + " $" + nextTabStop();
        }
        try {
            if ("object".equals(type)) {
                String childIndent = indent + unit;
                List<String> members = objectMembers(schema, childIndent, depth);
                if (members.isEmpty()) {
                    return key + "\n" + childIndent + "$" + nextTabStop();
                }
                return key + "\n" + childIndent + String.join("\n" + childIndent, members);
            } else if ("array".equals(type)) {
                String itemIndent = indent + unit;
                JsonSchema items = resolveOrTrue(schema.items());
                if ("object".equals(typeOf(items))) {
                    List<String> members = objectMembers(items, itemIndent + "  ", depth);
                    if (!members.isEmpty()) {
                        return key + "\n" + itemIndent + "- " + String.join("\n" + itemIndent + "  ", members);
                    }
                }
                return key + "\n" + itemIndent + "- $" + nextTabStop();
            }
            return key + " $" + nextTabStop();
        } finally {
            expanding.remove(schema);
        }
    }

    // Required properties, and properties with defaults, in declaration order
    private List<String> objectMembers(JsonSchema schema, String indent, int depth) {
        Set<String> names = new LinkedHashSet<>();
        Set<String> required = new LinkedHashSet<>(schema.required());
        schema.properties().forEach((name, property) -> {
            if (required.contains(name) || resolveOrTrue(property).defaultValue() != null) {
                names.add(name);
            }
        });
        names.addAll(required);

        List<String> members = new ArrayList<>();
        for (String name : names) {
            JsonSchema property = schema.properties().getOrDefault(name, JsonSchema.TRUE);
            members.add(propertyText(name, property, indent, depth + 1, true));
        }
        return members;
    }

    private JsonSchema resolveOrTrue(JsonSchema schema) {
        JsonSchema result = resolved == null ? schema : resolved.resolve(schema);
        return result == null ? JsonSchema.TRUE : result;
    }

    private int nextTabStop() {
        return tabStop++;
    }

    private String block(Node value, String indent) {
        StringBuilder builder = new StringBuilder();
        appendBlock(builder, value, indent, false);
        return builder.toString();
    }

    private String rawBlock(Node value, String indent) {
        StringBuilder builder = new StringBuilder();
        appendRawBlock(builder, value, indent);
        return builder.toString();
    }

    private void appendBlock(StringBuilder builder, Node value, String indent, boolean afterKey) {
        if (value.isObjectNode() && !value.expectObjectNode().isEmpty()) {
            if (afterKey) {
                builder.append('\n').append(indent);
            }
            boolean first = true;
            for (Map.Entry<String, Node> member : value.expectObjectNode().getStringMap().entrySet()) {
                if (!first) {
                    builder.append('\n').append(indent);
                }
                first = false;
                builder.append(scalar(Node.from(member.getKey()))).append(':');
                Node memberValue = member.getValue();
                if (isCollection(memberValue)) {
                    appendBlock(builder, memberValue, indent + unit, true);
                } else {
                    builder.append(' ').append(scalar(memberValue));
                }
            }
        } else if (value.isArrayNode() && !value.expectArrayNode().isEmpty()) {
            if (afterKey) {
                builder.append('\n').append(indent);
            }
            boolean first = true;
            for (Node element : value.expectArrayNode().getElements()) {
                if (!first) {
                    builder.append('\n').append(indent);
                }
                first = false;
                builder.append("- ");
                if (isCollection(element)) {
                    appendBlock(builder, element, indent + "  ", false);
                } else {
                    builder.append(scalar(element));
                }
            }
        } else {
            if (afterKey) {
                builder.append(' ');
            }
            builder.append(scalar(value));
        }
    }

    // Like appendBlock, but strings are snippet text, written as is
    private void appendRawBlock(StringBuilder builder, Node value, String indent) {
        if (value.isObjectNode()) {
            boolean first = true;
            for (Map.Entry<String, Node> member : value.expectObjectNode().getStringMap().entrySet()) {
                if (!first) {
                    builder.append('\n').append(indent);
                }
                first = false;
                builder.append(member.getKey()).append(':');
                Node memberValue = member.getValue();
                if (isCollection(memberValue)) {
                    builder.append('\n').append(indent).append(unit);
                    appendRawBlock(builder, memberValue, indent + unit);
                } else {
                    builder.append(' ').append(rawScalar(memberValue));
                }
            }
        } else if (value.isArrayNode()) {
            boolean first = true;
            for (Node element : value.expectArrayNode().getElements()) {
                if (!first) {
                    builder.append('\n').append(indent);
                }
                first = false;
                builder.append("- ");
                if (isCollection(element)) {
                    appendRawBlock(builder, element, indent + "  ");
                } else {
                    builder.append(rawScalar(element));
                }
            }
        } else {
            builder.append(rawScalar(value));
        }
    }

    private static String rawScalar(Node value) {
        return value.isStringNode() ? value.expectStringNode().getValue() : scalar(value);
    }

    private static boolean isCollection(Node value) {
        return value.isObjectNode() && !value.expectObjectNode().isEmpty()
                || value.isArrayNode() && !value.expectArrayNode().isEmpty();
    }

    /**
     * @param schema A resolved schema
     * @return The type the schema's values have, or an empty string if it
     *  can't be told
     */
    static String typeOf(JsonSchema schema) {
        if (!schema.types().isEmpty()) {
            return schema.types().get(0);
        }
        if (!schema.properties().isEmpty()
                || schema.additionalProperties() != null && schema.additionalProperties().node().isObjectNode()) {
            return "object";
        }
        if (schema.items() != null || schema.tupleItems() != null) {
            return "array";
        }
        Node sample = schema.constValue();
        if (sample == null && schema.enumValues() != null && !schema.enumValues().isEmpty()) {
            sample = schema.enumValues().get(0);
        }
        if (sample == null) {
            return "";
        } else if (sample.isStringNode()) {
            return "string";
        } else if (sample.isNumberNode()) {
            return "number";
        } else if (sample.isBooleanNode()) {
            return "boolean";
        } else if (sample.isObjectNode()) {
            return "object";
        } else if (sample.isArrayNode()) {
            return "array";
        }
        return "null";
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * Converts between YAML syntax nodes and the {@link Node} values schemas are
 * written with, and compares them.
 */
public final class NodeValues {
    private NodeValues() {
    }

    /**
     * @param node The syntax node
     * @return The value of the node
     */
    public static Node toNode(Syntax.Node node) {
        if (node == null) {
            return Node.nullNode();
        } else if (node instanceof Syntax.Node.Obj obj) {
            ObjectNode.Builder builder = ObjectNode.builder();
            for (Syntax.Node.Prop prop : obj.properties()) {
                builder.withMember(prop.key().value(), toNode(prop.value()));
            }
            return builder.build();
        } else if (node instanceof Syntax.Node.Prop prop) {
            return toNode(prop.value());
        } else if (node instanceof Syntax.Node.Arr arr) {
            List<Node> items = new ArrayList<>();
            for (Syntax.Node item : arr.items()) {
                items.add(toNode(item));
            }
            return Node.fromNodes(items);
        } else if (node instanceof Syntax.Node.Str str) {
            return Node.from(str.value());
        } else if (node instanceof Syntax.Node.Num num) {
            return Node.from(num.value());
        } else if (node instanceof Syntax.Node.Bool bool) {
            return Node.from(bool.value());
        }
        return Node.nullNode();
    }

    /**
     * @param node The syntax node
     * @param value The value to compare to
     * @return Whether the node has the value, comparing numbers numerically
     */
    public static boolean equal(Syntax.Node node, Node value) {
        return equal(toNode(node), value);
    }

    /**
     * @param a A value
     * @param b Another value
     * @return Whether the values are equal, comparing numbers numerically
     */
    public static boolean equal(Node a, Node b) {
        if (a.isNumberNode() && b.isNumberNode()) {
            return a.expectNumberNode().getValue().doubleValue() == b.expectNumberNode().getValue().doubleValue();
        } else if (a.isObjectNode() && b.isObjectNode()) {
            Map<String, Node> left = a.expectObjectNode().getStringMap();
            Map<String, Node> right = b.expectObjectNode().getStringMap();
            if (left.size() != right.size()) {
                return false;
            }
            for (Map.Entry<String, Node> entry : left.entrySet()) {
                Node other = right.get(entry.getKey());
                if (other == null || !equal(entry.getValue(), other)) {
                    return false;
                }
            }
            return true;
        } else if (a.isArrayNode() && b.isArrayNode()) {
            List<Node> left = a.expectArrayNode().getElements();
            List<Node> right = b.expectArrayNode().getElements();
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!equal(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * @param value The value to format
     * @return The value as it would be written in JSON
     */
    public static String toJson(Node value) {
        if (value.isNumberNode()) {
            return formatNumber(value.expectNumberNode().getValue());
        }
        return Node.printJson(value);
    }

    /**
     * @param number The number to format
     * @return The number, without a fractional part if it is whole
     */
    public static String formatNumber(Number number) {
        double d = number.doubleValue();
        if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return number.toString();
    }
}

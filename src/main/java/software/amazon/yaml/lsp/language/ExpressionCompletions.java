/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.yaml.lsp.schema.JsonSchema;
import software.amazon.yaml.lsp.schema.ResolvedSchema;

/**
 * Completes inline expressions: string values of an {@code inlineObject}
 * schema that are written as a path into that schema's properties, like
 * {@code spec.containers[0].image}.
 *
 * <p>An expression may start with {@code =}, which is not part of the path.
 * Bracketed predicates after a segment select items and don't change what
 * properties are available, except to step into the items of an array.
 */
final class ExpressionCompletions {
    static final char MARKER = '=';

    private ExpressionCompletions() {
    }

    /**
     * The properties that may follow an expression.
     *
     * @param segment The partial segment being typed, which completions replace
     * @param properties The properties, by name, in declaration order
     */
    record Candidates(String segment, Map<String, JsonSchema> properties) {}

    /**
     * @param expression The text of the expression up to the cursor
     * @param context The inline object schema the expression navigates
     * @param resolved The schema references are resolved against
     * @return The candidates for the segment at the end of the expression,
     *  or {@code null} if the expression doesn't lead anywhere in the schema
     */
    static Candidates complete(String expression, JsonSchema context, ResolvedSchema resolved) {
        String path = expression;
        if (!path.isEmpty() && path.charAt(0) == MARKER) {
            path = path.substring(1);
        }
        List<String> segments = split(path);
        JsonSchema current = resolved.resolve(context);
        for (int i = 0; i < segments.size() - 1 && current != null; i++) {
            String segment = segments.get(i);
            int bracket = segment.indexOf('[');
            String name = bracket < 0 ? segment : segment.substring(0, bracket);
            JsonSchema property = current.properties().get(name.strip());
            current = property == null ? null : resolved.resolve(property);
            if (current != null && bracket >= 0 && current.items() != null) {
                current = resolved.resolve(current.items());
            }
        }
        if (current == null) {
            return null;
        }
        if (current.properties().isEmpty() && current.items() != null) {
            JsonSchema items = resolved.resolve(current.items());
            if (items != null) {
                current = items;
            }
        }
        String last = segments.get(segments.size() - 1);
        return new Candidates(last, new LinkedHashMap<>(current.properties()));
    }

    // Splits on dots outside of brackets. Always returns at least one segment.
    static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']' && depth > 0) {
                depth--;
            } else if (c == '.' && depth == 0) {
                segments.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        segments.add(current.toString());
        return segments;
    }
}

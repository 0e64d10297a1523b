/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * A schema fragment that applies to a node.
 *
 * @param node The node the schema applies to
 * @param schema The resolved schema fragment
 * @param inverted Whether the fragment applies through a {@code not}, meaning
 *                 the node must <em>not</em> match it
 * @param branch The innermost {@code anyOf} or {@code oneOf} branch the
 *               fragment was found through, or {@code null}
 * @param selected Whether every branch the fragment was found through was
 *                 among the best matching branches of its combinator
 */
public record MatchResult(
        Syntax.Node node,
        JsonSchema schema,
        boolean inverted,
        Branch branch,
        boolean selected
) {
    /**
     * One alternative of an {@code anyOf} or {@code oneOf}.
     *
     * @param combinator The schema with the {@code anyOf} or {@code oneOf}
     * @param keyword Either {@code anyOf} or {@code oneOf}
     * @param index The index of the alternative
     * @param size The number of alternatives
     * @param valid Whether the node matched the alternative without problems
     */
    public record Branch(JsonSchema combinator, String keyword, int index, int size, boolean valid) {}

    MatchResult within(Branch outer, boolean outerSelected) {
        return new MatchResult(node, schema, inverted, branch != null ? branch : outer, selected && outerSelected);
    }

    MatchResult invert() {
        return new MatchResult(node, schema, !inverted, branch, selected);
    }
}

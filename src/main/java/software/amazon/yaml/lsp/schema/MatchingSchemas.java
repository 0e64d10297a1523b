/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * The result of matching a document against a schema: every schema fragment
 * that applies to each node, and the problems found along the way.
 */
public final class MatchingSchemas {
    static final MatchingSchemas EMPTY = new MatchingSchemas(List.of(), List.of(), List.of());

    private final List<MatchResult> matches;
    private final List<Problem> problems;
    private final List<SchemaError> errors;

    MatchingSchemas(List<MatchResult> matches, List<Problem> problems, List<SchemaError> errors) {
        this.matches = Collections.unmodifiableList(matches);
        this.problems = Collections.unmodifiableList(problems);
        this.errors = Collections.unmodifiableList(errors);
    }

    /**
     * @return Every match, in the order they were found
     */
    public List<MatchResult> matches() {
        return matches;
    }

    /**
     * @return The problems of the best matching alternatives
     */
    public List<Problem> problems() {
        return problems;
    }

    /**
     * @return References that couldn't be followed while matching
     */
    public List<SchemaError> errors() {
        return errors;
    }

    /**
     * @param node The node to get matches of
     * @return The matches of {@code node}, in the order they were found
     */
    public List<MatchResult> matchesFor(Syntax.Node node) {
        List<MatchResult> result = new ArrayList<>();
        for (MatchResult match : matches) {
            if (match.node() == node) {
                result.add(match);
            }
        }
        return result;
    }

    /**
     * The schemas a node positively matches, through the best alternatives
     * of every {@code anyOf} and {@code oneOf}. Alternatives that match
     * equally well all contribute.
     *
     * @param node The node to get schemas of
     * @return The distinct schemas, in the order they were found
     */
    public List<JsonSchema> schemasFor(Syntax.Node node) {
        Set<JsonSchema> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<JsonSchema> result = new ArrayList<>();
        for (MatchResult match : matches) {
            if (match.node() == node && !match.inverted() && match.selected() && seen.add(match.schema())) {
                result.add(match.schema());
            }
        }
        return result;
    }

    /**
     * @param node The node to check
     * @return For each combinator with an alternative matching {@code node},
     *  whether every one of its alternatives matched without problems
     */
    public Map<JsonSchema, Boolean> combinatorsFor(Syntax.Node node) {
        Map<JsonSchema, boolean[]> validity = new IdentityHashMap<>();
        for (MatchResult match : matchesFor(node)) {
            MatchResult.Branch branch = match.branch();
            if (branch == null || match.inverted()) {
                continue;
            }
            boolean[] valid = validity.computeIfAbsent(branch.combinator(), c -> new boolean[branch.size()]);
            if (branch.valid()) {
                valid[branch.index()] = true;
            }
        }
        Map<JsonSchema, Boolean> result = new IdentityHashMap<>();
        validity.forEach((combinator, valid) -> {
            boolean all = true;
            for (boolean v : valid) {
                all &= v;
            }
            result.put(combinator, all);
        });
        return result;
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.protocol.LspAdapter;
import software.amazon.yaml.lsp.schema.JsonSchema;
import software.amazon.yaml.lsp.schema.MatchResult;
import software.amazon.yaml.lsp.schema.MatchingSchemas;
import software.amazon.yaml.lsp.schema.NodeValues;
import software.amazon.yaml.lsp.schema.ResolvedSchema;
import software.amazon.yaml.lsp.schema.SchemaMatcher;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * Handles hover requests for YAML documents, showing the title and
 * description of the schemas of the value under the cursor.
 *
 * <p>When a value matches every alternative of an {@code anyOf} or
 * {@code oneOf}, there is no telling which one was meant, so each
 * alternative's documentation is shown, separated by a rule.
 */
public final class HoverHandler {
    /**
     * Empty markdown hover content.
     */
    public static final Hover EMPTY = new Hover(new MarkupContent("markdown", ""));

    static final String SECTION_SEPARATOR = "\n\n----\n\n";

    private static final Pattern MARKDOWN_SPECIAL = Pattern.compile("[\\\\`*_{}\\[\\]()#+\\-.!]");
    private static final Pattern SINGLE_NEW_LINE = Pattern.compile("([^\\n\\r])(\\r?\\n)([^\\n\\r])");

    private final ResolvedSchema schema;

    /**
     * @param schema The schema of the document
     */
    public HoverHandler(ResolvedSchema schema) {
        this.schema = schema;
    }

    /**
     * @param parsed The parsed document
     * @param offset The offset of the cursor
     * @return The hover, or {@code null} if there is nothing to show
     */
    public Hover handle(Syntax.ParsedDocument parsed, int offset) {
        Syntax.SingleDocument document = parsed.documentAt(offset);
        if (document == null || schema == null) {
            return null;
        }
        Syntax.Node node = document.nodeAt(offset, false);
        if (node == null) {
            node = document.nodeAt(offset, true);
        }
        if (node == null) {
            return null;
        }

        Syntax.Node hoverRangeNode = node;
        if (node instanceof Syntax.Node.Str str
                && node.parent() instanceof Syntax.Node.Prop prop
                && prop.key() == str) {
            node = prop.value();
            if (node == null) {
                return null;
            }
        } else if (node instanceof Syntax.Node.Prop prop) {
            hoverRangeNode = prop.key();
            node = prop.value();
        }

        MatchingSchemas matching = SchemaMatcher.match(document.root(), schema);
        String content = ambiguousContent(node, matching);
        if (content == null) {
            List<MatchResult> selected = new ArrayList<>();
            for (MatchResult match : matching.matchesFor(node)) {
                if (!match.inverted() && match.selected()) {
                    selected.add(match);
                }
            }
            content = section(node, selected);
        }
        if (content.isEmpty()) {
            return null;
        }

        Hover hover = new Hover(new MarkupContent(MarkupKind.MARKDOWN, content));
        hover.setRange(LspAdapter.toRange(parsed.lineIndex(), hoverRangeNode.start(), hoverRangeNode.end()));
        return hover;
    }

    // Documentation of every alternative, if the node matches them all
    private static String ambiguousContent(Syntax.Node node, MatchingSchemas matching) {
        for (Map.Entry<JsonSchema, Boolean> combinator : matching.combinatorsFor(node).entrySet()) {
            if (!combinator.getValue()) {
                continue;
            }
            List<List<MatchResult>> branches = new ArrayList<>();
            for (MatchResult match : matching.matchesFor(node)) {
                MatchResult.Branch branch = match.branch();
                if (match.inverted() || branch == null || branch.combinator() != combinator.getKey()) {
                    continue;
                }
                while (branches.size() < branch.size()) {
                    branches.add(new ArrayList<>());
                }
                branches.get(branch.index()).add(match);
            }

            List<String> sections = new ArrayList<>();
            for (List<MatchResult> branch : branches) {
                String section = section(node, branch);
                if (!section.isEmpty() && !sections.contains(section)) {
                    sections.add(section);
                }
            }
            if (sections.size() > 1) {
                return String.join(SECTION_SEPARATOR, sections);
            }
        }
        return null;
    }

    private static String section(Syntax.Node node, List<MatchResult> matches) {
        String title = null;
        String description = null;
        String enumDescription = null;
        for (MatchResult match : matches) {
            JsonSchema matched = match.schema();
            if (title == null && matched.title() != null) {
                title = toMarkdown(matched.title());
            }
            if (description == null) {
                if (matched.markdownDescription() != null) {
                    description = matched.markdownDescription();
                } else if (matched.description() != null) {
                    description = toMarkdown(matched.description());
                }
            }
            if (enumDescription == null) {
                enumDescription = enumDescription(node, matched);
            }
        }

        List<String> parts = new ArrayList<>();
        if (title != null) {
            parts.add("#### " + title);
        }
        if (description != null) {
            parts.add(description);
        }
        if (enumDescription != null) {
            parts.add(enumDescription);
        }
        return String.join("\n\n", parts);
    }

    private static String enumDescription(Syntax.Node node, JsonSchema matched) {
        List<Node> values = matched.enumValues();
        if (values == null) {
            return null;
        }
        List<String> markdown = matched.markdownEnumDescriptions();
        List<String> plain = matched.enumDescriptions();
        for (int i = 0; i < values.size(); i++) {
            if (!NodeValues.equal(node, values.get(i))) {
                continue;
            }
            String description = null;
            if (i < markdown.size()) {
                description = markdown.get(i);
            } else if (i < plain.size()) {
                description = toMarkdown(plain.get(i));
            }
            if (description != null) {
                return "`" + NodeValues.toJson(values.get(i)) + "`: " + description;
            }
        }
        return null;
    }

    static String toMarkdown(String plain) {
        String paragraphs = SINGLE_NEW_LINE.matcher(plain).replaceAll("$1\n\n$3");
        return MARKDOWN_SPECIAL.matcher(paragraphs).replaceAll("\\\\$0");
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.utils.IoUtils;
import software.amazon.yaml.lsp.protocol.LspAdapter;

/**
 * Ready-made resource templates, offered as completions wherever a key could
 * be typed, whatever the schema.
 */
final class StaticSnippets {
    static final String DETAIL = "vscode-k8s";
    private static final String FILENAME_VARIABLE = "${TM_FILENAME}";

    private StaticSnippets() {
    }

    /**
     * @param prefix The label of the snippet
     * @param description What the snippet generates
     * @param body The lines of the snippet
     */
    record Snippet(String prefix, String description, List<String> body) {
        /**
         * @param uri The URI of the document the snippet is inserted into
         * @param indent The indentation of the line the snippet starts on
         * @return The snippet text, with the file name variable replaced by
         *  the document's base name
         */
        String text(String uri, String indent) {
            String fileName = InsertTexts.escape(LspAdapter.baseName(uri));
            String text = String.join("\n", body).replace(FILENAME_VARIABLE, fileName);
            return InsertTexts.indentLines(text, indent);
        }
    }

    /**
     * @return All the snippets, in a fixed order
     */
    static List<Snippet> all() {
        return Holder.SNIPPETS;
    }

    private static List<Snippet> load() {
        URL url = Objects.requireNonNull(StaticSnippets.class.getResource("snippets.json"));
        ArrayNode snippets = Node.parseJsonWithComments(IoUtils.readUtf8Url(url), url.toString()).expectArrayNode();
        List<Snippet> result = new ArrayList<>();
        for (ObjectNode snippet : snippets.getElementsAs(ObjectNode.class)) {
            List<String> body = new ArrayList<>();
            for (StringNode line : snippet.expectArrayMember("body").getElementsAs(StringNode.class)) {
                body.add(line.getValue());
            }
            result.add(new Snippet(
                    snippet.expectStringMember("prefix").getValue(),
                    snippet.getStringMemberOrDefault("description", ""),
                    List.copyOf(body)));
        }
        return List.copyOf(result);
    }

    private static final class Holder {
        private static final List<Snippet> SNIPPETS = load();
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A comment in a document naming its schema, like
 * {@code # yaml-language-server: $schema=https://example.com/schema.json}.
 *
 * @param schemaUri The URI given in the comment
 * @param start The start offset of the comment
 * @param end The end offset of the comment
 */
public record Modeline(String schemaUri, int start, int end) {
    private static final Pattern MODELINE = Pattern.compile(
            "^[ \\t]*#[ \\t]*(?:yaml-language-server[ \\t]*:[ \\t]*)?\\$schema(?:=|:[ \\t]*)(\\S+)",
            Pattern.MULTILINE);

    /**
     * @param text The text of a single document
     * @param baseOffset The offset of {@code text} within the full text
     * @return The first modeline in the text, if there is one
     */
    public static Optional<Modeline> find(String text, int baseOffset) {
        Matcher matcher = MODELINE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int commentStart = text.indexOf('#', matcher.start());
        return Optional.of(new Modeline(matcher.group(1), baseOffset + commentStart, baseOffset + matcher.end()));
    }
}

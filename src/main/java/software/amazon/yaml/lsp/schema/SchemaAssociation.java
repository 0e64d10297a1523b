/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Associates resources whose URI matches a glob with one or more schemas.
 *
 * <p>Globs match the end of a URI: {@code *.yaml} matches any resource whose
 * file name ends with {@code .yaml}. {@code *} and {@code ?} don't cross
 * {@code /}, while {@code **} does.
 *
 * @param glob The glob resource URIs are matched against
 * @param schemaUris The schemas of matching resources
 * @param priority Where the association came from
 */
public record SchemaAssociation(String glob, List<String> schemaUris, SchemaPriority priority) {
    public SchemaAssociation {
        schemaUris = List.copyOf(schemaUris);
    }

    /**
     * @param resourceUri The URI of the resource to check
     * @return Whether this association applies to the resource
     */
    public boolean matches(String resourceUri) {
        return globMatches(glob, resourceUri);
    }

    /**
     * @param glob The glob to match against
     * @param resourceUri The URI of the resource to check
     * @return Whether the glob matches the resource
     */
    public static boolean globMatches(String glob, String resourceUri) {
        return toPattern(glob).matcher(resourceUri).find();
    }

    static Pattern toPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        if (!glob.startsWith("/") && !glob.startsWith("**") && !glob.contains(":")) {
            regex.append("(?:^|/)");
        }
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '/') {
                        // "**/" also matches no directories at all
                        regex.append("/?");
                        i++;
                    }
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        regex.append('$');
        return Pattern.compile(regex.toString());
    }
}

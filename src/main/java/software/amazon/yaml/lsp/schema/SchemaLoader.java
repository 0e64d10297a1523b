/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import software.amazon.smithy.model.SourceException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.yaml.lsp.util.Result;

/**
 * Parses schema text into {@link Node}s, and rewrites the {@code $ref}s in
 * them to absolute {@code uri#pointer} form so a loaded schema no longer
 * depends on where it came from.
 */
final class SchemaLoader {
    private static final Logger LOGGER = Logger.getLogger(SchemaLoader.class.getName());

    // Members whose values are data, not schemas
    private static final Set<String> DATA_MEMBERS = Set.of("enum", "const", "default", "examples", "defaultSnippets");

    // Members whose keys are names rather than keywords
    private static final Set<String> NAMED_SCHEMAS = Set.of(
            "properties", "patternProperties", "definitions", "$defs", "dependencies", "dependentSchemas");

    private SchemaLoader() {
    }

    /**
     * Parses schema text as JSON, falling back to YAML if that fails.
     *
     * @param uri The URI the text came from
     * @param content The text to parse
     * @return The parsed schema document with normalized refs, or the error
     *  from parsing it as JSON
     */
    static Result<Node, SchemaError> parse(String uri, String content) {
        Node parsed;
        try {
            parsed = Node.parseJsonWithComments(content, uri);
        } catch (SourceException jsonError) {
            LOGGER.finest(() -> "Schema " + uri + " isn't JSON, trying YAML");
            try {
                Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
                if (!(loaded instanceof Map) && !(loaded instanceof Boolean)) {
                    return Result.err(SchemaError.unableToParse(uri, jsonError.getMessageWithoutLocation()));
                }
                parsed = toNode(loaded);
            } catch (YAMLException yamlError) {
                return Result.err(SchemaError.unableToParse(uri, jsonError.getMessageWithoutLocation()));
            }
        }
        if (!parsed.isObjectNode() && !parsed.isBooleanNode()) {
            return Result.err(SchemaError.unableToParse(uri, "Expected a JSON object or boolean"));
        }
        return Result.ok(normalizeRefs(parsed, uri));
    }

    /**
     * @param uri A URI, possibly with a fragment
     * @return The URI without its fragment
     */
    static String documentUri(String uri) {
        int hash = uri.indexOf('#');
        return hash < 0 ? uri : uri.substring(0, hash);
    }

    /**
     * @param uri A URI, possibly with a fragment
     * @return The URI with a fragment, which is empty if it had none
     */
    static String withFragment(String uri) {
        return uri.indexOf('#') < 0 ? uri + "#" : uri;
    }

    /**
     * @param base The URI of the document containing the ref
     * @param ref The ref as written
     * @return The absolute form of the ref, always containing a {@code #}
     */
    static String resolveRef(String base, String ref) {
        if (ref.startsWith("#")) {
            return documentUri(base) + ref;
        }
        try {
            URI baseUri = URI.create(documentUri(base));
            if (!baseUri.isOpaque()) {
                return withFragment(baseUri.resolve(ref).toString());
            }
        } catch (IllegalArgumentException e) {
            LOGGER.fine(() -> "Couldn't resolve " + ref + " against " + base + ": " + e.getMessage());
        }
        return withFragment(ref);
    }

    /**
     * @param document A schema document with normalized refs
     * @return All the refs in the document, in order of appearance
     */
    static Set<String> collectRefs(Node document) {
        Set<String> refs = new LinkedHashSet<>();
        collectRefs(document, refs);
        return refs;
    }

    private static void collectRefs(Node node, Set<String> refs) {
        if (node.isObjectNode()) {
            ObjectNode obj = node.expectObjectNode();
            obj.getStringMember("$ref").ifPresent(ref -> refs.add(ref.getValue()));
            obj.getStringMap().forEach((key, value) -> {
                if (NAMED_SCHEMAS.contains(key) && value.isObjectNode()) {
                    value.expectObjectNode().getStringMap().values().forEach(schema -> collectRefs(schema, refs));
                } else if (!DATA_MEMBERS.contains(key)) {
                    collectRefs(value, refs);
                }
            });
        } else if (node.isArrayNode()) {
            for (Node element : node.expectArrayNode().getElements()) {
                collectRefs(element, refs);
            }
        }
    }

    private static Node normalizeRefs(Node node, String base) {
        if (node.isObjectNode()) {
            ObjectNode.Builder builder = ObjectNode.builder();
            node.expectObjectNode().getStringMap().forEach((key, value) -> {
                if (key.equals("$ref") && value.isStringNode()) {
                    builder.withMember(key, resolveRef(base, value.expectStringNode().getValue()));
                } else if (NAMED_SCHEMAS.contains(key) && value.isObjectNode()) {
                    ObjectNode.Builder named = ObjectNode.builder();
                    value.expectObjectNode().getStringMap()
                            .forEach((name, schema) -> named.withMember(name, normalizeRefs(schema, base)));
                    builder.withMember(key, named.build());
                } else if (DATA_MEMBERS.contains(key)) {
                    builder.withMember(key, value);
                } else {
                    builder.withMember(key, normalizeRefs(value, base));
                }
            });
            return builder.build();
        } else if (node.isArrayNode()) {
            List<Node> elements = new ArrayList<>();
            for (Node element : node.expectArrayNode().getElements()) {
                elements.add(normalizeRefs(element, base));
            }
            return ArrayNode.fromNodes(elements);
        }
        return node;
    }

    /**
     * Follows a JSON pointer within a document.
     *
     * @param document The document to search
     * @param pointer The pointer, without the leading {@code #}
     * @return The node at the pointer, or {@code null} if there isn't one
     */
    static Node findPointer(Node document, String pointer) {
        if (pointer.isEmpty() || pointer.equals("/")) {
            return document;
        }
        if (!pointer.startsWith("/")) {
            return null;
        }
        Node current = document;
        for (String rawSegment : pointer.substring(1).split("/", -1)) {
            String segment = decodeSegment(rawSegment);
            if (current.isObjectNode()) {
                current = current.expectObjectNode().getMember(segment).orElse(null);
            } else if (current.isArrayNode()) {
                try {
                    current = current.expectArrayNode().get(Integer.parseInt(segment)).orElse(null);
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static String decodeSegment(String segment) {
        String decoded = segment;
        if (decoded.indexOf('%') >= 0) {
            try {
                decoded = URLDecoder.decode(decoded.replace("+", "%2B"), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                LOGGER.finest(() -> "Leaving undecodable pointer segment as is: " + segment);
            }
        }
        return decoded.replace("~1", "/").replace("~0", "~");
    }

    private static Node toNode(Object value) {
        if (value == null) {
            return Node.nullNode();
        } else if (value instanceof Map<?, ?> map) {
            ObjectNode.Builder builder = ObjectNode.builder();
            map.forEach((key, member) -> builder.withMember(String.valueOf(key), toNode(member)));
            return builder.build();
        } else if (value instanceof List<?> list) {
            List<Node> elements = new ArrayList<>();
            for (Object element : list) {
                elements.add(toNode(element));
            }
            return ArrayNode.fromNodes(elements);
        } else if (value instanceof Boolean) {
            return Node.from((Boolean) value);
        } else if (value instanceof Number) {
            return Node.from((Number) value);
        } else if (value instanceof Date) {
            return Node.from(((Date) value).toInstant().toString());
        }
        return StringNode.from(String.valueOf(value));
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.smithy.model.node.Node;

/**
 * A schema together with every document it transitively references, so
 * {@code $ref}s can be followed without further loading.
 *
 * <p>References are followed lazily, when a schema is {@link #resolve resolved}.
 * Because of that, recursive schemas are fine: they are only unrolled as
 * deep as the YAML being matched against them.
 */
public final class ResolvedSchema {
    private final List<String> uris;
    private final JsonSchema root;
    private final Map<String, Node> documents;
    private final List<SchemaError> errors;
    private final Map<String, Optional<JsonSchema>> targets = new ConcurrentHashMap<>();
    private final Map<JsonSchema, JsonSchema> merged = new ConcurrentHashMap<>();
    private volatile KubernetesIndex kubernetesIndex;

    ResolvedSchema(List<String> uris, JsonSchema root, Map<String, Node> documents, List<SchemaError> errors) {
        this.uris = List.copyOf(uris);
        this.root = root;
        this.documents = Collections.unmodifiableMap(new LinkedHashMap<>(documents));
        this.errors = List.copyOf(errors);
    }

    /**
     * Creates a resolved schema from a single, self-contained schema.
     *
     * @param uri The URI to identify the schema by
     * @param schema The schema node
     * @return The resolved schema
     */
    public static ResolvedSchema of(String uri, Node schema) {
        Node document = SchemaLoader.parse(uri, Node.printJson(schema)).unwrap();
        return new ResolvedSchema(List.of(uri), JsonSchema.reference(SchemaLoader.withFragment(uri)),
                Map.of(SchemaLoader.documentUri(uri), document), List.of());
    }

    /**
     * @return The URIs this schema was resolved from
     */
    public List<String> uris() {
        return uris;
    }

    /**
     * @return The root schema, which refers to the documents of {@link #uris()}
     */
    public JsonSchema root() {
        return root;
    }

    /**
     * @return Problems loading referenced documents or following references
     */
    public List<SchemaError> errors() {
        return errors;
    }

    /**
     * @return The URIs of every document this schema was built from
     */
    public Set<String> dependencies() {
        return documents.keySet();
    }

    /**
     * Follows {@code $ref}s until reaching a schema without one. Members next
     * to a {@code $ref} take precedence over the members of its target.
     *
     * @param schema The schema to resolve
     * @return The resolved schema, or {@code null} if a reference couldn't be
     *  followed
     */
    public JsonSchema resolve(JsonSchema schema) {
        if (schema == null) {
            return null;
        }
        JsonSchema current = schema;
        Set<String> seen = new HashSet<>();
        while (current.ref() != null) {
            String ref = current.ref();
            if (!seen.add(ref)) {
                // The reference loops back on itself without adding anything
                return JsonSchema.of(current.node().expectObjectNode().withoutMember("$ref"));
            }
            JsonSchema target = lookup(ref);
            if (target == null) {
                return null;
            }
            current = merged.computeIfAbsent(current, unresolved -> unresolved.mergedOnto(target));
        }
        return current;
    }

    /**
     * @param ref A normalized reference
     * @return The schema it points to, or {@code null} if there isn't one
     */
    JsonSchema lookup(String ref) {
        return targets.computeIfAbsent(ref, r -> {
            Node document = documents.get(SchemaLoader.documentUri(r));
            if (document == null) {
                return Optional.empty();
            }
            int hash = r.indexOf('#');
            String pointer = hash < 0 ? "" : r.substring(hash + 1);
            Node target = SchemaLoader.findPointer(document, pointer);
            if (target == null || !(target.isObjectNode() || target.isBooleanNode())) {
                return Optional.empty();
            }
            return Optional.of(JsonSchema.of(target));
        }).orElse(null);
    }

    /**
     * @return The index of this schema in the shape of a Kubernetes schema
     */
    public KubernetesIndex kubernetesIndex() {
        KubernetesIndex index = kubernetesIndex;
        if (index == null) {
            index = KubernetesIndex.build(this);
            kubernetesIndex = index;
        }
        return index;
    }
}

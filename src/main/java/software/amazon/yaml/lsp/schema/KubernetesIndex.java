/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * A name-keyed index of a Kubernetes-shaped schema, for completion and
 * validation of Kubernetes documents without general schema matching.
 *
 * <p>{@link #rootNodes()} maps each property name of a top-level API object
 * to where it appears, and {@link #childrenNodes()} does the same for the
 * properties of each definition. Both are built once from the schema, which
 * is left untouched, and are immutable.
 */
public final class KubernetesIndex {
    private final Map<String, List<Entry>> rootNodes;
    private final Map<String, List<Entry>> childrenNodes;
    private final Map<String, List<String>> definitionProperties;

    private KubernetesIndex(
            Map<String, List<Entry>> rootNodes,
            Map<String, List<Entry>> childrenNodes,
            Map<String, List<String>> definitionProperties
    ) {
        this.rootNodes = freeze(rootNodes);
        this.childrenNodes = freeze(childrenNodes);
        this.definitionProperties = freeze(definitionProperties);
    }

    /**
     * Where a property appears in the schema.
     *
     * @param owner The API object or definition declaring the property
     * @param children The property names of the property's value, or of its
     *                 items if it is an array
     * @param type The JSON type of the property, or an empty string
     * @param childRef The {@code $ref} of the property or its items, or {@code null}
     * @param enumValues The values the property is restricted to, which is
     *                   empty if it isn't restricted
     * @param defaultValue The default value of the property, or {@code null}
     */
    public record Entry(
            String owner,
            List<String> children,
            String type,
            String childRef,
            List<Node> enumValues,
            Node defaultValue
    ) {
        public Entry {
            children = List.copyOf(children);
            enumValues = List.copyOf(enumValues);
        }

        /**
         * @return The enum values, followed by the default value if it isn't
         *  one of them
         */
        public List<Node> values() {
            if (defaultValue == null || enumValues.contains(defaultValue)) {
                return enumValues;
            }
            List<Node> values = new ArrayList<>(enumValues);
            values.add(defaultValue);
            return values;
        }
    }

    static KubernetesIndex build(ResolvedSchema schema) {
        Map<String, List<Entry>> rootNodes = new LinkedHashMap<>();
        Map<String, List<Entry>> childrenNodes = new LinkedHashMap<>();
        Map<String, List<String>> definitionProperties = new LinkedHashMap<>();

        List<JsonSchema> tops = new ArrayList<>();
        JsonSchema root = schema.resolve(schema.root());
        if (root != null) {
            tops.add(root);
            for (JsonSchema part : root.allOf()) {
                JsonSchema resolved = schema.resolve(part);
                if (resolved != null) {
                    tops.add(resolved);
                }
            }
        }

        for (JsonSchema top : tops) {
            top.properties().forEach((apiObject, apiSchema) ->
                    indexProperties(schema, apiObject, schema.resolve(apiSchema), rootNodes));
            List<JsonSchema> branches = new ArrayList<>(top.oneOf());
            branches.addAll(top.anyOf());
            for (JsonSchema branch : branches) {
                indexProperties(schema, lastSegment(branch.ref()), schema.resolve(branch), rootNodes);
            }
            top.definitions().forEach((definition, definitionSchema) -> {
                JsonSchema resolved = schema.resolve(definitionSchema);
                indexProperties(schema, definition, resolved, childrenNodes);
                if (resolved != null) {
                    definitionProperties.put(definition, new ArrayList<>(resolved.properties().keySet()));
                }
            });
        }
        return new KubernetesIndex(rootNodes, childrenNodes, definitionProperties);
    }

    /**
     * @return Entries for the properties of top-level API objects, by property name
     */
    public Map<String, List<Entry>> rootNodes() {
        return rootNodes;
    }

    /**
     * @return Entries for the properties of definitions, by property name
     */
    public Map<String, List<Entry>> childrenNodes() {
        return childrenNodes;
    }

    /**
     * @return Whether there is nothing in the index
     */
    public boolean isEmpty() {
        return rootNodes.isEmpty() && childrenNodes.isEmpty();
    }

    /**
     * @param key A property name
     * @return Every entry for the property, top-level ones first
     */
    public List<Entry> entries(String key) {
        List<Entry> entries = new ArrayList<>(rootNodes.getOrDefault(key, List.of()));
        entries.addAll(childrenNodes.getOrDefault(key, List.of()));
        return entries;
    }

    /**
     * @param key A property name
     * @return The names of the properties that may appear in the value of
     *  {@code key}, from all the places {@code key} appears
     */
    public Set<String> childrenOf(String key) {
        Set<String> children = new LinkedHashSet<>();
        for (Entry entry : entries(key)) {
            children.addAll(entry.children());
            if (entry.children().isEmpty() && entry.childRef() != null) {
                children.addAll(definitionProperties.getOrDefault(lastSegment(entry.childRef()), List.of()));
            }
        }
        return children;
    }

    /**
     * @param obj A mapping in a Kubernetes document
     * @return The keys the mapping may have, which is empty if it isn't known
     */
    public Set<String> allowedKeys(Syntax.Node.Obj obj) {
        Syntax.Node parent = obj.parent();
        if (parent == null) {
            return rootNodes.keySet();
        }
        if (parent instanceof Syntax.Node.Arr) {
            parent = parent.parent();
        }
        if (parent instanceof Syntax.Node.Prop prop) {
            return childrenOf(prop.key().value());
        }
        return Set.of();
    }

    private static void indexProperties(
            ResolvedSchema schema,
            String owner,
            JsonSchema objectSchema,
            Map<String, List<Entry>> into
    ) {
        if (objectSchema == null) {
            return;
        }
        objectSchema.properties().forEach((name, raw) -> {
            JsonSchema property = schema.resolve(raw);
            if (property == null) {
                property = JsonSchema.TRUE;
            }
            List<String> children = new ArrayList<>();
            String childRef = raw.ref();
            JsonSchema childSchema = property;
            if (property.items() != null) {
                if (childRef == null) {
                    childRef = property.items().ref();
                }
                childSchema = schema.resolve(property.items());
            }
            if (childSchema != null) {
                children.addAll(childSchema.properties().keySet());
            }

            String type = property.types().isEmpty() ? (property.items() != null ? "array" : "")
                    : property.types().get(0);
            List<Node> enumValues = property.enumValues() == null ? List.of() : property.enumValues();
            into.computeIfAbsent(name, k -> new ArrayList<>())
                    .add(new Entry(owner, children, type, childRef, enumValues, property.defaultValue()));
        });
    }

    private static String lastSegment(String ref) {
        if (ref == null) {
            return "";
        }
        return ref.substring(ref.lastIndexOf('/') + 1);
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> map) {
        Map<String, List<T>> frozen = new LinkedHashMap<>();
        map.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }
}

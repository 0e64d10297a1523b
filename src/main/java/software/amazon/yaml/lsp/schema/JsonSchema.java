/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.BooleanNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.NumberNode;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

/**
 * An immutable JSON Schema fragment, read from the {@link Node} it is backed
 * by. Boolean schemas are represented by {@link #TRUE} and {@link #FALSE}.
 *
 * <p>Nested schemas are read eagerly, so a tree of {@code JsonSchema} mirrors
 * the tree of nodes. {@code $ref}s are not followed here; see
 * {@link ResolvedSchema#resolve(JsonSchema)}.
 */
public final class JsonSchema {
    public static final JsonSchema TRUE = new JsonSchema(Node.from(true));
    public static final JsonSchema FALSE = new JsonSchema(Node.from(false));

    private static final Logger LOGGER = Logger.getLogger(JsonSchema.class.getName());

    private final Node node;
    private final Boolean booleanValue;
    private final String ref;
    private final List<String> types;
    private final Map<String, JsonSchema> properties;
    private final Map<String, JsonSchema> patternProperties;
    private final JsonSchema additionalProperties;
    private final JsonSchema items;
    private final List<JsonSchema> tupleItems;
    private final JsonSchema additionalItems;
    private final List<String> required;
    private final List<Node> enumValues;
    private final Node constValue;
    private final Node defaultValue;
    private final List<Node> examples;
    private final List<JsonSchema> allOf;
    private final List<JsonSchema> anyOf;
    private final List<JsonSchema> oneOf;
    private final JsonSchema not;
    private final JsonSchema ifSchema;
    private final JsonSchema thenSchema;
    private final JsonSchema elseSchema;
    private final Map<String, JsonSchema> definitions;
    private final Map<String, List<String>> dependentRequired;
    private final Map<String, JsonSchema> dependentSchemas;
    private final List<DefaultSnippet> defaultSnippets;
    private final List<String> enumDescriptions;
    private final List<String> markdownEnumDescriptions;
    private final Pattern pattern;

    private JsonSchema(Node node) {
        this.node = node;
        if (node.isBooleanNode()) {
            this.booleanValue = node.expectBooleanNode().getValue();
        } else {
            this.booleanValue = node.isObjectNode() ? null : Boolean.TRUE;
        }
        ObjectNode obj = node.asObjectNode().orElse(Node.objectNode());

        this.ref = obj.getStringMember("$ref").map(StringNode::getValue).orElse(null);
        this.types = readTypes(obj);
        this.properties = readSchemaMap(obj, "properties");
        this.patternProperties = readSchemaMap(obj, "patternProperties");
        this.additionalProperties = readSchema(obj, "additionalProperties");
        Optional<Node> itemsNode = obj.getMember("items");
        if (itemsNode.isPresent() && itemsNode.get().isArrayNode()) {
            this.items = null;
            this.tupleItems = readSchemaList(itemsNode.get());
        } else {
            this.items = itemsNode.map(JsonSchema::of).orElse(null);
            this.tupleItems = null;
        }
        this.additionalItems = readSchema(obj, "additionalItems");
        this.required = readStrings(obj.getMember("required").orElse(null));
        this.enumValues = obj.getArrayMember("enum").map(ArrayNode::getElements).orElse(null);
        this.constValue = obj.getMember("const").orElse(null);
        this.defaultValue = obj.getMember("default").orElse(null);
        this.examples = obj.getArrayMember("examples").map(ArrayNode::getElements).orElse(Collections.emptyList());
        this.allOf = obj.getMember("allOf").map(JsonSchema::readSchemaList).orElse(Collections.emptyList());
        this.anyOf = obj.getMember("anyOf").map(JsonSchema::readSchemaList).orElse(Collections.emptyList());
        this.oneOf = obj.getMember("oneOf").map(JsonSchema::readSchemaList).orElse(Collections.emptyList());
        this.not = readSchema(obj, "not");
        this.ifSchema = readSchema(obj, "if");
        this.thenSchema = readSchema(obj, "then");
        this.elseSchema = readSchema(obj, "else");

        Map<String, JsonSchema> defs = new LinkedHashMap<>(readSchemaMap(obj, "definitions"));
        defs.putAll(readSchemaMap(obj, "$defs"));
        this.definitions = Collections.unmodifiableMap(defs);

        Map<String, List<String>> depRequired = new LinkedHashMap<>();
        Map<String, JsonSchema> depSchemas = new LinkedHashMap<>();
        obj.getObjectMember("dependencies").ifPresent(deps -> deps.getStringMap().forEach((key, value) -> {
            if (value.isArrayNode()) {
                depRequired.put(key, readStrings(value));
            } else {
                depSchemas.put(key, of(value));
            }
        }));
        obj.getObjectMember("dependentRequired").ifPresent(deps -> deps.getStringMap()
                .forEach((key, value) -> depRequired.put(key, readStrings(value))));
        obj.getObjectMember("dependentSchemas").ifPresent(deps -> deps.getStringMap()
                .forEach((key, value) -> depSchemas.put(key, of(value))));
        this.dependentRequired = Collections.unmodifiableMap(depRequired);
        this.dependentSchemas = Collections.unmodifiableMap(depSchemas);

        List<DefaultSnippet> snippets = new ArrayList<>();
        obj.getArrayMember("defaultSnippets").ifPresent(array -> {
            for (Node element : array.getElements()) {
                element.asObjectNode().ifPresent(snippet -> snippets.add(new DefaultSnippet(
                        snippet.getStringMemberOrDefault("label", null),
                        snippet.getStringMemberOrDefault("description", null),
                        snippet.getMember("body").orElse(null),
                        snippet.getStringMemberOrDefault("bodyText", null))));
            }
        });
        this.defaultSnippets = Collections.unmodifiableList(snippets);
        this.enumDescriptions = readStrings(obj.getMember("enumDescriptions").orElse(null));
        this.markdownEnumDescriptions = readStrings(obj.getMember("markdownEnumDescriptions").orElse(null));
        this.pattern = obj.getStringMember("pattern").map(p -> compile(p.getValue())).orElse(null);
    }

    /**
     * @param node The node to read a schema from
     * @return The schema
     */
    public static JsonSchema of(Node node) {
        if (node.isBooleanNode()) {
            return node.expectBooleanNode().getValue() ? TRUE : FALSE;
        }
        return new JsonSchema(node);
    }

    /**
     * Creates the schema referenced by {@code uri}, which is how documents and
     * combinations of documents are rooted.
     *
     * @param uri The URI, optionally with a JSON pointer fragment
     * @return A schema that is only a reference to {@code uri}
     */
    public static JsonSchema reference(String uri) {
        return of(Node.objectNode().withMember("$ref", uri));
    }

    /**
     * @param uris The URIs, which are all required to match
     * @return A schema combining references to {@code uris}
     */
    public static JsonSchema allOfReferences(List<String> uris) {
        if (uris.size() == 1) {
            return reference(uris.get(0));
        }
        List<Node> refs = new ArrayList<>();
        for (String uri : uris) {
            refs.add(Node.objectNode().withMember("$ref", uri));
        }
        return of(Node.objectNode().withMember("allOf", Node.fromNodes(refs)));
    }

    /**
     * Creates the schema a {@code $ref} stands for: the members of this schema
     * other than {@code $ref}, on top of the referenced {@code target}.
     *
     * @param target The schema {@code $ref} points to
     * @return The merged schema
     */
    JsonSchema mergedOnto(JsonSchema target) {
        ObjectNode own = node.expectObjectNode().withoutMember("$ref");
        if (target.booleanValue != null) {
            if (!target.booleanValue) {
                return FALSE;
            }
            return of(own);
        }
        return of(target.node.expectObjectNode().merge(own));
    }

    /**
     * @return The node this schema was read from
     */
    public Node node() {
        return node;
    }

    /**
     * @return Whether this is the {@code true} or {@code false} schema
     */
    public boolean isBoolean() {
        return booleanValue != null;
    }

    /**
     * @return Whether this is the {@code false} schema, which matches nothing
     */
    public boolean isFalse() {
        return Boolean.FALSE.equals(booleanValue);
    }

    public String ref() {
        return ref;
    }

    /**
     * @return The allowed types, empty if any type is allowed
     */
    public List<String> types() {
        return types;
    }

    /**
     * @return The declared properties, in declaration order
     */
    public Map<String, JsonSchema> properties() {
        return properties;
    }

    public Map<String, JsonSchema> patternProperties() {
        return patternProperties;
    }

    public JsonSchema additionalProperties() {
        return additionalProperties;
    }

    /**
     * @return The schema of every item, or {@code null} if items is absent or
     *  a tuple
     */
    public JsonSchema items() {
        return items;
    }

    /**
     * @return The positional item schemas, or {@code null} if items isn't a tuple
     */
    public List<JsonSchema> tupleItems() {
        return tupleItems;
    }

    public JsonSchema additionalItems() {
        return additionalItems;
    }

    public List<String> required() {
        return required;
    }

    /**
     * @return The allowed values, or {@code null} if there is no enum
     */
    public List<Node> enumValues() {
        return enumValues;
    }

    public Node constValue() {
        return constValue;
    }

    public Node defaultValue() {
        return defaultValue;
    }

    public List<Node> examples() {
        return examples;
    }

    public List<JsonSchema> allOf() {
        return allOf;
    }

    public List<JsonSchema> anyOf() {
        return anyOf;
    }

    public List<JsonSchema> oneOf() {
        return oneOf;
    }

    public JsonSchema not() {
        return not;
    }

    public JsonSchema ifSchema() {
        return ifSchema;
    }

    public JsonSchema thenSchema() {
        return thenSchema;
    }

    public JsonSchema elseSchema() {
        return elseSchema;
    }

    /**
     * @return Both {@code definitions} and {@code $defs}
     */
    public Map<String, JsonSchema> definitions() {
        return definitions;
    }

    public Map<String, List<String>> dependentRequired() {
        return dependentRequired;
    }

    public Map<String, JsonSchema> dependentSchemas() {
        return dependentSchemas;
    }

    public List<DefaultSnippet> defaultSnippets() {
        return defaultSnippets;
    }

    public List<String> enumDescriptions() {
        return enumDescriptions;
    }

    public List<String> markdownEnumDescriptions() {
        return markdownEnumDescriptions;
    }

    /**
     * @return The compiled pattern, or {@code null} if there is none or it
     *  isn't a valid regular expression
     */
    public Pattern pattern() {
        return pattern;
    }

    public String patternString() {
        return string("pattern");
    }

    public String title() {
        return string("title");
    }

    public String description() {
        return string("description");
    }

    public String markdownDescription() {
        return string("markdownDescription");
    }

    public String deprecationMessage() {
        return string("deprecationMessage");
    }

    public String errorMessage() {
        return string("errorMessage");
    }

    public String patternErrorMessage() {
        return string("patternErrorMessage");
    }

    public Integer minLength() {
        return integer("minLength");
    }

    public Integer maxLength() {
        return integer("maxLength");
    }

    public Integer minItems() {
        return integer("minItems");
    }

    public Integer maxItems() {
        return integer("maxItems");
    }

    public Integer minProperties() {
        return integer("minProperties");
    }

    public Integer maxProperties() {
        return integer("maxProperties");
    }

    public Double minimum() {
        return number("minimum");
    }

    public Double maximum() {
        return number("maximum");
    }

    public Double multipleOf() {
        return number("multipleOf");
    }

    /**
     * @return The exclusive minimum, reading both the numeric form and the
     *  boolean form that modifies {@code minimum}
     */
    public Double exclusiveMinimum() {
        return exclusive("exclusiveMinimum", minimum());
    }

    /**
     * @return The exclusive maximum, reading both the numeric form and the
     *  boolean form that modifies {@code maximum}
     */
    public Double exclusiveMaximum() {
        return exclusive("exclusiveMaximum", maximum());
    }

    public boolean uniqueItems() {
        return flag("uniqueItems");
    }

    public boolean doNotSuggest() {
        return flag("doNotSuggest");
    }

    /**
     * @return Whether values of this schema may be written as inline
     *  expressions that navigate the schema
     */
    public boolean inlineObject() {
        return flag("inlineObject");
    }

    @Override
    public String toString() {
        return Node.printJson(node);
    }

    private String string(String member) {
        return node.asObjectNode()
                .flatMap(obj -> obj.getStringMember(member))
                .map(StringNode::getValue)
                .orElse(null);
    }

    private Integer integer(String member) {
        Double value = number(member);
        return value == null ? null : value.intValue();
    }

    private Double number(String member) {
        return node.asObjectNode()
                .flatMap(obj -> obj.getNumberMember(member))
                .map(NumberNode::getValue)
                .map(Number::doubleValue)
                .orElse(null);
    }

    private boolean flag(String member) {
        return node.asObjectNode()
                .flatMap(obj -> obj.getBooleanMember(member))
                .map(BooleanNode::getValue)
                .orElse(false);
    }

    private Double exclusive(String member, Double inclusive) {
        Optional<Node> value = node.asObjectNode().flatMap(obj -> obj.getMember(member));
        if (value.isEmpty()) {
            return null;
        }
        if (value.get().isNumberNode()) {
            return value.get().expectNumberNode().getValue().doubleValue();
        }
        if (value.get().isBooleanNode() && value.get().expectBooleanNode().getValue()) {
            return inclusive;
        }
        return null;
    }

    private static List<String> readTypes(ObjectNode obj) {
        Optional<Node> type = obj.getMember("type");
        if (type.isEmpty()) {
            return Collections.emptyList();
        }
        if (type.get().isStringNode()) {
            return List.of(type.get().expectStringNode().getValue());
        }
        return readStrings(type.get());
    }

    private static List<String> readStrings(Node node) {
        if (node == null || !node.isArrayNode()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Node element : node.expectArrayNode().getElements()) {
            element.asStringNode().ifPresent(s -> result.add(s.getValue()));
        }
        return Collections.unmodifiableList(result);
    }

    private static JsonSchema readSchema(ObjectNode obj, String member) {
        return obj.getMember(member)
                .filter(n -> n.isObjectNode() || n.isBooleanNode())
                .map(JsonSchema::of)
                .orElse(null);
    }

    private static List<JsonSchema> readSchemaList(Node node) {
        if (!node.isArrayNode()) {
            return Collections.emptyList();
        }
        List<JsonSchema> result = new ArrayList<>();
        for (Node element : node.expectArrayNode().getElements()) {
            if (element.isObjectNode() || element.isBooleanNode()) {
                result.add(of(element));
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static Map<String, JsonSchema> readSchemaMap(ObjectNode obj, String member) {
        Optional<ObjectNode> map = obj.getObjectMember(member);
        if (map.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, JsonSchema> result = new LinkedHashMap<>();
        map.get().getStringMap().forEach((key, value) -> {
            if (value.isObjectNode() || value.isBooleanNode()) {
                result.put(key, of(value));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            LOGGER.fine(() -> "Ignoring pattern that isn't a valid regular expression: " + regex);
            return null;
        }
    }

    /**
     * A completion snippet suggested by the schema itself.
     *
     * @param label The label to show, or {@code null}
     * @param description The description to show, or {@code null}
     * @param body The value to insert, or {@code null} if {@code bodyText} is used
     * @param bodyText Literal snippet text to insert, or {@code null}
     */
    public record DefaultSnippet(String label, String description, Node body, String bodyText) {}
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * Matches a YAML tree against a {@link ResolvedSchema}, finding every schema
 * fragment that applies to each node and every way in which the tree doesn't
 * conform.
 *
 * <p>Matching never throws. Unresolvable references match nothing and are
 * reported through {@link MatchingSchemas#errors()}.
 */
public final class SchemaMatcher {
    private static final Logger LOGGER = Logger.getLogger(SchemaMatcher.class.getName());

    private final ResolvedSchema schema;
    private final Map<Syntax.Node, Set<JsonSchema>> active = new IdentityHashMap<>();
    private final Set<String> unresolved = new LinkedHashSet<>();

    private SchemaMatcher(ResolvedSchema schema) {
        this.schema = schema;
    }

    /**
     * @param root The root of the tree to match
     * @param schema The schema to match against
     * @return The matches and problems
     */
    public static MatchingSchemas match(Syntax.Node root, ResolvedSchema schema) {
        if (root == null || schema == null) {
            return MatchingSchemas.EMPTY;
        }
        SchemaMatcher matcher = new SchemaMatcher(schema);
        Validation validation = new Validation();
        Collector collector = new Collector();
        try {
            matcher.validate(root, schema.root(), validation, collector);
        } catch (RuntimeException | StackOverflowError e) {
            LOGGER.warning("Failed to match document against " + schema.uris() + ": " + e);
        }
        List<SchemaError> errors = new ArrayList<>();
        for (String ref : matcher.unresolved) {
            int hash = ref.indexOf('#');
            errors.add(SchemaError.unresolvedRef(SchemaLoader.documentUri(ref), hash < 0 ? ref : ref.substring(hash)));
        }
        return new MatchingSchemas(collector.matches, validation.problems, errors);
    }

    private void validate(Syntax.Node node, JsonSchema raw, Validation result, Collector collector) {
        if (node == null || raw == null) {
            return;
        }
        if (node instanceof Syntax.Node.Prop prop) {
            validate(prop.value(), raw, result, collector);
            return;
        }

        JsonSchema resolved = schema.resolve(raw);
        if (resolved == null) {
            unresolved.add(raw.ref());
            return;
        }

        Set<JsonSchema> onNode = active.computeIfAbsent(node, n -> Collections.newSetFromMap(new IdentityHashMap<>()));
        if (!onNode.add(resolved)) {
            // Already matching this schema against this node further up
            return;
        }
        try {
            if (resolved.isBoolean()) {
                if (resolved.isFalse()) {
                    result.problems.add(Problem.error(anchorStart(node), anchorEnd(node),
                            "Matches a schema that is not allowed."));
                }
            } else {
                if (node instanceof Syntax.Node.Obj obj) {
                    validateObject(obj, resolved, result, collector);
                } else if (node instanceof Syntax.Node.Arr arr) {
                    validateArray(arr, resolved, result, collector);
                } else if (node instanceof Syntax.Node.Str str) {
                    validateString(str, resolved, result);
                } else if (node instanceof Syntax.Node.Num num) {
                    validateNumber(num, resolved, result);
                }
                validateNode(node, resolved, result, collector);
            }
            collector.add(new MatchResult(node, resolved, false, null, true));
        } finally {
            onNode.remove(resolved);
        }
    }

    private void validateNode(Syntax.Node node, JsonSchema schema, Validation result, Collector collector) {
        List<String> types = schema.types();
        if (!types.isEmpty() && types.stream().noneMatch(type -> matchesType(node, type))) {
            String message = schema.errorMessage();
            if (message == null) {
                message = types.size() == 1
                        ? String.format("Incorrect type. Expected \"%s\".", types.get(0))
                        : String.format("Incorrect type. Expected one of %s.", String.join(", ", types));
            }
            result.problems.add(Problem.error(anchorStart(node), anchorEnd(node), message));
        }

        for (JsonSchema part : schema.allOf()) {
            validate(node, part, result, collector);
        }

        if (schema.not() != null) {
            Validation sub = new Validation();
            Collector subCollector = new Collector();
            validate(node, schema.not(), sub, subCollector);
            if (!sub.hasProblems()) {
                result.problems.add(Problem.error(anchorStart(node), anchorEnd(node),
                        "Matches a schema that is not allowed."));
            }
            for (MatchResult match : subCollector.matches) {
                collector.add(match.invert());
            }
        }

        if (!schema.anyOf().isEmpty()) {
            testAlternatives(node, schema, "anyOf", schema.anyOf(), false, result, collector);
        }
        if (!schema.oneOf().isEmpty()) {
            testAlternatives(node, schema, "oneOf", schema.oneOf(), true, result, collector);
        }

        if (schema.ifSchema() != null) {
            // The condition is only tested; its matches don't apply to the node
            Validation condition = new Validation();
            validate(node, schema.ifSchema(), condition, new Collector());
            JsonSchema branch = condition.hasProblems() ? schema.elseSchema() : schema.thenSchema();
            if (branch != null) {
                Validation sub = new Validation();
                Collector subCollector = new Collector();
                validate(node, branch, sub, subCollector);
                result.merge(sub);
                result.propertiesMatches += sub.propertiesMatches;
                result.propertiesValueMatches += sub.propertiesValueMatches;
                collector.merge(subCollector);
            }
        }

        if (schema.enumValues() != null) {
            Node value = NodeValues.toNode(node);
            boolean match = schema.enumValues().stream().anyMatch(e -> NodeValues.equal(value, e));
            result.enumValues = schema.enumValues();
            result.enumValueMatch = match;
            if (!match) {
                String message = schema.errorMessage();
                if (message == null) {
                    String valid = schema.enumValues().stream()
                            .map(NodeValues::toJson)
                            .collect(Collectors.joining(", "));
                    message = String.format("Value is not accepted. Valid values: %s.", valid);
                }
                result.problems.add(Problem.error(anchorStart(node), anchorEnd(node), message));
            }
        }

        if (schema.constValue() != null) {
            boolean match = NodeValues.equal(node, schema.constValue());
            result.enumValues = List.of(schema.constValue());
            result.enumValueMatch = match;
            if (!match) {
                String message = schema.errorMessage();
                if (message == null) {
                    message = String.format("Value must be %s.", NodeValues.toJson(schema.constValue()));
                }
                result.problems.add(Problem.error(anchorStart(node), anchorEnd(node), message));
            }
        }

        if (schema.deprecationMessage() != null && node.parent() instanceof Syntax.Node.Prop prop) {
            result.problems.add(Problem.warning(prop.start(), prop.end(), schema.deprecationMessage()));
        }
    }

    private void testAlternatives(
            Syntax.Node node,
            JsonSchema combinator,
            String keyword,
            List<JsonSchema> alternatives,
            boolean maxOneMatch,
            Validation result,
            Collector collector
    ) {
        int size = alternatives.size();
        List<Validation> validations = new ArrayList<>(size);
        List<Collector> collectors = new ArrayList<>(size);
        Set<Integer> selected = new LinkedHashSet<>();
        Validation best = null;
        int matches = 0;

        for (int i = 0; i < size; i++) {
            Validation sub = new Validation();
            Collector subCollector = new Collector();
            validate(node, alternatives.get(i), sub, subCollector);
            validations.add(sub);
            collectors.add(subCollector);
            if (!sub.hasProblems()) {
                matches++;
            }

            if (best == null) {
                best = sub;
                selected.add(i);
            } else if (!maxOneMatch && !sub.hasProblems() && !best.hasProblems()) {
                // Both match without problems, so they are equally good
                selected.add(i);
                best.propertiesMatches += sub.propertiesMatches;
                best.propertiesValueMatches += sub.propertiesValueMatches;
            } else {
                int compare = sub.compare(best);
                if (compare > 0) {
                    best = sub;
                    selected.clear();
                    selected.add(i);
                } else if (compare == 0) {
                    selected.add(i);
                    best.mergeEnumValues(sub);
                }
            }
        }

        if (matches > 1 && maxOneMatch) {
            result.problems.add(Problem.warning(node.start(), node.start() + 1,
                    "Matches multiple schemas when only one must validate."));
        }
        if (best != null) {
            result.merge(best);
            result.propertiesMatches += best.propertiesMatches;
            result.propertiesValueMatches += best.propertiesValueMatches;
        }
        for (int i = 0; i < size; i++) {
            MatchResult.Branch branch = new MatchResult.Branch(
                    combinator, keyword, i, size, !validations.get(i).hasProblems());
            for (MatchResult match : collectors.get(i).matches) {
                collector.add(match.within(branch, selected.contains(i)));
            }
        }
    }

    private void validateObject(Syntax.Node.Obj obj, JsonSchema schema, Validation result, Collector collector) {
        Map<String, Syntax.Node.Prop> seen = new LinkedHashMap<>();
        for (Syntax.Node.Prop prop : obj.properties()) {
            seen.remove(prop.key().value());
            seen.put(prop.key().value(), prop);
        }
        List<String> unprocessed = new ArrayList<>(seen.keySet());

        for (String name : schema.required()) {
            if (!seen.containsKey(name)) {
                result.problems.add(Problem.error(objectAnchorStart(obj), objectAnchorEnd(obj),
                        String.format("Missing property \"%s\".", name)));
            }
        }

        schema.properties().forEach((name, propertySchema) -> {
            unprocessed.remove(name);
            Syntax.Node.Prop prop = seen.get(name);
            if (prop != null) {
                validateProperty(prop, propertySchema, result, collector);
            }
        });

        schema.patternProperties().forEach((regex, propertySchema) -> {
            Pattern pattern = compile(regex);
            if (pattern == null) {
                return;
            }
            for (String name : new ArrayList<>(unprocessed)) {
                if (pattern.matcher(name).find()) {
                    unprocessed.remove(name);
                    validateProperty(seen.get(name), propertySchema, result, collector);
                }
            }
        });

        JsonSchema additional = schema.additionalProperties();
        if (additional != null) {
            for (String name : unprocessed) {
                validateProperty(seen.get(name), additional, result, collector);
            }
        }

        Integer maxProperties = schema.maxProperties();
        if (maxProperties != null && seen.size() > maxProperties) {
            result.problems.add(Problem.error(obj.start(), obj.end(),
                    String.format("Object has more properties than limit of %d.", maxProperties)));
        }
        Integer minProperties = schema.minProperties();
        if (minProperties != null && seen.size() < minProperties) {
            result.problems.add(Problem.error(obj.start(), obj.end(),
                    String.format("Object has fewer properties than the required number of %d", minProperties)));
        }

        schema.dependentRequired().forEach((name, requiredNames) -> {
            if (seen.containsKey(name)) {
                for (String requiredName : requiredNames) {
                    if (!seen.containsKey(requiredName)) {
                        result.problems.add(Problem.error(obj.start(), obj.end(),
                                String.format("Object is missing property %s required by property %s.",
                                        requiredName, name)));
                    } else {
                        result.propertiesValueMatches++;
                    }
                }
            }
        });
        schema.dependentSchemas().forEach((name, dependentSchema) -> {
            if (seen.containsKey(name)) {
                Validation sub = new Validation();
                validate(obj, dependentSchema, sub, collector);
                result.mergePropertyMatch(sub);
            }
        });
    }

    private void validateProperty(Syntax.Node.Prop prop, JsonSchema raw, Validation result, Collector collector) {
        JsonSchema resolved = schema.resolve(raw);
        if (resolved != null && resolved.isBoolean()) {
            if (resolved.isFalse()) {
                result.problems.add(Problem.error(prop.key().start(), prop.key().end(),
                        String.format("Property %s is not allowed.", prop.key().value())));
            } else {
                result.propertiesMatches++;
                result.propertiesValueMatches++;
            }
            return;
        }
        Validation sub = new Validation();
        validate(prop.value(), raw, sub, collector);
        result.mergePropertyMatch(sub);
    }

    private void validateArray(Syntax.Node.Arr arr, JsonSchema schema, Validation result, Collector collector) {
        List<Syntax.Node> items = arr.items();
        List<JsonSchema> tuple = schema.tupleItems();
        if (tuple != null) {
            for (int i = 0; i < tuple.size(); i++) {
                if (i < items.size()) {
                    Validation sub = new Validation();
                    validate(items.get(i), tuple.get(i), sub, collector);
                    result.mergePropertyMatch(sub);
                } else if (items.size() >= tuple.size()) {
                    result.propertiesValueMatches++;
                }
            }
            if (items.size() > tuple.size()) {
                JsonSchema additional = this.schema.resolve(schema.additionalItems());
                if (additional != null && additional.isFalse()) {
                    result.problems.add(Problem.error(arr.start(), arr.end(), String.format(
                            "Array has too many items according to schema. Expected %d or fewer.", tuple.size())));
                } else if (additional != null) {
                    for (int i = tuple.size(); i < items.size(); i++) {
                        Validation sub = new Validation();
                        validate(items.get(i), schema.additionalItems(), sub, collector);
                        result.mergePropertyMatch(sub);
                    }
                }
            }
        } else if (schema.items() != null) {
            for (Syntax.Node item : items) {
                Validation sub = new Validation();
                validate(item, schema.items(), sub, collector);
                result.mergePropertyMatch(sub);
            }
        }

        Integer minItems = schema.minItems();
        if (minItems != null && items.size() < minItems) {
            result.problems.add(Problem.error(arr.start(), arr.end(),
                    String.format("Array has too few items. Expected %d or more.", minItems)));
        }
        Integer maxItems = schema.maxItems();
        if (maxItems != null && items.size() > maxItems) {
            result.problems.add(Problem.error(arr.start(), arr.end(),
                    String.format("Array has too many items. Expected %d or fewer.", maxItems)));
        }
        if (schema.uniqueItems()) {
            List<Node> values = new ArrayList<>();
            for (Syntax.Node item : items) {
                values.add(NodeValues.toNode(item));
            }
            outer:
            for (int i = 0; i < values.size(); i++) {
                for (int j = i + 1; j < values.size(); j++) {
                    if (NodeValues.equal(values.get(i), values.get(j))) {
                        result.problems.add(Problem.error(arr.start(), arr.end(), "Array has duplicate items."));
                        break outer;
                    }
                }
            }
        }
    }

    private void validateString(Syntax.Node.Str str, JsonSchema schema, Validation result) {
        int length = str.value().codePointCount(0, str.value().length());
        Integer minLength = schema.minLength();
        if (minLength != null && length < minLength) {
            result.problems.add(Problem.error(str.start(), str.end(),
                    String.format("String is shorter than the minimum length of %d.", minLength)));
        }
        Integer maxLength = schema.maxLength();
        if (maxLength != null && length > maxLength) {
            result.problems.add(Problem.error(str.start(), str.end(),
                    String.format("String is longer than the maximum length of %d.", maxLength)));
        }
        Pattern pattern = schema.pattern();
        if (pattern != null && !pattern.matcher(str.value()).find()) {
            String message = schema.patternErrorMessage();
            if (message == null) {
                message = schema.errorMessage();
            }
            if (message == null) {
                message = String.format("String does not match the pattern of \"%s\".", schema.patternString());
            }
            result.problems.add(Problem.error(str.start(), str.end(), message));
        }
    }

    private void validateNumber(Syntax.Node.Num num, JsonSchema schema, Validation result) {
        double value = num.value().doubleValue();
        Double multipleOf = schema.multipleOf();
        if (multipleOf != null && multipleOf != 0 && Double.isFinite(value)) {
            BigDecimal remainder = new BigDecimal(num.value().toString())
                    .remainder(BigDecimal.valueOf(multipleOf));
            if (remainder.signum() != 0) {
                result.problems.add(Problem.error(num.start(), num.end(),
                        String.format("Value is not divisible by %s.", NodeValues.formatNumber(multipleOf))));
            }
        }

        Double exclusiveMinimum = schema.exclusiveMinimum();
        Double minimum = schema.minimum();
        if (exclusiveMinimum != null && value <= exclusiveMinimum) {
            result.problems.add(Problem.error(num.start(), num.end(), String.format(
                    "Value is below the exclusive minimum of %s.", NodeValues.formatNumber(exclusiveMinimum))));
        } else if (exclusiveMinimum == null && minimum != null && value < minimum) {
            result.problems.add(Problem.error(num.start(), num.end(), String.format(
                    "Value is below the minimum of %s.", NodeValues.formatNumber(minimum))));
        }

        Double exclusiveMaximum = schema.exclusiveMaximum();
        Double maximum = schema.maximum();
        if (exclusiveMaximum != null && value >= exclusiveMaximum) {
            result.problems.add(Problem.error(num.start(), num.end(), String.format(
                    "Value is above the exclusive maximum of %s.", NodeValues.formatNumber(exclusiveMaximum))));
        } else if (exclusiveMaximum == null && maximum != null && value > maximum) {
            result.problems.add(Problem.error(num.start(), num.end(), String.format(
                    "Value is above the maximum of %s.", NodeValues.formatNumber(maximum))));
        }
    }

    private static boolean matchesType(Syntax.Node node, String type) {
        if (node.type().jsonType().equals(type)) {
            return true;
        }
        if (type.equals("integer") && node instanceof Syntax.Node.Num num) {
            return num.isIntegral();
        }
        return false;
    }

    // Values the parser filled in have no extent, so point at their key instead
    private static int anchorStart(Syntax.Node node) {
        if (node.length() == 0 && node.parent() instanceof Syntax.Node.Prop prop) {
            return prop.key().start();
        }
        return node.start();
    }

    private static int anchorEnd(Syntax.Node node) {
        if (node.length() == 0 && node.parent() instanceof Syntax.Node.Prop prop) {
            return prop.key().end();
        }
        return node.end();
    }

    private static int objectAnchorStart(Syntax.Node.Obj obj) {
        if (obj.parent() instanceof Syntax.Node.Prop prop) {
            return prop.key().start();
        }
        return obj.start();
    }

    private static int objectAnchorEnd(Syntax.Node.Obj obj) {
        if (obj.parent() instanceof Syntax.Node.Prop prop) {
            return prop.key().end();
        }
        return obj.start() + 1;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            LOGGER.fine(() -> "Ignoring invalid pattern property: " + regex);
            return null;
        }
    }

    private static final class Collector {
        private final List<MatchResult> matches = new ArrayList<>();

        void add(MatchResult match) {
            matches.add(match);
        }

        void merge(Collector other) {
            matches.addAll(other.matches);
        }
    }

    private static final class Validation {
        private final List<Problem> problems = new ArrayList<>();
        private int propertiesMatches;
        private int propertiesValueMatches;
        private int primaryValueMatches;
        private boolean enumValueMatch;
        private List<Node> enumValues;

        boolean hasProblems() {
            return !problems.isEmpty();
        }

        void merge(Validation other) {
            problems.addAll(other.problems);
        }

        void mergeEnumValues(Validation other) {
            if (!enumValueMatch && !other.enumValueMatch && enumValues != null && other.enumValues != null) {
                List<Node> combined = new ArrayList<>(enumValues);
                combined.addAll(other.enumValues);
                enumValues = combined;
            }
        }

        void mergePropertyMatch(Validation property) {
            merge(property);
            propertiesMatches++;
            if (property.enumValueMatch || (!property.hasProblems() && property.propertiesMatches > 0)) {
                propertiesValueMatches++;
            }
            if (property.enumValueMatch && property.enumValues != null && property.enumValues.size() == 1) {
                primaryValueMatches++;
            }
        }

        int compare(Validation other) {
            if (hasProblems() != other.hasProblems()) {
                return hasProblems() ? -1 : 1;
            }
            if (enumValueMatch != other.enumValueMatch) {
                return other.enumValueMatch ? -1 : 1;
            }
            if (primaryValueMatches != other.primaryValueMatches) {
                return primaryValueMatches - other.primaryValueMatches;
            }
            if (propertiesValueMatches != other.propertiesValueMatches) {
                return propertiesValueMatches - other.propertiesValueMatches;
            }
            return propertiesMatches - other.propertiesMatches;
        }
    }
}

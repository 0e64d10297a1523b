/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.util.List;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.syntax.Syntax;

public class SchemaMatcherTest {
    @Test
    public void validDocumentHasNoProblems() {
        MatchingSchemas result = match("""
                {
                    "type": "object",
                    "required": ["name"],
                    "properties": {
                        "name": {"type": "string"},
                        "port": {"type": "integer", "minimum": 1},
                        "tags": {"type": "array", "items": {"type": "string"}}
                    }
                }
                """, "name: api\nport: 8080\ntags:\n  - a\n  - b\n");

        assertThat(result.problems(), empty());
    }

    @Test
    public void incorrectType() {
        MatchingSchemas result = match("{\"properties\": {\"port\": {\"type\": \"integer\"}}}", "port: abc");

        assertThat(result.problems(), contains(Problem.error(6, 9, "Incorrect type. Expected \"integer\".")));
    }

    @Test
    public void incorrectTypeWithSeveralTypes() {
        MatchingSchemas result = match("{\"properties\": {\"a\": {\"type\": [\"string\", \"boolean\"]}}}", "a: 1");

        assertThat(messages(result), contains("Incorrect type. Expected one of string, boolean."));
    }

    @Test
    public void numbersWithFractionOrExponentAreNotIntegers() {
        String schema = "{\"properties\": {\"a\": {\"type\": \"integer\"}}}";

        assertThat(messages(match(schema, "a: 2.0")), contains("Incorrect type. Expected \"integer\"."));
        assertThat(messages(match(schema, "a: 1e3")), contains("Incorrect type. Expected \"integer\"."));
        assertThat(match(schema, "a: 0x1F").problems(), empty());
        assertThat(match(schema, "a: 2.0").problems().get(0).severity(), equalTo(DiagnosticSeverity.Error));
    }

    @Test
    public void missingPropertyAtRoot() {
        MatchingSchemas result = match("{\"required\": [\"name\"]}", "other: 1\n");

        assertThat(result.problems(), contains(Problem.error(0, 1, "Missing property \"name\".")));
    }

    @Test
    public void missingPropertyIsReportedOnParentKey() {
        MatchingSchemas result = match("""
                {"properties": {"meta": {"type": "object", "required": ["id"]}}}
                """, "meta:\n  x: 1\n");

        assertThat(result.problems(), contains(Problem.error(0, 4, "Missing property \"id\".")));
    }

    @Test
    public void additionalPropertiesNotAllowed() {
        MatchingSchemas result = match("""
                {"properties": {"a": {}}, "additionalProperties": false}
                """, "a: 1\nb: 2\n");

        assertThat(result.problems(), contains(Problem.error(5, 6, "Property b is not allowed.")));
    }

    @Test
    public void additionalPropertiesAreValidated() {
        MatchingSchemas result = match("{\"additionalProperties\": {\"type\": \"string\"}}", "a: x\nb: 2\n");

        assertThat(messages(result), contains("Incorrect type. Expected \"string\"."));
    }

    @Test
    public void patternProperties() {
        MatchingSchemas result = match("""
                {
                    "patternProperties": {"^x-": {"type": "string"}},
                    "additionalProperties": false
                }
                """, "x-one: a\nx-two: 2\nother: 3\n");

        assertThat(messages(result), containsInAnyOrder(
                "Incorrect type. Expected \"string\".",
                "Property other is not allowed."));
    }

    @Test
    public void enumValues() {
        MatchingSchemas result = match(
                "{\"properties\": {\"level\": {\"enum\": [\"debug\", \"info\"]}}}", "level: loud");

        assertThat(messages(result), contains("Value is not accepted. Valid values: \"debug\", \"info\"."));
    }

    @Test
    public void enumValuesMatchScalarTypes() {
        MatchingSchemas result = match("{\"properties\": {\"a\": {\"enum\": [1, true, null]}}}", "a: true");

        assertThat(result.problems(), empty());
    }

    @Test
    public void constValue() {
        MatchingSchemas result = match("{\"properties\": {\"v\": {\"const\": 2}}}", "v: 3");

        assertThat(messages(result), contains("Value must be 2."));
    }

    @Test
    public void customErrorMessage() {
        MatchingSchemas result = match("""
                {"properties": {"v": {"type": "string", "errorMessage": "Give v a name"}}}
                """, "v: 3");

        assertThat(messages(result), contains("Give v a name"));
    }

    @Test
    public void emptyValueIsReportedOnItsKey() {
        MatchingSchemas result = match("{\"properties\": {\"name\": {\"type\": \"string\"}}}", "name:\n");

        assertThat(result.problems(), contains(Problem.error(0, 4, "Incorrect type. Expected \"string\".")));
    }

    @Test
    public void oneOfMatchingSeveralSchemas() {
        MatchingSchemas result = match("""
                {
                    "oneOf": [
                        {"properties": {"a": {"type": "integer"}}},
                        {"properties": {"a": {"type": "number"}}}
                    ]
                }
                """, "a: 1");

        assertThat(messages(result), contains("Matches multiple schemas when only one must validate."));
        assertThat(result.problems().get(0).severity(), equalTo(DiagnosticSeverity.Warning));
    }

    @Test
    public void anyOfReportsBestAlternative() {
        MatchingSchemas result = match("""
                {
                    "anyOf": [
                        {"type": "object", "required": ["a", "b"], "properties": {"a": {"const": 1}}},
                        {"type": "string"}
                    ]
                }
                """, "a: 1");

        assertThat(messages(result), contains("Missing property \"b\"."));
    }

    @Test
    public void combinatorValidity() {
        String text = "a: 1";
        Syntax.Node root = parse(text);
        ResolvedSchema schema = schema("""
                {"anyOf": [{"required": ["a"]}, {"required": ["b"]}]}
                """);

        MatchingSchemas result = SchemaMatcher.match(root, schema);

        assertThat(result.problems(), empty());
        assertThat(result.combinatorsFor(root).values(), contains(false));
    }

    @Test
    public void notSchema() {
        MatchingSchemas result = match("{\"properties\": {\"a\": {\"not\": {\"type\": \"string\"}}}}", "a: x");

        assertThat(messages(result), contains("Matches a schema that is not allowed."));
    }

    @Test
    public void falseSchema() {
        MatchingSchemas result = match("{\"properties\": {\"a\": {\"items\": false}}}", "a:\n  - 1\n");

        assertThat(messages(result), contains("Matches a schema that is not allowed."));
    }

    @Test
    public void deprecatedProperty() {
        MatchingSchemas result = match("""
                {"properties": {"old": {"deprecationMessage": "Use new instead"}}}
                """, "old: 1");

        assertThat(result.problems(), hasSize(1));
        assertThat(result.problems().get(0).message(), equalTo("Use new instead"));
        assertThat(result.problems().get(0).severity(), equalTo(DiagnosticSeverity.Warning));
        assertThat(result.problems().get(0).start(), equalTo(0));
    }

    @Test
    public void numberBounds() {
        MatchingSchemas result = match("""
                {
                    "properties": {
                        "low": {"minimum": 5},
                        "high": {"exclusiveMaximum": 10},
                        "odd": {"multipleOf": 2}
                    }
                }
                """, "low: 3\nhigh: 10\nodd: 3\n");

        assertThat(messages(result), containsInAnyOrder(
                "Value is below the minimum of 5.",
                "Value is above the exclusive maximum of 10.",
                "Value is not divisible by 2."));
    }

    @Test
    public void stringConstraints() {
        MatchingSchemas result = match("""
                {
                    "properties": {
                        "short": {"minLength": 3},
                        "named": {"pattern": "^a"},
                        "custom": {"pattern": "^b", "patternErrorMessage": "Must start with b"}
                    }
                }
                """, "short: ab\nnamed: xyz\ncustom: xyz\n");

        assertThat(messages(result), containsInAnyOrder(
                "String is shorter than the minimum length of 3.",
                "String does not match the pattern of \"^a\".",
                "Must start with b"));
    }

    @Test
    public void arrayConstraints() {
        MatchingSchemas result = match("""
                {
                    "properties": {
                        "few": {"minItems": 2},
                        "same": {"uniqueItems": true},
                        "ints": {"items": {"type": "integer"}}
                    }
                }
                """, "few: [1]\nsame: [a, a]\nints: [1, x]\n");

        assertThat(messages(result), containsInAnyOrder(
                "Array has too few items. Expected 2 or more.",
                "Array has duplicate items.",
                "Incorrect type. Expected \"integer\"."));
    }

    @Test
    public void tupleItems() {
        MatchingSchemas result = match("""
                {"items": [{"type": "string"}, {"type": "integer"}], "additionalItems": false}
                """, "- a\n- 1\n- extra\n");

        assertThat(messages(result), contains("Array has too many items according to schema. Expected 2 or fewer."));
    }

    @Test
    public void dependentRequired() {
        MatchingSchemas result = match("{\"dependentRequired\": {\"a\": [\"b\"]}}", "a: 1\n");

        assertThat(messages(result), contains("Object is missing property b required by property a."));
    }

    @Test
    public void ifThenElseChoosesBranch() {
        String schema = """
                {
                    "properties": {"kind": {"type": "string"}},
                    "if": {"properties": {"kind": {"const": "a"}}},
                    "then": {"required": ["x"]},
                    "else": {"required": ["y"]}
                }
                """;

        assertThat(messages(match(schema, "kind: a\n")), contains("Missing property \"x\"."));
        assertThat(messages(match(schema, "kind: b\n")), contains("Missing property \"y\"."));
    }

    @Test
    public void ifConditionContributesNoMatches() {
        String text = "kind: a\nx: 1\n";
        Syntax.Node root = parse(text);
        ResolvedSchema schema = schema("""
                {
                    "properties": {"kind": {"type": "string"}, "x": {"description": "An x"}},
                    "if": {"properties": {"kind": {"const": "a", "description": "Only in the condition"}}},
                    "then": {"properties": {"x": {"title": "X when a"}}}
                }
                """);

        MatchingSchemas result = SchemaMatcher.match(root, schema);
        Syntax.Node.Obj obj = (Syntax.Node.Obj) root;
        Syntax.Node kindValue = obj.getProperty("kind").value();
        Syntax.Node xValue = obj.getProperty("x").value();

        List<String> kindDescriptions = result.schemasFor(kindValue).stream()
                .map(JsonSchema::description)
                .collect(Collectors.toList());
        assertThat(kindDescriptions, not(hasItem("Only in the condition")));
        List<String> xTitles = result.schemasFor(xValue).stream()
                .map(JsonSchema::title)
                .collect(Collectors.toList());
        assertThat(xTitles, hasItem("X when a"));
    }

    @Test
    public void nestedConditionOnlySeesItsOwnObject() {
        MatchingSchemas result = match("""
                {
                    "properties": {
                        "kind": {"type": "string"},
                        "spec": {
                            "type": "object",
                            "if": {"required": ["kind"]},
                            "then": {"required": ["a"]},
                            "else": {"required": ["b"]}
                        }
                    }
                }
                """, "kind: x\nspec:\n  c: 1\n");

        assertThat(result.problems(), contains(Problem.error(8, 12, "Missing property \"b\".")));
    }

    @Test
    public void recursiveSchemas() {
        MatchingSchemas result = match("""
                {
                    "definitions": {
                        "tree": {
                            "type": "object",
                            "properties": {"name": {"type": "string"}, "child": {"$ref": "#/definitions/tree"}}
                        }
                    },
                    "$ref": "#/definitions/tree"
                }
                """, "name: a\nchild:\n  name: b\n  child:\n    name: 3\n");

        assertThat(result.problems(), contains(Problem.error(44, 45, "Incorrect type. Expected \"string\".")));
    }

    @Test
    public void unresolvedReferencesAreCollected() {
        MatchingSchemas result = match("""
                {"properties": {"a": {"$ref": "#/definitions/missing"}}}
                """, "a: 1");

        assertThat(result.problems(), empty());
        assertThat(result.errors(), hasSize(1));
        assertThat(result.errors().get(0).kind(), equalTo(SchemaError.Kind.REF));
    }

    @Test
    public void nothingToMatch() {
        assertThat(SchemaMatcher.match(null, schema("{}")).matches(), empty());
        assertThat(SchemaMatcher.match(parse("a: 1"), null).problems(), empty());
    }

    @Test
    public void matchesCoverEveryValidatedNode() {
        Syntax.Node root = parse("a:\n  b: 1\n");
        MatchingSchemas result = SchemaMatcher.match(root, schema("""
                {"properties": {"a": {"properties": {"b": {"type": "integer"}}}}}
                """));

        Syntax.Node a = ((Syntax.Node.Obj) root).getProperty("a").value();
        Syntax.Node b = ((Syntax.Node.Obj) a).getProperty("b").value();
        assertThat(result.matchesFor(root).isEmpty(), is(false));
        assertThat(result.schemasFor(b).get(0).types(), contains("integer"));
    }

    private static MatchingSchemas match(String schema, String yaml) {
        return SchemaMatcher.match(parse(yaml), schema(schema));
    }

    private static ResolvedSchema schema(String json) {
        return ResolvedSchema.of("https://example.com/schema.json", Node.parse(json));
    }

    private static Syntax.Node parse(String yaml) {
        return Syntax.parse(yaml).documents().get(0).root();
    }

    private static List<String> messages(MatchingSchemas result) {
        return result.problems().stream().map(Problem::message).collect(Collectors.toList());
    }
}

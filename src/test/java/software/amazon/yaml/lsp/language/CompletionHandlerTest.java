/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static software.amazon.yaml.lsp.LspMatchers.hasLabel;
import static software.amazon.yaml.lsp.LspMatchers.hasLabelAndEditText;
import static software.amazon.yaml.lsp.LspMatchers.makesEditedDocument;

import java.util.List;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.TextWithPositions;
import software.amazon.yaml.lsp.document.Document;
import software.amazon.yaml.lsp.schema.ResolvedSchema;

public class CompletionHandlerTest {
    private static final String URI = "file:///workspace/app.yaml";
    private static final ResolvedSchema SCHEMA = ResolvedSchema.of("https://example.com/app.json", Node.parse("""
            {
                "type": "object",
                "properties": {
                    "name": {"type": "string", "description": "The name"},
                    "replicas": {"type": "integer", "default": 1},
                    "mode": {"enum": ["fast", "slow"], "enumDescriptions": ["Quick", "Careful"]},
                    "enabled": {"type": "boolean"},
                    "meta": {
                        "type": "object",
                        "required": ["id"],
                        "properties": {"id": {"type": "string"}, "extra": {"type": "string"}}
                    },
                    "ports": {"type": "array", "items": {"type": "integer"}},
                    "tags": {"type": "array", "items": {"enum": ["a", "b"]}},
                    "old": {"type": "string", "deprecationMessage": "Gone"},
                    "hidden": {"doNotSuggest": true}
                }
            }
            """));

    private static final ResolvedSchema EXPRESSIONS = ResolvedSchema.of("https://example.com/expr.json", Node.parse("""
            {
                "properties": {
                    "expr": {
                        "type": "string",
                        "inlineObject": true,
                        "properties": {
                            "spec": {
                                "properties": {
                                    "template": {"properties": {"metadata": {}}},
                                    "replicas": {"type": "integer"}
                                }
                            },
                            "containers": {
                                "type": "array",
                                "items": {"properties": {"name": {}, "image": {}}}
                            }
                        }
                    }
                }
            }
            """));

    @Test
    public void completesPropertiesWithValueSkeletons() {
        List<CompletionItem> items = complete("na%");

        assertThat(items, hasItems(
                hasLabelAndEditText("name", "name: $1"),
                hasLabelAndEditText("replicas", "replicas: ${1:1}"),
                hasLabelAndEditText("mode", "mode: $1"),
                hasLabelAndEditText("meta", "meta:\n  id: $1"),
                hasLabelAndEditText("ports", "ports:\n  - $1")));
    }

    @Test
    public void propertiesComeFirstInDeclarationOrder() {
        List<CompletionItem> items = complete("na%");

        List<String> labels = items.stream().map(CompletionItem::getLabel).collect(Collectors.toList());
        assertThat(labels.subList(0, 7), contains("name", "replicas", "mode", "enabled", "meta", "ports", "tags"));
        assertThat(items.get(0).getKind(), equalTo(CompletionItemKind.Property));
        assertThat(items.get(0).getDocumentation().getLeft(), equalTo("The name"));
    }

    @Test
    public void skipsDeprecatedAndHiddenProperties() {
        List<CompletionItem> items = complete("na%");

        assertThat(items, not(hasItem(hasLabel("old"))));
        assertThat(items, not(hasItem(hasLabel("hidden"))));
    }

    @Test
    public void skipsExistingProperties() {
        List<CompletionItem> items = complete("name: x\nre%");

        assertThat(items, not(hasItem(hasLabel("name"))));
        assertThat(items, hasItem(hasLabel("replicas")));
    }

    @Test
    public void replacesKeyWithoutValueWhenColonExists() {
        TextWithPositions text = TextWithPositions.from("na%m: x\n");
        List<CompletionItem> items = new CompletionHandler(URI, SCHEMA, "  ", false)
                .handle(text.text(), text.offset(0), false);

        CompletionItem name = items.stream().filter(item -> item.getLabel().equals("name")).findFirst().get();
        assertThat(name.getTextEdit().getLeft(), makesEditedDocument(Document.of(text.text()), "name: x\n"));
    }

    @Test
    public void completesNestedProperties() {
        List<CompletionItem> items = complete("meta:\n  ex%");

        assertThat(items, hasItems(hasLabel("id"), hasLabel("extra")));
        assertThat(items, not(hasItem(hasLabel("name"))));
    }

    @Test
    public void completesOnBlankLine() {
        TextWithPositions text = TextWithPositions.from("meta:\n  id: a\n  %");
        List<CompletionItem> items = new CompletionHandler(URI, SCHEMA, "  ", false)
                .handle(text.text(), text.offset(0), false);

        CompletionItem extra = items.stream().filter(item -> item.getLabel().equals("extra")).findFirst().get();
        assertThat(extra.getTextEdit().getLeft(),
                makesEditedDocument(Document.of(text.text()), "meta:\n  id: a\n  extra: $1"));
        assertThat(items, not(hasItem(hasLabel("id"))));
    }

    @Test
    public void completesEnumValues() {
        List<CompletionItem> items = complete("mode: %");

        assertThat(items, contains(hasLabelAndEditText("fast", "fast"), hasLabelAndEditText("slow", "slow")));
        assertThat(items.get(0).getKind(), equalTo(CompletionItemKind.Value));
        assertThat(items.get(0).getDocumentation().getRight().getValue(), equalTo("Quick"));
    }

    @Test
    public void separatesValueFromColon() {
        List<CompletionItem> items = complete("mode:%");

        assertThat(items, hasItem(hasLabelAndEditText("fast", " fast")));
    }

    @Test
    public void replacesPartialValue() {
        TextWithPositions text = TextWithPositions.from("mode: fa%\n");
        List<CompletionItem> items = new CompletionHandler(URI, SCHEMA, "  ", false)
                .handle(text.text(), text.offset(0), false);

        assertThat(items.get(0).getTextEdit().getLeft(), makesEditedDocument(Document.of(text.text()), "mode: fast\n"));
    }

    @Test
    public void completesBooleansAndDefaults() {
        assertThat(complete("enabled: %"), contains(hasLabel("true"), hasLabel("false")));
        assertThat(complete("replicas: %"), contains(hasLabel("1")));
    }

    @Test
    public void completesArrayItemValues() {
        List<CompletionItem> items = complete("tags:\n  - %");

        assertThat(items, hasItems(hasLabel("a"), hasLabel("b")));
    }

    @Test
    public void retriesOnNewLineAfterObjectKey() {
        List<CompletionItem> items = complete("meta:%");

        assertThat(items, hasItem(hasLabelAndEditText("id", "\n  id: $1")));
        assertThat(items, not(hasItem(hasLabel("deployment"))));
    }

    @Test
    public void usesConfiguredIndentation() {
        TextWithPositions text = TextWithPositions.from("meta:%");
        List<CompletionItem> items = new CompletionHandler(URI, SCHEMA, "    ", false)
                .handle(text.text(), text.offset(0), false);

        assertThat(items, hasItem(hasLabelAndEditText("id", "\n    id: $1")));
    }

    @Test
    public void sortsAlphabeticallyWhenConfigured() {
        TextWithPositions text = TextWithPositions.from("na%");
        List<CompletionItem> items = new CompletionHandler(URI, SCHEMA, "  ", true)
                .handle(text.text(), text.offset(0), false);

        List<String> labels = items.stream().map(CompletionItem::getLabel).collect(Collectors.toList());
        assertThat(labels.subList(0, 7), contains("enabled", "meta", "mode", "name", "ports", "replicas", "tags"));
    }

    @Test
    public void offersStaticSnippetsAfterProperties() {
        List<CompletionItem> items = complete("na%");

        CompletionItem last = items.get(items.size() - 1);
        assertThat(last.getDetail(), equalTo(StaticSnippets.DETAIL));
        assertThat(last.getSortText(), startsWith("2"));
    }

    @Test
    public void staticSnippetsUseFileName() {
        TextWithPositions text = TextWithPositions.from("%");
        List<CompletionItem> items = new CompletionHandler(URI, null, "  ", false)
                .handle(text.text(), text.offset(0), false);

        CompletionItem deployment = items.stream()
                .filter(item -> item.getLabel().equals("deployment"))
                .findFirst()
                .get();
        assertThat(deployment.getKind(), equalTo(CompletionItemKind.Snippet));
        assertThat(deployment.getTextEdit().getLeft().getNewText(), containsString("name: app"));
    }

    @Test
    public void defaultSnippets() {
        ResolvedSchema schema = ResolvedSchema.of("https://example.com/s.json", Node.parse("""
                {
                    "properties": {"a": {"type": "string"}},
                    "defaultSnippets": [{"label": "starter", "description": "A start", "body": {"a": "${1:value}"}}]
                }
                """));
        TextWithPositions text = TextWithPositions.from("x%");

        List<CompletionItem> items = new CompletionHandler(URI, schema, "  ", false)
                .handle(text.text(), text.offset(0), false);

        assertThat(items, hasItem(hasLabelAndEditText("starter", "a: ${1:value}")));
    }

    @Test
    public void completesKubernetesKeys() {
        List<CompletionItem> items = completeKubernetes("apiVersion: v1\nkind: Pod\nsp%");

        assertThat(items, hasItems(hasLabelAndEditText("spec", "spec: $1"), hasLabel("metadata")));
        assertThat(items, not(hasItem(hasLabel("kind"))));
        CompletionItem spec = items.stream().filter(item -> item.getLabel().equals("spec")).findFirst().get();
        assertThat(spec.getDetail(), equalTo("io.k8s.api.core.v1.Pod"));
    }

    @Test
    public void completesKubernetesChildKeys() {
        List<CompletionItem> items = completeKubernetes("spec:\n  containers:\n    - im%");

        assertThat(items, hasItems(hasLabel("image"), hasLabel("name")));
    }

    @Test
    public void completesKubernetesValues() {
        List<CompletionItem> items = completeKubernetes("kind: %");

        assertThat(items, contains(hasLabel("Pod")));
    }

    @Test
    public void anyOfBranchesContributeTheirPropertiesOnce() {
        ResolvedSchema schema = ResolvedSchema.of("https://example.com/union.json", Node.parse("""
                {"anyOf": [
                    {"properties": {"a": {"type": "string"}}},
                    {"properties": {"b": {"type": "string"}}}
                ]}
                """));
        List<CompletionItem> items = complete(schema, "%");

        assertThat(labels(items, "a"), equalTo(1L));
        assertThat(labels(items, "b"), equalTo(1L));
    }

    @Test
    public void anyOfBranchesWithRequiredPropertiesAreAllOffered() {
        ResolvedSchema schema = ResolvedSchema.of("https://example.com/union.json", Node.parse("""
                {"anyOf": [
                    {"required": ["a"], "properties": {"a": {"type": "string"}}},
                    {"required": ["b"], "properties": {"b": {"type": "string"}}}
                ]}
                """));
        List<CompletionItem> items = complete(schema, "%");

        assertThat(labels(items, "a"), equalTo(1L));
        assertThat(labels(items, "b"), equalTo(1L));
    }

    @Test
    public void completesExpressionRoots() {
        List<CompletionItem> items = complete(EXPRESSIONS, "expr: %");

        assertThat(items, hasItems(hasLabel("spec"), hasLabel("containers")));
        assertThat(items, not(hasItem(hasLabel("image"))));
    }

    @Test
    public void completesNestedExpressionPaths() {
        TextWithPositions text = TextWithPositions.from("expr: =spec.te%");
        List<CompletionItem> items = new CompletionHandler(URI, EXPRESSIONS, "  ", false)
                .handle(text.text(), text.offset(0), false);

        assertThat(items, hasItems(hasLabel("template"), hasLabel("replicas")));
        assertThat(items, not(hasItem(hasLabel("spec"))));
        CompletionItem template = items.stream()
                .filter(item -> item.getLabel().equals("template"))
                .findFirst()
                .get();
        assertThat(template.getTextEdit().getLeft(),
                makesEditedDocument(Document.of(text.text()), "expr: =spec.template"));
    }

    @Test
    public void bracketPredicatesStepIntoArrayItems() {
        TextWithPositions text = TextWithPositions.from("expr: containers[?name].%");
        List<CompletionItem> items = new CompletionHandler(URI, EXPRESSIONS, "  ", false)
                .handle(text.text(), text.offset(0), false);

        assertThat(items, hasItems(hasLabel("name"), hasLabel("image")));
        assertThat(items, not(hasItem(hasLabel("containers"))));
        CompletionItem image = items.stream().filter(item -> item.getLabel().equals("image")).findFirst().get();
        assertThat(image.getTextEdit().getLeft(),
                makesEditedDocument(Document.of(text.text()), "expr: containers[?name].image"));
    }

    @Test
    public void expressionsIntoUnknownPropertiesCompleteNothing() {
        List<CompletionItem> items = complete(EXPRESSIONS, "expr: =missing.%");

        assertThat(items, not(hasItem(hasLabel("spec"))));
        assertThat(items, not(hasItem(hasLabel("name"))));
    }

    private static List<CompletionItem> complete(String raw) {
        TextWithPositions text = TextWithPositions.from(raw);
        return new CompletionHandler(URI, SCHEMA, "  ", false).handle(text.text(), text.offset(0), false);
    }

    private static List<CompletionItem> complete(ResolvedSchema schema, String raw) {
        TextWithPositions text = TextWithPositions.from(raw);
        return new CompletionHandler(URI, schema, "  ", false).handle(text.text(), text.offset(0), false);
    }

    private static long labels(List<CompletionItem> items, String label) {
        return items.stream().filter(item -> item.getLabel().equals(label)).count();
    }

    private static List<CompletionItem> completeKubernetes(String raw) {
        ResolvedSchema schema = ResolvedSchema.of("https://example.com/k8s.json", Node.parse("""
                {
                    "oneOf": [{"$ref": "#/definitions/io.k8s.api.core.v1.Pod"}],
                    "definitions": {
                        "io.k8s.api.core.v1.Pod": {
                            "properties": {
                                "apiVersion": {"type": "string"},
                                "kind": {"type": "string", "enum": ["Pod"]},
                                "metadata": {"type": "object"},
                                "spec": {"$ref": "#/definitions/podspec"}
                            }
                        },
                        "podspec": {
                            "properties": {
                                "containers": {"type": "array", "items": {"$ref": "#/definitions/container"}}
                            }
                        },
                        "container": {
                            "properties": {"image": {"type": "string"}, "name": {"type": "string"}}
                        }
                    }
                }
                """));
        TextWithPositions text = TextWithPositions.from(raw);
        return new CompletionHandler(URI, schema, "  ", false).handle(text.text(), text.offset(0), true);
    }
}

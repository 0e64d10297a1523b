/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.document.LineIndex;
import software.amazon.yaml.lsp.protocol.LspAdapter;
import software.amazon.yaml.lsp.schema.KubernetesIndex;
import software.amazon.yaml.lsp.schema.MatchingSchemas;
import software.amazon.yaml.lsp.schema.Modeline;
import software.amazon.yaml.lsp.schema.NodeValues;
import software.amazon.yaml.lsp.schema.Problem;
import software.amazon.yaml.lsp.schema.ResolvedSchema;
import software.amazon.yaml.lsp.schema.SchemaError;
import software.amazon.yaml.lsp.schema.SchemaMatcher;
import software.amazon.yaml.lsp.syntax.Syntax;
import software.amazon.yaml.lsp.util.Result;

/**
 * Creates diagnostics for YAML files, from syntax errors and from matching
 * each document against its schema.
 */
public final class YamlDiagnostics {
    public static final String SYNTAX_SOURCE = "YAML";
    public static final String SCHEMA_SOURCE = "yaml-schema";

    private YamlDiagnostics() {
    }

    /**
     * Finds the schema of a single document, if it has one.
     */
    @FunctionalInterface
    public interface SchemaLookup extends
            Function<Syntax.SingleDocument, Optional<Result<ResolvedSchema, SchemaError>>> {
    }

    /**
     * @param parsed The parsed file
     * @param schemas Finds the schema of each document
     * @return The diagnostics of every document, without duplicates
     */
    public static List<Diagnostic> getFileDiagnostics(Syntax.ParsedDocument parsed, SchemaLookup schemas) {
        List<Finding> findings = new ArrayList<>();
        for (Syntax.SingleDocument document : parsed.documents()) {
            addSyntaxFindings(document, findings);
            addSchemaFindings(parsed, document, schemas.apply(document), findings);
        }

        // Alternatives and allOf can find the same problem more than once
        Set<Finding> distinct = new LinkedHashSet<>(findings);
        LineIndex lineIndex = parsed.lineIndex();
        return distinct.stream()
                .map(finding -> finding.toDiagnostic(lineIndex))
                .collect(Collectors.toList());
    }

    private static void addSyntaxFindings(Syntax.SingleDocument document, List<Finding> findings) {
        for (Syntax.Err error : document.errors()) {
            findings.add(new Finding(error.start(), error.end(), error.message(), DiagnosticSeverity.Error,
                    SYNTAX_SOURCE));
        }
        for (Syntax.Err warning : document.warnings()) {
            findings.add(new Finding(warning.start(), warning.end(), warning.message(), DiagnosticSeverity.Warning,
                    SYNTAX_SOURCE));
        }
    }

    private static void addSchemaFindings(
            Syntax.ParsedDocument parsed,
            Syntax.SingleDocument document,
            Optional<Result<ResolvedSchema, SchemaError>> schema,
            List<Finding> findings
    ) {
        if (schema.isEmpty()) {
            return;
        }
        Result<ResolvedSchema, SchemaError> result = schema.get();
        if (result.isErr()) {
            // Without a schema, there is nothing to check nodes against
            findings.add(schemaWarning(parsed, document, result.unwrapErr()));
            return;
        }

        ResolvedSchema resolved = result.unwrap();
        for (SchemaError error : resolved.errors()) {
            findings.add(schemaWarning(parsed, document, error));
        }
        if (document.root() == null) {
            return;
        }

        KubernetesIndex index = document.isKubernetes() ? resolved.kubernetesIndex() : null;
        if (index != null && !index.isEmpty()) {
            addKubernetesFindings(document.root(), index, findings);
            return;
        }

        MatchingSchemas matching = SchemaMatcher.match(document.root(), resolved);
        for (Problem problem : matching.problems()) {
            findings.add(new Finding(problem.start(), problem.end(), problem.message(), problem.severity(),
                    SCHEMA_SOURCE));
        }
        for (SchemaError error : matching.errors()) {
            findings.add(schemaWarning(parsed, document, error));
        }
    }

    // Anchored on the modeline if there is one, otherwise the start of the document
    private static Finding schemaWarning(
            Syntax.ParsedDocument parsed,
            Syntax.SingleDocument document,
            SchemaError error
    ) {
        Optional<Modeline> modeline = Modeline.find(parsed.textOf(document), document.start());
        int start;
        int end;
        if (modeline.isPresent()) {
            start = modeline.get().start();
            end = modeline.get().end();
        } else {
            start = document.start();
            end = Math.min(document.start() + 1, parsed.text().length());
        }
        return new Finding(start, end, error.message(), DiagnosticSeverity.Warning, SCHEMA_SOURCE);
    }

    private static void addKubernetesFindings(Syntax.Node root, KubernetesIndex index, List<Finding> findings) {
        root.consume(node -> {
            if (!(node instanceof Syntax.Node.Obj obj)) {
                return;
            }
            Set<String> allowed = index.allowedKeys(obj);
            for (Syntax.Node.Prop prop : obj.properties()) {
                String key = prop.key().value();
                if (!allowed.isEmpty() && !allowed.contains(key)) {
                    findings.add(new Finding(prop.key().start(), prop.key().end(),
                            String.format("Property %s is not allowed.", key), DiagnosticSeverity.Error,
                            SCHEMA_SOURCE));
                    continue;
                }
                Syntax.Node value = prop.value();
                if (value == null || value instanceof Syntax.Node.Obj || value instanceof Syntax.Node.Arr
                        || value instanceof Syntax.Node.Null) {
                    continue;
                }
                // Only restricted if every place the key appears restricts it
                List<Node> accepted = new ArrayList<>();
                boolean restricted = true;
                for (KubernetesIndex.Entry entry : index.entries(key)) {
                    restricted &= !entry.enumValues().isEmpty();
                    accepted.addAll(entry.enumValues());
                }
                if (restricted && !accepted.isEmpty() && accepted.stream().noneMatch(v -> NodeValues.equal(value, v))) {
                    String valid = accepted.stream().distinct().map(NodeValues::toJson)
                            .collect(Collectors.joining(", "));
                    findings.add(new Finding(value.start(), value.end(),
                            String.format("Value is not accepted. Valid values: %s.", valid),
                            DiagnosticSeverity.Error, SCHEMA_SOURCE));
                }
            }
        });
    }

    private record Finding(int start, int end, String message, DiagnosticSeverity severity, String source) {
        @Override
        public boolean equals(Object o) {
            return o instanceof Finding other
                    && start == other.start
                    && end == other.end
                    && message.equals(other.message);
        }

        @Override
        public int hashCode() {
            return (start * 31 + end) * 31 + message.hashCode();
        }

        Diagnostic toDiagnostic(LineIndex lineIndex) {
            return new Diagnostic(LspAdapter.toRange(lineIndex, start, end), message, severity, source);
        }
    }
}

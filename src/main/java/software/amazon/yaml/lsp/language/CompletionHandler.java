/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.InsertTextFormat;
import org.eclipse.lsp4j.InsertTextMode;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.document.LineIndex;
import software.amazon.yaml.lsp.protocol.LspAdapter;
import software.amazon.yaml.lsp.schema.JsonSchema;
import software.amazon.yaml.lsp.schema.KubernetesIndex;
import software.amazon.yaml.lsp.schema.MatchingSchemas;
import software.amazon.yaml.lsp.schema.ResolvedSchema;
import software.amazon.yaml.lsp.schema.SchemaMatcher;
import software.amazon.yaml.lsp.syntax.CustomTags;
import software.amazon.yaml.lsp.syntax.Syntax;

/**
 * Handles completion requests for YAML documents.
 *
 * <p>The text is first {@link CompletionPatch patched} so the line being
 * typed on parses as a key, then the node at the cursor decides what is
 * completed:
 * <ul>
 *     <li>On a key, the properties the schemas of the enclosing mapping
 *     allow, followed by snippets.</li>
 *     <li>On the value of a key, the values the schemas of the value
 *     suggest, or inline expression paths.</li>
 * </ul>
 * If nothing is found after a {@code key:}, completion is tried again as if
 * the cursor was on a new, indented line.
 */
public final class CompletionHandler {
    private static final Logger LOGGER = Logger.getLogger(CompletionHandler.class.getName());
    private static final Pattern AFTER_KEY = Pattern.compile(":\\s?$");

    private static final String PROPERTY_GROUP = "0";
    private static final String SCHEMA_SNIPPET_GROUP = "1";
    private static final String STATIC_SNIPPET_GROUP = "2";

    private final String uri;
    private final ResolvedSchema schema;
    private final String indentation;
    private final boolean alphabetical;
    private final CustomTags customTags;

    /**
     * @param uri The URI of the document
     * @param schema The schema of the document, or {@code null} if it has none
     * @param indentation One level of indentation
     * @param alphabetical Whether properties are ordered by name rather than
     *                     by declaration order
     */
    public CompletionHandler(String uri, ResolvedSchema schema, String indentation, boolean alphabetical) {
        this(uri, schema, indentation, alphabetical, CustomTags.NONE);
    }

    /**
     * @param uri The URI of the document
     * @param schema The schema of the document, or {@code null} if it has none
     * @param indentation One level of indentation
     * @param alphabetical Whether properties are ordered by name rather than
     *                     by declaration order
     * @param customTags The application specific tags the document may use
     */
    public CompletionHandler(
            String uri,
            ResolvedSchema schema,
            String indentation,
            boolean alphabetical,
            CustomTags customTags
    ) {
        this.uri = uri;
        this.schema = schema;
        this.indentation = indentation;
        this.alphabetical = alphabetical;
        this.customTags = customTags;
    }

    /**
     * @param text The text of the document
     * @param offset The offset of the cursor
     * @param kubernetes Whether the document is associated with a Kubernetes schema
     * @return The completions, properties before snippets
     */
    public List<CompletionItem> handle(String text, int offset, boolean kubernetes) {
        LineIndex lineIndex = LineIndex.of(text);
        CompletionPatch patch = CompletionPatch.patch(text, offset);
        Items items = new Items(lineIndex, patch, "");
        complete(patch, kubernetes, items);

        if (items.isEmpty() && !patch.isPatched() && isAfterKey(text, lineIndex, offset)) {
            String keyIndent = leadingIndent(text, lineIndex, offset);
            String lineIndent = keyIndent + indentation;
            LOGGER.finest(() -> "Retrying completion on a new line");
            CompletionPatch retry = CompletionPatch.newLine(text, offset, lineIndent);
            Items retried = new Items(lineIndex, retry, "\n" + lineIndent);
            complete(retry, kubernetes, retried);
            return retried.toList();
        }
        return items.toList();
    }

    private void complete(CompletionPatch patch, boolean kubernetes, Items items) {
        Syntax.ParsedDocument parsed = Syntax.parse(patch.text(), kubernetes, customTags);
        int lookup = patch.lookupOffset();
        Syntax.SingleDocument document = parsed.documentAt(lookup);
        if (document == null) {
            addStaticSnippets(items, items.range(lookup, lookup), "");
            return;
        }

        Syntax.Node node = document.nodeAt(lookup, true);
        if (node instanceof Syntax.Node.Str key
                && key.parent() instanceof Syntax.Node.Prop prop
                && prop.key() == key
                && prop.parent() instanceof Syntax.Node.Obj parent) {
            completeKey(document, parsed, patch, prop, parent, items);
            return;
        }

        Syntax.Node.Prop valueOf = findValueProperty(document, parsed, lookup);
        if (valueOf != null) {
            completeValue(document, parsed, patch, valueOf, lookup, items);
            return;
        }

        if (document.root() == null) {
            String indent = leadingIndent(patch.text(), parsed.lineIndex(), lookup);
            addStaticSnippets(items, items.range(lookup, lookup), indent);
        }
    }

    private void completeKey(
            Syntax.SingleDocument document,
            Syntax.ParsedDocument parsed,
            CompletionPatch patch,
            Syntax.Node.Prop prop,
            Syntax.Node.Obj parent,
            Items items
    ) {
        Syntax.Node.Str key = prop.key();
        Range range = patch.isInserted(key.start())
                ? items.range(patch.offset(), patch.offset())
                : items.range(key.start(), key.end());
        // Only offer the whole entry if the colon wasn't there already
        boolean withValue = patch.isPatched();
        String indent = indentAt(parsed, key.start());

        Set<String> existing = new HashSet<>();
        for (Syntax.Node.Prop sibling : parent.properties()) {
            if (sibling != prop) {
                existing.add(sibling.key().value());
            }
        }

        if (schema != null) {
            KubernetesIndex index = document.isKubernetes() ? schema.kubernetesIndex() : null;
            if (index != null && !index.isEmpty()) {
                addKubernetesProperties(index, parent, existing, range, withValue, indent, items);
            } else {
                MatchingSchemas matches = SchemaMatcher.match(document.root(), schema);
                List<JsonSchema> schemas = matches.schemasFor(parent);
                addProperties(schemas, existing, range, withValue, indent, items);
                if (parent.parent() instanceof Syntax.Node.Arr && parent.properties().size() == 1) {
                    // The item was probably meant to be a scalar, made into a key by the patch
                    for (JsonSchema itemSchema : schemas) {
                        addValues(itemSchema, range, indent, items);
                    }
                }
            }
        }
        addStaticSnippets(items, range, indent);
    }

    private void completeValue(
            Syntax.SingleDocument document,
            Syntax.ParsedDocument parsed,
            CompletionPatch patch,
            Syntax.Node.Prop prop,
            int lookup,
            Items items
    ) {
        Syntax.Node value = prop.value();
        boolean empty = value instanceof Syntax.Node.Null nullValue && nullValue.isSynthetic();
        Range range = empty ? items.range(lookup, lookup) : items.range(value.start(), value.end());
        String indent = indentAt(parsed, prop.key().start());

        if (schema == null) {
            return;
        }
        if (empty && lookup > 0 && patch.text().charAt(lookup - 1) == ':') {
            items.separateValues();
        }
        KubernetesIndex index = document.isKubernetes() ? schema.kubernetesIndex() : null;
        if (index != null && !index.isEmpty()) {
            for (KubernetesIndex.Entry entry : index.entries(prop.key().value())) {
                for (Node entryValue : entry.values()) {
                    items.addValue(entryValue, range, new InsertTexts(schema, indentation).value(entryValue, indent),
                            null);
                }
                if (entry.type().equals("boolean")) {
                    items.addValue(Node.from(true), range, "true", null);
                    items.addValue(Node.from(false), range, "false", null);
                }
            }
            return;
        }

        MatchingSchemas matches = SchemaMatcher.match(document.root(), schema);
        for (JsonSchema valueSchema : matches.schemasFor(value)) {
            if (valueSchema.inlineObject() && (empty || value instanceof Syntax.Node.Str)) {
                int start = value instanceof Syntax.Node.Str str && str.isQuoted() ? value.start() + 1 : value.start();
                String expression = empty ? "" : patch.text().substring(Math.min(start, lookup), lookup);
                addExpressionProperties(valueSchema, expression, lookup, items);
                continue;
            }
            addValues(valueSchema, range, indent, items);
        }
    }

    private void addProperties(
            List<JsonSchema> schemas,
            Set<String> existing,
            Range range,
            boolean withValue,
            String indent,
            Items items
    ) {
        InsertTexts texts = new InsertTexts(schema, indentation);
        for (JsonSchema objectSchema : schemas) {
            Integer maxProperties = objectSchema.maxProperties();
            if (maxProperties != null && existing.size() >= maxProperties) {
                continue;
            }
            objectSchema.properties().forEach((name, raw) -> {
                if (existing.contains(name)) {
                    return;
                }
                JsonSchema property = schema.resolve(raw);
                if (property == null) {
                    property = JsonSchema.TRUE;
                }
                if (property.doNotSuggest() || property.deprecationMessage() != null) {
                    return;
                }
                String insertText = withValue ? texts.property(name, raw, indent) : InsertTexts.escape(name);
                items.addProperty(name, range, insertText, property);
            });
            for (JsonSchema.DefaultSnippet snippet : objectSchema.defaultSnippets()) {
                if (snippet.bodyText() == null && (snippet.body() == null || !snippet.body().isObjectNode())) {
                    continue;
                }
                String body = snippet.bodyText() != null
                        ? InsertTexts.indentLines(snippet.bodyText(), indent)
                        : texts.snippetBody(snippet.body(), indent);
                String label = snippet.label() != null ? snippet.label() : firstLine(body);
                items.addSnippet(label, range, body, snippet.description(), SCHEMA_SNIPPET_GROUP, null);
            }
        }
    }

    private void addValues(JsonSchema valueSchema, Range range, String indent, Items items) {
        InsertTexts texts = new InsertTexts(schema, indentation);
        String description = descriptionOf(valueSchema);
        List<Node> enumValues = valueSchema.enumValues();
        if (enumValues != null) {
            List<String> enumDescriptions = valueSchema.markdownEnumDescriptions().isEmpty()
                    ? valueSchema.enumDescriptions()
                    : valueSchema.markdownEnumDescriptions();
            for (int i = 0; i < enumValues.size(); i++) {
                String enumDescription = i < enumDescriptions.size() ? enumDescriptions.get(i) : description;
                items.addValue(enumValues.get(i), range, texts.value(enumValues.get(i), indent), enumDescription);
            }
        }
        if (valueSchema.constValue() != null) {
            items.addValue(valueSchema.constValue(), range, texts.value(valueSchema.constValue(), indent),
                    description);
        }
        if (valueSchema.defaultValue() != null) {
            items.addValue(valueSchema.defaultValue(), range, texts.value(valueSchema.defaultValue(), indent),
                    description);
        }
        for (Node example : valueSchema.examples()) {
            items.addValue(example, range, texts.value(example, indent), description);
        }
        if (enumValues == null && valueSchema.constValue() == null && valueSchema.types().contains("boolean")) {
            items.addValue(Node.from(true), range, "true", description);
            items.addValue(Node.from(false), range, "false", description);
        }
        for (JsonSchema.DefaultSnippet snippet : valueSchema.defaultSnippets()) {
            if (snippet.bodyText() == null && snippet.body() == null) {
                continue;
            }
            String body;
            if (snippet.bodyText() != null) {
                body = InsertTexts.indentLines(snippet.bodyText(), indent);
            } else if (snippet.body().isObjectNode() || snippet.body().isArrayNode()) {
                body = "\n" + indent + indentation + texts.snippetBody(snippet.body(), indent + indentation);
            } else {
                body = texts.snippetBody(snippet.body(), indent);
            }
            String label = snippet.label() != null ? snippet.label() : firstLine(body.strip());
            items.addSnippet(label, range, body, snippet.description(), SCHEMA_SNIPPET_GROUP, CompletionItemKind.Value);
        }
    }

    private void addExpressionProperties(JsonSchema context, String expression, int lookup, Items items) {
        ExpressionCompletions.Candidates candidates = ExpressionCompletions.complete(expression, context, schema);
        if (candidates == null) {
            return;
        }
        Range range = items.range(lookup - candidates.segment().length(), lookup);
        candidates.properties().forEach((name, raw) -> {
            JsonSchema property = schema.resolve(raw);
            if (property == null) {
                property = JsonSchema.TRUE;
            }
            if (!property.doNotSuggest()) {
                items.addProperty(name, range, InsertTexts.escape(name), property);
            }
        });
    }

    private void addKubernetesProperties(
            KubernetesIndex index,
            Syntax.Node.Obj parent,
            Set<String> existing,
            Range range,
            boolean withValue,
            String indent,
            Items items
    ) {
        Set<String> names = index.allowedKeys(parent);
        for (String name : names) {
            if (existing.contains(name)) {
                continue;
            }
            List<KubernetesIndex.Entry> entries = parent.parent() == null
                    ? index.rootNodes().getOrDefault(name, List.of())
                    : index.entries(name);
            String type = entries.isEmpty() ? "" : entries.get(0).type();
            String insertText = InsertTexts.escape(name);
            if (withValue) {
                if (type.equals("object")) {
                    insertText += ":\n" + indent + indentation + "$1";
                } else if (type.equals("array")) {
                    insertText += ":\n" + indent + indentation + "- $1";
                } else {
                    insertText += ": $1";
                }
            }
            Set<String> owners = new LinkedHashSet<>();
            for (KubernetesIndex.Entry entry : entries) {
                owners.add(entry.owner());
            }
            CompletionItem item = items.addProperty(name, range, insertText, null);
            if (item != null) {
                item.setDetail(String.join(", ", owners));
            }
        }
    }

    private void addStaticSnippets(Items items, Range range, String indent) {
        if (items.isRetry()) {
            return;
        }
        for (StaticSnippets.Snippet snippet : StaticSnippets.all()) {
            CompletionItem item = items.addSnippet(snippet.prefix(), range, snippet.text(uri, indent),
                    snippet.description(), STATIC_SNIPPET_GROUP, null);
            if (item != null) {
                item.setDetail(StaticSnippets.DETAIL);
            }
        }
    }

    // The innermost property with its key on the cursor's line, before the
    // cursor, whose scalar value the cursor is in or after.
    private static Syntax.Node.Prop findValueProperty(
            Syntax.SingleDocument document,
            Syntax.ParsedDocument parsed,
            int lookup
    ) {
        if (document.root() == null) {
            return null;
        }
        LineIndex lineIndex = parsed.lineIndex();
        int line = lineIndex.lineOf(lookup);
        List<Syntax.Node.Prop> candidates = new ArrayList<>();
        document.root().consume(node -> {
            if (node instanceof Syntax.Node.Prop prop
                    && prop.key().end() <= lookup
                    && lineIndex.lineOf(prop.key().start()) == line) {
                candidates.add(prop);
            }
        });
        for (int i = candidates.size() - 1; i >= 0; i--) {
            Syntax.Node.Prop prop = candidates.get(i);
            Syntax.Node value = prop.value();
            if (value == null || value instanceof Syntax.Node.Obj || value instanceof Syntax.Node.Arr) {
                continue;
            }
            String gap = parsed.text().substring(prop.key().end(), Math.max(prop.key().end(), lookup));
            if (!gap.stripLeading().startsWith(":") && !quotedKeyGap(gap)) {
                continue;
            }
            boolean synthetic = value instanceof Syntax.Node.Null nullValue && nullValue.isSynthetic();
            if (synthetic || value.start() <= lookup && lookup <= value.end()) {
                return prop;
            }
        }
        return null;
    }

    // A quoted key's scalar ends before its closing quote
    private static boolean quotedKeyGap(String gap) {
        return gap.length() > 1 && (gap.charAt(0) == '"' || gap.charAt(0) == '\'')
                && gap.substring(1).stripLeading().startsWith(":");
    }

    private static boolean isAfterKey(String text, LineIndex lineIndex, int offset) {
        int line = lineIndex.lineOf(offset);
        String before = text.substring(lineIndex.lineStart(line), offset);
        String after = text.substring(offset, lineIndex.lineContentEnd(line));
        return AFTER_KEY.matcher(before).find() && after.isBlank();
    }

    private static String leadingIndent(String text, LineIndex lineIndex, int offset) {
        int line = lineIndex.lineOf(offset);
        int start = lineIndex.lineStart(line);
        int end = lineIndex.lineContentEnd(line);
        int i = start;
        while (i < end && (text.charAt(i) == ' ' || text.charAt(i) == '-')) {
            i++;
        }
        return " ".repeat(i - start);
    }

    // Spaces up to the column of the offset
    private static String indentAt(Syntax.ParsedDocument parsed, int offset) {
        LineIndex lineIndex = parsed.lineIndex();
        return " ".repeat(offset - lineIndex.lineStart(lineIndex.lineOf(offset)));
    }

    private static String firstLine(String text) {
        int newLine = text.indexOf('\n');
        return newLine < 0 ? text : text.substring(0, newLine);
    }

    private static String descriptionOf(JsonSchema schema) {
        return schema.markdownDescription() != null ? schema.markdownDescription() : schema.description();
    }

    /**
     * Collects items, dropping duplicates, and translates offsets in the
     * patched text back to the original.
     */
    private final class Items {
        private final LineIndex lineIndex;
        private final CompletionPatch patch;
        private final String prefix;
        private final Map<String, CompletionItem> items = new LinkedHashMap<>();
        private String valueSeparator = "";
        private int properties;
        private int values;
        private int snippets;

        /**
         * @param lineIndex The line index of the original text
         * @param patch The patch completion is done on
         * @param prefix Text to insert before every item
         */
        Items(LineIndex lineIndex, CompletionPatch patch, String prefix) {
            this.lineIndex = lineIndex;
            this.patch = patch;
            this.prefix = prefix;
        }

        Range range(int patchedStart, int patchedEnd) {
            return LspAdapter.toRange(lineIndex, patch.toOriginal(patchedStart), patch.toOriginal(patchedEnd));
        }

        boolean isEmpty() {
            return items.isEmpty();
        }

        boolean isRetry() {
            return !prefix.isEmpty();
        }

        // Values go right after a colon with no space
        void separateValues() {
            valueSeparator = " ";
        }

        CompletionItem addProperty(String name, Range range, String insertText, JsonSchema property) {
            String description = property == null ? null : descriptionOf(property);
            String dedupKey = "property:" + name + "\u0000" + description;
            if (items.containsKey(dedupKey)) {
                return null;
            }
            CompletionItem item = newItem(name, CompletionItemKind.Property, range, insertText);
            item.setSortText(PROPERTY_GROUP + (alphabetical ? name : String.format("%05d", properties++)));
            if (property != null) {
                setDocumentation(item, property.markdownDescription(), property.description());
            }
            items.put(dedupKey, item);
            return item;
        }

        void addValue(Node value, Range range, String insertText, String description) {
            String label = value.isObjectNode() || value.isArrayNode()
                    ? firstLine(insertText.strip())
                    : InsertTexts.scalar(value);
            String dedupKey = "value:" + label;
            if (items.containsKey(dedupKey)) {
                return;
            }
            CompletionItem item = newItem(label, CompletionItemKind.Value, range, valueSeparator + insertText);
            item.setSortText(PROPERTY_GROUP + String.format("%05d", values++));
            setDocumentation(item, description, null);
            items.put(dedupKey, item);
        }

        CompletionItem addSnippet(
                String label,
                Range range,
                String insertText,
                String description,
                String group,
                CompletionItemKind kind
        ) {
            String dedupKey = "snippet:" + label + "\u0000" + description;
            if (items.containsKey(dedupKey)) {
                return null;
            }
            String text = kind == CompletionItemKind.Value ? valueSeparator + insertText : insertText;
            CompletionItem item = newItem(label, kind == null ? CompletionItemKind.Snippet : kind, range, text);
            item.setSortText(group + String.format("%05d", snippets++));
            setDocumentation(item, null, description);
            items.put(dedupKey, item);
            return item;
        }

        List<CompletionItem> toList() {
            List<CompletionItem> result = new ArrayList<>(items.values());
            result.sort((a, b) -> a.getSortText().compareTo(b.getSortText()));
            return result;
        }

        private CompletionItem newItem(String label, CompletionItemKind kind, Range range, String insertText) {
            CompletionItem item = new CompletionItem(label);
            item.setKind(kind);
            item.setInsertTextFormat(InsertTextFormat.Snippet);
            item.setInsertTextMode(InsertTextMode.AsIs);
            item.setTextEdit(Either.forLeft(new TextEdit(range, prefix + insertText)));
            item.setFilterText(label);
            return item;
        }

        private void setDocumentation(CompletionItem item, String markdown, String plain) {
            if (markdown != null) {
                item.setDocumentation(Either.forRight(new MarkupContent(MarkupKind.MARKDOWN, markdown)));
            } else if (plain != null) {
                item.setDocumentation(plain);
            }
        }
    }
}

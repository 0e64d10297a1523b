/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.yaml.lsp.diagnostics.YamlDiagnostics;
import software.amazon.yaml.lsp.schema.ResolvedSchema;
import software.amazon.yaml.lsp.schema.SchemaError;
import software.amazon.yaml.lsp.schema.SchemaStore;
import software.amazon.yaml.lsp.syntax.CustomTags;
import software.amazon.yaml.lsp.syntax.Syntax;
import software.amazon.yaml.lsp.util.Result;

/**
 * The entry points of YAML language features: parsing, completion, hover,
 * validation and document symbols.
 *
 * <p>Every feature runs against a snapshot of a document's text, identified
 * by its URI and version. Parses are cached per URI until a newer version is
 * parsed. No exception thrown while computing a feature escapes: it is logged,
 * and the feature's empty result is returned instead.
 */
public final class YamlLanguageService {
    private static final Logger LOGGER = Logger.getLogger(YamlLanguageService.class.getName());

    private final SchemaStore schemaStore;
    private final Map<String, CachedParse> parses = new ConcurrentHashMap<>();
    private volatile Settings settings = Settings.DEFAULT;

    /**
     * @param schemaStore Where schemas of documents are found
     */
    public YamlLanguageService(SchemaStore schemaStore) {
        this.schemaStore = schemaStore;
    }

    /**
     * Which features are enabled, and how they behave.
     *
     * @param validate Whether documents are validated
     * @param hover Whether hovers are provided
     * @param completion Whether completions are provided
     * @param indentation One level of indentation in inserted text
     * @param alphabetical Whether completed properties are ordered by name
     * @param customTags The application specific tags documents may use
     */
    public record Settings(
            boolean validate,
            boolean hover,
            boolean completion,
            String indentation,
            boolean alphabetical,
            CustomTags customTags
    ) {
        public static final Settings DEFAULT = new Settings(true, true, true, "  ", false, CustomTags.NONE);
    }

    private record CachedParse(
            int version,
            boolean kubernetes,
            CustomTags customTags,
            String text,
            Syntax.ParsedDocument parsed
    ) {}

    /**
     * @return The schema store
     */
    public SchemaStore schemaStore() {
        return schemaStore;
    }

    /**
     * @return The current settings
     */
    public Settings settings() {
        return settings;
    }

    /**
     * @param settings The new settings
     */
    public void configure(Settings settings) {
        this.settings = settings;
    }

    /**
     * @param uri The URI of the document
     * @param version The version of the text
     * @param text The text of the document
     * @param kubernetes Whether the document is associated with a Kubernetes schema
     * @return The parse of the text, from the cache if the version was
     *  parsed before
     */
    public Syntax.ParsedDocument parse(String uri, int version, String text, boolean kubernetes) {
        CustomTags customTags = settings.customTags();
        CachedParse cached = parses.get(uri);
        if (cached != null && cached.version() == version && cached.kubernetes() == kubernetes
                && cached.customTags().equals(customTags) && cached.text().equals(text)) {
            return cached.parsed();
        }
        Syntax.ParsedDocument parsed = Syntax.parse(text, kubernetes, customTags);
        parses.put(uri, new CachedParse(version, kubernetes, customTags, text, parsed));
        return parsed;
    }

    /**
     * Drops the cached parse of a document.
     *
     * @param uri The URI of the document
     */
    public void forget(String uri) {
        parses.remove(uri);
    }

    /**
     * @param uri The URI of the document
     * @param parsed The parse of the document
     * @param document The document to get the schema of
     * @return The schema of the document, or empty if it has none
     */
    public Optional<Result<ResolvedSchema, SchemaError>> getSchema(
            String uri,
            Syntax.ParsedDocument parsed,
            Syntax.SingleDocument document
    ) {
        return schemaStore.getSchemaForResource(uri, parsed, document);
    }

    /**
     * @param uri The URI of the document
     * @param version The version of the text
     * @param text The text of the document
     * @param offset The offset of the cursor
     * @param kubernetes Whether the document is associated with a Kubernetes schema
     * @return The completions at the cursor
     */
    public List<CompletionItem> complete(String uri, int version, String text, int offset, boolean kubernetes) {
        if (!settings.completion()) {
            return List.of();
        }
        try {
            Syntax.ParsedDocument parsed = parse(uri, version, text, kubernetes);
            ResolvedSchema schema = schemaAt(uri, parsed, offset);
            Settings current = settings;
            return new CompletionHandler(uri, schema, current.indentation(), current.alphabetical(),
                    current.customTags())
                    .handle(text, offset, kubernetes);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Completion failed for " + uri, e);
            return List.of();
        }
    }

    /**
     * @param uri The URI of the document
     * @param version The version of the text
     * @param text The text of the document
     * @param offset The offset of the cursor
     * @param kubernetes Whether the document is associated with a Kubernetes schema
     * @return The hover at the cursor, or {@code null} if there is nothing to show
     */
    public Hover hover(String uri, int version, String text, int offset, boolean kubernetes) {
        if (!settings.hover()) {
            return null;
        }
        try {
            Syntax.ParsedDocument parsed = parse(uri, version, text, kubernetes);
            ResolvedSchema schema = schemaAt(uri, parsed, offset);
            return new HoverHandler(schema).handle(parsed, offset);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Hover failed for " + uri, e);
            return null;
        }
    }

    /**
     * @param uri The URI of the document
     * @param version The version of the text
     * @param text The text of the document
     * @param kubernetes Whether the document is associated with a Kubernetes schema
     * @return The diagnostics of the document
     */
    public List<Diagnostic> validate(String uri, int version, String text, boolean kubernetes) {
        if (!settings.validate()) {
            return List.of();
        }
        try {
            Syntax.ParsedDocument parsed = parse(uri, version, text, kubernetes);
            return YamlDiagnostics.getFileDiagnostics(parsed, document -> getSchema(uri, parsed, document));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Validation failed for " + uri, e);
            return List.of();
        }
    }

    /**
     * @param uri The URI of the document
     * @param version The version of the text
     * @param text The text of the document
     * @return The symbols of the document
     */
    public List<Either<SymbolInformation, DocumentSymbol>> documentSymbols(String uri, int version, String text) {
        try {
            CachedParse cached = parses.get(uri);
            boolean kubernetes = cached != null && cached.kubernetes();
            return new DocumentSymbolHandler(parse(uri, version, text, kubernetes)).handle();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Document symbols failed for " + uri, e);
            return List.of();
        }
    }

    private ResolvedSchema schemaAt(String uri, Syntax.ParsedDocument parsed, int offset) {
        Syntax.SingleDocument document = parsed.documentAt(offset);
        Optional<Result<ResolvedSchema, SchemaError>> schema = document == null
                ? schemaStore.getSchemaForResource(uri, parsed.text())
                : getSchema(uri, parsed, document);
        return schema.flatMap(Result::get).orElse(null);
    }
}

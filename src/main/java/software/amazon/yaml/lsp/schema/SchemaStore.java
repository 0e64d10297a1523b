/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.syntax.Syntax;
import software.amazon.yaml.lsp.util.Result;

/**
 * Decides which schemas apply to a resource, and loads, resolves and caches
 * them.
 *
 * <p>The schemas of a resource come from the first of these that has any:
 * <ol>
 *     <li>The custom {@link SchemaResolver}, if one is set.</li>
 *     <li>A {@link Modeline} in the document.</li>
 *     <li>The {@link SchemaAssociation}s whose glob matches the resource URI.
 *     Only associations of the highest matching {@link SchemaPriority} are
 *     used. Registering a glob again at the same priority replaces its
 *     schemas, and schemas of distinct globs are combined.</li>
 * </ol>
 * When there is more than one schema, the resource must match all of them.
 *
 * <p>Fetched documents and resolved schemas are cached until
 * {@link #invalidate(String) invalidated}. Concurrent requests for the same
 * schema share a single fetch.
 */
public final class SchemaStore {
    private static final Logger LOGGER = Logger.getLogger(SchemaStore.class.getName());

    private final SchemaFetcher fetcher;
    private final Map<String, String> contributed = new ConcurrentHashMap<>();
    private final SchemaCache<String, Result<Node, SchemaError>> documents = new SchemaCache<>();
    private final SchemaCache<List<String>, Result<ResolvedSchema, SchemaError>> resolved = new SchemaCache<>();
    private final Map<AssociationKey, SchemaAssociation> associations = new LinkedHashMap<>();
    private volatile SchemaResolver customResolver;

    /**
     * @param fetcher Retrieves the text of schemas
     */
    public SchemaStore(SchemaFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * @param resolver The resolver to consult before anything else, or
     *                 {@code null} to remove it
     */
    public void setCustomResolver(SchemaResolver resolver) {
        this.customResolver = resolver;
    }

    /**
     * @param glob The glob resource URIs are matched against
     * @param schemaUris The schemas of matching resources
     * @param priority Where the association came from
     */
    public synchronized void registerAssociation(String glob, List<String> schemaUris, SchemaPriority priority) {
        AssociationKey key = new AssociationKey(glob, priority);
        // Re-registering moves the glob to the end of the registration order
        associations.remove(key);
        associations.put(key, new SchemaAssociation(glob, schemaUris, priority));
    }

    /**
     * @param priority The source of the associations to remove
     */
    public synchronized void clearAssociations(SchemaPriority priority) {
        associations.keySet().removeIf(key -> key.priority() == priority);
    }

    /**
     * @return All registered associations, in registration order
     */
    public synchronized List<SchemaAssociation> associations() {
        return new ArrayList<>(associations.values());
    }

    /**
     * Provides the content of a schema directly, rather than fetching it.
     *
     * @param uri The URI of the schema
     * @param content The text of the schema
     */
    public void addSchema(String uri, String content) {
        contributed.put(uri, content);
        invalidate(uri);
    }

    /**
     * Removes a schema provided with {@link #addSchema}.
     *
     * @param uri The URI of the schema
     */
    public void deleteSchema(String uri) {
        contributed.remove(uri);
        invalidate(uri);
    }

    /**
     * Drops a schema from the cache, along with every resolved schema built
     * from it, so it is fetched again the next time it is needed.
     *
     * @param uri The URI of the schema
     */
    public void invalidate(String uri) {
        String documentUri = SchemaLoader.documentUri(uri);
        LOGGER.finest(() -> "Invalidating schema " + documentUri);
        documents.invalidate(documentUri);
        resolved.invalidateIf((uris, result) -> {
            if (result == null || result.isErr()) {
                return true;
            }
            return uris.contains(uri) || result.unwrap().dependencies().contains(documentUri);
        });
    }

    /**
     * Drops everything from the cache.
     */
    public void invalidateAll() {
        documents.clear();
        resolved.clear();
    }

    /**
     * @param resourceUri The URI of the resource
     * @param parsed The parse of the resource
     * @param document The document of the parse to get schemas for
     * @return The resolved schema, or empty if no schema applies
     */
    public Optional<Result<ResolvedSchema, SchemaError>> getSchemaForResource(
            String resourceUri,
            Syntax.ParsedDocument parsed,
            Syntax.SingleDocument document
    ) {
        return getSchemaForResource(resourceUri, parsed.textOf(document));
    }

    /**
     * @param resourceUri The URI of the resource
     * @param documentText The text of the document to get schemas for, which
     *                     is searched for a modeline
     * @return The resolved schema, or empty if no schema applies
     */
    public Optional<Result<ResolvedSchema, SchemaError>> getSchemaForResource(String resourceUri, String documentText) {
        List<String> uris = schemaUrisFor(resourceUri, documentText);
        if (uris.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(getResolvedSchema(uris));
    }

    /**
     * @param resourceUri The URI of the resource
     * @param documentText The text of the document, or {@code null}
     * @return The URIs of the schemas that apply, which may be empty
     */
    public List<String> schemaUrisFor(String resourceUri, String documentText) {
        SchemaResolver resolver = customResolver;
        if (resolver != null) {
            try {
                List<String> fromResolver = resolver.resolve(resourceUri);
                if (fromResolver != null && !fromResolver.isEmpty()) {
                    return List.copyOf(fromResolver);
                }
            } catch (RuntimeException e) {
                LOGGER.warning("Custom schema resolver failed for " + resourceUri + ": " + e);
            }
        }

        if (documentText != null) {
            Optional<Modeline> modeline = Modeline.find(documentText, 0);
            if (modeline.isPresent()) {
                return List.of(resolveAgainst(resourceUri, modeline.get().schemaUri()));
            }
        }

        List<SchemaAssociation> matching = new ArrayList<>();
        int highest = Integer.MIN_VALUE;
        for (SchemaAssociation association : associations()) {
            if (association.matches(resourceUri)) {
                matching.add(association);
                highest = Math.max(highest, association.priority().value());
            }
        }
        Set<String> uris = new LinkedHashSet<>();
        for (SchemaAssociation association : matching) {
            if (association.priority().value() == highest) {
                uris.addAll(association.schemaUris());
            }
        }
        return new ArrayList<>(uris);
    }

    /**
     * @param uri The URI of the schema
     * @return The resolved schema, or why it couldn't be loaded
     */
    public Result<ResolvedSchema, SchemaError> getResolvedSchema(String uri) {
        return getResolvedSchema(List.of(uri));
    }

    /**
     * @param uris The URIs of the schemas, all of which must match
     * @return The resolved combination of the schemas, or why one of them
     *  couldn't be loaded
     */
    public Result<ResolvedSchema, SchemaError> getResolvedSchema(List<String> uris) {
        return resolved.getOrCompute(List.copyOf(uris), this::resolve);
    }

    private Result<ResolvedSchema, SchemaError> resolve(List<String> uris) {
        Map<String, Node> loaded = new LinkedHashMap<>();
        List<SchemaError> errors = new ArrayList<>();
        List<String> roots = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();

        for (String uri : uris) {
            String documentUri = SchemaLoader.documentUri(uri);
            Result<Node, SchemaError> document = loadDocument(documentUri);
            if (document.isErr()) {
                return Result.err(document.unwrapErr());
            }
            roots.add(SchemaLoader.withFragment(uri));
            if (!loaded.containsKey(documentUri)) {
                loaded.put(documentUri, document.unwrap());
                pending.add(documentUri);
            }
        }

        // A document that is already loaded or being loaded is never visited
        // again, which is what makes reference cycles between documents safe.
        Set<String> failed = new HashSet<>();
        while (!pending.isEmpty()) {
            String documentUri = pending.poll();
            for (String ref : SchemaLoader.collectRefs(loaded.get(documentUri))) {
                String target = SchemaLoader.documentUri(ref);
                if (loaded.containsKey(target) || failed.contains(target)) {
                    continue;
                }
                Result<Node, SchemaError> document = loadDocument(target);
                if (document.isErr()) {
                    failed.add(target);
                    errors.add(SchemaError.problemLoadingRef(documentUri, ref, document.unwrapErr().message()));
                } else {
                    loaded.put(target, document.unwrap());
                    pending.add(target);
                }
            }
        }

        JsonSchema root = JsonSchema.allOfReferences(roots);
        ResolvedSchema unchecked = new ResolvedSchema(uris, root, loaded, List.of());
        for (Map.Entry<String, Node> entry : loaded.entrySet()) {
            for (String ref : SchemaLoader.collectRefs(entry.getValue())) {
                if (!failed.contains(SchemaLoader.documentUri(ref)) && unchecked.lookup(ref) == null) {
                    errors.add(SchemaError.unresolvedRef(entry.getKey(), fragmentOf(ref)));
                }
            }
        }
        for (SchemaError error : errors) {
            LOGGER.info(error.message());
        }
        return Result.ok(new ResolvedSchema(uris, root, loaded, errors));
    }

    private Result<Node, SchemaError> loadDocument(String documentUri) {
        return documents.getOrCompute(documentUri, uri -> {
            String content = contributed.get(uri);
            if (content == null) {
                try {
                    LOGGER.finest(() -> "Fetching schema " + uri);
                    content = fetcher.fetch(uri);
                } catch (IOException | RuntimeException e) {
                    LOGGER.warning("Unable to load schema from " + uri + ": " + e.getMessage());
                    return Result.err(SchemaError.unableToLoad(uri, String.valueOf(e.getMessage())));
                }
            }
            return SchemaLoader.parse(uri, content);
        });
    }

    private static String fragmentOf(String ref) {
        int hash = ref.indexOf('#');
        return hash < 0 ? ref : ref.substring(hash);
    }

    private static String resolveAgainst(String resourceUri, String schemaUri) {
        if (schemaUri.contains(":/") || schemaUri.startsWith("/")) {
            return schemaUri;
        }
        try {
            URI base = URI.create(resourceUri);
            if (!base.isOpaque()) {
                return base.resolve(schemaUri).toString();
            }
        } catch (IllegalArgumentException e) {
            LOGGER.fine(() -> "Couldn't resolve " + schemaUri + " against " + resourceUri);
        }
        return schemaUri;
    }

    private record AssociationKey(String glob, SchemaPriority priority) {}
}

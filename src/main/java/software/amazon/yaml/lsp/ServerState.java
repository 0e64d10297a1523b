/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import software.amazon.yaml.lsp.document.Document;
import software.amazon.yaml.lsp.language.YamlLanguageService;
import software.amazon.yaml.lsp.schema.SchemaAssociation;
import software.amazon.yaml.lsp.schema.SchemaFetcher;
import software.amazon.yaml.lsp.schema.SchemaPriority;
import software.amazon.yaml.lsp.schema.SchemaStore;

/**
 * Keeps track of the state of the server: the documents open in the client,
 * the current options, and the language service that answers requests.
 */
public final class ServerState {
    private static final Logger LOGGER = Logger.getLogger(ServerState.class.getName());

    private final Map<String, ManagedDocument> managed = new ConcurrentHashMap<>();
    private final DocumentLifecycleManager lifecycleTasks = new DocumentLifecycleManager();
    private final SchemaStore schemaStore;
    private final YamlLanguageService languageService;
    private volatile ServerOptions options = ServerOptions.builder().build();
    private volatile Path workspaceRoot;

    /**
     * @param fetcher Retrieves the text of schemas
     */
    public ServerState(SchemaFetcher fetcher) {
        this.schemaStore = new SchemaStore(fetcher);
        this.languageService = new YamlLanguageService(schemaStore);
    }

    /**
     * An open document, and the version of its text the client last sent.
     */
    static final class ManagedDocument {
        private final String uri;
        private final Document document;
        private volatile int version;

        ManagedDocument(String uri, Document document, int version) {
            this.uri = uri;
            this.document = document;
            this.version = version;
        }

        String uri() {
            return uri;
        }

        Document document() {
            return document;
        }

        int version() {
            return version;
        }

        void setVersion(int version) {
            this.version = version;
        }
    }

    /**
     * A copy of a document's text, for computing against while the document
     * keeps changing.
     */
    record Snapshot(String uri, int version, String text) {}

    /**
     * @return All documents open in the client
     */
    public Set<String> managedUris() {
        return Set.copyOf(managed.keySet());
    }

    public SchemaStore schemaStore() {
        return schemaStore;
    }

    public YamlLanguageService languageService() {
        return languageService;
    }

    public ServerOptions options() {
        return options;
    }

    DocumentLifecycleManager lifecycleTasks() {
        return lifecycleTasks;
    }

    ManagedDocument findManaged(String uri) {
        return managed.get(uri);
    }

    Snapshot snapshot(String uri) {
        ManagedDocument managedDocument = managed.get(uri);
        if (managedDocument == null) {
            return null;
        }
        synchronized (managedDocument) {
            return new Snapshot(uri, managedDocument.version(), managedDocument.document().copyText());
        }
    }

    ManagedDocument open(String uri, int version, String text) {
        ManagedDocument managedDocument = new ManagedDocument(uri, Document.of(text), version);
        managed.put(uri, managedDocument);
        return managedDocument;
    }

    void close(String uri) {
        lifecycleTasks.cancelTask(uri);
        managed.remove(uri);
        languageService.forget(uri);
    }

    /**
     * @param workspaceRoot The root relative schema paths are resolved against,
     *                      or {@code null} if there is none
     */
    void setWorkspaceRoot(String workspaceRoot) {
        if (workspaceRoot == null) {
            this.workspaceRoot = null;
            return;
        }
        try {
            this.workspaceRoot = Paths.get(URI.create(workspaceRoot));
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            LOGGER.warning("Ignoring workspace root that isn't a file URI: " + workspaceRoot);
            this.workspaceRoot = null;
        }
    }

    /**
     * Replaces the options, along with the schema associations that come
     * from them.
     *
     * @param options The new options
     */
    void applyOptions(ServerOptions options) {
        this.options = options;
        languageService.configure(options.toSettings());

        schemaStore.clearAssociations(SchemaPriority.SETTINGS);
        schemaStore.clearAssociations(SchemaPriority.SCHEMA_STORE);
        registerAssociations(options.getSchemas(), SchemaPriority.SETTINGS);
        registerAssociations(options.getSchemaStore(), SchemaPriority.SCHEMA_STORE);
    }

    /**
     * Replaces the schema associations contributed by editor extensions.
     *
     * @param associations Schema URIs, by the glob of the resources they apply to
     */
    void applySchemaAssociations(Map<String, List<String>> associations) {
        schemaStore.clearAssociations(SchemaPriority.SCHEMA_ASSOCIATION);
        for (Map.Entry<String, List<String>> entry : associations.entrySet()) {
            List<String> schemaUris = new ArrayList<>();
            for (String schemaUri : entry.getValue()) {
                schemaUris.add(resolveAgainstWorkspace(options.resolveSchemaUri(schemaUri)));
            }
            schemaStore.registerAssociation(entry.getKey(), schemaUris, SchemaPriority.SCHEMA_ASSOCIATION);
        }
    }

    /**
     * @param uri The URI of a document
     * @return Whether the document is associated with the Kubernetes schema,
     *  either in the options or by an editor extension
     */
    boolean isKubernetes(String uri) {
        ServerOptions current = options;
        if (current.isKubernetes(uri)) {
            return true;
        }
        for (SchemaAssociation association : schemaStore.associations()) {
            if (association.priority() == SchemaPriority.SCHEMA_ASSOCIATION
                    && association.schemaUris().contains(current.getKubernetesSchemaUrl())
                    && association.matches(uri)) {
                return true;
            }
        }
        return false;
    }

    private void registerAssociations(Map<String, List<String>> schemas, SchemaPriority priority) {
        for (Map.Entry<String, List<String>> entry : schemas.entrySet()) {
            String schemaUri = resolveAgainstWorkspace(options.resolveSchemaUri(entry.getKey()));
            for (String glob : entry.getValue()) {
                LOGGER.finest(() -> "Associating " + glob + " with " + schemaUri);
                schemaStore.registerAssociation(glob, List.of(schemaUri), priority);
            }
        }
    }

    private String resolveAgainstWorkspace(String schemaUri) {
        Path root = workspaceRoot;
        if (root != null && schemaUri.startsWith(".")) {
            return root.resolve(schemaUri).normalize().toUri().toString();
        }
        return schemaUri;
    }
}

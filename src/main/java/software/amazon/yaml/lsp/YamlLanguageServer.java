/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.SetTraceParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.WorkDoneProgressCancelParams;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import software.amazon.yaml.lsp.document.LineIndex;
import software.amazon.yaml.lsp.language.HoverHandler;
import software.amazon.yaml.lsp.language.YamlLanguageService;
import software.amazon.yaml.lsp.schema.SchemaFetcher;

public class YamlLanguageServer implements
        LanguageServer, LanguageClientAware, YamlProtocolExtensions, WorkspaceService, TextDocumentService {
    private static final Logger LOGGER = Logger.getLogger(YamlLanguageServer.class.getName());
    private static final ServerCapabilities CAPABILITIES;

    static {
        ServerCapabilities capabilities = new ServerCapabilities();
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        capabilities.setCompletionProvider(new CompletionOptions(true, null));
        capabilities.setHoverProvider(true);
        capabilities.setDocumentSymbolProvider(true);

        CAPABILITIES = capabilities;
    }

    private YamlLanguageClient client;
    private final ServerState state;

    YamlLanguageServer(SchemaFetcher fetcher) {
        this.state = new ServerState(fetcher);
    }

    ServerState getState() {
        return state;
    }

    @Override
    public void connect(LanguageClient client) {
        LOGGER.finest("Connect");
        this.client = new YamlLanguageClient(client);
        String message = "yaml-language-server";
        try {
            Properties props = new Properties();
            props.load(Objects.requireNonNull(getClass().getClassLoader().getResourceAsStream("version.properties")));
            message += " version " + props.getProperty("version");
        } catch (IOException e) {
            this.client.error("Failed to load yaml-language-server version: " + e);
        }
        this.client.info(message + " started.");
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        LOGGER.finest("Initialize");

        Optional.ofNullable(params.getProcessId())
                .flatMap(ProcessHandle::of)
                .ifPresent(processHandle -> processHandle.onExit().thenRun(this::exit));

        List<WorkspaceFolder> workspaceFolders = params.getWorkspaceFolders();
        if (workspaceFolders != null && !workspaceFolders.isEmpty()) {
            state.setWorkspaceRoot(workspaceFolders.get(0).getUri());
        } else {
            @SuppressWarnings("deprecation")
            String rootUri = params.getRootUri();
            state.setWorkspaceRoot(rootUri);
        }
        state.applyOptions(ServerOptions.fromInitializeParams(params, client));

        LOGGER.finest("Done initialize");
        return completedFuture(new InitializeResult(CAPABILITIES));
    }

    @Override
    public void initialized(InitializedParams params) {
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return this;
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return this;
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        state.lifecycleTasks().cancelAllTasks();
        return completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public void cancelProgress(WorkDoneProgressCancelParams params) {
        // The server doesn't create work done progress, so there is nothing to cancel
        LOGGER.warning("window/workDoneProgress/cancel not implemented");
    }

    @Override
    public void setTrace(SetTraceParams params) {
        LOGGER.warning("$/setTrace not implemented");
    }

    @Override
    public void schemaAssociations(Map<String, List<String>> associations) {
        LOGGER.finest("SchemaAssociations");

        state.applySchemaAssociations(associations == null ? Map.of() : associations);
        sendFileDiagnosticsForManagedDocuments();
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        LOGGER.finest("DidChangeWatchedFiles");

        // Schemas read from disk may have changed
        for (FileEvent event : params.getChanges()) {
            state.schemaStore().invalidate(event.getUri());
        }
        sendFileDiagnosticsForManagedDocuments();
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        LOGGER.finest("DidChangeConfiguration");

        if (!(params.getSettings() instanceof JsonObject settings)) {
            return;
        }
        state.applyOptions(ServerOptions.fromJson(settings, client));
        sendFileDiagnosticsForManagedDocuments();
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        LOGGER.finest("DidOpen");

        String uri = params.getTextDocument().getUri();
        state.open(uri, params.getTextDocument().getVersion(), params.getTextDocument().getText());
        sendFileDiagnostics(uri, 0);
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        LOGGER.finest("DidChange");

        if (params.getContentChanges().isEmpty()) {
            LOGGER.info("Received empty DidChange");
            return;
        }

        String uri = params.getTextDocument().getUri();
        ServerState.ManagedDocument managed = state.findManaged(uri);
        if (managed == null) {
            client.unknownFileError(uri, "change");
            return;
        }

        synchronized (managed) {
            for (TextDocumentContentChangeEvent contentChangeEvent : params.getContentChanges()) {
                managed.document().applyEdit(contentChangeEvent.getRange(), contentChangeEvent.getText());
            }
            managed.setVersion(params.getTextDocument().getVersion());
        }

        sendFileDiagnostics(uri, state.options().getDebounceMillis());
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        LOGGER.finest("DidClose");

        String uri = params.getTextDocument().getUri();
        state.close(uri);
        client.clearDiagnostics(uri);
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        LOGGER.finest("DidSave");

        String uri = params.getTextDocument().getUri();
        ServerState.ManagedDocument managed = state.findManaged(uri);
        if (managed == null) {
            client.unknownFileError(uri, "save");
            return;
        }

        if (params.getText() != null) {
            synchronized (managed) {
                managed.document().applyEdit(null, params.getText());
            }
        }
        sendFileDiagnostics(uri, 0);
    }

    @Override
    public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
        LOGGER.finest("Completion");

        String uri = params.getTextDocument().getUri();
        ServerState.Snapshot snapshot = state.snapshot(uri);
        if (snapshot == null) {
            client.unknownFileError(uri, "completion");
            return completedFuture(Either.forLeft(Collections.emptyList()));
        }

        int offset = offsetOf(snapshot.text(), params.getPosition());
        boolean kubernetes = state.isKubernetes(uri);
        YamlLanguageService service = state.languageService();
        return CompletableFuture.supplyAsync(() -> Either.forLeft(
                service.complete(uri, snapshot.version(), snapshot.text(), offset, kubernetes)));
    }

    @Override
    public CompletableFuture<CompletionItem> resolveCompletionItem(CompletionItem unresolved) {
        LOGGER.finest("ResolveCompletion");
        return completedFuture(unresolved);
    }

    @Override
    public CompletableFuture<Hover> hover(HoverParams params) {
        LOGGER.finest("Hover");

        String uri = params.getTextDocument().getUri();
        ServerState.Snapshot snapshot = state.snapshot(uri);
        if (snapshot == null) {
            client.unknownFileError(uri, "hover");
            return completedFuture(HoverHandler.EMPTY);
        }

        int offset = offsetOf(snapshot.text(), params.getPosition());
        boolean kubernetes = state.isKubernetes(uri);
        YamlLanguageService service = state.languageService();
        return CompletableFuture.supplyAsync(() -> {
            Hover hover = service.hover(uri, snapshot.version(), snapshot.text(), offset, kubernetes);
            return hover == null ? HoverHandler.EMPTY : hover;
        });
    }

    @Override
    public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>>
    documentSymbol(DocumentSymbolParams params) {
        LOGGER.finest("DocumentSymbol");

        String uri = params.getTextDocument().getUri();
        ServerState.Snapshot snapshot = state.snapshot(uri);
        if (snapshot == null) {
            client.unknownFileError(uri, "document symbol");
            return completedFuture(Collections.emptyList());
        }

        YamlLanguageService service = state.languageService();
        return CompletableFuture.supplyAsync(
                () -> service.documentSymbols(uri, snapshot.version(), snapshot.text()));
    }

    private void sendFileDiagnosticsForManagedDocuments() {
        for (String uri : state.managedUris()) {
            sendFileDiagnostics(uri, 0);
        }
    }

    private CompletableFuture<Void> sendFileDiagnostics(String uri, long delayMillis) {
        return state.lifecycleTasks().schedule(uri, delayMillis, () -> {
            ServerState.Snapshot snapshot = state.snapshot(uri);
            if (snapshot == null) {
                return;
            }
            List<Diagnostic> diagnostics = state.languageService()
                    .validate(uri, snapshot.version(), snapshot.text(), state.isKubernetes(uri));
            client.publishDiagnostics(uri, diagnostics);
        });
    }

    private static int offsetOf(String text, Position position) {
        int offset = LineIndex.of(text).offsetOf(position.getLine(), position.getCharacter());
        return offset < 0 ? text.length() : offset;
    }
}

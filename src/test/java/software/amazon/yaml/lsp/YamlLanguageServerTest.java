/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static software.amazon.yaml.lsp.LspMatchers.diagnosticWithMessage;
import static software.amazon.yaml.lsp.LspMatchers.hasLabel;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.junit.jupiter.api.Test;
import software.amazon.yaml.lsp.language.HoverHandler;

public class YamlLanguageServerTest {
    private static final String URI = "file:///work/app.yaml";
    private static final String SCHEMA_URI = "https://example.com/app.json";
    private static final String SCHEMA = """
            {
                "type": "object",
                "properties": {
                    "port": {"type": "integer", "description": "The port to listen on"},
                    "host": {"type": "string"}
                }
            }""";

    @Test
    public void advertisesCapabilities() throws Exception {
        YamlLanguageServer server = new YamlLanguageServer(new StubFetcher());
        server.connect(new StubClient());

        InitializeResult result = server.initialize(new InitializeParams()).get();

        assertThat(result.getCapabilities().getHoverProvider().getLeft(), is(true));
        assertThat(result.getCapabilities().getDocumentSymbolProvider().getLeft(), is(true));
        assertThat(result.getCapabilities().getCompletionProvider(), notNullValue());
    }

    @Test
    public void logsStartup() {
        StubClient client = new StubClient();
        YamlLanguageServer server = new YamlLanguageServer(new StubFetcher());

        server.connect(client);

        assertThat(client.logged.get(0).getType(), equalTo(MessageType.Info));
        assertThat(client.logged.get(0).getMessage(), startsWith("yaml-language-server"));
    }

    @Test
    public void publishesDiagnosticsOnOpen() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = initialized(client, new StubFetcher().put(SCHEMA_URI, SCHEMA));

        open(server, "port: abc\n");
        server.getState().lifecycleTasks().waitForAllTasks();

        assertThat(client.lastDiagnostics(URI).getDiagnostics(),
                contains(diagnosticWithMessage(equalTo("Incorrect type. Expected \"integer\"."))));
    }

    @Test
    public void revalidatesOnChange() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = initialized(client, new StubFetcher().put(SCHEMA_URI, SCHEMA));
        open(server, "port: abc\n");

        // Replace "abc" with "80"
        TextDocumentContentChangeEvent change = new TextDocumentContentChangeEvent(
                new Range(new Position(0, 6), new Position(0, 9)), "80");
        server.didChange(new DidChangeTextDocumentParams(
                new VersionedTextDocumentIdentifier(URI, 2), List.of(change)));
        awaitDiagnostics(server);

        assertThat(server.getState().snapshot(URI).text(), equalTo("port: 80\n"));
        assertThat(server.getState().snapshot(URI).version(), equalTo(2));
        assertThat(client.lastDiagnostics(URI).getDiagnostics(), empty());
    }

    @Test
    public void clearsDiagnosticsOnClose() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = initialized(client, new StubFetcher().put(SCHEMA_URI, SCHEMA));
        open(server, "port: abc\n");
        awaitDiagnostics(server);

        server.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(URI)));

        assertThat(client.lastDiagnostics(URI).getDiagnostics(), empty());
        assertThat(server.getState().managedUris(), empty());
    }

    @Test
    public void appliesSavedText() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = initialized(client, new StubFetcher().put(SCHEMA_URI, SCHEMA));
        open(server, "port: 1\n");
        awaitDiagnostics(server);

        server.didSave(new DidSaveTextDocumentParams(new TextDocumentIdentifier(URI), "port: true\n"));
        awaitDiagnostics(server);

        assertThat(client.lastDiagnostics(URI).getDiagnostics(), not(empty()));
    }

    @Test
    public void reportsRequestsForUnknownDocuments() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = initialized(client, new StubFetcher());
        client.clear();

        Hover hover = server.hover(new HoverParams(new TextDocumentIdentifier(URI), new Position(0, 0))).get();

        assertThat(hover, sameInstance(HoverHandler.EMPTY));
        assertThat(client.logged.get(0).getMessage(),
                equalTo("attempted to get document for hover that isn't open: " + URI));
    }

    @Test
    public void completesFromSchema() throws Exception {
        YamlLanguageServer server = initialized(new StubClient(), new StubFetcher().put(SCHEMA_URI, SCHEMA));
        open(server, "po");

        CompletionParams params = new CompletionParams(new TextDocumentIdentifier(URI), new Position(0, 2));
        List<CompletionItem> items = server.completion(params).get().getLeft();

        assertThat(items, hasItem(hasLabel("port")));
        assertThat(items, hasItem(hasLabel("host")));
    }

    @Test
    public void hoversFromSchema() throws Exception {
        YamlLanguageServer server = initialized(new StubClient(), new StubFetcher().put(SCHEMA_URI, SCHEMA));
        open(server, "port: 80\n");

        Hover hover = server.hover(new HoverParams(new TextDocumentIdentifier(URI), new Position(0, 1))).get();

        assertThat(hover.getContents().getRight().getValue(), equalTo("The port to listen on"));
    }

    @Test
    public void listsDocumentSymbols() throws Exception {
        YamlLanguageServer server = initialized(new StubClient(), new StubFetcher());
        open(server, "port: 80\nhost: local\n");

        var symbols = server.documentSymbol(new DocumentSymbolParams(new TextDocumentIdentifier(URI))).get();

        assertThat(symbols.size(), equalTo(2));
        assertThat(symbols.get(0).getRight().getName(), equalTo("port"));
    }

    @Test
    public void revalidatesOnConfigurationChange() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = initialized(client, new StubFetcher().put(SCHEMA_URI, SCHEMA));
        open(server, "port: abc\n");
        awaitDiagnostics(server);

        server.didChangeConfiguration(new DidChangeConfigurationParams(
                JsonParser.parseString("{\"yaml\": {\"validate\": false}}")));
        awaitDiagnostics(server);

        assertThat(server.getState().options().getValidate(), is(false));
        assertThat(client.lastDiagnostics(URI).getDiagnostics(), empty());
    }

    @Test
    public void revalidatesOnSchemaAssociations() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = new YamlLanguageServer(new StubFetcher().put(SCHEMA_URI, SCHEMA));
        server.connect(client);
        server.initialize(new InitializeParams()).get();
        open(server, "port: abc\n");
        awaitDiagnostics(server);
        assertThat(client.lastDiagnostics(URI).getDiagnostics(), empty());

        server.schemaAssociations(Map.of("*.yaml", List.of(SCHEMA_URI)));
        awaitDiagnostics(server);

        assertThat(client.lastDiagnostics(URI).getDiagnostics(), not(empty()));
    }

    @Test
    public void reloadsChangedSchemas() throws Exception {
        StubClient client = new StubClient();
        StubFetcher fetcher = new StubFetcher().put(SCHEMA_URI, SCHEMA);
        YamlLanguageServer server = initialized(client, fetcher);
        open(server, "port: abc\n");
        awaitDiagnostics(server);

        fetcher.put(SCHEMA_URI, "{\"type\": \"object\"}");
        server.didChangeWatchedFiles(new DidChangeWatchedFilesParams(
                List.of(new FileEvent(SCHEMA_URI, FileChangeType.Changed))));
        awaitDiagnostics(server);

        assertThat(client.lastDiagnostics(URI).getDiagnostics(), empty());
        assertThat(fetcher.fetchCount(SCHEMA_URI), equalTo(2));
    }

    @Test
    public void shutdownCancelsPendingValidation() throws Exception {
        StubClient client = new StubClient();
        YamlLanguageServer server = new YamlLanguageServer(new StubFetcher());
        server.connect(client);
        JsonObject options = JsonParser.parseString("{\"yaml.validation.debounce\": 10000}").getAsJsonObject();
        InitializeParams params = new InitializeParams();
        params.setInitializationOptions(options);
        server.initialize(params).get();
        open(server, "a: 1\n");
        awaitDiagnostics(server);
        client.clear();

        server.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(URI, 2),
                List.of(new TextDocumentContentChangeEvent("a: 2\n"))));
        server.shutdown().get();

        assertThat(server.getState().lifecycleTasks().getTask(URI), nullValue());
        assertThat(client.diagnostics, empty());
    }

    private static YamlLanguageServer initialized(StubClient client, StubFetcher fetcher) throws Exception {
        YamlLanguageServer server = new YamlLanguageServer(fetcher);
        server.connect(client);
        JsonObject options = JsonParser.parseString("""
                {
                    "yaml.validation.debounce": 0,
                    "yaml.schemas": {"%s": "*.yaml"}
                }""".formatted(SCHEMA_URI)).getAsJsonObject();
        InitializeParams params = new InitializeParams();
        params.setInitializationOptions(options);
        server.initialize(params).get();
        return server;
    }

    private static void open(YamlLanguageServer server, String text) {
        server.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(URI, "yaml", 1, text)));
    }

    private static void awaitDiagnostics(YamlLanguageServer server) throws Exception {
        server.getState().lifecycleTasks().waitForAllTasks();
    }
}

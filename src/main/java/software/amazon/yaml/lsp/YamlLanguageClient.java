/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import java.util.List;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Wrapper around a delegate {@link LanguageClient} that provides the
 * messages the server sends to the client.
 */
public final class YamlLanguageClient {
    private final LanguageClient delegate;

    YamlLanguageClient(LanguageClient delegate) {
        this.delegate = delegate;
    }

    /**
     * Log a {@link MessageType#Info} message on the client.
     *
     * @param message Message to log
     */
    public void info(String message) {
        delegate.logMessage(new MessageParams(MessageType.Info, message));
    }

    /**
     * Log a {@link MessageType#Error} message on the client.
     *
     * @param message Message to log
     */
    public void error(String message) {
        delegate.logMessage(new MessageParams(MessageType.Error, message));
    }

    /**
     * Log a {@link MessageType#Error} message on the client, for requests
     * about a document that hasn't been opened.
     *
     * @param uri LSP URI of the document that was requested.
     * @param source Reason for requesting the document.
     */
    public void unknownFileError(String uri, String source) {
        delegate.logMessage(new MessageParams(
                MessageType.Error, "attempted to get document for " + source + " that isn't open: " + uri));
    }

    /**
     * @param uri LSP URI of the document.
     * @param diagnostics All diagnostics of the document, replacing any
     *                    previously published.
     */
    public void publishDiagnostics(String uri, List<Diagnostic> diagnostics) {
        delegate.publishDiagnostics(new PublishDiagnosticsParams(uri, diagnostics));
    }

    /**
     * @param uri LSP URI of the document to clear the diagnostics of.
     */
    public void clearDiagnostics(String uri) {
        publishDiagnostics(uri, List.of());
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import software.amazon.smithy.utils.IoUtils;

/**
 * Retrieves the text of a schema given its URI.
 */
@FunctionalInterface
public interface SchemaFetcher {
    /**
     * @param uri The URI of the schema
     * @return The text of the schema
     * @throws IOException If the schema couldn't be retrieved
     */
    String fetch(String uri) throws IOException;

    /**
     * @return A fetcher that reads {@code file:} URIs and plain paths from
     *  disk, and everything else through {@link URL}
     */
    static SchemaFetcher urls() {
        return uri -> {
            try {
                if (uri.startsWith("file:")) {
                    return Files.readString(Paths.get(URI.create(uri)));
                }
                if (!uri.contains(":/")) {
                    Path path = Paths.get(uri);
                    return Files.readString(path);
                }
                return IoUtils.readUtf8Url(URI.create(uri).toURL());
            } catch (UncheckedIOException e) {
                throw e.getCause();
            } catch (IllegalArgumentException | FileSystemNotFoundException e) {
                // Malformed URIs, and paths the file system can't represent
                throw new IOException("Invalid schema URI: " + uri + " (" + e.getMessage() + ")", e);
            }
        };
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.protocol;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.yaml.lsp.document.LineIndex;

/**
 * Utility methods for converting to and from LSP types {@link Range},
 * {@link Position} and URI (which is just a string), and the offsets the
 * engines work with.
 */
public final class LspAdapter {
    private LspAdapter() {
    }

    /**
     * @param startLine Range start line
     * @param startCharacter Range start character
     * @param endLine Range end line
     * @param endCharacter Range end character
     * @return Range of (startLine, startCharacter) - (endLine, endCharacter)
     */
    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Converts a span of offsets to a range, clamping both ends to the text.
     *
     * @param lineIndex The line index of the text the offsets are in
     * @param start The start offset
     * @param end The end offset
     * @return The range of the span
     */
    public static Range toRange(LineIndex lineIndex, int start, int end) {
        int length = lineIndex.length();
        int clampedStart = Math.max(0, Math.min(start, length));
        int clampedEnd = Math.max(clampedStart, Math.min(end, length));
        return new Range(lineIndex.positionOf(clampedStart), lineIndex.positionOf(clampedEnd));
    }

    /**
     * @param uri LSP URI of a file
     * @return The file name of {@code uri} without its extension, or the last
     *  path segment if it isn't a file URI
     */
    public static String baseName(String uri) {
        String name;
        if (uri.startsWith("file:")) {
            Path fileName = Paths.get(URI.create(uri)).getFileName();
            name = fileName == null ? "" : fileName.toString();
        } else {
            int slash = uri.lastIndexOf('/');
            name = uri.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.document;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * In-memory representation of a text document, indexed by line, which can
 * be patched in-place by the hosting layer.
 *
 * <p>Methods on this class will often return {@code -1} or {@code null} for
 * failure cases to reduce allocations, since these methods may be called
 * frequently.
 */
public final class Document {
    private final StringBuilder buffer;
    private LineIndex lineIndex;

    private Document(StringBuilder buffer, LineIndex lineIndex) {
        this.buffer = buffer;
        this.lineIndex = lineIndex;
    }

    /**
     * @param string String to create a document for
     * @return The created document
     */
    public static Document of(String string) {
        StringBuilder buffer = new StringBuilder(string);
        return new Document(buffer, LineIndex.of(buffer));
    }

    /**
     * @return A copy of this document
     */
    public Document copy() {
        return new Document(new StringBuilder(buffer), lineIndex);
    }

    /**
     * @param range The range to apply the edit to. Providing {@code null} will
     *              replace the text in the document
     * @param text The text of the edit to apply
     */
    public void applyEdit(Range range, String text) {
        if (range == null) {
            buffer.replace(0, buffer.length(), text);
        } else {
            Position start = range.getStart();
            Position end = range.getEnd();
            if (start.getLine() >= lineIndex.lineCount()) {
                buffer.append(text);
            } else {
                int startIndex = lineIndex.offsetOf(start.getLine(), start.getCharacter());
                if (end.getLine() >= lineIndex.lineCount()) {
                    buffer.replace(startIndex, buffer.length(), text);
                } else {
                    int endIndex = lineIndex.offsetOf(end.getLine(), end.getCharacter());
                    buffer.replace(startIndex, endIndex, text);
                }
            }
        }
        this.lineIndex = LineIndex.of(buffer);
    }

    /**
     * @return The line index of the current text
     */
    public LineIndex lineIndex() {
        return lineIndex;
    }

    /**
     * @param line The line to find the index of
     * @return The index of the start of the given {@code line}, or {@code -1}
     *  if the line doesn't exist
     */
    public int indexOfLine(int line) {
        return lineIndex.lineStart(line);
    }

    /**
     * @param position The position to find the index of
     * @return The index of the position in this document, or {@code -1} if the
     *  position is out of bounds
     */
    public int indexOfPosition(Position position) {
        return indexOfPosition(position.getLine(), position.getCharacter());
    }

    /**
     * Unlike most lookups, the end of the document is a valid index here, since
     * it is where the cursor sits when typing at the end of the last line.
     *
     * @param line The line of the index to find
     * @param character The character offset in the line
     * @return The index of the position in this document, or {@code -1} if the
     *  position is out of bounds
     */
    public int indexOfPosition(int line, int character) {
        int startLineIdx = indexOfLine(line);
        if (startLineIdx < 0) {
            // line is oob
            return -1;
        }

        int idx = startLineIdx + character;
        if (idx > lineIndex.lineContentEnd(line)) {
            // index is onto next line
            return -1;
        }
        return idx;
    }

    /**
     * @param index The index to find the position of
     * @return The position of the index in this document, or {@code null} if
     *  the index is out of bounds
     */
    public Position positionAtIndex(int index) {
        return lineIndex.positionOf(index);
    }

    /**
     * @return The line number of the last line in this document
     */
    public int lastLine() {
        return lineIndex.lineCount() - 1;
    }

    /**
     * @return The end position of this document
     */
    public Position end() {
        return lineIndex.positionOf(buffer.length());
    }

    /**
     * @return A copy of the text of this document
     */
    public String copyText() {
        return buffer.toString();
    }

    /**
     * @param range The range to copy the text of
     * @return A copy of the text in this document within the given {@code range}
     *  or {@code null} if the range is out of bounds
     */
    public String copyRange(Range range) {
        int start = indexOfPosition(range.getStart());
        int end = indexOfPosition(range.getEnd());
        return copySpan(start, end);
    }

    /**
     * @param start The index of the start of the span to copy
     * @param end The index of the end of the span to copy
     * @return A copy of the text within the indicies {@code start} and
     *  {@code end}, or {@code null} if the span is out of bounds or start > end
     */
    public String copySpan(int start, int end) {
        // end is exclusive
        if (start < 0 || end > buffer.length() || start > end) {
            return null;
        }
        return buffer.substring(start, end);
    }

    /**
     * @return The length of the document
     */
    public int length() {
        return buffer.length();
    }
}

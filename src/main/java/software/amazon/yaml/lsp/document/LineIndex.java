/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.document;

import java.util.Arrays;
import org.eclipse.lsp4j.Position;

/**
 * Immutable table of the line start offsets of some text.
 *
 * <p>Line breaks are recognized the same way the YAML scanner recognizes
 * them: {@code \n}, {@code \r\n}, a lone {@code \r}, and the unicode breaks
 * {@code \u0085}, {@code \u2028} and {@code \u2029}. Using the same rules
 * as the scanner means line/column marks it reports can be mapped back to
 * offsets without drifting.
 *
 * <p>Like {@link Document}, methods return {@code -1} or {@code null} for
 * out of bounds input rather than throwing.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int[] contentEnds;
    private final int length;

    private LineIndex(int[] lineStarts, int[] contentEnds, int length) {
        this.lineStarts = lineStarts;
        this.contentEnds = contentEnds;
        this.length = length;
    }

    /**
     * @param text The text to index
     * @return The line index of {@code text}
     */
    public static LineIndex of(CharSequence text) {
        int[] starts = new int[16];
        int[] ends = new int[16];
        int lines = 0;
        int lineStart = 0;
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            int breakLength = 0;
            if (c == '\r') {
                breakLength = (i + 1 < len && text.charAt(i + 1) == '\n') ? 2 : 1;
            } else if (c == '\n' || c == '\u0085' || c == '\u2028' || c == '\u2029') {
                breakLength = 1;
            }

            if (breakLength > 0) {
                if (lines + 1 >= starts.length) {
                    starts = Arrays.copyOf(starts, starts.length * 2);
                    ends = Arrays.copyOf(ends, ends.length * 2);
                }
                starts[lines] = lineStart;
                ends[lines] = i;
                lines++;
                i += breakLength;
                lineStart = i;
            } else {
                i++;
            }
        }
        if (lines + 1 > starts.length) {
            starts = Arrays.copyOf(starts, lines + 1);
            ends = Arrays.copyOf(ends, lines + 1);
        }
        starts[lines] = lineStart;
        ends[lines] = len;
        lines++;
        return new LineIndex(Arrays.copyOf(starts, lines), Arrays.copyOf(ends, lines), len);
    }

    /**
     * @return The number of lines, which is always at least one
     */
    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * @return The length of the indexed text
     */
    public int length() {
        return length;
    }

    /**
     * @param line The line to get the start of
     * @return The offset of the first character of {@code line}, or {@code -1}
     *  if the line doesn't exist
     */
    public int lineStart(int line) {
        if (line < 0 || line >= lineStarts.length) {
            return -1;
        }
        return lineStarts[line];
    }

    /**
     * @param line The line to get the end of
     * @return The offset just past the last non-line-break character of
     *  {@code line}, or {@code -1} if the line doesn't exist
     */
    public int lineContentEnd(int line) {
        if (line < 0 || line >= contentEnds.length) {
            return -1;
        }
        return contentEnds[line];
    }

    /**
     * @param offset The offset to find the line of
     * @return The line containing {@code offset}, or {@code -1} if it is out
     *  of bounds. The end of the text belongs to the last line.
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > length) {
            return -1;
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        if (idx >= 0) {
            return idx;
        }
        return -idx - 2;
    }

    /**
     * Computes an offset from a line and a character, clamping the character
     * to the end of the line's content.
     *
     * @param line The line of the position
     * @param character The character within the line
     * @return The offset, or {@code -1} if the line doesn't exist
     */
    public int offsetOf(int line, int character) {
        int start = lineStart(line);
        if (start < 0 || character < 0) {
            return -1;
        }
        return Math.min(start + character, contentEnds[line]);
    }

    /**
     * Computes an offset from a line and a column counted in code points, as
     * the YAML scanner reports them.
     *
     * @param text The text this index was built from
     * @param line The line of the mark
     * @param codePointColumn The column of the mark, in code points
     * @return The offset, or {@code -1} if the line doesn't exist
     */
    public int offsetOfCodePoint(CharSequence text, int line, int codePointColumn) {
        int start = lineStart(line);
        if (start < 0) {
            return -1;
        }
        int offset = start;
        int end = contentEnds[line];
        for (int i = 0; i < codePointColumn && offset < end; i++) {
            offset += Character.isHighSurrogate(text.charAt(offset)) && offset + 1 < end ? 2 : 1;
        }
        return offset;
    }

    /**
     * @param offset The offset to get the position of
     * @return The position of {@code offset}, or {@code null} if the offset is
     *  out of bounds
     */
    public Position positionOf(int offset) {
        int line = lineOf(offset);
        if (line < 0) {
            return null;
        }
        return new Position(line, offset - lineStarts[line]);
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import software.amazon.yaml.lsp.document.LineIndex;

/**
 * A copy of some text with an insertion that makes the line being typed on
 * parse as a mapping entry, so there is a key node to complete.
 *
 * <p>A word with no colon after it, like {@code metad}, parses as a plain
 * scalar rather than a key, and an empty line parses as nothing at all.
 * Completing on either requires pretending the user has typed a bit more:
 * a {@code :} after the word, or a placeholder key on the empty line.
 *
 * <p>All insertions are at or after the cursor, so offsets before
 * {@link #insertAt()} are the same in both texts. Offsets in the patched text
 * are translated back with {@link #toOriginal(int)}.
 *
 * @param text The patched text
 * @param offset The cursor offset, which is the same in both texts
 * @param insertAt The offset of the insertion in the original text
 * @param delta The length of the insertion
 */
record CompletionPatch(String text, int offset, int insertAt, int delta) {
    static final String PLACEHOLDER = "holder";

    /**
     * @param text The original text
     * @param offset The cursor offset
     * @return The patch needed to complete at {@code offset}, which may be
     *  no change at all
     */
    static CompletionPatch patch(String text, int offset) {
        LineIndex lineIndex = LineIndex.of(text);
        int line = lineIndex.lineOf(offset);
        int lineStart = lineIndex.lineStart(line);
        int lineEnd = lineIndex.lineContentEnd(line);
        String lineText = text.substring(lineStart, lineEnd);

        if (lineText.indexOf(':') >= 0) {
            return none(text, offset);
        }

        String trimmed = lineText.strip();
        if (trimmed.isEmpty()) {
            return insert(text, offset, offset, PLACEHOLDER + ":");
        }
        if (trimmed.equals("-")) {
            int dashEnd = lineStart + lineText.indexOf('-') + 1;
            int at = Math.max(offset, dashEnd);
            return insert(text, offset, at, (at == dashEnd ? " " : "") + PLACEHOLDER + ":");
        }
        if (trimmed.startsWith("#")) {
            return none(text, offset);
        }

        int contentEnd = lineStart + lineText.stripTrailing().length();
        return insert(text, offset, Math.max(offset, contentEnd), ":");
    }

    /**
     * Puts a placeholder key on a new, further indented line after the
     * cursor, for completing the value of a {@code key:} as a nested mapping.
     *
     * @param text The original text
     * @param offset The cursor offset, which must be at the end of a {@code key:}
     * @param indentation The indentation of the new line
     * @return The patch
     */
    static CompletionPatch newLine(String text, int offset, String indentation) {
        return insert(text, offset, offset, "\n" + indentation + PLACEHOLDER + ":");
    }

    static CompletionPatch none(String text, int offset) {
        return new CompletionPatch(text, offset, offset, 0);
    }

    /**
     * @return Whether the text was patched
     */
    boolean isPatched() {
        return delta > 0;
    }

    /**
     * @param patchedOffset An offset in the patched text
     * @return The corresponding offset in the original text. Offsets inside
     *  the insertion map to where it was inserted.
     */
    int toOriginal(int patchedOffset) {
        if (patchedOffset <= insertAt) {
            return patchedOffset;
        }
        return Math.max(insertAt, patchedOffset - delta);
    }

    /**
     * @return The offset in the patched text to look for the node being
     *  completed at
     */
    int lookupOffset() {
        if (text.startsWith(PLACEHOLDER + ":", insertAt + delta - PLACEHOLDER.length() - 1) && delta > 1) {
            return insertAt + delta - PLACEHOLDER.length() - 1;
        }
        return offset;
    }

    /**
     * @param patchedOffset An offset in the patched text
     * @return Whether the offset is inside the insertion
     */
    boolean isInserted(int patchedOffset) {
        return isPatched() && patchedOffset >= insertAt && patchedOffset < insertAt + delta;
    }

    private static CompletionPatch insert(String text, int offset, int at, String insertion) {
        String patched = text.substring(0, at) + insertion + text.substring(at);
        return new CompletionPatch(patched, offset, at, insertion.length());
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import org.eclipse.lsp4j.DiagnosticSeverity;

/**
 * A way in which a document doesn't conform to its schema.
 *
 * @param start The start offset of the problem
 * @param end The end offset of the problem
 * @param message The human-readable message
 * @param severity How bad the problem is
 */
public record Problem(int start, int end, String message, DiagnosticSeverity severity) {
    static Problem error(int start, int end, String message) {
        return new Problem(start, end, message, DiagnosticSeverity.Error);
    }

    static Problem warning(int start, int end, String message) {
        return new Problem(start, end, message, DiagnosticSeverity.Warning);
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

/**
 * A problem loading a schema or one of the schemas it references.
 *
 * @param uri The URI of the schema the problem is in
 * @param message The human-readable message
 * @param kind What went wrong
 */
public record SchemaError(String uri, String message, Kind kind) {
    public enum Kind {
        /**
         * The schema couldn't be fetched or parsed.
         */
        LOAD,

        /**
         * A {@code $ref} couldn't be followed.
         */
        REF
    }

    static SchemaError unableToLoad(String uri, String reason) {
        return new SchemaError(uri, String.format("Unable to load schema from '%s': %s", uri, reason), Kind.LOAD);
    }

    static SchemaError unableToParse(String uri, String reason) {
        return new SchemaError(uri, String.format("Unable to parse content from '%s': %s.", uri, reason), Kind.LOAD);
    }

    static SchemaError unresolvedRef(String uri, String ref) {
        return new SchemaError(uri, String.format("$ref '%s' in '%s' can not be resolved.", ref, uri), Kind.REF);
    }

    static SchemaError problemLoadingRef(String uri, String ref, String reason) {
        return new SchemaError(uri, String.format("Problems loading reference '%s': %s", ref, reason), Kind.REF);
    }
}

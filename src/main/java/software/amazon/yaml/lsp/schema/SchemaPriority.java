/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

/**
 * Where an association came from. When associations from more than one
 * source match a resource, only those with the highest priority are used.
 */
public enum SchemaPriority {
    SCHEMA_STORE(1),
    SCHEMA_ASSOCIATION(2),
    SETTINGS(3),
    MODELINE(4);

    private final int value;

    SchemaPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.List;

/**
 * A client-provided hook which picks the schemas of a resource, taking
 * precedence over modelines and associations.
 */
@FunctionalInterface
public interface SchemaResolver {
    /**
     * @param resourceUri The URI of the resource to find schemas for
     * @return The schema URIs, or an empty list to fall back to the other
     *  ways of associating schemas
     */
    List<String> resolve(String resourceUri);
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import org.eclipse.lsp4j.jsonrpc.services.JsonSegment;

/**
 * Interface for protocol extensions shared with JSON language servers.
 */
@JsonSegment("json")
public interface YamlProtocolExtensions {

  /**
   * Replaces the schema associations contributed by editor extensions.
   *
   * @param associations Schema URIs, by the glob of the resources they apply to
   */
  @JsonNotification
  void schemaAssociations(Map<String, List<String>> associations);
}

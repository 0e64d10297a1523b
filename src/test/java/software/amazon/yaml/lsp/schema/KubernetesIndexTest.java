/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.node.Node;
import software.amazon.yaml.lsp.syntax.Syntax;

public class KubernetesIndexTest {
    private static final String POD = "io.k8s.api.core.v1.Pod";
    private static final ResolvedSchema SCHEMA = ResolvedSchema.of("https://example.com/k8s.json", Node.parse("""
            {
                "oneOf": [{"$ref": "#/definitions/io.k8s.api.core.v1.Pod"}],
                "definitions": {
                    "io.k8s.api.core.v1.Pod": {
                        "properties": {
                            "apiVersion": {"type": "string"},
                            "kind": {"type": "string", "enum": ["Pod"]},
                            "metadata": {"$ref": "#/definitions/meta"},
                            "spec": {"$ref": "#/definitions/podspec"}
                        }
                    },
                    "meta": {
                        "properties": {
                            "name": {"type": "string"},
                            "labels": {"type": "object"}
                        }
                    },
                    "podspec": {
                        "properties": {
                            "containers": {"type": "array", "items": {"$ref": "#/definitions/container"}},
                            "restartPolicy": {"type": "string", "enum": ["Always", "Never"], "default": "Always"},
                            "dnsPolicy": {"type": "string", "enum": ["ClusterFirst"], "default": "Default"}
                        }
                    },
                    "container": {
                        "properties": {
                            "image": {"type": "string"},
                            "name": {"type": "string"}
                        }
                    }
                }
            }
            """));

    @Test
    public void indexesApiObjectProperties() {
        KubernetesIndex index = SCHEMA.kubernetesIndex();

        assertThat(index.isEmpty(), is(false));
        assertThat(index.rootNodes().keySet(), contains("apiVersion", "kind", "metadata", "spec"));
        KubernetesIndex.Entry kind = index.rootNodes().get("kind").get(0);
        assertThat(kind.owner(), equalTo(POD));
        assertThat(kind.type(), equalTo("string"));
        assertThat(kind.enumValues(), contains(Node.from("Pod")));
    }

    @Test
    public void indexesDefinitionProperties() {
        KubernetesIndex index = SCHEMA.kubernetesIndex();

        assertThat(index.childrenNodes().keySet(), hasItems("image", "containers", "labels"));
        assertThat(index.childrenNodes().get("image").get(0).owner(), equalTo("container"));
    }

    @Test
    public void topLevelEntriesComeFirst() {
        List<KubernetesIndex.Entry> entries = SCHEMA.kubernetesIndex().entries("spec");

        assertThat(entries.size(), equalTo(2));
        assertThat(entries.get(0).owner(), equalTo(POD));
    }

    @Test
    public void childrenFollowReferencesAndItems() {
        KubernetesIndex index = SCHEMA.kubernetesIndex();

        assertThat(index.childrenOf("metadata"), contains("name", "labels"));
        assertThat(index.childrenOf("spec"), contains("containers", "restartPolicy", "dnsPolicy"));
        assertThat(index.childrenOf("containers"), contains("image", "name"));

        KubernetesIndex.Entry containers = index.entries("containers").get(0);
        assertThat(containers.type(), equalTo("array"));
        assertThat(containers.childRef(), equalTo("https://example.com/k8s.json#/definitions/container"));
    }

    @Test
    public void valuesIncludeDefault() {
        KubernetesIndex index = SCHEMA.kubernetesIndex();

        assertThat(index.entries("restartPolicy").get(0).values(),
                contains(Node.from("Always"), Node.from("Never")));
        assertThat(index.entries("dnsPolicy").get(0).values(),
                contains(Node.from("ClusterFirst"), Node.from("Default")));
    }

    @Test
    public void allowedKeysDependOnPosition() {
        Syntax.Node.Obj root = (Syntax.Node.Obj) Syntax.parse("""
                apiVersion: v1
                kind: Pod
                spec:
                  containers:
                    - image: nginx
                  other:
                    x: 1
                """, true).documents().get(0).root();
        KubernetesIndex index = SCHEMA.kubernetesIndex();
        Syntax.Node.Obj spec = (Syntax.Node.Obj) root.getProperty("spec").value();
        Syntax.Node.Arr containers = (Syntax.Node.Arr) spec.getProperty("containers").value();
        Syntax.Node.Obj container = (Syntax.Node.Obj) containers.items().get(0);
        Syntax.Node.Obj other = (Syntax.Node.Obj) spec.getProperty("other").value();

        assertThat(index.allowedKeys(root), containsInAnyOrder("apiVersion", "kind", "metadata", "spec"));
        assertThat(index.allowedKeys(spec), contains("containers", "restartPolicy", "dnsPolicy"));
        assertThat(index.allowedKeys(container), contains("image", "name"));
        assertThat(index.allowedKeys(other), empty());
    }

    @Test
    public void builtOncePerSchema() {
        assertThat(SCHEMA.kubernetesIndex(), sameInstance(SCHEMA.kubernetesIndex()));
    }

    @Test
    public void schemaWithoutApiObjectsIsEmpty() {
        ResolvedSchema schema = ResolvedSchema.of("https://example.com/empty.json", Node.parse("{}"));

        assertThat(schema.kubernetesIndex().isEmpty(), is(true));
    }
}

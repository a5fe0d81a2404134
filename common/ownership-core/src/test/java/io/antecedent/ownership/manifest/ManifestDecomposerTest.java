package io.antecedent.ownership.manifest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ManifestDecomposerTest {

  private final ManifestDecomposer decomposer = new ManifestDecomposer();

  @Test
  void emptyOrBlankManifestHasNoResources() {
    assertThat(decomposer.decompose("")).isEmpty();
    assertThat(decomposer.decompose("   \n---\n\n---\n")).isEmpty();
    assertThat(decomposer.decompose(null)).isEmpty();
  }

  @Test
  void keepsManifestOrderAndDuplicates() {
    String manifest = """
        ---
        # Source: podinfo/templates/service.yaml
        apiVersion: v1
        kind: Service
        metadata:
          name: podinfo
        ---
        apiVersion: apps/v1
        kind: Deployment
        metadata:
          name: podinfo
        ---
        apiVersion: v1
        kind: Service
        metadata:
          name: podinfo
        """;

    List<ResourceDescriptor> resources = decomposer.decompose(manifest);

    assertThat(resources).extracting(ResourceDescriptor::kind).containsExactly("Service", "Deployment", "Service");
    assertThat(resources.get(0)).isEqualTo(resources.get(2));
    assertThat(resources.get(1).groupVersionKind()).isEqualTo(new GroupVersionKind("apps", "v1", "Deployment"));
  }

  @Test
  void skipsDocumentsThatAreNotResources() {
    String manifest = """
        apiVersion: v1
        kind: ConfigMap
        metadata: {name: [broken
        ---
        just a string
        ---
        metadata:
          name: no-kind
        ---
        kind: Secret
        metadata:
          name: no-api-version
        ---
        # only a comment
        ---
        apiVersion: v1
        kind: ServiceAccount
        metadata:
          name: podinfo
        """;

    List<ResourceDescriptor> resources = decomposer.decompose(manifest);

    assertThat(resources).singleElement().satisfies(resource -> {
      assertThat(resource.kind()).isEqualTo("ServiceAccount");
      assertThat(resource.name()).isEqualTo("podinfo");
    });
  }

  @Test
  void expandsListsInPlaceOfTheWrapper() {
    String manifest = """
        apiVersion: v1
        kind: Namespace
        metadata:
          name: first
        ---
        apiVersion: v1
        kind: List
        items:
          - apiVersion: v1
            kind: ConfigMap
            metadata:
              name: one
          - apiVersion: v1
            kind: Secret
            metadata:
              name: two
        ---
        apiVersion: v1
        kind: Namespace
        metadata:
          name: last
        """;

    List<ResourceDescriptor> resources = decomposer.decompose(manifest);

    assertThat(resources).extracting(ResourceDescriptor::name).containsExactly("first", "one", "two", "last");
    assertThat(resources).extracting(ResourceDescriptor::kind).doesNotContain("List");
  }

  @Test
  void emptyListContributesNothing() {
    String manifest = """
        apiVersion: v1
        kind: ConfigMapList
        items: []
        """;

    assertThat(decomposer.decompose(manifest)).isEmpty();
  }

  @Test
  void listWithNonObjectMemberIsDroppedEntirely() {
    String manifest = """
        apiVersion: v1
        kind: List
        items:
          - apiVersion: v1
            kind: ConfigMap
            metadata:
              name: one
          - not-an-object
        ---
        apiVersion: v1
        kind: Secret
        metadata:
          name: kept
        """;

    assertThat(decomposer.decompose(manifest)).extracting(ResourceDescriptor::name).containsExactly("kept");
  }

  @Test
  void preservesFieldsItDoesNotInterpret() {
    String manifest = """
        apiVersion: apps/v1
        kind: Deployment
        metadata:
          name: podinfo
          labels:
            app.kubernetes.io/name: podinfo
          annotations:
            checksum/config: abc123
        spec:
          replicas: 2
          template:
            spec:
              containers:
                - name: podinfo
                  image: ghcr.io/stefanprodan/podinfo:6.5.0
        """;

    ResourceDescriptor resource = decomposer.decompose(manifest).get(0);

    assertThat(resource.annotations()).containsExactly(Map.entry("checksum/config", "abc123"));
    assertThat(resource.asMap()).containsKeys("apiVersion", "kind", "metadata", "spec");
    @SuppressWarnings("unchecked")
    Map<String, Object> spec = (Map<String, Object>) resource.asMap().get("spec");
    assertThat(spec).containsEntry("replicas", 2);
  }
}

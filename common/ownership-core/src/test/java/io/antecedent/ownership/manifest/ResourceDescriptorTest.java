package io.antecedent.ownership.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResourceDescriptorTest {

  @Test
  void emptyNamespaceReceivesReleaseNamespace() {
    ResourceDescriptor resource = descriptor(Map.of("name", "podinfo"));

    ResourceDescriptor defaulted = resource.withDefaultNamespace("apps");

    assertThat(defaulted.namespace()).isEqualTo("apps");
    assertThat(defaulted.name()).isEqualTo("podinfo");
    assertThat(resource.namespace()).isEmpty();
  }

  @Test
  void explicitNamespaceIsLeftUnchanged() {
    ResourceDescriptor resource = descriptor(Map.of("name", "podinfo", "namespace", "shared"));

    assertThat(resource.withDefaultNamespace("apps")).isSameAs(resource);
  }

  @Test
  void copiesInputSoLaterChangesDoNotLeakIn() {
    Map<String, Object> metadata = new LinkedHashMap<>(Map.of("name", "podinfo"));
    Map<String, Object> content = new LinkedHashMap<>(Map.of("apiVersion", "v1", "kind", "Service", "metadata", metadata));
    ResourceDescriptor resource = ResourceDescriptor.of(content);

    metadata.put("name", "changed");

    assertThat(resource.name()).isEqualTo("podinfo");
    assertThatThrownBy(() -> resource.asMap().put("kind", "Pod")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void splitsApiVersionIntoGroupAndVersion() {
    assertThat(GroupVersionKind.of("v1", "Service")).isEqualTo(new GroupVersionKind("", "v1", "Service"));
    assertThat(GroupVersionKind.of("networking.k8s.io/v1", "Ingress").group()).isEqualTo("networking.k8s.io");
    assertThat(GroupVersionKind.of("networking.k8s.io/v1", "Ingress").apiVersion()).isEqualTo("networking.k8s.io/v1");
  }

  @Test
  void missingMetadataReadsAsEmpty() {
    ResourceDescriptor resource = ResourceDescriptor.of(Map.of("apiVersion", "v1", "kind", "Namespace"));

    assertThat(resource.name()).isEmpty();
    assertThat(resource.annotations()).isEmpty();
    assertThat(resource.annotation("anything")).isEmpty();
  }

  private static ResourceDescriptor descriptor(Map<String, Object> metadata) {
    return ResourceDescriptor.of(Map.of("apiVersion", "v1", "kind", "Service", "metadata", metadata));
  }
}

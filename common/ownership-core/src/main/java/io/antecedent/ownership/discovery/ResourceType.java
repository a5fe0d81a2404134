package io.antecedent.ownership.discovery;

import io.antecedent.ownership.manifest.GroupVersionKind;
import java.util.Objects;

/**
 * Backend addressable form of a kind: the plural resource name under its group and version,
 * and whether instances live inside a namespace.
 */
public record ResourceType(String group, String version, String resource, String kind, boolean namespaced) {

  public ResourceType {
    group = group == null ? "" : group;
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(kind, "kind");
  }

  public GroupVersionKind groupVersionKind() {
    return new GroupVersionKind(group, version, kind);
  }

  public String apiVersion() {
    return group.isEmpty() ? version : group + "/" + version;
  }
}

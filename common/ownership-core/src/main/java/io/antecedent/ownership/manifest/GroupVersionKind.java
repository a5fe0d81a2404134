package io.antecedent.ownership.manifest;

import java.util.Objects;

/**
 * API group, version and kind of a resource. The core API group is the empty string.
 */
public record GroupVersionKind(String group, String version, String kind) {

  public GroupVersionKind {
    group = group == null ? "" : group;
    version = version == null ? "" : version;
    kind = kind == null ? "" : kind;
  }

  /**
   * Splits an {@code apiVersion} value such as {@code apps/v1} or {@code v1} and pairs it with the kind.
   */
  public static GroupVersionKind of(String apiVersion, String kind) {
    Objects.requireNonNull(kind, "kind");
    if (apiVersion == null || apiVersion.isBlank()) {
      return new GroupVersionKind("", "", kind);
    }
    int slash = apiVersion.lastIndexOf('/');
    if (slash < 0) {
      return new GroupVersionKind("", apiVersion, kind);
    }
    return new GroupVersionKind(apiVersion.substring(0, slash), apiVersion.substring(slash + 1), kind);
  }

  public String apiVersion() {
    return group.isEmpty() ? version : group + "/" + version;
  }

  @Override
  public String toString() {
    return apiVersion() + ", Kind=" + kind;
  }
}

package io.antecedent.ownership.manifest;

import java.util.Objects;

/**
 * Rendered manifest of a release together with the namespace its resources default to.
 *
 * @param releaseName name of the release, used in diagnostics only
 * @param namespace   namespace applied to resources that do not declare one
 * @param content     multi-document YAML text
 */
public record ReleaseManifest(String releaseName, String namespace, String content) {

  public ReleaseManifest {
    Objects.requireNonNull(namespace, "namespace");
    releaseName = releaseName == null ? "" : releaseName;
    content = content == null ? "" : content;
  }
}

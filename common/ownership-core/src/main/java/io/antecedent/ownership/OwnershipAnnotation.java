package io.antecedent.ownership;

import io.antecedent.ownership.manifest.ResourceDescriptor;
import java.util.Map;
import java.util.Optional;

/**
 * The annotation recording which release last claimed a resource.
 * <p>
 * Owner references cannot point across namespaces, so ownership is kept in an annotation whose
 * value is the serialised {@link ReleaseId} of the claiming release.
 */
public final class OwnershipAnnotation {

  public static final String KEY = "helm.fluxcd.io/antecedent";

  private OwnershipAnnotation() {
  }

  public static Optional<String> read(ResourceDescriptor resource) {
    return resource == null ? Optional.empty() : resource.annotation(KEY);
  }

  /**
   * Merge patch that sets only the ownership annotation and leaves every other field as stored.
   */
  public static Map<String, Object> mergePatch(ReleaseId owner) {
    return Map.of("metadata", Map.of("annotations", Map.of(KEY, owner.toString())));
  }
}

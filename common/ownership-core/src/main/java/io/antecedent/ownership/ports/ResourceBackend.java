package io.antecedent.ownership.ports;

import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.manifest.ResourceDescriptor;
import java.util.Map;

/**
 * Read and merge-patch access to live resources, addressed by resolved type, namespace and name.
 * <p>
 * Implementations report failures as {@link BackendException}; a missing object is a
 * {@code BackendException} with status 404, never {@code null}. For cluster-scoped types the
 * namespace argument is ignored.
 */
public interface ResourceBackend {

  ResourceDescriptor get(ResourceType type, String namespace, String name);

  /**
   * Applies a JSON merge patch (RFC 7386) to the named resource.
   *
   * @param mergeDocument patch body; only the fields it names are changed
   * @return the resource as stored after the patch
   */
  ResourceDescriptor patch(ResourceType type, String namespace, String name, Map<String, Object> mergeDocument);
}

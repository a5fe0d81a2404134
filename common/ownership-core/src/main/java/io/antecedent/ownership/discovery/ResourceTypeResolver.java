package io.antecedent.ownership.discovery;

import io.antecedent.ownership.SchemaDiscoveryException;
import io.antecedent.ownership.manifest.GroupVersionKind;
import io.antecedent.ownership.ports.SchemaDiscovery;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Kind to resource type table built from one round of schema discovery.
 * <p>
 * A resolver reflects the backend at the moment it was built; callers build a new one per
 * operation instead of keeping it around.
 */
public final class ResourceTypeResolver {

  private final Map<GroupVersionKind, ResourceType> types;

  private ResourceTypeResolver(Map<GroupVersionKind, ResourceType> types) {
    this.types = types;
  }

  /**
   * Queries the backend and builds the table.
   *
   * @throws SchemaDiscoveryException when discovery fails as a whole
   */
  public static ResourceTypeResolver discover(SchemaDiscovery discovery) {
    Objects.requireNonNull(discovery, "discovery");
    List<ResourceType> discovered;
    try {
      discovered = discovery.resourceTypes();
    } catch (RuntimeException e) {
      throw new SchemaDiscoveryException("Unable to discover resource types: " + e.getMessage(), e);
    }
    if (discovered == null) {
      throw new SchemaDiscoveryException("Schema discovery returned no resource types", null);
    }
    return of(discovered);
  }

  public static ResourceTypeResolver of(List<ResourceType> discovered) {
    Map<GroupVersionKind, ResourceType> table = new LinkedHashMap<>();
    for (ResourceType type : discovered) {
      // first registration wins when a kind is served under several resource names
      table.putIfAbsent(type.groupVersionKind(), type);
    }
    return new ResourceTypeResolver(Collections.unmodifiableMap(table));
  }

  public Optional<ResourceType> resolve(GroupVersionKind gvk) {
    if (gvk == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(types.get(gvk));
  }

  public int size() {
    return types.size();
  }
}

package io.antecedent.ownership.ports;

import io.antecedent.ownership.discovery.ResourceType;
import java.util.List;

/**
 * Enumerates the resource types the connected backend serves right now.
 */
public interface SchemaDiscovery {

  List<ResourceType> resourceTypes();
}

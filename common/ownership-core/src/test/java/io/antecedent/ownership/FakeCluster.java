package io.antecedent.ownership;

import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.manifest.ResourceDescriptor;
import io.antecedent.ownership.ports.BackendConnector;
import io.antecedent.ownership.ports.BackendException;
import io.antecedent.ownership.ports.BackendSession;
import io.antecedent.ownership.ports.ResourceBackend;
import io.antecedent.ownership.ports.SchemaDiscovery;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory backend with scripted failures, used by the verifier and writer tests.
 */
final class FakeCluster implements BackendConnector {

  static final ResourceType CONFIG_MAPS = new ResourceType("", "v1", "configmaps", "ConfigMap", true);
  static final ResourceType SERVICES = new ResourceType("", "v1", "services", "Service", true);
  static final ResourceType DEPLOYMENTS = new ResourceType("apps", "v1", "deployments", "Deployment", true);
  static final ResourceType CLUSTER_ROLES =
      new ResourceType("rbac.authorization.k8s.io", "v1", "clusterroles", "ClusterRole", false);

  private final List<ResourceType> types = new ArrayList<>(List.of(CONFIG_MAPS, SERVICES, DEPLOYMENTS, CLUSTER_ROLES));
  private final Map<String, Map<String, Object>> objects = new LinkedHashMap<>();
  private final Map<String, Deque<RuntimeException>> getFailures = new HashMap<>();
  private final Map<String, RuntimeException> patchFailures = new HashMap<>();
  private final Map<String, Integer> getCalls = new HashMap<>();
  private final List<String> patched = new ArrayList<>();
  private RuntimeException discoveryFailure;
  private RuntimeException openFailure;
  private int opened;
  private int closed;

  FakeCluster store(ResourceType type, String namespace, String name, Map<String, String> annotations) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("name", name);
    if (type.namespaced()) {
      metadata.put("namespace", namespace);
    }
    metadata.put("labels", Map.of("app", name));
    if (!annotations.isEmpty()) {
      metadata.put("annotations", new LinkedHashMap<>(annotations));
    }
    Map<String, Object> object = new LinkedHashMap<>();
    object.put("apiVersion", type.apiVersion());
    object.put("kind", type.kind());
    object.put("metadata", metadata);
    objects.put(key(type, namespace, name), object);
    return this;
  }

  FakeCluster failGet(ResourceType type, String namespace, String name, RuntimeException... failures) {
    getFailures.computeIfAbsent(key(type, namespace, name), k -> new ArrayDeque<>()).addAll(List.of(failures));
    return this;
  }

  FakeCluster failPatch(ResourceType type, String namespace, String name, RuntimeException failure) {
    patchFailures.put(key(type, namespace, name), failure);
    return this;
  }

  FakeCluster failDiscovery(RuntimeException failure) {
    this.discoveryFailure = failure;
    return this;
  }

  FakeCluster failOpen(RuntimeException failure) {
    this.openFailure = failure;
    return this;
  }

  int getCalls(ResourceType type, String namespace, String name) {
    return getCalls.getOrDefault(key(type, namespace, name), 0);
  }

  int totalGetCalls() {
    return getCalls.values().stream().mapToInt(Integer::intValue).sum();
  }

  List<String> patched() {
    return List.copyOf(patched);
  }

  Map<String, String> annotations(ResourceType type, String namespace, String name) {
    ResourceDescriptor descriptor = ResourceDescriptor.of(objects.get(key(type, namespace, name)));
    return descriptor.annotations();
  }

  int opened() {
    return opened;
  }

  int closed() {
    return closed;
  }

  @Override
  public BackendSession open() {
    if (openFailure != null) {
      throw openFailure;
    }
    opened++;
    return new Session();
  }

  private static String key(ResourceType type, String namespace, String name) {
    return type.resource() + "/" + (type.namespaced() ? namespace : "") + "/" + name;
  }

  @SuppressWarnings("unchecked")
  private static void merge(Map<String, Object> target, Map<String, Object> patch) {
    patch.forEach((field, value) -> {
      if (value == null) {
        target.remove(field);
      } else if (value instanceof Map<?, ?> nested && target.get(field) instanceof Map<?, ?> existing) {
        Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) existing);
        merge(copy, (Map<String, Object>) nested);
        target.put(field, copy);
      } else if (value instanceof Map<?, ?> nested) {
        Map<String, Object> created = new LinkedHashMap<>();
        merge(created, (Map<String, Object>) nested);
        target.put(field, created);
      } else {
        target.put(field, value);
      }
    });
  }

  private final class Session implements BackendSession, ResourceBackend, SchemaDiscovery {

    @Override
    public ResourceBackend backend() {
      return this;
    }

    @Override
    public SchemaDiscovery discovery() {
      return this;
    }

    @Override
    public List<ResourceType> resourceTypes() {
      if (discoveryFailure != null) {
        throw discoveryFailure;
      }
      return List.copyOf(types);
    }

    @Override
    public ResourceDescriptor get(ResourceType type, String namespace, String name) {
      String key = key(type, namespace, name);
      getCalls.merge(key, 1, Integer::sum);
      Deque<RuntimeException> failures = getFailures.get(key);
      if (failures != null && !failures.isEmpty()) {
        throw failures.poll();
      }
      Map<String, Object> object = objects.get(key);
      if (object == null) {
        throw BackendException.notFound(type.resource() + " \"" + name + "\" not found");
      }
      return ResourceDescriptor.of(object);
    }

    @Override
    public ResourceDescriptor patch(ResourceType type, String namespace, String name,
                                    Map<String, Object> mergeDocument) {
      String key = key(type, namespace, name);
      RuntimeException failure = patchFailures.get(key);
      if (failure != null) {
        throw failure;
      }
      Map<String, Object> object = objects.get(key);
      if (object == null) {
        throw BackendException.notFound(type.resource() + " \"" + name + "\" not found");
      }
      merge(object, mergeDocument);
      patched.add(key);
      return ResourceDescriptor.of(object);
    }

    @Override
    public void close() {
      closed++;
    }
  }
}

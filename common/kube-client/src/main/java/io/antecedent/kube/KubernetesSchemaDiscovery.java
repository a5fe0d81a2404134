package io.antecedent.kube;

import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.ports.SchemaDiscovery;
import io.fabric8.kubernetes.api.model.APIGroup;
import io.fabric8.kubernetes.api.model.APIGroupList;
import io.fabric8.kubernetes.api.model.APIResource;
import io.fabric8.kubernetes.api.model.APIResourceList;
import io.fabric8.kubernetes.api.model.GroupVersionForDiscovery;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists every resource type served by the API server: the core {@code v1} group followed by every
 * version of every named group.
 * <p>
 * Failing to list the core group or the group index fails discovery. A single group version
 * that cannot be listed, typically an aggregated API whose backing service is down, is logged
 * and left out.
 */
public class KubernetesSchemaDiscovery implements SchemaDiscovery {

    private static final Logger log = LoggerFactory.getLogger(KubernetesSchemaDiscovery.class);

    private static final String CORE_GROUP_VERSION = "v1";

    private final KubernetesClient client;

    public KubernetesSchemaDiscovery(KubernetesClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public List<ResourceType> resourceTypes() {
        List<ResourceType> types = new ArrayList<>();
        APIResourceList core = call("list core API resources", () -> client.getApiResources(CORE_GROUP_VERSION));
        collect("", CORE_GROUP_VERSION, core, types);

        APIGroupList groups = call("list API groups", client::getApiGroups);
        if (groups == null || groups.getGroups() == null) {
            return types;
        }
        for (APIGroup group : groups.getGroups()) {
            if (group.getVersions() == null) {
                continue;
            }
            for (GroupVersionForDiscovery version : group.getVersions()) {
                String groupVersion = version.getGroupVersion();
                APIResourceList resources;
                try {
                    resources = client.getApiResources(groupVersion);
                } catch (RuntimeException e) {
                    log.warn("Skipping API group version {} during discovery: {}", groupVersion, e.getMessage());
                    continue;
                }
                collect(group.getName(), version.getVersion(), resources, types);
            }
        }
        log.debug("Discovered {} resource type(s)", types.size());
        return types;
    }

    private static void collect(String group, String version, APIResourceList list, List<ResourceType> into) {
        if (list == null || list.getResources() == null) {
            return;
        }
        for (APIResource resource : list.getResources()) {
            String name = resource.getName();
            if (name == null || name.contains("/") || resource.getKind() == null) {
                continue;
            }
            into.add(new ResourceType(group, version, name, resource.getKind(),
                Boolean.TRUE.equals(resource.getNamespaced())));
        }
    }

    private static <T> T call(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw KubernetesErrors.translate(action, e);
        }
    }
}

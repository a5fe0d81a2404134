package io.antecedent.kube;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.manifest.ResourceDescriptor;
import io.antecedent.ownership.ports.BackendException;
import io.antecedent.ownership.ports.ResourceBackend;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link ResourceBackend} over the fabric8 generic resource API, so any discovered kind can be
 * read and patched without a typed model class.
 */
public class KubernetesResourceBackend implements ResourceBackend {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final KubernetesClient client;
    private final ObjectMapper mapper;

    public KubernetesResourceBackend(KubernetesClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public ResourceDescriptor get(ResourceType type, String namespace, String name) {
        GenericKubernetesResource resource = callKubernetes("get " + describe(type, namespace, name),
            () -> resource(type, namespace, name).get());
        if (resource == null) {
            throw BackendException.notFound(describe(type, namespace, name) + " not found");
        }
        return toDescriptor(resource);
    }

    @Override
    public ResourceDescriptor patch(ResourceType type, String namespace, String name, Map<String, Object> mergeDocument) {
        String body = toJson(mergeDocument);
        GenericKubernetesResource patched = callKubernetes("patch " + describe(type, namespace, name),
            () -> resource(type, namespace, name).patch(PatchContext.of(PatchType.JSON_MERGE), body));
        return patched == null ? null : toDescriptor(patched);
    }

    private Resource<GenericKubernetesResource> resource(ResourceType type, String namespace, String name) {
        MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> op =
            client.genericKubernetesResources(context(type));
        if (!type.namespaced()) {
            return op.withName(name);
        }
        if (namespace == null || namespace.isBlank()) {
            // fabric8 would otherwise fall back to the kubeconfig's current namespace
            throw new BackendException(400, "BadRequest",
                describe(type, namespace, name) + " is namespaced but no namespace was given");
        }
        return op.inNamespace(namespace).withName(name);
    }

    static ResourceDefinitionContext context(ResourceType type) {
        return new ResourceDefinitionContext.Builder()
            .withGroup(type.group())
            .withVersion(type.version())
            .withPlural(type.resource())
            .withKind(type.kind())
            .withNamespaced(type.namespaced())
            .build();
    }

    private ResourceDescriptor toDescriptor(GenericKubernetesResource resource) {
        return ResourceDescriptor.of(mapper.convertValue(resource, MAP_TYPE));
    }

    private String toJson(Map<String, Object> document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Merge patch cannot be serialised: " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(ResourceType type, String namespace, String name) {
        String scope = type.namespaced() && namespace != null && !namespace.isEmpty() ? namespace + "/" : "";
        return type.resource() + "." + (type.group().isEmpty() ? "" : type.group() + "/") + type.version()
            + " '" + scope + name + "'";
    }

    private static <T> T callKubernetes(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw KubernetesErrors.translate(action, e);
        }
    }
}

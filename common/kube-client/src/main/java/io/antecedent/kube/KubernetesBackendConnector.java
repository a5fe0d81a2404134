package io.antecedent.kube;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.antecedent.ownership.BackendConstructionException;
import io.antecedent.ownership.ports.BackendConnector;
import io.antecedent.ownership.ports.BackendSession;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Opens a new fabric8 {@link KubernetesClient} for every session so each call sees the API
 * server's current set of resource types.
 */
public class KubernetesBackendConnector implements BackendConnector {

    private static final String KUBERNETES_HINT =
        "Ensure a kubeconfig is available (KUBECONFIG or ~/.kube/config) or the process runs in-cluster "
            + "with a service account token.";

    private final Supplier<KubernetesClient> clientFactory;
    private final ObjectMapper mapper;
    private final Config config;

    public KubernetesBackendConnector(Config config) {
        this(() -> new KubernetesClientBuilder().withConfig(config).build(), new ObjectMapper(),
            Objects.requireNonNull(config, "config"));
    }

    public KubernetesBackendConnector(Supplier<KubernetesClient> clientFactory, ObjectMapper mapper) {
        this(clientFactory, mapper, null);
    }

    private KubernetesBackendConnector(Supplier<KubernetesClient> clientFactory, ObjectMapper mapper, Config config) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = config;
    }

    /**
     * Client configuration sessions are opened with; empty when a custom client factory is used.
     */
    public Optional<Config> config() {
        return Optional.ofNullable(config);
    }

    @Override
    public BackendSession open() {
        KubernetesClient client;
        try {
            client = clientFactory.get();
        } catch (RuntimeException e) {
            throw new BackendConstructionException(
                "Unable to create Kubernetes client: " + e.getMessage() + ". " + KUBERNETES_HINT, e);
        }
        if (client == null) {
            throw new BackendConstructionException("Kubernetes client factory returned null. " + KUBERNETES_HINT, null);
        }
        return new KubernetesBackendSession(client, mapper);
    }
}

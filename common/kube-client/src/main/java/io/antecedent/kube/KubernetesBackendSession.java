package io.antecedent.kube;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.antecedent.ownership.ports.BackendSession;
import io.antecedent.ownership.ports.ResourceBackend;
import io.antecedent.ownership.ports.SchemaDiscovery;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One {@link KubernetesClient} serving both resource access and discovery for a single call.
 * Closing the session closes the client.
 */
public class KubernetesBackendSession implements BackendSession {

    private static final Logger log = LoggerFactory.getLogger(KubernetesBackendSession.class);

    private final KubernetesClient client;
    private final KubernetesResourceBackend backend;
    private final KubernetesSchemaDiscovery discovery;

    public KubernetesBackendSession(KubernetesClient client, ObjectMapper mapper) {
        this.client = client;
        this.backend = new KubernetesResourceBackend(client, mapper);
        this.discovery = new KubernetesSchemaDiscovery(client);
    }

    @Override
    public ResourceBackend backend() {
        return backend;
    }

    @Override
    public SchemaDiscovery discovery() {
        return discovery;
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close Kubernetes client: {}", e.getMessage());
        }
    }
}

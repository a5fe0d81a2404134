package io.antecedent.ownership;

import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.discovery.ResourceTypeResolver;
import io.antecedent.ownership.manifest.ManifestDecomposer;
import io.antecedent.ownership.manifest.ReleaseManifest;
import io.antecedent.ownership.manifest.ResourceDescriptor;
import io.antecedent.ownership.ports.BackendConnector;
import io.antecedent.ownership.ports.BackendSession;
import io.antecedent.ownership.ports.ResourceBackend;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamps the ownership annotation on every resource of a release.
 * <p>
 * Claiming is best effort: a resource whose type cannot be resolved or whose patch fails is
 * logged, recorded in the {@link ClaimReport} and skipped, and the remaining resources are still
 * processed. Repeating a claim with the same id leaves the resources unchanged.
 */
public class OwnershipWriter {

  private static final Logger log = LoggerFactory.getLogger(OwnershipWriter.class);

  private final ManifestDecomposer decomposer;

  public OwnershipWriter() {
    this(new ManifestDecomposer());
  }

  public OwnershipWriter(ManifestDecomposer decomposer) {
    this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
  }

  /**
   * @throws BackendConstructionException when no backend session can be opened
   * @throws SchemaDiscoveryException     when resource types cannot be discovered
   */
  public ClaimReport claim(ReleaseManifest manifest, ReleaseId owner, BackendConnector connector) {
    Objects.requireNonNull(manifest, "manifest");
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(connector, "connector");

    Map<String, Object> patch = OwnershipAnnotation.mergePatch(owner);
    List<ClaimOutcome> outcomes = new ArrayList<>();
    try (BackendSession session = BackendSessions.open(connector)) {
      ResourceTypeResolver resolver = ResourceTypeResolver.discover(session.discovery());
      ResourceBackend backend = session.backend();
      for (ResourceDescriptor declared : decomposer.decompose(manifest.content())) {
        ResourceDescriptor resource = declared.withDefaultNamespace(manifest.namespace());
        Optional<ResourceType> type = resolver.resolve(resource.groupVersionKind());
        if (type.isEmpty()) {
          log.warn("Failed to get resource type for {} of release {}; '{}/{}' not annotated",
              resource.groupVersionKind(), manifest.releaseName(), resource.kind(), resource.name());
          outcomes.add(ClaimOutcome.unresolved(resource));
          continue;
        }
        outcomes.add(annotate(backend, type.get(), resource, patch));
      }
    }
    ClaimReport report = new ClaimReport(owner, outcomes);
    log.info("Claimed {} of {} resource(s) of release {} for {}",
        report.annotated().size(), outcomes.size(), manifest.releaseName(), owner);
    return report;
  }

  private ClaimOutcome annotate(ResourceBackend backend, ResourceType type, ResourceDescriptor resource,
                                Map<String, Object> patch) {
    String namespace = type.namespaced() ? resource.namespace() : "";
    try {
      backend.patch(type, namespace, resource.name(), patch);
      return ClaimOutcome.annotated(resource, type);
    } catch (RuntimeException e) {
      log.warn("Failed to mark resource '{}/{}' with ownership annotation: {}",
          resource.kind(), resource.name(), e.getMessage(), e);
      return ClaimOutcome.failed(resource, type, e);
    }
  }
}

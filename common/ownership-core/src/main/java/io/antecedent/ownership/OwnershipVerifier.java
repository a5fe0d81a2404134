package io.antecedent.ownership;

import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.discovery.ResourceTypeResolver;
import io.antecedent.ownership.manifest.ManifestDecomposer;
import io.antecedent.ownership.manifest.ReleaseManifest;
import io.antecedent.ownership.manifest.ResourceDescriptor;
import io.antecedent.ownership.ports.BackendConnector;
import io.antecedent.ownership.ports.BackendSession;
import io.antecedent.ownership.ports.ResourceBackend;
import io.antecedent.ownership.retry.BoundedRetry;
import io.antecedent.ownership.retry.RetryExhaustedException;
import io.antecedent.ownership.retry.RetryPolicy;
import io.antecedent.ownership.retry.TransientErrors;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines whether the resources of a release are owned by an expected release id.
 * <p>
 * Resources are inspected in manifest order and the first one carrying the ownership
 * annotation decides the result; the remaining resources are not read. This assumes a release
 * is annotated homogeneously and is not a consensus check. If no resource carries the
 * annotation the release is reported as unclaimed.
 */
public class OwnershipVerifier {

  private static final Logger log = LoggerFactory.getLogger(OwnershipVerifier.class);

  private final ManifestDecomposer decomposer;
  private final BoundedRetry retry;
  private final RetryPolicy retryPolicy;

  public OwnershipVerifier() {
    this(new ManifestDecomposer(), new BoundedRetry(), RetryPolicy.DEFAULT);
  }

  public OwnershipVerifier(ManifestDecomposer decomposer, BoundedRetry retry, RetryPolicy retryPolicy) {
    this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  /**
   * @throws BackendConstructionException when no backend session can be opened
   * @throws SchemaDiscoveryException     when resource types cannot be discovered
   * @throws ResourceFetchException       when a live resource cannot be read; ownership is then unknown
   */
  public VerificationResult verify(ReleaseManifest manifest, ReleaseId expected, BackendConnector connector) {
    Objects.requireNonNull(manifest, "manifest");
    Objects.requireNonNull(expected, "expected");
    Objects.requireNonNull(connector, "connector");

    try (BackendSession session = BackendSessions.open(connector)) {
      ResourceTypeResolver resolver = ResourceTypeResolver.discover(session.discovery());
      ResourceBackend backend = session.backend();
      for (ResourceDescriptor declared : decomposer.decompose(manifest.content())) {
        ResourceDescriptor resource = declared.withDefaultNamespace(manifest.namespace());
        Optional<ResourceType> type = resolver.resolve(resource.groupVersionKind());
        if (type.isEmpty()) {
          log.debug("Skipping {} of release {}: no resource type for {}",
              resource, manifest.releaseName(), resource.groupVersionKind());
          continue;
        }
        ResourceDescriptor live = fetch(backend, type.get(), resource);
        Optional<String> owner = OwnershipAnnotation.read(live);
        if (owner.isPresent()) {
          VerificationResult result = VerificationResult.claimed(owner.get(), expected);
          log.debug("Release {} is annotated by {} on {} (expected {})",
              manifest.releaseName(), owner.get(), resource, expected);
          return result;
        }
      }
    }
    return VerificationResult.unclaimed();
  }

  private ResourceDescriptor fetch(ResourceBackend backend, ResourceType type, ResourceDescriptor resource) {
    String namespace = type.namespaced() ? resource.namespace() : "";
    AtomicInteger attempts = new AtomicInteger();
    try {
      return retry.call(() -> {
        attempts.incrementAndGet();
        return backend.get(type, namespace, resource.name());
      }, TransientErrors::isTransient, retryPolicy);
    } catch (RetryExhaustedException e) {
      throw new ResourceFetchException(resource.kind(), namespace, resource.name(), attempts.get(), e.lastError());
    } catch (RuntimeException e) {
      throw new ResourceFetchException(resource.kind(), namespace, resource.name(), attempts.get(), e);
    }
  }
}

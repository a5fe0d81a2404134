package io.antecedent.ownership;

import io.antecedent.ownership.discovery.ResourceType;
import io.antecedent.ownership.manifest.ResourceDescriptor;
import java.util.Objects;

/**
 * What happened to a single resource during {@link OwnershipWriter#claim}.
 *
 * @param resource descriptor as addressed, namespace already defaulted
 * @param status   result for this resource
 * @param type     resolved type, {@code null} when unresolved
 * @param error    failure for {@link Status#FAILED}, otherwise {@code null}
 */
public record ClaimOutcome(ResourceDescriptor resource, Status status, ResourceType type, Throwable error) {

  public enum Status {
    ANNOTATED,
    UNRESOLVED,
    FAILED
  }

  public ClaimOutcome {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(status, "status");
  }

  static ClaimOutcome annotated(ResourceDescriptor resource, ResourceType type) {
    return new ClaimOutcome(resource, Status.ANNOTATED, type, null);
  }

  static ClaimOutcome unresolved(ResourceDescriptor resource) {
    return new ClaimOutcome(resource, Status.UNRESOLVED, null, null);
  }

  static ClaimOutcome failed(ResourceDescriptor resource, ResourceType type, Throwable error) {
    return new ClaimOutcome(resource, Status.FAILED, type, error);
  }

  public boolean isAnnotated() {
    return status == Status.ANNOTATED;
  }
}

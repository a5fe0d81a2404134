package io.antecedent.ownership;

import io.antecedent.ownership.manifest.ReleaseManifest;
import io.antecedent.ownership.ports.BackendConnector;
import java.util.Objects;

/**
 * Verifies and claims release ownership against one configured backend.
 * <p>
 * Callers verify before any destructive adoption and only claim when the result allows it.
 * Each call opens its own backend session.
 */
public class ReleaseOwnership {

  private final BackendConnector connector;
  private final OwnershipVerifier verifier;
  private final OwnershipWriter writer;

  public ReleaseOwnership(BackendConnector connector, OwnershipVerifier verifier, OwnershipWriter writer) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  public VerificationResult verify(ReleaseManifest manifest, ReleaseId expected) {
    return verifier.verify(manifest, expected, connector);
  }

  public ClaimReport claim(ReleaseManifest manifest, ReleaseId owner) {
    return writer.claim(manifest, owner, connector);
  }
}

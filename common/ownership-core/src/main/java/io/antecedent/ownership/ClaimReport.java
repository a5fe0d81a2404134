package io.antecedent.ownership;

import java.util.List;
import java.util.Objects;

/**
 * Per-resource outcomes of one claim call, in manifest order.
 * <p>
 * A report is returned even when some resources could not be annotated; callers that need
 * every resource claimed re-run the claim on a later reconciliation until {@link #isComplete()}.
 */
public record ClaimReport(ReleaseId owner, List<ClaimOutcome> outcomes) {

  public ClaimReport {
    Objects.requireNonNull(owner, "owner");
    outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
  }

  public List<ClaimOutcome> annotated() {
    return outcomes.stream().filter(ClaimOutcome::isAnnotated).toList();
  }

  public List<ClaimOutcome> skipped() {
    return outcomes.stream().filter(outcome -> !outcome.isAnnotated()).toList();
  }

  public boolean isComplete() {
    return outcomes.stream().allMatch(ClaimOutcome::isAnnotated);
  }
}

package io.antecedent.ownership;

/**
 * Outcome of {@link OwnershipVerifier#verify}.
 * <p>
 * An unclaimed release (no resource carries the ownership annotation) reports
 * {@code ownedByExpected == true} with an empty value so it can be adopted, but stays
 * distinguishable from a release claimed by the expected owner through {@link #annotated()}.
 *
 * @param ownedByExpected whether the release may be managed by the expected owner
 * @param actualValue     annotation value found, empty when unclaimed
 * @param annotated       whether any resource carried the annotation
 */
public record VerificationResult(boolean ownedByExpected, String actualValue, boolean annotated) {

  private static final VerificationResult UNCLAIMED = new VerificationResult(true, "", false);

  public VerificationResult {
    actualValue = actualValue == null ? "" : actualValue;
  }

  public static VerificationResult unclaimed() {
    return UNCLAIMED;
  }

  public static VerificationResult claimed(String actualValue, ReleaseId expected) {
    return new VerificationResult(expected.toString().equals(actualValue), actualValue, true);
  }

  public boolean isUnclaimed() {
    return !annotated;
  }

  public boolean isClaimedByOther() {
    return annotated && !ownedByExpected;
  }
}

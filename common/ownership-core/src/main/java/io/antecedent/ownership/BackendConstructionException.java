package io.antecedent.ownership;

/**
 * Indicates that no backend session could be opened from the supplied connection configuration.
 */
public class BackendConstructionException extends OwnershipException {

  public BackendConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}

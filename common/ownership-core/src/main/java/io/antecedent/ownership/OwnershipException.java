package io.antecedent.ownership;

/**
 * Base type for failures that stop a verify or claim call as a whole.
 */
public class OwnershipException extends RuntimeException {

  public OwnershipException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.antecedent.ownership;

/**
 * Indicates that the kind to resource type table could not be built.
 */
public class SchemaDiscoveryException extends OwnershipException {

  public SchemaDiscoveryException(String message, Throwable cause) {
    super(message, cause);
  }
}

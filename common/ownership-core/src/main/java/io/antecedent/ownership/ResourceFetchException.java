package io.antecedent.ownership;

/**
 * A live resource could not be read while verifying ownership, either because the backend
 * answered with a terminal error or because transient failures outlasted the retry policy.
 * Ownership cannot be determined safely when this is thrown.
 */
public class ResourceFetchException extends OwnershipException {

  private final String kind;
  private final String namespace;
  private final String name;
  private final int attempts;

  public ResourceFetchException(String kind, String namespace, String name, int attempts, Throwable cause) {
    super("Failed to get " + kind + " '" + (namespace.isEmpty() ? "" : namespace + "/") + name
        + "' after " + attempts + " attempt(s): " + (cause == null ? "unknown error" : cause.getMessage()), cause);
    this.kind = kind;
    this.namespace = namespace;
    this.name = name;
    this.attempts = attempts;
  }

  public String kind() {
    return kind;
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  public int attempts() {
    return attempts;
  }
}

package io.antecedent.ownership;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logical identifier of the release object that claims resources, serialised as
 * {@code <namespace>:<kind>/<name>} with a lower-case kind, for example
 * {@code flux-system:helmrelease/podinfo}. Cluster-scoped owners use the {@code <cluster>} namespace.
 */
public record ReleaseId(String namespace, String kind, String name) {

  public static final String CLUSTER_SCOPE = "<cluster>";

  private static final Pattern FORMAT =
      Pattern.compile("^(<cluster>|[a-zA-Z0-9_-]+):([a-zA-Z0-9_-]+)/([a-zA-Z0-9_.:@-]+)$");

  public ReleaseId {
    namespace = requireText(namespace == null || namespace.isEmpty() ? CLUSTER_SCOPE : namespace, "namespace");
    kind = requireText(kind, "kind").toLowerCase(Locale.ROOT);
    name = requireText(name, "name");
  }

  public static ReleaseId of(String namespace, String kind, String name) {
    return new ReleaseId(namespace, kind, name);
  }

  public static ReleaseId parse(String value) {
    Objects.requireNonNull(value, "value");
    Matcher matcher = FORMAT.matcher(value.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("'" + value + "' is not a release id of the form <namespace>:<kind>/<name>");
    }
    return new ReleaseId(matcher.group(1), matcher.group(2), matcher.group(3));
  }

  @Override
  public String toString() {
    return namespace + ":" + kind + "/" + name;
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }
}

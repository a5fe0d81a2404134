package io.antecedent.ownership.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schemaless view of a single resource document.
 * <p>
 * The full document is retained as a nested map so fields this library does not understand
 * survive decomposition untouched. Instances are immutable; the {@code with*} methods return
 * modified copies.
 */
public final class ResourceDescriptor {

  private static final String API_VERSION = "apiVersion";
  private static final String KIND = "kind";
  private static final String METADATA = "metadata";
  private static final String ITEMS = "items";

  private final Map<String, Object> content;

  private ResourceDescriptor(Map<String, Object> content) {
    this.content = content;
  }

  public static ResourceDescriptor of(Map<String, ?> content) {
    Objects.requireNonNull(content, "content");
    return new ResourceDescriptor(copyMap(content));
  }

  public String apiVersion() {
    return text(content.get(API_VERSION));
  }

  public String kind() {
    return text(content.get(KIND));
  }

  public GroupVersionKind groupVersionKind() {
    return GroupVersionKind.of(apiVersion(), kind());
  }

  public String name() {
    return text(metadata().get("name"));
  }

  public String namespace() {
    return text(metadata().get("namespace"));
  }

  public Map<String, String> annotations() {
    Object raw = metadata().get("annotations");
    if (!(raw instanceof Map<?, ?> map) || map.isEmpty()) {
      return Map.of();
    }
    Map<String, String> annotations = new LinkedHashMap<>();
    map.forEach((key, value) -> {
      if (key != null && value != null) {
        annotations.put(String.valueOf(key), String.valueOf(value));
      }
    });
    return Collections.unmodifiableMap(annotations);
  }

  public Optional<String> annotation(String key) {
    return Optional.ofNullable(annotations().get(key));
  }

  /**
   * A document is a list container when its {@code items} field is a sequence, whatever its kind.
   */
  public boolean isList() {
    return content.get(ITEMS) instanceof List<?>;
  }

  /**
   * Raw members of a list container, in document order. Empty for non-list documents.
   */
  public List<Object> items() {
    Object raw = content.get(ITEMS);
    if (raw instanceof List<?> list) {
      return Collections.unmodifiableList(new ArrayList<>(list));
    }
    return List.of();
  }

  public ResourceDescriptor withNamespace(String namespace) {
    Map<String, Object> copy = mutableCopy(content);
    Map<String, Object> metadata = mutableCopy(metadata());
    metadata.put("namespace", namespace);
    copy.put(METADATA, metadata);
    return of(copy);
  }

  /**
   * Returns this descriptor when it already names a namespace, otherwise a copy placed in the given one.
   */
  public ResourceDescriptor withDefaultNamespace(String namespace) {
    if (!namespace().isEmpty() || namespace == null || namespace.isEmpty()) {
      return this;
    }
    return withNamespace(namespace);
  }

  /**
   * Unmodifiable view of the whole document.
   */
  public Map<String, Object> asMap() {
    return content;
  }

  private Map<String, Object> metadata() {
    Object raw = content.get(METADATA);
    if (raw instanceof Map<?, ?> map) {
      @SuppressWarnings("unchecked")
      Map<String, Object> metadata = (Map<String, Object>) map;
      return metadata;
    }
    return Map.of();
  }

  private static String text(Object value) {
    return value == null ? "" : String.valueOf(value);
  }

  private static Map<String, Object> mutableCopy(Map<String, Object> source) {
    return new LinkedHashMap<>(source);
  }

  private static Map<String, Object> copyMap(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>(source.size());
    source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
    return Collections.unmodifiableMap(copy);
  }

  private static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return copyMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(copyValue(element));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResourceDescriptor that)) {
      return false;
    }
    return content.equals(that.content);
  }

  @Override
  public int hashCode() {
    return content.hashCode();
  }

  @Override
  public String toString() {
    String ns = namespace();
    return kind() + " " + (ns.isEmpty() ? "" : ns + "/") + name();
  }
}

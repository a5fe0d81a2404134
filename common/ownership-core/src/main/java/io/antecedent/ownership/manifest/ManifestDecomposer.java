package io.antecedent.ownership.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a multi-document manifest into resource descriptors.
 * <p>
 * Documents that cannot be parsed, are not mappings, or lack {@code apiVersion}/{@code kind}
 * are dropped without producing a descriptor. List containers are replaced by their members
 * at the position the container occupied.
 */
public final class ManifestDecomposer {

  private static final Logger log = LoggerFactory.getLogger(ManifestDecomposer.class);

  private static final Pattern DOCUMENT_SEPARATOR = Pattern.compile("(?:^|\\s*\\n)---\\s*");

  private final ObjectMapper yamlMapper;

  public ManifestDecomposer() {
    this(new ObjectMapper(new YAMLFactory()));
  }

  public ManifestDecomposer(ObjectMapper yamlMapper) {
    this.yamlMapper = yamlMapper;
  }

  public List<ResourceDescriptor> decompose(String manifest) {
    List<ResourceDescriptor> descriptors = new ArrayList<>();
    if (manifest == null || manifest.isBlank()) {
      return descriptors;
    }
    int index = 0;
    for (String document : DOCUMENT_SEPARATOR.split(manifest)) {
      if (document.isBlank()) {
        continue;
      }
      index++;
      ResourceDescriptor descriptor = parse(document, index);
      if (descriptor == null) {
        continue;
      }
      if (descriptor.isList()) {
        expand(descriptor, index, descriptors);
        continue;
      }
      descriptors.add(descriptor);
    }
    return descriptors;
  }

  private ResourceDescriptor parse(String document, int index) {
    Object parsed;
    try {
      parsed = yamlMapper.readValue(document, Object.class);
    } catch (JsonProcessingException | RuntimeException e) {
      log.debug("Skipping manifest document {}: {}", index, e.getMessage());
      return null;
    }
    if (!(parsed instanceof Map<?, ?> map)) {
      return null;
    }
    @SuppressWarnings("unchecked")
    ResourceDescriptor descriptor = ResourceDescriptor.of((Map<String, ?>) map);
    if (descriptor.kind().isBlank() || descriptor.apiVersion().isBlank()) {
      return null;
    }
    return descriptor;
  }

  private void expand(ResourceDescriptor list, int index, List<ResourceDescriptor> into) {
    List<ResourceDescriptor> members = new ArrayList<>();
    for (Object item : list.items()) {
      if (!(item instanceof Map<?, ?> map)) {
        log.debug("Skipping {} in manifest document {}: list member is not an object", list.kind(), index);
        return;
      }
      @SuppressWarnings("unchecked")
      Map<String, ?> member = (Map<String, ?>) map;
      members.add(ResourceDescriptor.of(member));
    }
    into.addAll(members);
  }
}

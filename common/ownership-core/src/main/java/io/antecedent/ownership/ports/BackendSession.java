package io.antecedent.ownership.ports;

/**
 * Backend handle and schema discovery scoped to a single verify or claim call.
 */
public interface BackendSession extends AutoCloseable {

  ResourceBackend backend();

  SchemaDiscovery discovery();

  @Override
  void close();
}

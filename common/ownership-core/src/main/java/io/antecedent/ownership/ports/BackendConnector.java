package io.antecedent.ownership.ports;

/**
 * Opens a fresh {@link BackendSession} from caller supplied connection configuration.
 * <p>
 * Sessions are never pooled: every call opens its own and closes it when done.
 */
@FunctionalInterface
public interface BackendConnector {

  /**
   * @throws io.antecedent.ownership.BackendConstructionException when no session can be created
   */
  BackendSession open();
}

package io.antecedent.ownership;

import io.antecedent.ownership.ports.BackendConnector;
import io.antecedent.ownership.ports.BackendSession;

final class BackendSessions {

  private BackendSessions() {
  }

  static BackendSession open(BackendConnector connector) {
    BackendSession session;
    try {
      session = connector.open();
    } catch (BackendConstructionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BackendConstructionException("Unable to open backend session: " + e.getMessage(), e);
    }
    if (session == null) {
      throw new BackendConstructionException("Backend connector returned no session", null);
    }
    return session;
  }
}

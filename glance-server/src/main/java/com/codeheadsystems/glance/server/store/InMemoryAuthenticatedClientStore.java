package com.codeheadsystems.glance.server.store;

import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AuthenticatedClientStore} keyed by caller address.
 */
public class InMemoryAuthenticatedClientStore implements AuthenticatedClientStore {

  /**
   * Default maximum number of cached addresses.
   */
  public static final int DEFAULT_MAX_CLIENTS = 100;

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuthenticatedClientStore.class);

  private final BoundedExpiringMap<AuthenticatedClient> clients;

  public InMemoryAuthenticatedClientStore() {
    this(DEFAULT_MAX_CLIENTS, Clock.systemUTC());
  }

  public InMemoryAuthenticatedClientStore(int maxClients, Clock clock) {
    this.clients = new BoundedExpiringMap<>(maxClients, clock);
  }

  @Override
  public void store(AuthenticatedClient authenticatedClient) {
    int evicted = clients.put(authenticatedClient.callerAddress(), authenticatedClient);
    log.debug("Cached authenticated address {} for client_id={}",
        authenticatedClient.callerAddress(), authenticatedClient.clientId());
    if (evicted > 0) {
      log.warn("Authenticated client cache at capacity ({}), evicted {} oldest entr(ies)",
          clients.maxEntries(), evicted);
    }
  }

  @Override
  public Optional<AuthenticatedClient> load(String callerAddress) {
    if (callerAddress == null) {
      return Optional.empty();
    }
    return clients.get(callerAddress);
  }

  @Override
  public int removeExpired() {
    return clients.removeExpired();
  }

  @Override
  public int evictOverCapacity() {
    return clients.evictOverCapacity();
  }

  @Override
  public int size() {
    return clients.size();
  }
}

package com.codeheadsystems.glance.server.store;

import java.util.Optional;

/**
 * Storage abstraction for the caller-address cache used by the address fallback.
 * <p>
 * Implementations must be thread-safe and bounded in size.
 */
public interface AuthenticatedClientStore {

  /**
   * Records (or refreshes) the entry for its caller address.
   *
   * @param authenticatedClient the entry
   */
  void store(AuthenticatedClient authenticatedClient);

  /**
   * Loads the entry for an address. An expired entry is removed and reported as absent.
   *
   * @param callerAddress the caller address
   * @return the entry, or empty if unknown or expired
   */
  Optional<AuthenticatedClient> load(String callerAddress);

  /**
   * Removes every expired entry.
   *
   * @return the number removed
   */
  int removeExpired();

  /**
   * Evicts the oldest-inserted entries until the store is within capacity.
   *
   * @return the number evicted
   */
  int evictOverCapacity();

  /**
   * Current number of entries, expired ones included.
   *
   * @return the size
   */
  int size();
}

package com.codeheadsystems.glance.server.store;

import java.util.Optional;

/**
 * Storage abstraction for pending authorization codes.
 * <p>
 * Implementations must be thread-safe and bounded in size. The in-memory implementation is
 * enough for a single gateway instance; a shared store is needed once several instances sit
 * behind a load balancer, since the code may be redeemed on a different node than issued it.
 */
public interface AuthorizationCodeStore {

  /**
   * Stores a code, evicting the oldest entries if the store is at capacity.
   *
   * @param authorizationCode the code to store
   */
  void store(AuthorizationCode authorizationCode);

  /**
   * Loads a code without consuming it. An expired code is removed and reported as absent.
   *
   * @param code the code value
   * @return the code, or empty if unknown or expired
   */
  Optional<AuthorizationCode> load(String code);

  /**
   * Removes a code. Exactly one of several concurrent callers observes {@code true}.
   *
   * @param code the code value
   * @return true if this call removed the code
   */
  boolean consume(String code);

  /**
   * Removes every expired code.
   *
   * @return the number removed
   */
  int removeExpired();

  /**
   * Evicts the oldest-inserted codes until the store is within capacity.
   *
   * @return the number evicted
   */
  int evictOverCapacity();

  /**
   * Current number of stored codes, expired ones included.
   *
   * @return the size
   */
  int size();
}

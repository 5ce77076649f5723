package com.codeheadsystems.glance.server.store;

import java.time.Instant;

/**
 * A stored value with an absolute expiry.
 */
public interface Expiring {

  /**
   * When the value stops being valid.
   *
   * @return the expiry instant
   */
  Instant expiresAt();

  /**
   * An entry is still valid at exactly its expiry instant and expired strictly after it.
   *
   * @param now the current time
   * @return true if expired
   */
  default boolean isExpired(Instant now) {
    return now.isAfter(expiresAt());
  }
}

package com.codeheadsystems.glance.server.store;

import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AuthorizationCodeStore}.
 * <p>
 * Expired codes are evicted on {@link #load} and by the periodic sweep. All codes are lost
 * on server restart, which only forces clients to restart the authorization flow.
 */
public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {

  /**
   * Default maximum number of pending codes.
   */
  public static final int DEFAULT_MAX_CODES = 1000;

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuthorizationCodeStore.class);

  private final BoundedExpiringMap<AuthorizationCode> codes;

  /**
   * Creates a store with the default capacity and the system clock.
   */
  public InMemoryAuthorizationCodeStore() {
    this(DEFAULT_MAX_CODES, Clock.systemUTC());
  }

  /**
   * Creates a store.
   *
   * @param maxCodes maximum number of pending codes
   * @param clock    source of the current time for expiry checks
   */
  public InMemoryAuthorizationCodeStore(int maxCodes, Clock clock) {
    this.codes = new BoundedExpiringMap<>(maxCodes, clock);
  }

  @Override
  public void store(AuthorizationCode authorizationCode) {
    int evicted = codes.put(authorizationCode.code(), authorizationCode);
    if (evicted > 0) {
      log.warn("Authorization code store at capacity ({}), evicted {} oldest code(s)",
          codes.maxEntries(), evicted);
    }
  }

  @Override
  public Optional<AuthorizationCode> load(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return codes.get(code);
  }

  @Override
  public boolean consume(String code) {
    return code != null && codes.remove(code);
  }

  @Override
  public int removeExpired() {
    return codes.removeExpired();
  }

  @Override
  public int evictOverCapacity() {
    return codes.evictOverCapacity();
  }

  @Override
  public int size() {
    return codes.size();
  }
}

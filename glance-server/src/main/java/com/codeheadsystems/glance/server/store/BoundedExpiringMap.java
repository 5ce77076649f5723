package com.codeheadsystems.glance.server.store;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered map with a hard capacity and per-entry expiry, guarded by a single lock.
 * <p>
 * Re-inserting an existing key moves it to the newest position, so eviction always removes
 * the entries that were written longest ago.
 *
 * @param <V> the value type
 */
class BoundedExpiringMap<V extends Expiring> {

  private final LinkedHashMap<String, V> entries = new LinkedHashMap<>();
  private final int maxEntries;
  private final Clock clock;

  BoundedExpiringMap(int maxEntries, Clock clock) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.maxEntries = maxEntries;
    this.clock = clock;
  }

  /**
   * Inserts the value and evicts the oldest entries above capacity.
   *
   * @return the number of entries evicted to make room
   */
  synchronized int put(String key, V value) {
    entries.remove(key);
    entries.put(key, value);
    return evictOverCapacity();
  }

  synchronized Optional<V> get(String key) {
    V value = entries.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value.isExpired(clock.instant())) {
      entries.remove(key);
      return Optional.empty();
    }
    return Optional.of(value);
  }

  synchronized boolean remove(String key) {
    return entries.remove(key) != null;
  }

  synchronized int removeExpired() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.values().removeIf(v -> v.isExpired(now));
    return before - entries.size();
  }

  synchronized int evictOverCapacity() {
    int evicted = 0;
    Iterator<Map.Entry<String, V>> it = entries.entrySet().iterator();
    while (entries.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
      evicted++;
    }
    return evicted;
  }

  synchronized int size() {
    return entries.size();
  }

  int maxEntries() {
    return maxEntries;
  }
}

package com.codeheadsystems.glance.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.glance.server.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryAuthenticatedClientStoreTest {

  private MutableClock clock;
  private InMemoryAuthenticatedClientStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpochSecond(1_000_000);
    store = new InMemoryAuthenticatedClientStore(2, clock);
  }

  private AuthenticatedClient entry(String address, long ttlSeconds) {
    return new AuthenticatedClient(address, "client", clock.instant().plusSeconds(ttlSeconds));
  }

  @Test
  void storeAndLoad() {
    store.store(entry("10.0.0.1", 3600));

    assertThat(store.load("10.0.0.1")).map(AuthenticatedClient::clientId).contains("client");
    assertThat(store.load("10.0.0.2")).isEmpty();
  }

  @Test
  void load_expired_removesEntry() {
    store.store(entry("10.0.0.1", 60));
    clock.advanceSeconds(61);

    assertThat(store.load("10.0.0.1")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void store_sameAddress_replacesAndRefreshesOrder() {
    store.store(entry("10.0.0.1", 60));
    store.store(entry("10.0.0.2", 60));
    store.store(entry("10.0.0.1", 3600));
    store.store(entry("10.0.0.3", 60));

    // 10.0.0.2 is now the oldest insertion and is evicted
    assertThat(store.size()).isEqualTo(2);
    assertThat(store.load("10.0.0.2")).isEmpty();
    clock.advanceSeconds(61);
    assertThat(store.load("10.0.0.1")).isPresent();
  }

  @Test
  void removeExpired() {
    store.store(entry("10.0.0.1", 60));
    store.store(entry("10.0.0.2", 600));
    clock.advanceSeconds(61);

    assertThat(store.removeExpired()).isEqualTo(1);
    assertThat(store.load("10.0.0.2")).isPresent();
  }
}

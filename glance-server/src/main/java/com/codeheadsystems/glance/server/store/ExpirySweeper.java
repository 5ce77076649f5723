package com.codeheadsystems.glance.server.store;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically purges expired entries from the code store and the address cache, then trims
 * either one back to capacity.
 * <p>
 * Runs on a single daemon thread. Lookups already drop expired entries on sight; the sweep
 * bounds memory for entries nobody looks up again.
 */
public class ExpirySweeper {

  private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

  private final AuthorizationCodeStore authorizationCodeStore;
  private final AuthenticatedClientStore authenticatedClientStore;
  private final Duration interval;
  private ScheduledExecutorService executor;

  public ExpirySweeper(AuthorizationCodeStore authorizationCodeStore,
                       AuthenticatedClientStore authenticatedClientStore,
                       Duration interval) {
    this.authorizationCodeStore = authorizationCodeStore;
    this.authenticatedClientStore = authenticatedClientStore;
    this.interval = interval;
  }

  /**
   * Starts the sweep thread. Calling start on a running sweeper does nothing.
   */
  public synchronized void start() {
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "glance-expiry-sweeper");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    executor.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Expiry sweeper started, interval {}", interval);
  }

  /**
   * Stops the sweep thread and waits briefly for an in-flight sweep to finish.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public synchronized void stop() throws InterruptedException {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
      log.warn("Expiry sweeper did not terminate within 5 seconds");
    }
    executor = null;
    log.info("Expiry sweeper stopped");
  }

  /**
   * Runs one sweep: expiry on both stores first, then capacity on both.
   *
   * @return the result counts
   */
  public SweepResult sweepOnce() {
    int expiredCodes = authorizationCodeStore.removeExpired();
    int expiredClients = authenticatedClientStore.removeExpired();
    int evictedCodes = authorizationCodeStore.evictOverCapacity();
    int evictedClients = authenticatedClientStore.evictOverCapacity();
    SweepResult result = new SweepResult(expiredCodes, expiredClients, evictedCodes, evictedClients);
    log.debug("Sweep complete: {}", result);
    return result;
  }

  private void sweepSafely() {
    try {
      sweepOnce();
    } catch (RuntimeException e) {
      // an exception escaping a scheduled task cancels every later run
      log.error("Expiry sweep failed", e);
    }
  }

  /**
   * Counts from one sweep.
   *
   * @param expiredCodes   codes removed for expiry
   * @param expiredClients address entries removed for expiry
   * @param evictedCodes   codes evicted for capacity
   * @param evictedClients address entries evicted for capacity
   */
  public record SweepResult(int expiredCodes, int expiredClients, int evictedCodes,
                            int evictedClients) {
  }
}

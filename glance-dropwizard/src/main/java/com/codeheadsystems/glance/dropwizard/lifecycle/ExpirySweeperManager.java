package com.codeheadsystems.glance.dropwizard.lifecycle;

import com.codeheadsystems.glance.server.store.ExpirySweeper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the {@link ExpirySweeper} to the application lifecycle.
 */
public class ExpirySweeperManager implements Managed {

  private final ExpirySweeper expirySweeper;

  /**
   * Instantiates a new Expiry sweeper manager.
   *
   * @param expirySweeper the sweeper
   */
  public ExpirySweeperManager(ExpirySweeper expirySweeper) {
    this.expirySweeper = expirySweeper;
  }

  @Override
  public void start() {
    expirySweeper.start();
  }

  @Override
  public void stop() throws Exception {
    expirySweeper.stop();
  }
}

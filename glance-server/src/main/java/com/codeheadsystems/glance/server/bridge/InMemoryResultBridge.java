package com.codeheadsystems.glance.server.bridge;

import com.codeheadsystems.glance.model.artwork.Artwork;
import com.codeheadsystems.glance.model.bridge.SearchSnapshot;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResultBridge} holding an immutable snapshot in an {@link AtomicReference}.
 * Lost on restart.
 */
public class InMemoryResultBridge implements ResultBridge {

  private static final Logger log = LoggerFactory.getLogger(InMemoryResultBridge.class);

  private final AtomicReference<SearchSnapshot> latest = new AtomicReference<>(SearchSnapshot.EMPTY);
  private final Clock clock;

  public InMemoryResultBridge() {
    this(Clock.systemUTC());
  }

  public InMemoryResultBridge(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void write(String query, List<Artwork> results) {
    SearchSnapshot snapshot = new SearchSnapshot(query, results, clock.millis());
    latest.set(snapshot);
    log.debug("Result bridge now holds {} result(s) for '{}'", snapshot.results().size(), query);
  }

  @Override
  public SearchSnapshot read() {
    return latest.get();
  }

  @Override
  public void clear() {
    latest.set(SearchSnapshot.EMPTY);
    log.debug("Result bridge cleared");
  }
}

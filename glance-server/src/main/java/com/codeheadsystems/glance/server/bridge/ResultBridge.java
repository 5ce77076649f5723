package com.codeheadsystems.glance.server.bridge;

import com.codeheadsystems.glance.model.artwork.Artwork;
import com.codeheadsystems.glance.model.bridge.SearchSnapshot;
import java.util.List;

/**
 * Single shared slot holding the latest result set an agent produced, so the dashboard can
 * show what the agent just found.
 * <p>
 * Implementations must be thread-safe: a write replaces the slot atomically and a reader sees
 * either the previous or the new snapshot, never a mix.
 */
public interface ResultBridge {

  /**
   * Replaces the slot.
   *
   * @param query   the query or label that produced the results
   * @param results the results
   */
  void write(String query, List<Artwork> results);

  /**
   * Reads the slot without blocking.
   *
   * @return the current snapshot, or {@link SearchSnapshot#EMPTY}
   */
  SearchSnapshot read();

  /**
   * Resets the slot to {@link SearchSnapshot#EMPTY}.
   */
  void clear();
}

package com.codeheadsystems.glance.model.bridge;

import com.codeheadsystems.glance.model.artwork.Artwork;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * The most recent displayable result set produced by an agent tool call.
 * <p>
 * Used by: {@code GET /ai-search/latest} response
 *
 * @param query     the search query, playlist name or label that produced the results; null when empty
 * @param results   the artworks, never null
 * @param timestamp epoch millis of the write; null when empty
 */
public record SearchSnapshot(String query, List<Artwork> results, Long timestamp) {

  /**
   * Value before any write and after a clear.
   */
  public static final SearchSnapshot EMPTY = new SearchSnapshot(null, List.of(), null);

  /**
   * Instantiates a new snapshot with a copy of the results, minus any null entries.
   *
   * @param query     the query
   * @param results   the results
   * @param timestamp the timestamp
   */
  public SearchSnapshot {
    results = results == null ? List.of() : results.stream().filter(Objects::nonNull).toList();
  }

  /**
   * Whether this is the empty default.
   *
   * @return true if nothing has been written since start or the last clear
   */
  @JsonIgnore
  public boolean isEmpty() {
    return query == null && results.isEmpty() && timestamp == null;
  }
}

package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

/**
 * Backend response for {@code GET /api/art/search}.
 *
 * @param results matching artworks, may be null when the backend omits the field
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(List<Artwork> results) {

  /**
   * Results, never null. Null entries from the backend are skipped.
   *
   * @return the list
   */
  public List<Artwork> resultsOrEmpty() {
    return results == null ? List.of() : results.stream().filter(Objects::nonNull).toList();
  }
}

package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

/**
 * Backend response for {@code GET /api/playlists/{id}}.
 *
 * @param name     display name
 * @param artworks artworks in playlist order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaylistDetail(String name, List<Artwork> artworks) {

  /**
   * Artworks, never null. Null entries from the backend are skipped.
   *
   * @return the list
   */
  public List<Artwork> artworksOrEmpty() {
    return artworks == null ? List.of() : artworks.stream().filter(Objects::nonNull).toList();
  }
}

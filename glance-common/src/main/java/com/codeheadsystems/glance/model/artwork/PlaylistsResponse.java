package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

/**
 * Backend response for {@code GET /api/playlists}.
 *
 * @param playlists available playlists
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistsResponse(List<Playlist> playlists) {

  /**
   * Playlists, never null. Null entries from the backend are skipped.
   *
   * @return the list
   */
  public List<Playlist> playlistsOrEmpty() {
    return playlists == null ? List.of() : playlists.stream().filter(Objects::nonNull).toList();
  }
}

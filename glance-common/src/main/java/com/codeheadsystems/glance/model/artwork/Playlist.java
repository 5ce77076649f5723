package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Summary of a playlist.
 *
 * @param id          playlist identifier, e.g. {@code impressionist-masters}
 * @param name        display name
 * @param type        {@code classic}, {@code dynamic}, ...
 * @param description optional description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Playlist(String id, String name, String type, String description) {
}

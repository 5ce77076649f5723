package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single artwork as returned by the Glance backend search, playlist and random endpoints.
 * Every field is optional on the wire.
 *
 * @param id           backend identifier
 * @param title        title
 * @param artist       artist name
 * @param date         free-form creation date
 * @param imageUrl     full-size image URL
 * @param thumbnailUrl thumbnail URL
 * @param source       museum or collection the artwork came from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Artwork(
    String id,
    String title,
    String artist,
    String date,
    String imageUrl,
    String thumbnailUrl,
    String source) {
}

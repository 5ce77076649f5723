package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the frame is showing, from {@code GET /api/current.json}.
 *
 * @param title     title of the displayed image; null when nothing is displayed
 * @param timestamp epoch millis of the last update
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CurrentDisplay(String title, Long timestamp) {
}

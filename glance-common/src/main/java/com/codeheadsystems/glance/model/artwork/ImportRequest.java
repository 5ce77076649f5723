package com.codeheadsystems.glance.model.artwork;

/**
 * Body of {@code POST /api/art/import}, which fetches, dithers and queues an image for the
 * frame.
 *
 * @param imageUrl source image URL
 * @param title    title shown on the dashboard
 * @param artist   artist shown on the dashboard
 * @param rotation rotation in degrees
 */
public record ImportRequest(String imageUrl, String title, String artist, int rotation) {
}

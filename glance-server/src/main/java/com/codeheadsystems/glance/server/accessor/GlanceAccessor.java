package com.codeheadsystems.glance.server.accessor;

import com.codeheadsystems.glance.model.artwork.Artwork;
import com.codeheadsystems.glance.model.artwork.CurrentDisplay;
import com.codeheadsystems.glance.model.artwork.DeviceStatus;
import com.codeheadsystems.glance.model.artwork.ImportRequest;
import com.codeheadsystems.glance.model.artwork.PlaylistDetail;
import com.codeheadsystems.glance.model.artwork.PlaylistsResponse;
import com.codeheadsystems.glance.model.artwork.SearchResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Glance backend that owns the display, its playlists and artwork search.
 * <p>
 * Every call is a single request with a per-request timeout; nothing is retried. Failures of
 * any kind surface as {@link GlanceAccessorException}.
 */
public class GlanceAccessor {

  private static final Logger log = LoggerFactory.getLogger(GlanceAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final Duration timeout;

  /**
   * Instantiates a new Glance accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param baseUrl      backend base URL, e.g. {@code http://localhost:3000}
   * @param timeout      per-request timeout
   */
  public GlanceAccessor(final HttpClient httpClient,
                        final ObjectMapper objectMapper,
                        final URI baseUrl,
                        final Duration timeout) {
    log.info("GlanceAccessor({}, timeout={})", baseUrl, timeout);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    String base = baseUrl.toString();
    this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    this.timeout = timeout;
  }

  /**
   * Searches museum collections.
   *
   * @param query free-text query
   * @param limit maximum number of results
   * @return the search response
   */
  public SearchResponse searchArtworks(final String query, final int limit) {
    return get("/api/art/search?q=" + encode(query) + "&limit=" + limit, SearchResponse.class);
  }

  /**
   * Imports an image and queues it for display on the frame.
   *
   * @param importRequest the import request
   * @return the raw backend response
   */
  public JsonNode importArtwork(final ImportRequest importRequest) {
    final String body;
    try {
      body = objectMapper.writeValueAsString(importRequest);
    } catch (IOException e) {
      throw new GlanceAccessorException("Could not serialize import request", e);
    }
    HttpRequest request = newRequest("/api/art/import")
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
    return send(request, JsonNode.class);
  }

  public CurrentDisplay currentDisplay() {
    return get("/api/current.json", CurrentDisplay.class);
  }

  public PlaylistsResponse listPlaylists() {
    return get("/api/playlists", PlaylistsResponse.class);
  }

  /**
   * Fetches a single playlist.
   *
   * @param playlistId the playlist id
   * @return the playlist
   */
  public PlaylistDetail playlist(final String playlistId) {
    return get("/api/playlists/" + URLEncoder.encode(playlistId, StandardCharsets.UTF_8)
        .replace("+", "%20"), PlaylistDetail.class);
  }

  public DeviceStatus deviceStatus() {
    return get("/api/esp32-status", DeviceStatus.class);
  }

  public Artwork randomArtwork() {
    return get("/api/art/random", Artwork.class);
  }

  private <T> T get(final String path, final Class<T> type) {
    return send(newRequest(path).GET().build(), type);
  }

  private HttpRequest.Builder newRequest(final String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Accept", "application/json")
        .timeout(timeout);
  }

  private <T> T send(final HttpRequest request, final Class<T> type) {
    log.trace("send({} {})", request.method(), request.uri());
    try {
      final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new GlanceAccessorException("Glance API error: " + response.statusCode(), null);
      }
      String body = response.body();
      if (body == null || body.isBlank()) {
        throw new GlanceAccessorException("Glance API returned an empty body", null);
      }
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new GlanceAccessorException(
          "Glance API request failed: " + request.method() + " " + request.uri().getPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GlanceAccessorException(
          "Glance API request interrupted: " + request.method() + " " + request.uri().getPath(), e);
    }
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}

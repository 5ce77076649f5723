package com.codeheadsystems.glance.server.tool;

import com.codeheadsystems.glance.model.artwork.Artwork;
import com.codeheadsystems.glance.model.artwork.CurrentDisplay;
import com.codeheadsystems.glance.model.artwork.DeviceStatus;
import com.codeheadsystems.glance.model.artwork.ImportRequest;
import com.codeheadsystems.glance.model.artwork.Playlist;
import com.codeheadsystems.glance.model.artwork.PlaylistDetail;
import com.codeheadsystems.glance.server.accessor.GlanceAccessor;
import com.codeheadsystems.glance.server.bridge.ResultBridge;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.spec.McpSchema;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Glance tools offered to remote agents, as tool specifications for the stateless MCP server.
 * <p>
 * Every handler is wrapped by {@link GuardedToolHandler}, so a tool call always answers with a
 * result and backend failures reach the agent as {@code isError} text.
 */
public final class GlanceToolCatalog {

  public static final String SEARCH_ARTWORKS = "search_artworks";
  public static final String DISPLAY_ARTWORK = "display_artwork";
  public static final String GET_CURRENT_DISPLAY = "get_current_display";
  public static final String LIST_PLAYLISTS = "list_playlists";
  public static final String GET_PLAYLIST = "get_playlist";
  public static final String GET_DEVICE_STATUS = "get_device_status";
  public static final String RANDOM_ARTWORK = "random_artwork";

  /**
   * Tool names in registration order.
   */
  public static final List<String> TOOL_NAMES = List.of(SEARCH_ARTWORKS, DISPLAY_ARTWORK,
      GET_CURRENT_DISPLAY, LIST_PLAYLISTS, GET_PLAYLIST, GET_DEVICE_STATUS, RANDOM_ARTWORK);

  static final int DEFAULT_SEARCH_LIMIT = 12;
  static final int MAX_SEARCH_LIMIT = 20;
  static final int PLAYLIST_PREVIEW_SIZE = 10;
  static final String RANDOM_ARTWORK_QUERY = "Random artwork";

  private static final Logger log = LoggerFactory.getLogger(GlanceToolCatalog.class);

  private final GlanceAccessor accessor;
  private final ResultBridge bridge;

  private GlanceToolCatalog(GlanceAccessor accessor, ResultBridge bridge) {
    this.accessor = accessor;
    this.bridge = bridge;
  }

  /**
   * Builds the Glance tool specifications.
   *
   * @param accessor backend client
   * @param bridge   slot receiving list-producing results
   * @return the specifications, in {@link #TOOL_NAMES} order
   */
  public static List<SyncToolSpecification> build(GlanceAccessor accessor, ResultBridge bridge) {
    GlanceToolCatalog catalog = new GlanceToolCatalog(accessor, bridge);
    return List.of(
        tool(SEARCH_ARTWORKS,
            "Search for artworks across museum collections. Use keywords like artist names, "
                + "art movements, subjects, or time periods.",
            objectSchema(properties(
                "query", stringParam("Search query (e.g., \"Monet water lilies\", "
                    + "\"impressionist landscape\", \"Dutch Golden Age\")"),
                "limit", integerParam("Maximum number of results to return (default: 12, max: 20)")),
                List.of("query")),
            "Search failed", catalog::searchArtworks),
        tool(DISPLAY_ARTWORK,
            "Display an artwork on the e-ink frame. The image will be processed and sent to the display.",
            objectSchema(properties(
                "imageUrl", stringParam("URL of the artwork image to display"),
                "title", stringParam("Title of the artwork"),
                "artist", stringParam("Artist name")),
                List.of("imageUrl")),
            "Failed to display artwork", catalog::displayArtwork),
        tool(GET_CURRENT_DISPLAY,
            "Get information about what is currently displayed on the e-ink frame.",
            noArguments(),
            "Failed to get current display", catalog::currentDisplay),
        tool(LIST_PLAYLISTS,
            "List all available art playlists. Includes curated museum collections and dynamic "
                + "AI-powered playlists.",
            noArguments(),
            "Failed to list playlists", catalog::listPlaylists),
        tool(GET_PLAYLIST,
            "Get artworks from a specific playlist.",
            objectSchema(properties(
                "playlistId", stringParam("Playlist ID (e.g., \"impressionist-masters\", "
                    + "\"serene-nature\", \"bold-abstract\")")),
                List.of("playlistId")),
            "Failed to get playlist", catalog::playlist),
        tool(GET_DEVICE_STATUS,
            "Get the status of the e-ink display device including battery level and connection status.",
            noArguments(),
            "Failed to get device status", catalog::deviceStatus),
        tool(RANDOM_ARTWORK,
            "Get a random artwork for serendipitous discovery.",
            noArguments(),
            "Failed to get random artwork", catalog::randomArtwork));
  }

  private McpSchema.CallToolResult searchArtworks(ToolArguments arguments) {
    String query = arguments.requiredString("query");
    int limit = Math.max(1, Math.min(
        arguments.optionalInt("limit").orElse(DEFAULT_SEARCH_LIMIT), MAX_SEARCH_LIMIT));
    log.info("search_artworks query='{}' limit={}", query, limit);

    List<Artwork> results = accessor.searchArtworks(query, limit).resultsOrEmpty();
    publish(query, results);
    if (results.isEmpty()) {
      return ToolResults.text("No artworks found for \"" + query + "\". Try different keywords "
          + "like artist names, art movements, or subjects.");
    }
    StringBuilder text = new StringBuilder("Found ").append(results.size()).append(" artworks:\n\n");
    for (int i = 0; i < results.size(); i++) {
      Artwork art = results.get(i);
      if (i > 0) {
        text.append("\n\n");
      }
      text.append(i + 1).append(". \"").append(art.title()).append("\" by ")
          .append(orDefault(art.artist(), "Unknown"))
          .append(" (").append(art.source()).append(")\n   Image: ").append(art.imageUrl());
    }
    return ToolResults.text(text.toString(), Map.of("results", results));
  }

  private McpSchema.CallToolResult displayArtwork(ToolArguments arguments) {
    String imageUrl = arguments.requiredString("imageUrl");
    String title = arguments.optionalString("title").orElse(null);
    String artist = arguments.optionalString("artist").orElse(null);
    log.info("display_artwork imageUrl={} title='{}'", imageUrl, title);

    accessor.importArtwork(new ImportRequest(imageUrl, orDefault(title, "Untitled"),
        orDefault(artist, "Unknown"), 0));
    return ToolResults.text("Displaying \"" + orDefault(title, "artwork") + "\" on your e-ink "
        + "frame. The display will refresh in about 30 seconds.");
  }

  private McpSchema.CallToolResult currentDisplay(ToolArguments arguments) {
    log.info("get_current_display");
    CurrentDisplay current = accessor.currentDisplay();
    if (current.title() == null || current.title().isEmpty()) {
      return ToolResults.text("Nothing is currently displayed on the frame.");
    }
    long updated = current.timestamp() == null ? 0L : current.timestamp();
    return ToolResults.text("Currently displaying: \"" + current.title() + "\"\nLast updated: "
        + Instant.ofEpochMilli(updated), Map.of("current", current));
  }

  private McpSchema.CallToolResult listPlaylists(ToolArguments arguments) {
    log.info("list_playlists");
    List<Playlist> playlists = accessor.listPlaylists().playlistsOrEmpty();
    if (playlists.isEmpty()) {
      return ToolResults.text("No playlists available.");
    }
    String formatted = playlists.stream()
        .map(p -> "• " + p.name() + " (" + p.type() + "): "
            + orDefault(p.description(), "No description"))
        .collect(Collectors.joining("\n"));
    return ToolResults.text("Available playlists:\n\n" + formatted, Map.of("playlists", playlists));
  }

  private McpSchema.CallToolResult playlist(ToolArguments arguments) {
    String playlistId = arguments.requiredString("playlistId");
    log.info("get_playlist playlistId={}", playlistId);

    PlaylistDetail detail = accessor.playlist(playlistId);
    List<Artwork> artworks = detail.artworksOrEmpty();
    if (artworks.isEmpty()) {
      return ToolResults.text("Playlist \"" + playlistId + "\" is empty or not found.");
    }
    String name = orDefault(detail.name(), playlistId);
    publish(name, artworks);

    StringBuilder text = new StringBuilder("Playlist \"").append(name).append("\" (")
        .append(artworks.size()).append(" artworks):\n\n");
    int shown = Math.min(artworks.size(), PLAYLIST_PREVIEW_SIZE);
    for (int i = 0; i < shown; i++) {
      Artwork art = artworks.get(i);
      if (i > 0) {
        text.append('\n');
      }
      text.append(i + 1).append(". \"").append(art.title()).append("\" by ")
          .append(orDefault(art.artist(), "Unknown"));
    }
    if (artworks.size() > PLAYLIST_PREVIEW_SIZE) {
      text.append("\n\n...and ").append(artworks.size() - PLAYLIST_PREVIEW_SIZE).append(" more");
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("playlist", detail);
    metadata.put("artworks", artworks);
    return ToolResults.text(text.toString(), metadata);
  }

  private McpSchema.CallToolResult deviceStatus(ToolArguments arguments) {
    log.info("get_device_status");
    DeviceStatus status = accessor.deviceStatus();
    if (status.batteryVoltage() == null || status.batteryVoltage() == 0.0) {
      return ToolResults.text("Device status not available. The device may be offline.");
    }
    String text = String.join("\n",
        "Battery: " + orUnknown(status.batteryPercent()) + "% (" + status.batteryVoltage() + "V)",
        Boolean.TRUE.equals(status.isCharging()) ? "Charging: Yes" : "Charging: No",
        "WiFi Signal: " + orUnknown(status.signalStrength()) + " dBm",
        "Firmware: " + orDefault(status.firmwareVersion(), "Unknown"),
        "Last seen: " + (status.lastSeen() == null || status.lastSeen() == 0L
            ? "Unknown" : Instant.ofEpochMilli(status.lastSeen()).toString()));
    return ToolResults.text("Device Status:\n\n" + text, Map.of("device", status));
  }

  private McpSchema.CallToolResult randomArtwork(ToolArguments arguments) {
    log.info("random_artwork");
    Artwork art = accessor.randomArtwork();
    if (art.imageUrl() == null || art.imageUrl().isEmpty()) {
      return ToolResults.text("Could not fetch a random artwork. Please try again.");
    }
    publish(RANDOM_ARTWORK_QUERY, List.of(art));
    return ToolResults.text("Random artwork: \"" + orDefault(art.title(), "Untitled") + "\" by "
        + orDefault(art.artist(), "Unknown") + " (" + art.source() + ")\n\nImage: "
        + art.imageUrl(), Map.of("artwork", art));
  }

  private void publish(String query, List<Artwork> results) {
    try {
      bridge.write(query, results);
    } catch (RuntimeException e) {
      // the agent still gets its answer when the dashboard slot cannot be updated
      log.warn("Could not publish {} result(s) for '{}' to the result bridge", results.size(), query, e);
    }
  }

  private static SyncToolSpecification tool(String name, String description, McpSchema.JsonSchema inputSchema,
                                            String failurePrefix, ToolHandler handler) {
    McpSchema.Tool tool = McpSchema.Tool.builder()
        .name(name)
        .description(description)
        .inputSchema(inputSchema)
        .build();
    GuardedToolHandler guarded = GuardedToolHandler.guard(name, failurePrefix, handler);
    return new SyncToolSpecification(tool,
        (context, request) -> guarded.apply(ToolArguments.of(request.arguments())));
  }

  private static McpSchema.JsonSchema objectSchema(Map<String, Object> properties, List<String> required) {
    return new McpSchema.JsonSchema("object", properties, required, null, null, null);
  }

  private static McpSchema.JsonSchema noArguments() {
    return new McpSchema.JsonSchema("object", Map.of(), null, null, null, null);
  }

  private static Map<String, Object> stringParam(String description) {
    return Map.of("type", "string", "description", description);
  }

  private static Map<String, Object> integerParam(String description) {
    return Map.of("type", "integer", "description", description);
  }

  private static Map<String, Object> properties(Object... nameSchemaPairs) {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (int i = 0; i < nameSchemaPairs.length; i += 2) {
      properties.put((String) nameSchemaPairs[i], nameSchemaPairs[i + 1]);
    }
    return properties;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isEmpty() ? fallback : value;
  }

  private static String orUnknown(Integer value) {
    return value == null || value == 0 ? "Unknown" : value.toString();
  }
}

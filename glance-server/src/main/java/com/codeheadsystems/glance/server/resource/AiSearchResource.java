package com.codeheadsystems.glance.server.resource;

import com.codeheadsystems.glance.model.bridge.SearchSnapshot;
import com.codeheadsystems.glance.server.bridge.ResultBridge;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Polling endpoint for the dashboard: the latest results an agent produced.
 * Deliberately unauthenticated, like the rest of the dashboard API.
 */
@Singleton
@Path("/ai-search/latest")
@Produces(MediaType.APPLICATION_JSON)
public class AiSearchResource {

  private final ResultBridge resultBridge;

  @Inject
  public AiSearchResource(final ResultBridge resultBridge) {
    this.resultBridge = resultBridge;
  }

  @GET
  public SearchSnapshot latest() {
    return resultBridge.read();
  }

  @DELETE
  public Map<String, Object> clear() {
    resultBridge.clear();
    return Map.of("success", true);
  }
}

package com.codeheadsystems.relay.server.resource;

import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Diagnostics: {@code GET /debug} returns the live connection count as plain text.
 */
@Path("/debug")
public class DebugResource {

  private final ConnectionRegistry registry;

  /**
   * Instantiates a new Debug resource.
   *
   * @param registry the registry
   */
  public DebugResource(final ConnectionRegistry registry) {
    this.registry = registry;
  }

  /**
   * Live connection count.
   *
   * @return the count as text
   */
  @GET
  @Produces(MediaType.TEXT_PLAIN)
  public String connectionCount() {
    return Integer.toString(registry.size());
  }
}

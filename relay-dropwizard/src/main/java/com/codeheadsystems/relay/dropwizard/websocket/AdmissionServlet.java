package com.codeheadsystems.relay.dropwizard.websocket;

import com.codeheadsystems.relay.server.connection.Connection;
import com.codeheadsystems.relay.server.exception.OriginRejectedException;
import com.codeheadsystems.relay.server.exception.UnauthorizedException;
import com.codeheadsystems.relay.server.exception.UpgradeFailedException;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.eclipse.jetty.websocket.server.JettyWebSocketServerContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The WebSocket admission endpoint: {@code GET <websocketPath>?otp=<token>}.
 * <p>
 * Answers {@code 401} for a missing or unredeemable token, {@code 403} for a rejected origin
 * and {@code 400} when the request cannot be upgraded. On success the response becomes the
 * WebSocket handshake.
 */
public class AdmissionServlet extends HttpServlet {

  private static final Logger log = LoggerFactory.getLogger(AdmissionServlet.class);

  private final transient ConnectionRegistry registry;
  private final int inboundCapacity;
  private final transient Clock clock;

  /**
   * Instantiates a new Admission servlet.
   *
   * @param registry        the registry admitting connections
   * @param inboundCapacity messages each stream buffers before Jetty waits on the read loop
   * @param clock           time source for the streams' read deadlines
   */
  public AdmissionServlet(final ConnectionRegistry registry,
                          final int inboundCapacity,
                          final Clock clock) {
    this.registry = registry;
    this.inboundCapacity = inboundCapacity;
    this.clock = clock;
  }

  @Override
  protected void doGet(final HttpServletRequest request, final HttpServletResponse response)
      throws IOException {
    JettyWebSocketServerContainer container = JettyWebSocketServerContainer.getContainer(getServletContext());
    try {
      Connection connection = registry.admit(new ServletAdmissionRequest(request), () -> {
        JettyWebSocketStream stream = new JettyWebSocketStream(clock, inboundCapacity);
        if (container == null) {
          throw new IOException("WebSocket container not initialized");
        }
        if (!container.upgrade((upgradeRequest, upgradeResponse) -> stream, request, response)) {
          throw new IOException("not a WebSocket upgrade request");
        }
        return stream;
      });
      log.debug("admitted {} from {}", connection.id(), request.getRemoteAddr());
    } catch (UnauthorizedException e) {
      log.debug("admission refused: {}", e.getMessage());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
    } catch (OriginRejectedException e) {
      log.warn("admission refused: {}", e.getMessage());
      response.sendError(HttpServletResponse.SC_FORBIDDEN);
    } catch (UpgradeFailedException e) {
      log.warn("admission failed: {}", e.getMessage());
      if (!response.isCommitted()) {
        response.sendError(HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
      }
    }
  }
}

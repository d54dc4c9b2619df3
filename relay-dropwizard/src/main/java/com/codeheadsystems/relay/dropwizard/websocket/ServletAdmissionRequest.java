package com.codeheadsystems.relay.dropwizard.websocket;

import com.codeheadsystems.relay.server.registry.AdmissionRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * {@link AdmissionRequest} over a servlet request.
 */
public class ServletAdmissionRequest implements AdmissionRequest {

  private final HttpServletRequest request;

  /**
   * Instantiates a new Servlet admission request.
   *
   * @param request the request
   */
  public ServletAdmissionRequest(final HttpServletRequest request) {
    this.request = request;
  }

  @Override
  public Optional<String> queryParameter(final String name) {
    return Optional.ofNullable(request.getParameter(name));
  }

  @Override
  public Optional<String> header(final String name) {
    return Optional.ofNullable(request.getHeader(name));
  }
}

package com.codeheadsystems.relay.server.registry;

import java.util.Optional;

/**
 * The parts of an inbound upgrade request the registry needs to decide admission.
 * Implemented by each transport adapter over its own request type.
 */
public interface AdmissionRequest {

  /**
   * Query parameter carrying the admission token.
   */
  String TOKEN_PARAMETER = "otp";

  /**
   * Looks up a query parameter.
   *
   * @param name the parameter name
   * @return the first value, or empty if absent
   */
  Optional<String> queryParameter(String name);

  /**
   * Looks up a request header.
   *
   * @param name the header name
   * @return the first value, or empty if absent
   */
  Optional<String> header(String name);

  /**
   * The admission token, if present and not blank.
   *
   * @return the token
   */
  default Optional<String> token() {
    return queryParameter(TOKEN_PARAMETER).filter(s -> !s.isBlank());
  }

  /**
   * The {@code Origin} header, if the client sent one.
   *
   * @return the origin
   */
  default Optional<String> origin() {
    return header("Origin");
  }
}

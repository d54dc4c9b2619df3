package com.codeheadsystems.relay.server.resource;

import com.codeheadsystems.relay.model.LoginRequest;
import com.codeheadsystems.relay.model.LoginResponse;
import com.codeheadsystems.relay.server.manager.LoginManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource issuing one-time admission tokens.
 * <p>
 * {@code POST /login} with {@code {"username": ..., "password": ...}} answers
 * {@code 200 {"otp": ...}}, {@code 401} for rejected credentials, or {@code 400} for a missing
 * field. Malformed JSON is rejected with {@code 400} by the container's JSON provider before
 * this resource is reached.
 */
@Path("/login")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class LoginResource {

  private static final Logger log = LoggerFactory.getLogger(LoginResource.class);

  private final LoginManager loginManager;

  /**
   * Instantiates a new Login resource.
   *
   * @param loginManager the login manager
   */
  public LoginResource(final LoginManager loginManager) {
    this.loginManager = loginManager;
    log.info("LoginResource({})", loginManager);
  }

  /**
   * Issues a token for valid credentials.
   *
   * @param request the login request
   * @return the login response
   */
  @POST
  public LoginResponse login(final LoginRequest request) {
    log.trace("login()");
    try {
      return loginManager.login(request);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (SecurityException e) {
      throw new WebApplicationException(Response.Status.UNAUTHORIZED);
    }
  }
}

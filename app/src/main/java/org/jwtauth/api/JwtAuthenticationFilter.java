package org.jwtauth.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.jwtauth.auth.AuthContext;
import org.jwtauth.auth.AuthenticatableRequest;
import org.jwtauth.auth.Authenticator;
import org.jwtauth.exception.AuthException;

// Runs the Authenticator before every request. On success the claims are available as the request
// property `auth`, otherwise the request is aborted with 401.
@Provider
@Priority(Priorities.AUTHENTICATION)
@Slf4j
public class JwtAuthenticationFilter implements ContainerRequestFilter {

  public static final String AUTH_PROPERTY = "auth";
  static final String AUTH_EXCEPTION = "AUTH_EXCEPTION";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Authenticator authenticator;

  @Inject
  public JwtAuthenticationFilter(Authenticator authenticator) {
    this.authenticator = authenticator;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    try {
      authenticator.authenticate(new ContainerRequest(requestContext));
    } catch (AuthException e) {
      log.error("Exception in JwtAuthenticationFilter: ", e);
      requestContext.abortWith(toErrorResponse(e));
    }
  }

  Response toErrorResponse(AuthException e) {
    ErrorResponse errorResponse = new ErrorResponse(AUTH_EXCEPTION, e.getMessage());
    byte[] entity;
    try {
      entity = MAPPER.writeValueAsBytes(errorResponse);
    } catch (JsonProcessingException jsonException) {
      throw new IllegalStateException("Unable to serialize error response", jsonException);
    }

    return Response.status(Response.Status.UNAUTHORIZED)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(entity)
        .build();
  }

  private static final class ContainerRequest implements AuthenticatableRequest {
    private final ContainerRequestContext context;

    private ContainerRequest(ContainerRequestContext context) {
      this.context = context;
    }

    @Nullable
    @Override
    public String getHeader(String name) {
      return context.getHeaderString(name);
    }

    @Override
    public Optional<AuthContext> getAuth() {
      Object auth = context.getProperty(AUTH_PROPERTY);
      return auth instanceof AuthContext ? Optional.of((AuthContext) auth) : Optional.empty();
    }

    @Override
    public void setAuth(AuthContext auth) {
      context.setProperty(AUTH_PROPERTY, auth);
    }
  }
}

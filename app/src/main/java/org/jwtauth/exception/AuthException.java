package org.jwtauth.exception;

// Unauthorized outcome of request authentication. The precise failure is kept as the cause.
public class AuthException extends RuntimeException {

  public AuthException(String message, JwtException cause) {
    super(message, cause);
  }

  public JwtErrorKind getKind() {
    return ((JwtException) getCause()).getKind();
  }
}

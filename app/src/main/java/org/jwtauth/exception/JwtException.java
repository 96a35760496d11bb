package org.jwtauth.exception;

import javax.annotation.Nullable;
import lombok.Getter;

/**
 * Failure of secret resolution, token verification or token signing.
 *
 * <p>The {@link JwtErrorKind} identifies the failure; the underlying library or I/O exception, if
 * any, is kept as the cause.
 */
@Getter
public class JwtException extends RuntimeException {

  private final JwtErrorKind kind;

  public JwtException(JwtErrorKind kind, String message) {
    this(kind, message, null);
  }

  public JwtException(JwtErrorKind kind, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}

package org.jwtauth.sign;

import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;
import org.jwtauth.exception.JwtException;
import org.jwtauth.registry.Executor;

// Issues signed tokens for outbound use.
public interface Signer extends Executor {

  default String sign(Object payload) throws JwtException {
    return sign(payload, (byte[]) null, null);
  }

  default String sign(Object payload, @Nullable String secret) throws JwtException {
    return sign(payload, secret == null ? null : secret.getBytes(StandardCharsets.UTF_8), null);
  }

  /**
   * Signs {@code payload} and returns the compact serialized token.
   *
   * @param payload claims, as a map or an object Jackson can convert to one
   * @param secret key material to use for this call instead of the configured one
   * @param options options to use for this call instead of the configured ones
   * @throws JwtException {@code NO_SECRET_CONFIGURED} if no key material is configured,
   *     {@code SIGNING_FAILED} if the key file is unreadable or the payload or options are
   *     rejected
   */
  String sign(Object payload, @Nullable byte[] secret, @Nullable SignOptions options)
      throws JwtException;
}

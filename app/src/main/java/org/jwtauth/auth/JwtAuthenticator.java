package org.jwtauth.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;
import com.auth0.jwt.interfaces.Verification;
import java.security.GeneralSecurityException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jwtauth.config.ConfigProvider;
import org.jwtauth.crypto.Algorithms;
import org.jwtauth.exception.AuthException;
import org.jwtauth.exception.JwtErrorKind;
import org.jwtauth.exception.JwtException;
import org.jwtauth.registry.ExecutorConfig;
import org.jwtauth.registry.ExecutorType;
import org.jwtauth.secret.ResolvedSecret;
import org.jwtauth.secret.SecretResolver;

// A JWT (https://datatracker.ietf.org/doc/html/rfc7519) based authenticator.
//
// Key material comes from `jwtSecret` or the key file `jwtCert`, given in the executor config or
// the host configuration. With a raw secret, HMAC tokens are accepted; with a PEM public key or
// certificate, RSA and ECDSA tokens are accepted. `jwtVerifyOptions` narrows this down.
@Slf4j
public class JwtAuthenticator implements Authenticator {

  public static final String NAME = "Authenticator";

  private static final String BEARER_PREFIX = "Bearer ";

  private final SecretResolver<VerifyOptions> secretResolver;

  public JwtAuthenticator(ExecutorConfig config, ConfigProvider configProvider) {
    this.secretResolver = new SecretResolver<>(config, configProvider,
        ConfigProvider.JWT_VERIFY_OPTIONS, VerifyOptions.class, VerifyOptions.DEFAULT);
  }

  @Override
  public <R extends AuthenticatableRequest> R authenticate(R request) throws AuthException {
    try {
      String token = extractToken(request);
      ResolvedSecret<VerifyOptions> resolved = resolve();
      AuthContext auth = verify(token, resolved.getSecret(), resolved.getOptions());

      request.setAuth(auth);
      return request;
    } catch (JwtException e) {
      log.warn("Rejected request, {}: {}", e.getKind(), e.getMessage());
      throw new AuthException(rejectionMessage(e.getKind()), e);
    }
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public ExecutorType getType() {
    return ExecutorType.REQUEST_HANDLER;
  }

  private static String extractToken(AuthenticatableRequest request) {
    String authorizationHeader = request.getHeader(AuthenticatableRequest.AUTHORIZATION);
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      throw new JwtException(JwtErrorKind.MISSING_OR_MALFORMED_TOKEN,
          "Missing or invalid Authorization header.");
    }

    // Extract token by excluding BEARER_PREFIX.
    return authorizationHeader.substring(BEARER_PREFIX.length());
  }

  private ResolvedSecret<VerifyOptions> resolve() {
    try {
      return secretResolver.resolve();
    } catch (IllegalArgumentException e) {
      throw new JwtException(JwtErrorKind.VERIFICATION_FAILED,
          "Invalid jwt verification configuration.", e);
    }
  }

  private static AuthContext verify(String token, byte[] secret, VerifyOptions options) {
    try {
      String algorithmName = JWT.decode(token).getAlgorithm();
      List<String> allowed = options.getAlgorithms() != null
          ? options.getAlgorithms()
          : Algorithms.defaultVerificationAlgorithms(secret);
      if (algorithmName == null || !allowed.contains(algorithmName)) {
        throw new JwtException(JwtErrorKind.VERIFICATION_FAILED,
            "Jwt algorithm " + algorithmName + " is not allowed.");
      }

      Algorithm algorithm = Algorithms.forVerification(algorithmName, secret);
      DecodedJWT jwt = buildVerifier(algorithm, options).verify(token);
      checkMaxAge(jwt, options);
      return AuthContext.from(jwt);
    } catch (JWTVerificationException | GeneralSecurityException | IllegalArgumentException
        | DateTimeException | ArithmeticException e) {
      // Date claims outside the Instant range fail while decoding.
      throw new JwtException(JwtErrorKind.VERIFICATION_FAILED, "Invalid JWT token.", e);
    }
  }

  private static JWTVerifier buildVerifier(Algorithm algorithm, VerifyOptions options) {
    Verification verification = JWT.require(algorithm).acceptLeeway(options.getClockTolerance());
    if (options.getIssuer() != null && !options.getIssuer().isEmpty()) {
      verification.withIssuer(options.getIssuer().toArray(new String[0]));
    }
    if (options.getAudience() != null && !options.getAudience().isEmpty()) {
      verification.withAnyOfAudience(options.getAudience().toArray(new String[0]));
    }
    if (options.getSubject() != null) {
      verification.withSubject(options.getSubject());
    }
    if (options.getJwtId() != null) {
      verification.withJWTId(options.getJwtId());
    }
    return verification.build();
  }

  private static void checkMaxAge(DecodedJWT jwt, VerifyOptions options) {
    Long maxAge = options.getMaxAge();
    if (maxAge == null) {
      return;
    }
    Instant issuedAt = jwt.getIssuedAtAsInstant();
    if (issuedAt == null) {
      throw new JwtException(JwtErrorKind.VERIFICATION_FAILED,
          "Jwt has no iat claim but maxAge is required.");
    }
    long allowedAge = Math.addExact(maxAge, options.getClockTolerance());
    if (issuedAt.plusSeconds(allowedAge).isBefore(Instant.now())) {
      throw new JwtException(JwtErrorKind.VERIFICATION_FAILED, "Jwt maxAge exceeded.");
    }
  }

  private static String rejectionMessage(JwtErrorKind kind) {
    if (kind == JwtErrorKind.MISSING_OR_MALFORMED_TOKEN) {
      return "Missing or invalid Authorization header.";
    }
    return "Invalid JWT token.";
  }
}

package org.jwtauth.sign;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.jwtauth.config.ConfigProvider;
import org.jwtauth.crypto.Algorithms;
import org.jwtauth.exception.JwtErrorKind;
import org.jwtauth.exception.JwtException;
import org.jwtauth.registry.ExecutorConfig;
import org.jwtauth.registry.ExecutorType;
import org.jwtauth.secret.SecretResolver;

// Issues JWTs signed with the configured `jwtSecret` or the private key in `jwtCert`.
@Slf4j
public class JwtSigner implements Signer {

  public static final String NAME = "Signer";

  private static final String ISSUED_AT = "iat";
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
  };

  private final SecretResolver<SignOptions> secretResolver;

  public JwtSigner(ExecutorConfig config, ConfigProvider configProvider) {
    this.secretResolver = new SecretResolver<>(config, configProvider,
        ConfigProvider.JWT_SIGN_OPTIONS, SignOptions.class, SignOptions.DEFAULT);
  }

  @Override
  public String sign(Object payload, @Nullable byte[] secret, @Nullable SignOptions options)
      throws JwtException {
    byte[] key = secret != null ? secret : resolveSecret();
    SignOptions signOptions = options != null ? options : resolveOptions();
    Map<String, Object> claims = toClaims(payload);

    try {
      String algorithmName = signOptions.getAlgorithm() != null
          ? signOptions.getAlgorithm()
          : Algorithms.defaultSigningAlgorithm(key);
      Algorithm algorithm = Algorithms.forSigning(algorithmName, key);

      JWTCreator.Builder builder = JWT.create().withPayload(claims);
      applyOptions(builder, claims, signOptions);
      String token = builder.sign(algorithm);
      log.debug("Signed jwt with {}", algorithmName);
      return token;
    } catch (JWTCreationException | GeneralSecurityException | IllegalArgumentException e) {
      throw new JwtException(JwtErrorKind.SIGNING_FAILED, "Unable to sign jwt.", e);
    }
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public ExecutorType getType() {
    return ExecutorType.SERVICE;
  }

  // A key file that cannot be read is a signing failure; a missing secret is reported as is.
  private byte[] resolveSecret() {
    try {
      return secretResolver.resolveSecret();
    } catch (IllegalArgumentException e) {
      throw new JwtException(JwtErrorKind.SIGNING_FAILED, "Invalid jwt secret configuration.", e);
    } catch (JwtException e) {
      if (e.getKind() == JwtErrorKind.SECRET_FILE_UNREADABLE) {
        throw new JwtException(JwtErrorKind.SIGNING_FAILED, "Unable to sign jwt.", e);
      }
      throw e;
    }
  }

  private SignOptions resolveOptions() {
    try {
      return secretResolver.resolveOptions();
    } catch (IllegalArgumentException e) {
      throw new JwtException(JwtErrorKind.SIGNING_FAILED, "Invalid jwt sign options.", e);
    }
  }

  private static Map<String, Object> toClaims(Object payload) {
    if (payload == null) {
      throw new JwtException(JwtErrorKind.SIGNING_FAILED, "Jwt payload is required.");
    }
    if (payload instanceof Map) {
      Map<String, Object> claims = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) payload).entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          throw new JwtException(JwtErrorKind.SIGNING_FAILED,
              "Jwt claim names must be strings, got " + entry.getKey());
        }
        claims.put((String) entry.getKey(), entry.getValue());
      }
      return claims;
    }
    try {
      return MAPPER.convertValue(payload, CLAIMS_TYPE);
    } catch (IllegalArgumentException e) {
      throw new JwtException(JwtErrorKind.SIGNING_FAILED,
          "Jwt payload must be a JSON object, got " + payload.getClass().getName(), e);
    }
  }

  private static void applyOptions(JWTCreator.Builder builder, Map<String, Object> claims,
      SignOptions options) {
    Instant issuedAt = issuedAt(claims);
    if (!options.isNoTimestamp()) {
      builder.withIssuedAt(issuedAt);
    }
    if (options.getExpiresIn() != null) {
      builder.withExpiresAt(issuedAt.plusSeconds(options.getExpiresIn()));
    }
    if (options.getNotBefore() != null) {
      builder.withNotBefore(issuedAt.plusSeconds(options.getNotBefore()));
    }
    if (options.getAudience() != null && !options.getAudience().isEmpty()) {
      builder.withAudience(options.getAudience().toArray(new String[0]));
    }
    if (options.getIssuer() != null) {
      builder.withIssuer(options.getIssuer());
    }
    if (options.getSubject() != null) {
      builder.withSubject(options.getSubject());
    }
    if (options.getJwtId() != null) {
      builder.withJWTId(options.getJwtId());
    }
    if (options.getKeyId() != null) {
      builder.withKeyId(options.getKeyId());
    }
    if (options.getHeader() != null) {
      builder.withHeader(options.getHeader());
    }
  }

  // iat of the payload when present, otherwise now. exp and nbf are relative to it.
  private static Instant issuedAt(Map<String, Object> claims) {
    Object value = claims.get(ISSUED_AT);
    if (value instanceof Number) {
      return Instant.ofEpochSecond(((Number) value).longValue());
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    if (value instanceof Instant) {
      return (Instant) value;
    }
    return Instant.now();
  }
}

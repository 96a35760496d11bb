package org.jwtauth.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.jwtauth.TestKeys;
import org.jwtauth.config.ConfigProvider;
import org.jwtauth.exception.AuthException;
import org.jwtauth.exception.JwtErrorKind;
import org.jwtauth.registry.ExecutorConfig;
import org.jwtauth.registry.ExecutorType;
import org.jwtauth.sign.JwtSigner;
import org.jwtauth.sign.SignOptions;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JwtAuthenticatorTest {

  private static final String SECRET = "s3cr3t";

  @TempDir
  Path tempDir;

  private ConfigProvider configProvider;
  private JwtSigner signer;

  @BeforeEach
  void setUp() {
    configProvider = mock(ConfigProvider.class);
    signer = new JwtSigner(ExecutorConfig.empty(), configProvider);
  }

  @Test
  void testValidJwtToken() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    SimpleRequest request = bearer(signer.sign(Map.of("sub", "u1"), SECRET));

    SimpleRequest authenticated = authenticator.authenticate(request);

    assertThat(authenticated, sameInstance(request));
    AuthContext auth = request.getAuth().orElseThrow();
    assertThat(auth.getSubject(), is(Optional.of("u1")));
    assertTrue(auth.get("iat").isPresent());
  }

  @Test
  void testMissingAuthorizationHeader() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    SimpleRequest request = new SimpleRequest(Map.of());

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.MISSING_OR_MALFORMED_TOKEN));
    assertFalse(request.getAuth().isPresent());
  }

  @ParameterizedTest
  @ValueSource(strings = {"Basic Zm9v", "InvalidHeader", "bearer abc.def.ghi", "Bearer",
      "Bearerabc", " Bearer abc.def.ghi"})
  void testMalformedAuthorizationHeader(String header) {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    SimpleRequest request = SimpleRequest.withAuthorization(header);

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.MISSING_OR_MALFORMED_TOKEN));
    assertThat(exception.getMessage(), is("Missing or invalid Authorization header."));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testMissingHeaderIsRejectedBeforeSecretResolution() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.empty(), configProvider);

    AuthException exception = assertThrows(AuthException.class,
        () -> authenticator.authenticate(new SimpleRequest(Map.of())));

    assertThat(exception.getKind(), is(JwtErrorKind.MISSING_OR_MALFORMED_TOKEN));
  }

  @Test
  void testInvalidJwtToken() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    SimpleRequest request = bearer("invalid.jwt.token");

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testTokenSignedWithOtherSecret() {
    JwtAuthenticator authenticator = authenticatorWithSecret("other");
    SimpleRequest request = bearer(signer.sign(Map.of("sub", "u1"), SECRET));

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
    assertThat(exception.getCause().getCause(), instanceOf(SignatureVerificationException.class));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testExpiredToken() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    long issuedAt = Instant.now().minusSeconds(3600).getEpochSecond();
    String token = signer.sign(Map.of("sub", "u1", "iat", issuedAt), SECRET.getBytes(),
        SignOptions.builder().expiresIn(60L).build());

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(bearer(token)));

    assertThat(exception.getCause().getCause(), instanceOf(TokenExpiredException.class));
  }

  @Test
  void testExpiredTokenWithinClockTolerance() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS,
            VerifyOptions.builder().clockTolerance(120).build())
        .build(), configProvider);
    long issuedAt = Instant.now().minusSeconds(90).getEpochSecond();
    String token = signer.sign(Map.of("iat", issuedAt), SECRET.getBytes(),
        SignOptions.builder().expiresIn(30L).build());

    SimpleRequest request = authenticator.authenticate(bearer(token));

    assertTrue(request.getAuth().isPresent());
  }

  @Test
  void testMaxAgeExceeded() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS, Map.of("maxAge", 60))
        .build(), configProvider);
    long issuedAt = Instant.now().minusSeconds(600).getEpochSecond();
    String token = signer.sign(Map.of("iat", issuedAt), SECRET);

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(bearer(token)));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
    assertThat(exception.getCause().getMessage(), is("Jwt maxAge exceeded."));
  }

  @Test
  void testMaxAgeRequiresIssuedAt() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS, Map.of("maxAge", 60))
        .build(), configProvider);
    String token = signer.sign(Map.of("sub", "u1"), SECRET.getBytes(),
        SignOptions.builder().noTimestamp(true).build());

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(bearer(token)));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
  }

  @ParameterizedTest
  @MethodSource("provideClaimConstraintCases")
  void testClaimConstraints(VerifyOptions verifyOptions, SignOptions signOptions,
      boolean accepted) {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS, verifyOptions)
        .build(), configProvider);
    SimpleRequest request = bearer(signer.sign(Map.of("x", 1), SECRET.getBytes(), signOptions));

    if (accepted) {
      authenticator.authenticate(request);
      assertTrue(request.getAuth().isPresent());
    } else {
      AuthException exception =
          assertThrows(AuthException.class, () -> authenticator.authenticate(request));
      assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
      assertFalse(request.getAuth().isPresent());
    }
  }

  private static Stream<Arguments> provideClaimConstraintCases() {
    return Stream.of(
        Arguments.of(VerifyOptions.builder().issuer(List.of("a", "b")).build(),
            SignOptions.builder().issuer("b").build(), true),
        Arguments.of(VerifyOptions.builder().issuer(List.of("a")).build(),
            SignOptions.builder().issuer("c").build(), false),
        Arguments.of(VerifyOptions.builder().audience(List.of("api")).build(),
            SignOptions.builder().audience(List.of("web", "api")).build(), true),
        Arguments.of(VerifyOptions.builder().audience(List.of("api")).build(),
            SignOptions.builder().audience(List.of("web")).build(), false),
        Arguments.of(VerifyOptions.builder().subject("u1").build(),
            SignOptions.builder().subject("u2").build(), false),
        Arguments.of(VerifyOptions.builder().jwtId("id-1").build(),
            SignOptions.builder().jwtId("id-1").build(), true),
        Arguments.of(VerifyOptions.builder().algorithms(List.of("HS256")).build(),
            SignOptions.builder().algorithm("HS512").build(), false),
        Arguments.of(VerifyOptions.builder().algorithms(List.of("HS384")).build(),
            SignOptions.builder().algorithm("HS384").build(), true),
        Arguments.of(VerifyOptions.DEFAULT,
            SignOptions.builder().notBefore(3600L).build(), false)
    );
  }

  @Test
  void testUnsignedTokenIsRejected() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS, Map.of("algorithms", List.of("none", "HS256")))
        .build(), configProvider);
    String token = JWT.create().withSubject("u1").sign(Algorithm.none());

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(bearer(token)));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
  }

  @Test
  void testHmacTokenIsRejectedForPublicKey() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_CERT, TestKeys.path(TestKeys.RSA_PUBLIC_KEY).toString())
        .build(), configProvider);
    String token = signer.sign(Map.of("sub", "u1"), SECRET);

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(bearer(token)));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
  }

  @ParameterizedTest
  @MethodSource("provideKeyPairCases")
  void testTokenSignedWithPrivateKeyFile(String privateKey, String publicKey, String algorithm) {
    JwtSigner keySigner = new JwtSigner(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_CERT, TestKeys.path(privateKey))
        .build(), configProvider);
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_CERT, TestKeys.path(publicKey).toString())
        .build(), configProvider);
    String token = keySigner.sign(Map.of("sub", "u1"));

    SimpleRequest request = authenticator.authenticate(bearer(token));

    assertThat(JWT.decode(token).getAlgorithm(), is(algorithm));
    assertThat(request.getAuth().orElseThrow().getSubject(), is(Optional.of("u1")));
  }

  private static Stream<Arguments> provideKeyPairCases() {
    return Stream.of(
        Arguments.of(TestKeys.RSA_PRIVATE_KEY, TestKeys.RSA_PUBLIC_KEY, "RS256"),
        Arguments.of(TestKeys.RSA_PRIVATE_KEY, TestKeys.RSA_CERTIFICATE, "RS256"),
        Arguments.of(TestKeys.EC_PRIVATE_KEY, TestKeys.EC_PUBLIC_KEY, "ES256")
    );
  }

  @Test
  void testMissingCertFileIsUnauthorized() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_CERT, tempDir.resolve("missing.pem").toString())
        .build(), configProvider);
    SimpleRequest request = bearer(signer.sign(Map.of("sub", "u1"), SECRET));

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.SECRET_FILE_UNREADABLE));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testNoSecretConfiguredIsUnauthorized() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.empty(), configProvider);
    SimpleRequest request = bearer(signer.sign(Map.of("sub", "u1"), SECRET));

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.NO_SECRET_CONFIGURED));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testSecretAndOptionsFromHostConfiguration() {
    when(configProvider.getConfig(ConfigProvider.JWT_SECRET)).thenReturn(Optional.of(SECRET));
    when(configProvider.getConfig(ConfigProvider.JWT_VERIFY_OPTIONS))
        .thenReturn(Optional.of(Map.of("issuer", "gateway")));
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.empty(), configProvider);
    String token = signer.sign(Map.of("sub", "u1"), SECRET.getBytes(),
        SignOptions.builder().issuer("gateway").build());

    SimpleRequest request = authenticator.authenticate(bearer(token));

    assertThat(request.getAuth().orElseThrow().get("iss"), is(Optional.of("gateway")));
  }

  @Test
  void testInvalidVerifyOptionsAreUnauthorized() {
    when(configProvider.getConfig(ConfigProvider.JWT_VERIFY_OPTIONS))
        .thenReturn(Optional.of("{broken"));
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);

    AuthException exception = assertThrows(AuthException.class,
        () -> authenticator.authenticate(bearer(signer.sign(Map.of("sub", "u1"), SECRET))));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
  }

  @Test
  void testTamperedPayloadIsRejected() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    String[] parts = signer.sign(Map.of("sub", "u1"), SECRET).split("\\.");
    String forgedPayload = Base64.getUrlEncoder().withoutPadding()
        .encodeToString("{\"sub\":\"admin\"}".getBytes());

    AuthException exception = assertThrows(AuthException.class, () -> authenticator.authenticate(
        bearer(parts[0] + "." + forgedPayload + "." + parts[2])));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
  }

  @Test
  void testOutOfRangeDateClaimIsRejected() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);
    Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    String header = encoder.encodeToString("{\"alg\":\"HS256\"}".getBytes());
    String payload = encoder.encodeToString("{\"iat\":1000000000000000000}".getBytes());
    SimpleRequest request = bearer(header + "." + payload + ".c2ln");

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testMaxAgeBeyondInstantRangeIsRejected() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS,
            VerifyOptions.builder().maxAge(Long.MAX_VALUE).clockTolerance(1).build())
        .build(), configProvider);
    String token = signer.sign(Map.of("sub", "u1"), SECRET);

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(bearer(token)));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
  }

  @Test
  void testInvalidInlineVerifyOptionsAreUnauthorized() {
    JwtAuthenticator authenticator = new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, SECRET)
        .value(ConfigProvider.JWT_VERIFY_OPTIONS, "{broken")
        .build(), configProvider);
    SimpleRequest request = bearer(signer.sign(Map.of("sub", "u1"), SECRET));

    AuthException exception =
        assertThrows(AuthException.class, () -> authenticator.authenticate(request));

    assertThat(exception.getKind(), is(JwtErrorKind.VERIFICATION_FAILED));
    assertFalse(request.getAuth().isPresent());
  }

  @Test
  void testExecutorInfo() {
    JwtAuthenticator authenticator = authenticatorWithSecret(SECRET);

    assertThat(authenticator.getName(), is("Authenticator"));
    assertThat(authenticator.getType(), is(ExecutorType.REQUEST_HANDLER));
  }

  private JwtAuthenticator authenticatorWithSecret(String secret) {
    return new JwtAuthenticator(ExecutorConfig.builder()
        .value(ConfigProvider.JWT_SECRET, secret)
        .build(), configProvider);
  }

  private static SimpleRequest bearer(String token) {
    return SimpleRequest.withAuthorization("Bearer " + token);
  }
}

package org.jwtauth.auth;

import java.util.List;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

// Constraints applied when verifying a token. Unset fields are not checked.
@Value
@Builder
@Jacksonized
public class VerifyOptions {

  public static final VerifyOptions DEFAULT = VerifyOptions.builder().build();

  // Accepted `alg` header values. Defaults depend on the key material.
  @Nullable
  List<String> algorithms;
  // Accepted issuers, any one must match.
  @Nullable
  List<String> issuer;
  // Accepted audiences, the token must name at least one.
  @Nullable
  List<String> audience;
  @Nullable
  String subject;
  @Nullable
  String jwtId;
  // Leeway in seconds for exp, nbf and iat.
  long clockTolerance;
  // Maximum age in seconds, measured from iat.
  @Nullable
  Long maxAge;
}

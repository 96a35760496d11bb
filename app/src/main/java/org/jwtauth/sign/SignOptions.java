package org.jwtauth.sign;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

// Claims and header fields added when issuing a token.
@Value
@Builder
@Jacksonized
public class SignOptions {

  public static final SignOptions DEFAULT = SignOptions.builder().build();

  // HS256 for raw secrets, RS256 or ES256 for PEM private keys when unset.
  @Nullable
  String algorithm;
  // Seconds after iat.
  @Nullable
  Long expiresIn;
  // Seconds after iat.
  @Nullable
  Long notBefore;
  @Nullable
  List<String> audience;
  @Nullable
  String issuer;
  @Nullable
  String subject;
  @Nullable
  String jwtId;
  @Nullable
  String keyId;
  // Do not add iat.
  boolean noTimestamp;
  @Nullable
  Map<String, Object> header;
}

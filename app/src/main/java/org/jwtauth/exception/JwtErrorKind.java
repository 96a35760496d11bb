package org.jwtauth.exception;

// Closed set of failures raised while resolving key material, verifying or signing tokens.
public enum JwtErrorKind {
  // No `authorization` header, or it does not start with "Bearer ".
  MISSING_OR_MALFORMED_TOKEN,
  // None of inline config, key file or host configuration provided a secret.
  NO_SECRET_CONFIGURED,
  // A key file was designated but could not be read.
  SECRET_FILE_UNREADABLE,
  // The token was rejected by signature, claim or algorithm checks.
  VERIFICATION_FAILED,
  // The payload or options were rejected while issuing a token.
  SIGNING_FAILED
}

package org.jwtauth.config;

import java.util.Optional;

// Host configuration lookup, queried only for values not supplied to an executor directly.
public interface ConfigProvider {

  String JWT_SECRET = "jwtSecret";
  String JWT_CERT = "jwtCert";
  String JWT_VERIFY_OPTIONS = "jwtVerifyOptions";
  String JWT_SIGN_OPTIONS = "jwtSignOptions";

  Optional<Object> getConfig(String key);
}

package org.jwtauth.auth;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;

// Request backed by a header map. Header names are case-insensitive.
public class SimpleRequest implements AuthenticatableRequest {

  private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
  private volatile AuthContext auth;

  public SimpleRequest(Map<String, String> headers) {
    this.headers.putAll(headers);
  }

  public static SimpleRequest withAuthorization(String authorization) {
    return new SimpleRequest(Map.of(AUTHORIZATION, authorization));
  }

  @Nullable
  @Override
  public String getHeader(String name) {
    return headers.get(name);
  }

  @Override
  public Optional<AuthContext> getAuth() {
    return Optional.ofNullable(auth);
  }

  @Override
  public void setAuth(AuthContext auth) {
    this.auth = auth;
  }
}

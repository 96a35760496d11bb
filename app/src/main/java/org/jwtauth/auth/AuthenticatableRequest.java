package org.jwtauth.auth;

import java.util.Optional;
import javax.annotation.Nullable;

// The parts of an externally owned request that authentication reads and writes.
public interface AuthenticatableRequest {

  String AUTHORIZATION = "authorization";

  @Nullable
  String getHeader(String name);

  Optional<AuthContext> getAuth();

  void setAuth(AuthContext auth);
}

package org.jwtauth.auth;

import org.jwtauth.exception.AuthException;
import org.jwtauth.registry.Executor;

// Authenticator that is run before every request.
public interface Authenticator extends Executor {

  // Verifies the bearer token of `request` and attaches its claims. Returns the same request.
  <R extends AuthenticatableRequest> R authenticate(R request) throws AuthException;
}

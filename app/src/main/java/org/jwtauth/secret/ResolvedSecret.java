package org.jwtauth.secret;

import lombok.ToString;
import lombok.Value;

// Key material and options resolved for one executor instance.
@Value
public class ResolvedSecret<O> {

  @ToString.Exclude
  byte[] secret;
  O options;

  public byte[] getSecret() {
    return secret.clone();
  }
}

package org.jwtauth.auth;

import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

// Immutable claim set of a verified token.
@EqualsAndHashCode
@ToString
public final class AuthContext {

  private final Map<String, Object> claims;

  public AuthContext(Map<String, Object> claims) {
    Map<String, Object> copy = new LinkedHashMap<>();
    claims.forEach((name, value) -> copy.put(name, unmodifiableCopy(value)));
    this.claims = Collections.unmodifiableMap(copy);
  }

  // Claim values are decoded to String, Boolean, Integer, Long, Double, List or Map.
  public static AuthContext from(DecodedJWT jwt) {
    Map<String, Object> claims = new LinkedHashMap<>();
    for (Map.Entry<String, Claim> entry : jwt.getClaims().entrySet()) {
      claims.put(entry.getKey(), entry.getValue().as(Object.class));
    }
    return new AuthContext(claims);
  }

  public Map<String, Object> getClaims() {
    return claims;
  }

  public Optional<Object> get(String name) {
    return Optional.ofNullable(claims.get(name));
  }

  public Optional<String> getSubject() {
    return get("sub").map(Object::toString);
  }

  // Nested maps and lists are copied as well.
  private static Object unmodifiableCopy(Object value) {
    if (value instanceof Map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      ((Map<?, ?>) value).forEach((key, nested) -> copy.put(key, unmodifiableCopy(nested)));
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof List) {
      List<Object> copy = new ArrayList<>();
      for (Object nested : (List<?>) value) {
        copy.add(unmodifiableCopy(nested));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}

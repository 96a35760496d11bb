package org.jwtauth.crypto;

import com.auth0.jwt.algorithms.Algorithm;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.interfaces.ECKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAKey;
import java.util.List;

// Maps a JWS algorithm name and resolved key material to a java-jwt Algorithm.
// HMAC algorithms use the key material as raw secret, RSA and ECDSA algorithms expect PEM keys.
public final class Algorithms {

  public static final List<String> HMAC_ALGORITHMS = List.of("HS256", "HS384", "HS512");
  public static final List<String> PUBLIC_KEY_ALGORITHMS =
      List.of("RS256", "RS384", "RS512", "ES256", "ES384", "ES512");

  private Algorithms() {
  }

  public static List<String> defaultVerificationAlgorithms(byte[] keyMaterial) {
    return PemKeys.isPem(keyMaterial) ? PUBLIC_KEY_ALGORITHMS : HMAC_ALGORITHMS;
  }

  public static String defaultSigningAlgorithm(byte[] keyMaterial)
      throws GeneralSecurityException {
    if (!PemKeys.isPem(keyMaterial)) {
      return "HS256";
    }
    return PemKeys.readPrivateKey(keyMaterial) instanceof ECPrivateKey ? "ES256" : "RS256";
  }

  public static Algorithm forVerification(String name, byte[] keyMaterial)
      throws GeneralSecurityException {
    return create(name, keyMaterial, false);
  }

  public static Algorithm forSigning(String name, byte[] keyMaterial)
      throws GeneralSecurityException {
    return create(name, keyMaterial, true);
  }

  private static Algorithm create(String name, byte[] keyMaterial, boolean signing)
      throws GeneralSecurityException {
    switch (name) {
      case "HS256":
        return Algorithm.HMAC256(keyMaterial);
      case "HS384":
        return Algorithm.HMAC384(keyMaterial);
      case "HS512":
        return Algorithm.HMAC512(keyMaterial);
      case "RS256":
        return Algorithm.RSA256(rsaKey(keyMaterial, signing));
      case "RS384":
        return Algorithm.RSA384(rsaKey(keyMaterial, signing));
      case "RS512":
        return Algorithm.RSA512(rsaKey(keyMaterial, signing));
      case "ES256":
        return Algorithm.ECDSA256(ecKey(keyMaterial, signing));
      case "ES384":
        return Algorithm.ECDSA384(ecKey(keyMaterial, signing));
      case "ES512":
        return Algorithm.ECDSA512(ecKey(keyMaterial, signing));
      default:
        throw new GeneralSecurityException("Unsupported jwt algorithm: " + name);
    }
  }

  private static RSAKey rsaKey(byte[] keyMaterial, boolean signing)
      throws GeneralSecurityException {
    Key key = readKey(keyMaterial, signing);
    if (!(key instanceof RSAKey)) {
      throw new GeneralSecurityException("Key is not an RSA key.");
    }
    return (RSAKey) key;
  }

  private static ECKey ecKey(byte[] keyMaterial, boolean signing)
      throws GeneralSecurityException {
    Key key = readKey(keyMaterial, signing);
    if (!(key instanceof ECKey)) {
      throw new GeneralSecurityException("Key is not an EC key.");
    }
    return (ECKey) key;
  }

  private static Key readKey(byte[] keyMaterial, boolean signing)
      throws GeneralSecurityException {
    return signing ? PemKeys.readPrivateKey(keyMaterial) : PemKeys.readPublicKey(keyMaterial);
  }
}

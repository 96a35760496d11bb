package org.jwtauth.crypto;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.spec.KeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;

// Reads RSA and EC keys from PEM encoded key material.
//
// Supported blocks: `PUBLIC KEY` (X.509 SubjectPublicKeyInfo), `CERTIFICATE` (X.509 certificate,
// its public key is used) and `PRIVATE KEY` (PKCS#8).
// Example, to generate a key pair:
// * `openssl genpkey -algorithm RSA -out private_key.pem -pkeyopt rsa_keygen_bits:2048`
// * `openssl rsa -pubout -in private_key.pem -out public_key.pem`
public final class PemKeys {

  private static final String PEM_MARKER = "-----BEGIN ";
  private static final String PUBLIC_KEY = "PUBLIC KEY";
  private static final String CERTIFICATE = "CERTIFICATE";
  private static final String PRIVATE_KEY = "PRIVATE KEY";
  private static final List<String> KEY_ALGORITHMS = List.of("RSA", "EC");

  private PemKeys() {
  }

  public static boolean isPem(byte[] keyMaterial) {
    return new String(keyMaterial, StandardCharsets.US_ASCII).stripLeading().startsWith(PEM_MARKER);
  }

  public static PublicKey readPublicKey(byte[] keyMaterial) throws GeneralSecurityException {
    String pem = new String(keyMaterial, StandardCharsets.US_ASCII);
    if (pem.contains(PEM_MARKER + CERTIFICATE)) {
      CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");
      return certificateFactory.generateCertificate(new ByteArrayInputStream(keyMaterial))
          .getPublicKey();
    }
    X509EncodedKeySpec spec = new X509EncodedKeySpec(decode(pem, PUBLIC_KEY));
    GeneralSecurityException failure =
        new GeneralSecurityException("Public key is neither an RSA nor an EC key.");
    for (String algorithm : KEY_ALGORITHMS) {
      try {
        return KeyFactory.getInstance(algorithm).generatePublic(spec);
      } catch (GeneralSecurityException e) {
        failure.addSuppressed(e);
      }
    }
    throw failure;
  }

  public static PrivateKey readPrivateKey(byte[] keyMaterial) throws GeneralSecurityException {
    String pem = new String(keyMaterial, StandardCharsets.US_ASCII);
    KeySpec spec = new PKCS8EncodedKeySpec(decode(pem, PRIVATE_KEY));
    GeneralSecurityException failure =
        new GeneralSecurityException("Private key is neither an RSA nor an EC PKCS#8 key.");
    for (String algorithm : KEY_ALGORITHMS) {
      try {
        return KeyFactory.getInstance(algorithm).generatePrivate(spec);
      } catch (GeneralSecurityException e) {
        failure.addSuppressed(e);
      }
    }
    throw failure;
  }

  private static byte[] decode(String pem, String type) throws GeneralSecurityException {
    String begin = PEM_MARKER + type + "-----";
    String end = "-----END " + type + "-----";
    int start = pem.indexOf(begin);
    int stop = pem.indexOf(end);
    if (start < 0 || stop < start) {
      throw new GeneralSecurityException("Expected a PEM encoded " + type + " block.");
    }
    String key = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
    try {
      return Base64.getDecoder().decode(key);
    } catch (IllegalArgumentException e) {
      throw new GeneralSecurityException("Invalid base64 in PEM encoded " + type + ".", e);
    }
  }
}

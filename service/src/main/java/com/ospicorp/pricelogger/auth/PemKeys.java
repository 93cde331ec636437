package com.ospicorp.pricelogger.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Reads RSA keys from PKCS#8 private and X.509 public PEM text. The PEM may itself be base64
 * encoded, as deployment secrets usually carry it.
 */
final class PemKeys {

  private static final String BEGIN = "-----BEGIN";

  private PemKeys() {
  }

  static RSAPrivateKey privateKey(String material) throws GeneralSecurityException {
    byte[] der = der(material);
    return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
  }

  static RSAPublicKey publicKey(String material) throws GeneralSecurityException {
    byte[] der = der(material);
    return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
  }

  private static byte[] der(String material) throws GeneralSecurityException {
    if (material == null || material.isBlank()) {
      throw new GeneralSecurityException("empty key material");
    }
    String pem = material.trim();
    if (!pem.startsWith(BEGIN)) {
      try {
        pem = new String(Base64.getMimeDecoder().decode(pem), StandardCharsets.US_ASCII).trim();
      } catch (IllegalArgumentException ex) {
        throw new GeneralSecurityException("key material is neither PEM nor base64", ex);
      }
      if (!pem.startsWith(BEGIN)) {
        throw new GeneralSecurityException("decoded key material is not PEM");
      }
    }
    String body = pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s", "");
    try {
      return Base64.getDecoder().decode(body);
    } catch (IllegalArgumentException ex) {
      throw new GeneralSecurityException("malformed PEM body", ex);
    }
  }
}

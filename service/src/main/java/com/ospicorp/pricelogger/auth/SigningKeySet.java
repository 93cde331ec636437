package com.ospicorp.pricelogger.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import java.security.GeneralSecurityException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Immutable snapshot of the configured signing keys, loaded once at startup.
 */
public final class SigningKeySet {

  private final List<SigningKey> keys;

  public SigningKeySet(List<SigningKey> keys) {
    this.keys = List.copyOf(keys);
  }

  /**
   * The usable key with the latest start, used to sign new tokens.
   */
  public Optional<SigningKey> current(Instant now) {
    return keys.stream()
        .filter(key -> key.usableAt(now))
        .max(Comparator.comparing(SigningKey::start));
  }

  public Optional<SigningKey> find(String kid, Instant now) {
    return keys.stream()
        .filter(key -> key.id().equals(kid) && key.usableAt(now))
        .findFirst();
  }

  public List<SigningKey> usable(Instant now) {
    return keys.stream().filter(key -> key.usableAt(now)).toList();
  }

  public int size() {
    return keys.size();
  }

  /**
   * Parses the JSON key list.
   *
   * @throws IllegalStateException when the JSON or any key's material is invalid
   */
  public static SigningKeySet parse(String json, ObjectMapper mapper) {
    if (!StringUtils.hasText(json)) {
      return new SigningKeySet(List.of());
    }
    List<SigningKeyDefinition> definitions;
    try {
      definitions = mapper.readValue(json, new TypeReference<List<SigningKeyDefinition>>() {});
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Signing keys must be a JSON array", ex);
    }
    List<SigningKey> keys = new ArrayList<>(definitions.size());
    for (SigningKeyDefinition definition : definitions) {
      keys.add(toKey(definition));
    }
    return new SigningKeySet(keys);
  }

  static SigningKey toKey(SigningKeyDefinition definition) {
    if (!StringUtils.hasText(definition.id())) {
      throw new IllegalStateException("Signing key without an id");
    }
    try {
      RSAPublicKey publicKey = PemKeys.publicKey(definition.publicKey());
      RSAPrivateKey privateKey = PemKeys.privateKey(definition.privateKey());
      RSAKey jwk = new RSAKey.Builder(publicKey)
          .privateKey(privateKey)
          .keyID(definition.id())
          .keyUse(KeyUse.SIGNATURE)
          .algorithm(JWSAlgorithm.RS256)
          .build();
      return new SigningKey(definition.id(), jwk, Instant.ofEpochSecond(definition.start()),
          Instant.ofEpochSecond(definition.expire()), definition.revoked());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Invalid key material for signing key " + definition.id(),
          ex);
    }
  }
}

package com.ospicorp.pricelogger.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.pricelogger.support.TestSigningKeys;
import java.security.KeyPair;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SigningKeySetTest {

  private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static KeyPair pair;

  @BeforeAll
  static void generate() {
    pair = TestSigningKeys.generate();
  }

  @Test
  void parsesBase64WrappedPem() {
    String json = TestSigningKeys.json(List.of(TestSigningKeys.definition("k1", pair,
        NOW.minusSeconds(60), NOW.plusSeconds(3600), false)));

    SigningKeySet keys = SigningKeySet.parse(json, MAPPER);

    assertThat(keys.size()).isEqualTo(1);
    assertThat(keys.current(NOW)).map(SigningKey::id).contains("k1");
  }

  @Test
  void parsesRawPem() {
    SigningKeyDefinition raw = new SigningKeyDefinition("k-raw", TestSigningKeys.privatePem(pair),
        TestSigningKeys.publicPem(pair), NOW.getEpochSecond(), NOW.plusSeconds(60).getEpochSecond(),
        false);

    SigningKey key = SigningKeySet.toKey(raw);

    assertThat(key.jwk().isPrivate()).isTrue();
    assertThat(key.usableAt(NOW)).isTrue();
  }

  @Test
  void windowIsStartInclusiveAndExpireExclusive() {
    SigningKey key = SigningKeySet.toKey(TestSigningKeys.definition("k", pair, NOW,
        NOW.plusSeconds(60), false));

    assertThat(key.usableAt(NOW.minusSeconds(1))).isFalse();
    assertThat(key.usableAt(NOW)).isTrue();
    assertThat(key.usableAt(NOW.plusSeconds(60))).isFalse();
  }

  @Test
  void currentPrefersLatestStartAndSkipsFutureAndRevokedKeys() {
    SigningKeySet keys = new SigningKeySet(List.of(
        SigningKeySet.toKey(TestSigningKeys.definition("a", pair, NOW.minusSeconds(300),
            NOW.plusSeconds(3600), false)),
        SigningKeySet.toKey(TestSigningKeys.definition("b", pair, NOW.minusSeconds(100),
            NOW.plusSeconds(3600), false)),
        SigningKeySet.toKey(TestSigningKeys.definition("c", pair, NOW.minusSeconds(10),
            NOW.plusSeconds(3600), true)),
        SigningKeySet.toKey(TestSigningKeys.definition("d", pair, NOW.plusSeconds(100),
            NOW.plusSeconds(3600), false))));

    assertThat(keys.current(NOW)).map(SigningKey::id).contains("b");
    assertThat(keys.find("c", NOW)).isEmpty();
    assertThat(keys.find("d", NOW)).isEmpty();
    assertThat(keys.usable(NOW)).extracting(SigningKey::id).containsExactly("a", "b");
  }

  @Test
  void emptyConfigurationHasNoCurrentKey() {
    assertThat(SigningKeySet.parse("", MAPPER).current(NOW)).isEmpty();
    assertThat(SigningKeySet.parse("[]", MAPPER).current(NOW)).isEmpty();
  }

  @Test
  void invalidMaterialFailsFast() {
    assertThatThrownBy(() -> SigningKeySet.parse("{oops", MAPPER))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> SigningKeySet.toKey(
        new SigningKeyDefinition("bad", "bm90IGEga2V5", "bm90IGEga2V5", 0, 1, false)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("bad");
  }
}

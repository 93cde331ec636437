package com.ospicorp.pricelogger.auth;

import com.nimbusds.jose.jwk.RSAKey;
import java.time.Instant;

/**
 * A parsed signing key. {@code jwk} carries both halves; publish only {@code jwk.toPublicJWK()}.
 */
public record SigningKey(String id, RSAKey jwk, Instant start, Instant expire, boolean revoked) {

  /** Not revoked and {@code start <= at < expire}. */
  public boolean usableAt(Instant at) {
    return !revoked && !at.isBefore(start) && at.isBefore(expire);
  }
}

package com.ospicorp.pricelogger.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies RS256 access and refresh tokens signed with the configured key set.
 *
 * <p>Claims: sub, client_id, isRefresh, iat, exp, jti. The {@code kid} header names the signing
 * key. Verification only trusts keys that are still usable, so revoking or expiring a key
 * invalidates every token it signed.
 */
@Service
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  static final String CLIENT_ID_CLAIM = "client_id";
  static final String REFRESH_CLAIM = "isRefresh";

  private final SigningKeySet keys;
  private final ClientAllowList clients;
  private final Duration accessTtl;
  private final Duration refreshTtl;
  private final Clock clock;

  public TokenService(SigningKeySet keys, ClientAllowList clients, AuthProperties properties,
      Clock clock) {
    this.keys = keys;
    this.clients = clients;
    this.accessTtl = properties.accessTokenTtl();
    this.refreshTtl = properties.refreshTokenTtl();
    this.clock = clock;
  }

  /**
   * Issues an access and a refresh token for an allowed client.
   *
   * @throws InvalidClientException when the client id is not allowed
   * @throws IllegalStateException when no signing key is currently usable
   */
  public TokenResponse issue(String clientId) {
    if (!clients.allows(clientId)) {
      throw new InvalidClientException();
    }
    SigningKey key = currentKey();
    String access = sign(key, clientId, false, accessTtl);
    String refresh = sign(key, clientId, true, refreshTtl);
    log.info("Issued tokens for client {} with key {}", clientId, key.id());
    return new TokenResponse(TokenResponse.BEARER, access, accessTtl.toSeconds(), refresh);
  }

  /**
   * Exchanges a valid refresh token for a new access token. The refresh token itself is not
   * rotated.
   *
   * @throws InvalidTokenException when the refresh token does not verify or its client is no
   *     longer allowed
   */
  public TokenResponse refresh(String refreshToken) {
    VerifiedToken verified = verify(refreshToken, true).orElseThrow(InvalidTokenException::new);
    if (!clients.allows(verified.clientId())) {
      throw new InvalidTokenException();
    }
    SigningKey key = currentKey();
    String access = sign(key, verified.clientId(), false, accessTtl);
    log.info("Refreshed access token for client {}", verified.clientId());
    return new TokenResponse(TokenResponse.BEARER, access, accessTtl.toSeconds(), null);
  }

  /**
   * Verifies signature, key, expiry and token kind.
   *
   * @param expectRefresh whether a refresh token (rather than an access token) is expected
   * @return the verified claims, or empty for any failure
   */
  public Optional<VerifiedToken> verify(String token, boolean expectRefresh) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    try {
      SignedJWT jwt = SignedJWT.parse(token);
      JWSHeader header = jwt.getHeader();
      if (!JWSAlgorithm.RS256.equals(header.getAlgorithm()) || header.getKeyID() == null) {
        return rejected("unexpected header");
      }
      Optional<SigningKey> key = keys.find(header.getKeyID(), now);
      if (key.isEmpty()) {
        return rejected("unknown or unusable kid " + header.getKeyID());
      }
      if (!jwt.verify(new RSASSAVerifier(key.get().jwk().toRSAPublicKey()))) {
        return rejected("bad signature");
      }
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      Date expiration = claims.getExpirationTime();
      if (expiration == null || !now.isBefore(expiration.toInstant())) {
        return rejected("expired");
      }
      String clientId = claims.getStringClaim(CLIENT_ID_CLAIM);
      Boolean refresh = claims.getBooleanClaim(REFRESH_CLAIM);
      if (clientId == null || refresh == null || refresh != expectRefresh) {
        return rejected("wrong token kind or missing client");
      }
      Date issuedAt = claims.getIssueTime();
      return Optional.of(new VerifiedToken(clientId, refresh, header.getKeyID(), claims.getJWTID(),
          issuedAt == null ? null : issuedAt.toInstant(), expiration.toInstant()));
    } catch (ParseException | JOSEException ex) {
      return rejected(ex.getMessage());
    }
  }

  /**
   * Public halves of every usable key.
   */
  public JWKSet publishKeys() {
    List<JWK> publics = keys.usable(clock.instant()).stream()
        .map(key -> (JWK) key.jwk().toPublicJWK())
        .toList();
    return new JWKSet(publics);
  }

  private SigningKey currentKey() {
    return keys.current(clock.instant())
        .orElseThrow(() -> new IllegalStateException("No active signing key"));
  }

  private String sign(SigningKey key, String clientId, boolean refresh, Duration ttl) {
    Instant now = clock.instant();
    JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(key.id()).build();
    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .subject(clientId)
        .claim(CLIENT_ID_CLAIM, clientId)
        .claim(REFRESH_CLAIM, refresh)
        .issueTime(Date.from(now))
        .expirationTime(Date.from(now.plus(ttl)))
        .jwtID(UUID.randomUUID().toString())
        .build();
    SignedJWT jwt = new SignedJWT(header, claims);
    try {
      jwt.sign(new RSASSASigner(key.jwk().toRSAPrivateKey()));
    } catch (JOSEException ex) {
      throw new IllegalStateException("Signing with key " + key.id() + " failed", ex);
    }
    return jwt.serialize();
  }

  private static Optional<VerifiedToken> rejected(String reason) {
    log.debug("Token rejected: {}", reason);
    return Optional.empty();
  }
}

package com.ospicorp.pricelogger.auth;

import com.nimbusds.jose.JWSAlgorithm;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Resource-server decoder that accepts access tokens issued by {@link TokenService}. Refresh
 * tokens are rejected.
 */
@Component
public class AccessTokenDecoder implements JwtDecoder {

  private final TokenService tokens;

  public AccessTokenDecoder(TokenService tokens) {
    this.tokens = tokens;
  }

  @Override
  public Jwt decode(String token) throws JwtException {
    VerifiedToken verified = tokens.verify(token, false)
        .orElseThrow(() -> new BadJwtException("Invalid or expired token"));
    Jwt.Builder jwt = Jwt.withTokenValue(token)
        .header("alg", JWSAlgorithm.RS256.getName())
        .header("kid", verified.keyId())
        .subject(verified.clientId())
        .claim(TokenService.CLIENT_ID_CLAIM, verified.clientId())
        .claim(TokenService.REFRESH_CLAIM, verified.refresh())
        .expiresAt(verified.expiresAt());
    if (verified.issuedAt() != null) {
      jwt.issuedAt(verified.issuedAt());
    }
    if (verified.tokenId() != null) {
      jwt.jti(verified.tokenId());
    }
    return jwt.build();
  }
}

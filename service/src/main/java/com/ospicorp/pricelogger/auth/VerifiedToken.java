package com.ospicorp.pricelogger.auth;

import java.time.Instant;

public record VerifiedToken(String clientId, boolean refresh, String keyId, String tokenId,
    Instant issuedAt, Instant expiresAt) {
}

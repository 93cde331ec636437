package com.ospicorp.pricelogger.auth;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Token settings.
 *
 * @param clientIds allowed client ids: a JSON array, or one bare id
 * @param signingKeys JSON array of signing key definitions
 */
@ConfigurationProperties("aemo.auth")
public record AuthProperties(
    @DefaultValue("[]") String clientIds,
    @DefaultValue("[]") String signingKeys,
    @DefaultValue("15m") Duration accessTokenTtl,
    @DefaultValue("14d") Duration refreshTokenTtl) {
}

package com.ospicorp.pricelogger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param allowedOrigins JSON array of browser origins allowed to call the API
 */
@ConfigurationProperties("aemo.cors")
public record CorsProperties(
    @DefaultValue("[]") String allowedOrigins,
    @DefaultValue("86400") long maxAgeSeconds) {
}

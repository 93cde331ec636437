package com.ospicorp.pricelogger.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param max requests allowed per identity within one window
 * @param windowSec sliding window length in seconds
 * @param clientIpHeader header carrying the original client address
 */
@ConfigurationProperties("aemo.rate-limit")
public record RateLimitProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("60") int max,
    @DefaultValue("60") int windowSec,
    @DefaultValue("CF-Connecting-IP") String clientIpHeader) {

  public long windowMs() {
    return windowSec * 1000L;
  }
}

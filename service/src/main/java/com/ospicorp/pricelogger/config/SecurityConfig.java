package com.ospicorp.pricelogger.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.pricelogger.auth.AccessTokenDecoder;
import com.ospicorp.pricelogger.ratelimit.RateLimitFilter;
import com.ospicorp.pricelogger.ratelimit.RateLimitProperties;
import com.ospicorp.pricelogger.ratelimit.RateLimiter;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * Request pipeline: CORS, then the rate limiter, then bearer authentication for {@code /data}.
 */
@Configuration
public class SecurityConfig {

  private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

  private static final String[] AUTHENTICATED_ENDPOINTS = {
      "/data"
  };

  private static final List<String> EXPOSED_HEADERS = List.of(
      "X-Total-Count", "X-Limit", "X-Offset", "X-Page", "X-Total-Pages", "X-Has-Next-Page",
      HttpHeaders.RETRY_AFTER);

  @Bean
  SecurityFilterChain apiChain(HttpSecurity http, AccessTokenDecoder accessTokenDecoder,
      RateLimiter rateLimiter, RateLimitProperties rateLimitProperties, ObjectMapper mapper,
      Clock clock, CorsConfigurationSource corsConfigurationSource) throws Exception {
    CorsFilter corsFilter = new CorsFilter(corsConfigurationSource);
    corsFilter.setCorsProcessor(new ForeignOriginCorsProcessor());

    http.csrf(AbstractHttpConfigurer::disable)
        .cors(AbstractHttpConfigurer::disable)
        .addFilterAt(corsFilter, CorsFilter.class)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(AUTHENTICATED_ENDPOINTS).authenticated()
            .anyRequest().permitAll())
        .oauth2ResourceServer(oauth -> oauth
            .jwt(jwt -> jwt.decoder(accessTokenDecoder))
            .authenticationEntryPoint(new ProblemAuthenticationEntryPoint(mapper)))
        .addFilterAfter(new RateLimitFilter(rateLimiter, rateLimitProperties, mapper, clock),
            CorsFilter.class);
    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource(CorsProperties properties,
      ObjectMapper mapper) {
    List<String> origins = parseOrigins(properties.allowedOrigins(), mapper);
    log.info("CORS allowed origins: {}", origins);
    CorsConfiguration cfg = new CorsConfiguration();
    cfg.setAllowedOrigins(origins);
    cfg.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
    cfg.setAllowedHeaders(List.of(HttpHeaders.CONTENT_TYPE, HttpHeaders.AUTHORIZATION));
    cfg.setExposedHeaders(EXPOSED_HEADERS);
    cfg.setAllowCredentials(false);
    cfg.setMaxAge(properties.maxAgeSeconds());

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", cfg);
    return source;
  }

  static List<String> parseOrigins(String json, ObjectMapper mapper) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return mapper.readValue(json, new TypeReference<List<String>>() {});
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Allowed origins must be a JSON array of strings", ex);
    }
  }
}

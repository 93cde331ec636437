package com.ospicorp.pricelogger.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AuthConfig {

  private static final Logger log = LoggerFactory.getLogger(AuthConfig.class);

  @Bean
  SigningKeySet signingKeySet(AuthProperties properties, ObjectMapper mapper) {
    SigningKeySet keys = SigningKeySet.parse(properties.signingKeys(), mapper);
    log.info("Loaded {} signing key(s)", keys.size());
    return keys;
  }

  @Bean
  ClientAllowList clientAllowList(AuthProperties properties, ObjectMapper mapper) {
    ClientAllowList clients = ClientAllowList.parse(properties.clientIds(), mapper);
    log.info("Loaded {} allowed client id(s)", clients.size());
    return clients;
  }
}

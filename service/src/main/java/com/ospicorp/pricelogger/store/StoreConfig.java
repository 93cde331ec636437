package com.ospicorp.pricelogger.store;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StoreConfig {

  @Bean(destroyMethod = "close")
  ShardRegistry shardRegistry(StoreProperties properties) {
    return new ShardRegistry(properties);
  }
}

package com.ospicorp.pricelogger.store;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * JDBC locations of the shards, keyed by shard name.
 */
@ConfigurationProperties(prefix = "aemo.store")
public record StoreProperties(
    Map<String, String> shards,
    @DefaultValue("sa") String username,
    @DefaultValue("") String password
) {}

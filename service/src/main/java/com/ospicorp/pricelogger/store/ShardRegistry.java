package com.ospicorp.pricelogger.store;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.springframework.util.StringUtils;

/**
 * Owns every shard of the process, addressed by stable name.
 */
public class ShardRegistry implements AutoCloseable {
  private final Map<String, Shard> shards = new LinkedHashMap<>();

  public ShardRegistry(StoreProperties properties) {
    if (properties.shards() == null || properties.shards().isEmpty()) {
      throw new IllegalStateException("aemo.store.shards must name at least one shard");
    }
    properties.shards().forEach((name, url) -> {
      if (!StringUtils.hasText(url)) {
        throw new IllegalStateException("aemo.store.shards." + name + " has no JDBC url");
      }
      shards.put(name, new Shard(name, url, properties.username(), properties.password()));
    });
  }

  public Shard shard(String name) {
    Shard shard = shards.get(name);
    if (shard == null) {
      throw new NoSuchElementException("Unknown shard: " + name);
    }
    return shard;
  }

  public Collection<Shard> all() {
    return Collections.unmodifiableCollection(shards.values());
  }

  @Override
  public void close() {
    shards.values().forEach(Shard::close);
  }
}

package com.ospicorp.pricelogger.support;

import com.ospicorp.pricelogger.store.ShardNames;
import com.ospicorp.pricelogger.store.ShardRegistry;
import com.ospicorp.pricelogger.store.StoreProperties;
import java.util.Map;
import java.util.UUID;

public final class InMemoryShards {

  private InMemoryShards() {
  }

  public static String url(String name) {
    return "jdbc:h2:mem:" + name + "-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
  }

  /** A registry with fresh, private intervals and abuse databases. */
  public static ShardRegistry registry() {
    return new ShardRegistry(new StoreProperties(Map.of(
        ShardNames.INTERVALS, url(ShardNames.INTERVALS),
        ShardNames.ABUSE, url(ShardNames.ABUSE)), "sa", ""));
  }
}

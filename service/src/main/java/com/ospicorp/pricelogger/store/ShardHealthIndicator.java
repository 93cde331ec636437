package com.ospicorp.pricelogger.store;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Round-trips a trivial statement through every shard's worker. Down when any shard fails.
 */
@Component("shards")
public class ShardHealthIndicator implements HealthIndicator {

  private final ShardRegistry shards;

  public ShardHealthIndicator(ShardRegistry shards) {
    this.shards = shards;
  }

  @Override
  public Health health() {
    Health.Builder builder = Health.up();
    for (Shard shard : shards.all()) {
      try {
        shard.execute(session -> session.jdbc().queryForObject("SELECT 1", Integer.class));
        builder.withDetail(shard.name(), "reachable");
      } catch (ShardException ex) {
        builder.down().withDetail(shard.name(), ex.getMessage());
      }
    }
    return builder.build();
  }
}

package com.ospicorp.pricelogger.ratelimit;

import com.ospicorp.pricelogger.store.Shard;
import com.ospicorp.pricelogger.store.ShardNames;
import com.ospicorp.pricelogger.store.ShardRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sliding-window request counter backed by the abuse shard.
 *
 * <p>Each check prunes rows older than the window, counts what remains for the identity and
 * records the request only when it is allowed. The three steps run as one transaction on the
 * shard's worker, so concurrent checks never interleave.
 */
@Service
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final Shard shard;
  private final AbuseTrackingDao dao;
  private final int max;
  private final long windowMs;

  public RateLimiter(ShardRegistry shards, AbuseTrackingDao dao, RateLimitProperties properties) {
    this.shard = shards.shard(ShardNames.ABUSE);
    this.dao = dao;
    this.max = properties.max();
    this.windowMs = properties.windowMs();
  }

  /**
   * @return true when the request is within the limit and has been recorded
   */
  public boolean checkAndRecord(ClientIdentity identity, long nowMs) {
    long cutoff = nowMs - windowMs;
    return shard.executeInTransaction(session -> {
      dao.deleteOlderThan(session, cutoff);
      long count = dao.countSince(session, identity, cutoff);
      if (count >= max) {
        log.warn("Rate limit exceeded for {} ({} requests in {} ms)", identity, count, windowMs);
        return false;
      }
      dao.recordIfAbsent(session, identity, nowMs);
      return true;
    });
  }
}

package com.ospicorp.pricelogger.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.pricelogger.interval.Interval;
import com.ospicorp.pricelogger.interval.IntervalDao;
import com.ospicorp.pricelogger.interval.IntervalKey;
import com.ospicorp.pricelogger.store.Shard;
import com.ospicorp.pricelogger.store.ShardNames;
import com.ospicorp.pricelogger.store.ShardRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls the upstream report and stores the intervals the store does not have yet.
 *
 * <p>The fetch runs outside the intervals shard; the existing-key lookup and the inserts run as
 * one transaction on it. Only one cycle runs at a time.
 */
@Service
public class IngestionEngine {

  private static final Logger log = LoggerFactory.getLogger(IngestionEngine.class);

  private final UpstreamClient upstream;
  private final IntervalNormalizer normalizer;
  private final IntervalDao dao;
  private final Shard shard;
  private final ReentrantLock cycle = new ReentrantLock();

  public IngestionEngine(UpstreamClient upstream, IntervalNormalizer normalizer, IntervalDao dao,
      ShardRegistry shards) {
    this.upstream = upstream;
    this.normalizer = normalizer;
    this.dao = dao;
    this.shard = shards.shard(ShardNames.INTERVALS);
  }

  /**
   * Runs a cycle, waiting for one already in flight to finish first.
   */
  public SyncSummary sync() {
    cycle.lock();
    try {
      return runCycle();
    } finally {
      cycle.unlock();
    }
  }

  /**
   * Runs a cycle unless one is already in flight.
   */
  public Optional<SyncSummary> trySync() {
    if (!cycle.tryLock()) {
      log.info("Sync already in progress, skipping");
      return Optional.empty();
    }
    try {
      return Optional.of(runCycle());
    } finally {
      cycle.unlock();
    }
  }

  private SyncSummary runCycle() {
    JsonNode records = upstream.fetchFiveMinute();
    int received = records.size();

    Map<IntervalKey, Interval> batch = new LinkedHashMap<>();
    int dropped = 0;
    for (JsonNode record : records) {
      Optional<Interval> interval = normalizer.normalize(record);
      if (interval.isEmpty()) {
        dropped++;
        log.warn("Dropping unusable upstream record: {}", record);
        continue;
      }
      batch.putIfAbsent(interval.get().key(), interval.get());
    }
    int parsed = received - dropped;

    int inserted = batch.isEmpty() ? 0 : store(new ArrayList<>(batch.values()));
    SyncSummary summary = new SyncSummary(received, parsed, dropped, inserted);
    log.info("Sync completed: received={} parsed={} dropped={} inserted={}",
        received, parsed, dropped, inserted);
    return summary;
  }

  private int store(List<Interval> intervals) {
    long minTs = Long.MAX_VALUE;
    long maxTs = Long.MIN_VALUE;
    Set<String> regions = new TreeSet<>();
    for (Interval interval : intervals) {
      minTs = Math.min(minTs, interval.settlementTs());
      maxTs = Math.max(maxTs, interval.settlementTs());
      regions.add(interval.regionId());
    }
    long from = minTs;
    long to = maxTs;
    return shard.executeInTransaction(session -> {
      Set<IntervalKey> existing = dao.existingKeys(session, from, to, regions);
      int written = 0;
      for (Interval interval : intervals) {
        if (!existing.contains(interval.key())) {
          written += dao.insertIfAbsent(session, interval);
        }
      }
      log.debug("{} of {} intervals already stored", existing.size(), intervals.size());
      return written;
    });
  }
}

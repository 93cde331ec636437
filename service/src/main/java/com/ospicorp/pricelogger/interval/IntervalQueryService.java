package com.ospicorp.pricelogger.interval;

import com.ospicorp.pricelogger.store.Shard;
import com.ospicorp.pricelogger.store.ShardNames;
import com.ospicorp.pricelogger.store.ShardRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IntervalQueryService {

  private static final Logger log = LoggerFactory.getLogger(IntervalQueryService.class);

  private final Shard shard;
  private final IntervalDao dao;

  public IntervalQueryService(ShardRegistry shards, IntervalDao dao) {
    this.shard = shards.shard(ShardNames.INTERVALS);
    this.dao = dao;
  }

  /**
   * Runs the page query and its total count as one unit on the intervals shard, so the count
   * always describes the same table state as the rows.
   */
  public IntervalPage range(RangeQuery query) {
    IntervalPage page = shard.execute(session -> switch (query.mode()) {
      case LATEST -> new IntervalPage(
          dao.fetchLatest(session, query.regionId(), query.limit(), query.offset()),
          query.offset(), query.limit(),
          dao.countLatest(session, query.regionId()));
      case LAST_SECONDS, EXPLICIT -> new IntervalPage(
          dao.fetchRange(session, query.startMs(), query.endMs(), query.regionId(),
              query.ascending(), query.limit(), query.offset()),
          query.offset(), query.limit(),
          dao.countRange(session, query.startMs(), query.endMs(), query.regionId()));
    });
    log.debug("Range {} returned {} of {} rows", query, page.rows().size(), page.totalCount());
    return page;
  }

  public List<Interval> mostRecent(int limit) {
    return shard.execute(session -> dao.fetchMostRecent(session, limit));
  }

  public int insertIfAbsent(Interval interval) {
    return shard.execute(session -> dao.insertIfAbsent(session, interval));
  }
}

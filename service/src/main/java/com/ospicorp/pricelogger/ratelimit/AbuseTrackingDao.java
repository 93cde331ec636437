package com.ospicorp.pricelogger.ratelimit;

import com.ospicorp.pricelogger.store.ShardSession;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

/**
 * SQL against {@code api_abuse_tracking} on the abuse shard.
 */
@Repository
public class AbuseTrackingDao {

  public int deleteOlderThan(ShardSession session, long cutoffMs) {
    return session.named().update("DELETE FROM api_abuse_tracking WHERE ts < :cutoff",
        new MapSqlParameterSource("cutoff", cutoffMs));
  }

  public long countSince(ShardSession session, ClientIdentity identity, long cutoffMs) {
    String sql = """
      SELECT COUNT(*)
      FROM api_abuse_tracking
      WHERE ip = :ip AND asn = :asn AND session_id = :sessionId AND ts >= :cutoff
    """;
    Long count = session.named().queryForObject(sql, params(identity).addValue("cutoff", cutoffMs),
        Long.class);
    return count == null ? 0 : count;
  }

  /**
   * Records one request. Two requests from the same identity in the same millisecond count once.
   */
  public int recordIfAbsent(ShardSession session, ClientIdentity identity, long ts) {
    String sql = """
      MERGE INTO api_abuse_tracking t
      USING (
        SELECT CAST(:ip AS VARCHAR(128)) AS ip,
               CAST(:asn AS VARCHAR(128)) AS asn,
               CAST(:sessionId AS VARCHAR(256)) AS session_id,
               CAST(:ts AS BIGINT) AS ts
      ) s
      ON t.ip = s.ip AND t.asn = s.asn AND t.session_id = s.session_id AND t.ts = s.ts
      WHEN NOT MATCHED THEN
        INSERT (ip, asn, session_id, ts) VALUES (s.ip, s.asn, s.session_id, s.ts)
    """;
    return session.named().update(sql, params(identity).addValue("ts", ts));
  }

  private static MapSqlParameterSource params(ClientIdentity identity) {
    return new MapSqlParameterSource()
        .addValue("ip", identity.ip())
        .addValue("asn", identity.asn())
        .addValue("sessionId", identity.sessionId());
  }
}

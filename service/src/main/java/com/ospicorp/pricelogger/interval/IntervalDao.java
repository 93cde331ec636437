package com.ospicorp.pricelogger.interval;

import com.ospicorp.pricelogger.store.ShardSession;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

/**
 * SQL against the {@code intervals} table. Every method runs inside a shard unit of work and
 * receives that unit's {@link ShardSession}.
 */
@Repository
public class IntervalDao {

  private static final String COLUMNS = """
      settlement_ts, regionid, region, rrp, totaldemand, periodtype, netinterchange,
      scheduledgeneration, semischeduledgeneration, apcflag
      """;

  private static final RowMapper<Interval> ROW_MAPPER = IntervalDao::mapRow;

  public Set<IntervalKey> existingKeys(ShardSession session, long minTs, long maxTs,
      Collection<String> regionIds) {
    if (regionIds.isEmpty()) {
      return Set.of();
    }
    String sql = """
      SELECT settlement_ts, regionid
      FROM intervals
      WHERE settlement_ts BETWEEN :minTs AND :maxTs
        AND regionid IN (:regionIds)
    """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("minTs", minTs)
        .addValue("maxTs", maxTs)
        .addValue("regionIds", regionIds);
    Set<IntervalKey> keys = new HashSet<>();
    session.named().query(sql, params,
        rs -> {
          keys.add(new IntervalKey(rs.getLong(1), rs.getString(2)));
        });
    return keys;
  }

  /**
   * Inserts the row unless its key is already present.
   *
   * @return 1 when a row was written, 0 when the key already existed
   */
  public int insertIfAbsent(ShardSession session, Interval interval) {
    String sql = """
      MERGE INTO intervals t
      USING (
        SELECT CAST(:settlementTs AS BIGINT) AS settlement_ts,
               CAST(:regionId AS VARCHAR(32)) AS regionid,
               CAST(:region AS VARCHAR(64)) AS region,
               CAST(:rrp AS DOUBLE PRECISION) AS rrp,
               CAST(:totalDemand AS DOUBLE PRECISION) AS totaldemand,
               CAST(:periodType AS VARCHAR(32)) AS periodtype,
               CAST(:netInterchange AS DOUBLE PRECISION) AS netinterchange,
               CAST(:scheduledGeneration AS DOUBLE PRECISION) AS scheduledgeneration,
               CAST(:semiScheduledGeneration AS DOUBLE PRECISION) AS semischeduledgeneration,
               CAST(:apcFlag AS DOUBLE PRECISION) AS apcflag
      ) s
      ON t.settlement_ts = s.settlement_ts AND t.regionid = s.regionid
      WHEN NOT MATCHED THEN
        INSERT (settlement_ts, regionid, region, rrp, totaldemand, periodtype, netinterchange,
                scheduledgeneration, semischeduledgeneration, apcflag)
        VALUES (s.settlement_ts, s.regionid, s.region, s.rrp, s.totaldemand, s.periodtype,
                s.netinterchange, s.scheduledgeneration, s.semischeduledgeneration, s.apcflag)
    """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("settlementTs", interval.settlementTs(), Types.BIGINT)
        .addValue("regionId", interval.regionId(), Types.VARCHAR)
        .addValue("region", interval.region(), Types.VARCHAR)
        .addValue("rrp", interval.rrp(), Types.DOUBLE)
        .addValue("totalDemand", interval.totalDemand(), Types.DOUBLE)
        .addValue("periodType", interval.periodType(), Types.VARCHAR)
        .addValue("netInterchange", interval.netInterchange(), Types.DOUBLE)
        .addValue("scheduledGeneration", interval.scheduledGeneration(), Types.DOUBLE)
        .addValue("semiScheduledGeneration", interval.semiScheduledGeneration(), Types.DOUBLE)
        .addValue("apcFlag", interval.apcFlag(), Types.DOUBLE);
    return session.named().update(sql, params);
  }

  public List<Interval> fetchRange(ShardSession session, long startMs, long endMs, String regionId,
      boolean ascending, int limit, long offset) {
    String direction = ascending ? "ASC" : "DESC";
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
        .append(" FROM intervals WHERE settlement_ts BETWEEN :start AND :end");
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("start", startMs)
        .addValue("end", endMs)
        .addValue("limit", limit)
        .addValue("offset", offset);
    if (regionId != null) {
      sql.append(" AND regionid = :regionId");
      params.addValue("regionId", regionId);
    }
    sql.append(" ORDER BY settlement_ts ").append(direction).append(", regionid ASC")
        .append(" OFFSET :offset ROWS FETCH NEXT :limit ROWS ONLY");
    return session.named().query(sql.toString(), params, ROW_MAPPER);
  }

  public long countRange(ShardSession session, long startMs, long endMs, String regionId) {
    StringBuilder sql = new StringBuilder(
        "SELECT COUNT(*) FROM intervals WHERE settlement_ts BETWEEN :start AND :end");
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("start", startMs)
        .addValue("end", endMs);
    if (regionId != null) {
      sql.append(" AND regionid = :regionId");
      params.addValue("regionId", regionId);
    }
    Long count = session.named().queryForObject(sql.toString(), params, Long.class);
    return count == null ? 0 : count;
  }

  /**
   * Most recent row of every region (or of one region), newest first.
   */
  public List<Interval> fetchLatest(ShardSession session, String regionId, int limit,
      long offset) {
    String sql = """
      SELECT %s
      FROM intervals i
      JOIN (
        SELECT regionid, MAX(settlement_ts) AS max_ts
        FROM intervals
        %s
        GROUP BY regionid
      ) latest ON i.regionid = latest.regionid AND i.settlement_ts = latest.max_ts
      ORDER BY i.settlement_ts DESC, i.regionid ASC
      OFFSET :offset ROWS FETCH NEXT :limit ROWS ONLY
    """.formatted(prefixed(COLUMNS, "i."), regionId != null ? "WHERE regionid = :regionId" : "");
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("limit", limit)
        .addValue("offset", offset);
    if (regionId != null) {
      params.addValue("regionId", regionId);
    }
    return session.named().query(sql, params, ROW_MAPPER);
  }

  public long countLatest(ShardSession session, String regionId) {
    String sql = "SELECT COUNT(DISTINCT regionid) FROM intervals"
        + (regionId != null ? " WHERE regionid = :regionId" : "");
    MapSqlParameterSource params = new MapSqlParameterSource();
    if (regionId != null) {
      params.addValue("regionId", regionId);
    }
    Long count = session.named().queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  public List<Interval> fetchMostRecent(ShardSession session, int limit) {
    String sql = "SELECT " + COLUMNS
        + " FROM intervals ORDER BY settlement_ts DESC, regionid ASC FETCH FIRST :limit ROWS ONLY";
    return session.named().query(sql, new MapSqlParameterSource("limit", limit), ROW_MAPPER);
  }

  private static String prefixed(String columns, String alias) {
    StringBuilder out = new StringBuilder();
    for (String column : columns.split(",")) {
      if (out.length() > 0) {
        out.append(", ");
      }
      out.append(alias).append(column.trim());
    }
    return out.toString();
  }

  private static Interval mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Interval(
        rs.getLong("settlement_ts"),
        rs.getString("regionid"),
        rs.getString("region"),
        nullableDouble(rs, "rrp"),
        nullableDouble(rs, "totaldemand"),
        rs.getString("periodtype"),
        nullableDouble(rs, "netinterchange"),
        nullableDouble(rs, "scheduledgeneration"),
        nullableDouble(rs, "semischeduledgeneration"),
        nullableDouble(rs, "apcflag"));
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}

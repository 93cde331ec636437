package com.ospicorp.pricelogger.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.pricelogger.interval.Interval;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns one upstream {@code 5MIN} element into an {@link Interval}.
 *
 * <p>Timestamps with an explicit offset are honoured; timestamps without one are read in market
 * time. Numeric attributes may arrive as numbers or numeric strings; anything else becomes null.
 * Records whose text attributes do not fit the store's columns are dropped rather than truncated.
 */
@Component
public class IntervalNormalizer {

  private static final DateTimeFormatter SLASHED = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

  private final ZoneOffset marketOffset;

  public IntervalNormalizer(IngestionProperties properties) {
    this.marketOffset = ZoneOffset.of(properties.marketOffset());
  }

  /**
   * @return the interval, or empty when the settlement date or region id is unusable or a text
   *     attribute is longer than its column
   */
  public Optional<Interval> normalize(JsonNode record) {
    String regionId = text(record, "REGIONID");
    String region = text(record, "REGION");
    String periodType = text(record, "PERIODTYPE");
    if (regionId == null
        || tooLong(regionId, Interval.MAX_REGION_ID_LENGTH)
        || tooLong(region, Interval.MAX_REGION_LENGTH)
        || tooLong(periodType, Interval.MAX_PERIOD_TYPE_LENGTH)) {
      return Optional.empty();
    }
    Long settlementTs = settlementMillis(text(record, "SETTLEMENTDATE"));
    if (settlementTs == null) {
      return Optional.empty();
    }
    return Optional.of(new Interval(
        settlementTs,
        regionId,
        region,
        number(record, "RRP"),
        number(record, "TOTALDEMAND"),
        periodType,
        number(record, "NETINTERCHANGE"),
        number(record, "SCHEDULEDGENERATION"),
        number(record, "SEMISCHEDULEDGENERATION"),
        number(record, "APCFLAG")));
  }

  Long settlementMillis(String value) {
    if (value == null) {
      return null;
    }
    DateTimeFormatter formatter = value.indexOf('/') >= 0 ? SLASHED : DateTimeFormatter.ISO_DATE_TIME;
    try {
      TemporalAccessor parsed = formatter.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime withOffset) {
        return withOffset.toInstant().toEpochMilli();
      }
      return ((LocalDateTime) parsed).toInstant(marketOffset).toEpochMilli();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static boolean tooLong(String value, int max) {
    return value != null && value.length() > max;
  }

  private static String text(JsonNode record, String field) {
    JsonNode node = record.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private static Double number(JsonNode record, String field) {
    JsonNode node = record.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      try {
        return Double.valueOf(node.asText().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }
}

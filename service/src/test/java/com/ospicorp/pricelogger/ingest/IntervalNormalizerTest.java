package com.ospicorp.pricelogger.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.pricelogger.interval.Interval;
import java.time.Instant;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IntervalNormalizerTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final IntervalNormalizer normalizer = new IntervalNormalizer(properties("+10:00"));

  @Test
  void readsOffsetlessTimestampsInMarketTime() throws Exception {
    Optional<Interval> interval = normalizer.normalize(json("""
        {"SETTLEMENTDATE":"2024-05-01T12:05:00","REGIONID":"NSW1","REGION":"NSW1",
         "RRP":85.12,"TOTALDEMAND":7120.5,"PERIODTYPE":"TRADE","NETINTERCHANGE":-310.2,
         "SCHEDULEDGENERATION":5900.1,"SEMISCHEDULEDGENERATION":1450.3,"APCFLAG":0}
        """));

    assertThat(interval).hasValueSatisfying(row -> {
      assertThat(row.settlementTs())
          .isEqualTo(Instant.parse("2024-05-01T02:05:00Z").toEpochMilli());
      assertThat(row.regionId()).isEqualTo("NSW1");
      assertThat(row.rrp()).isEqualTo(85.12);
      assertThat(row.totalDemand()).isEqualTo(7120.5);
      assertThat(row.periodType()).isEqualTo("TRADE");
      assertThat(row.netInterchange()).isEqualTo(-310.2);
      assertThat(row.apcFlag()).isEqualTo(0.0);
    });
  }

  @Test
  void honoursExplicitOffset() throws Exception {
    Optional<Interval> interval = normalizer.normalize(json(
        "{\"SETTLEMENTDATE\":\"2024-05-01T02:05:00Z\",\"REGIONID\":\"VIC1\"}"));

    assertThat(interval).map(Interval::settlementTs)
        .contains(Instant.parse("2024-05-01T02:05:00Z").toEpochMilli());
  }

  @Test
  void acceptsSlashedLayout() throws Exception {
    Optional<Interval> interval = normalizer.normalize(json(
        "{\"SETTLEMENTDATE\":\"2024/05/01 12:05:00\",\"REGIONID\":\"QLD1\"}"));

    assertThat(interval).map(Interval::settlementTs)
        .contains(Instant.parse("2024-05-01T02:05:00Z").toEpochMilli());
  }

  @Test
  void parsesNumericStringsAndNullsTheRest() throws Exception {
    Optional<Interval> interval = normalizer.normalize(json("""
        {"SETTLEMENTDATE":"2024-05-01T12:05:00","REGIONID":"SA1",
         "RRP":"101.5","TOTALDEMAND":"n/a","NETINTERCHANGE":null}
        """));

    assertThat(interval).hasValueSatisfying(row -> {
      assertThat(row.rrp()).isEqualTo(101.5);
      assertThat(row.totalDemand()).isNull();
      assertThat(row.netInterchange()).isNull();
      assertThat(row.region()).isNull();
    });
  }

  @Test
  void dropsUnparseableTimestamp() throws Exception {
    assertThat(normalizer.normalize(json(
        "{\"SETTLEMENTDATE\":\"yesterday\",\"REGIONID\":\"NSW1\"}"))).isEmpty();
    assertThat(normalizer.normalize(json("{\"REGIONID\":\"NSW1\"}"))).isEmpty();
  }

  @Test
  void dropsMissingRegion() throws Exception {
    assertThat(normalizer.normalize(json(
        "{\"SETTLEMENTDATE\":\"2024-05-01T12:05:00\",\"REGIONID\":\" \"}"))).isEmpty();
  }

  @Test
  void usesConfiguredMarketOffset() throws Exception {
    IntervalNormalizer perth = new IntervalNormalizer(properties("+08:00"));

    assertThat(perth.normalize(json(
        "{\"SETTLEMENTDATE\":\"2024-05-01T12:05:00\",\"REGIONID\":\"WA1\"}")))
        .map(Interval::settlementTs)
        .contains(Instant.parse("2024-05-01T04:05:00Z").toEpochMilli());
  }

  @Test
  void dropsTextLongerThanItsColumn() throws Exception {
    String longRegionId = "R".repeat(Interval.MAX_REGION_ID_LENGTH + 1);
    String longPeriodType = "P".repeat(Interval.MAX_PERIOD_TYPE_LENGTH + 8);
    String longRegion = "N".repeat(Interval.MAX_REGION_LENGTH + 1);

    assertThat(normalizer.normalize(json("{\"SETTLEMENTDATE\":\"2024-05-01T12:05:00\","
        + "\"REGIONID\":\"" + longRegionId + "\"}"))).isEmpty();
    assertThat(normalizer.normalize(json("{\"SETTLEMENTDATE\":\"2024-05-01T12:05:00\","
        + "\"REGIONID\":\"NSW1\",\"PERIODTYPE\":\"" + longPeriodType + "\"}"))).isEmpty();
    assertThat(normalizer.normalize(json("{\"SETTLEMENTDATE\":\"2024-05-01T12:05:00\","
        + "\"REGIONID\":\"NSW1\",\"REGION\":\"" + longRegion + "\"}"))).isEmpty();
    assertThat(normalizer.normalize(json("{\"SETTLEMENTDATE\":\"2024-05-01T12:05:00\","
        + "\"REGIONID\":\"" + "R".repeat(Interval.MAX_REGION_ID_LENGTH) + "\"}"))).isPresent();
  }

  private static IngestionProperties properties(String marketOffset) {
    return new IngestionProperties("http://upstream.test/report", "{}", marketOffset,
        Duration.ofSeconds(10), Duration.ofSeconds(30), "0 1/5 * * * *", false);
  }

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text);
  }
}

package com.ospicorp.pricelogger.interval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(name = "Interval", description = "One five-minute settlement interval for one region")
@JsonPropertyOrder({"settlement", "settlement_ts", "regionid", "region", "rrp", "totaldemand",
    "periodtype", "netinterchange", "scheduledgeneration", "semischeduledgeneration", "apcflag"})
public record IntervalView(
    @Schema(description = "Settlement time, ISO-8601 UTC", example = "2024-05-01T02:05:00Z")
    String settlement,
    @JsonProperty("settlement_ts")
    @Schema(description = "Settlement time, ms since epoch", example = "1714529100000")
    long settlementTs,
    @JsonProperty("regionid") @Schema(example = "NSW1") String regionId,
    String region,
    Double rrp,
    @JsonProperty("totaldemand") Double totalDemand,
    @JsonProperty("periodtype") String periodType,
    @JsonProperty("netinterchange") Double netInterchange,
    @JsonProperty("scheduledgeneration") Double scheduledGeneration,
    @JsonProperty("semischeduledgeneration") Double semiScheduledGeneration,
    @JsonProperty("apcflag") Double apcFlag) {

  public static IntervalView of(Interval interval) {
    return new IntervalView(
        Instant.ofEpochMilli(interval.settlementTs()).toString(),
        interval.settlementTs(),
        interval.regionId(),
        interval.region(),
        interval.rrp(),
        interval.totalDemand(),
        interval.periodType(),
        interval.netInterchange(),
        interval.scheduledGeneration(),
        interval.semiScheduledGeneration(),
        interval.apcFlag());
  }
}

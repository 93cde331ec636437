package com.ospicorp.pricelogger.interval;

/**
 * One five-minute price observation for a market region. Keyed by
 * {@code (settlementTs, regionId)}; never updated once stored.
 */
public record Interval(
    long settlementTs,
    String regionId,
    String region,
    Double rrp,
    Double totalDemand,
    String periodType,
    Double netInterchange,
    Double scheduledGeneration,
    Double semiScheduledGeneration,
    Double apcFlag
) {

  // column widths of the intervals table
  public static final int MAX_REGION_ID_LENGTH = 32;
  public static final int MAX_REGION_LENGTH = 64;
  public static final int MAX_PERIOD_TYPE_LENGTH = 32;

  public IntervalKey key() {
    return new IntervalKey(settlementTs, regionId);
  }
}

package com.ospicorp.pricelogger.interval;

import org.springframework.util.StringUtils;

/**
 * A validated request for a page of intervals.
 *
 * <p>The mode is chosen by which time parameters are present: {@code lastSec} selects a trailing
 * window ending now, {@code start} and {@code end} an explicit window, neither the latest row per
 * region. {@code startMs} and {@code endMs} are zero in {@link RangeMode#LATEST}.
 */
public record RangeQuery(RangeMode mode, long startMs, long endMs, String regionId, int limit,
    long offset) {

  public static final long MAX_LAST_SECONDS = 604_800L;
  public static final long MAX_SPAN_MS = MAX_LAST_SECONDS * 1000L;
  public static final int DEFAULT_LIMIT = 100;

  public boolean ascending() {
    return mode == RangeMode.EXPLICIT;
  }

  public static RangeQuery of(Long lastSec, Long start, Long end, String regionId, Integer limit,
      Long offset, long nowMs) {
    int effectiveLimit = limit != null ? limit : DEFAULT_LIMIT;
    long effectiveOffset = offset != null ? offset : 0L;
    if (effectiveLimit <= 0) {
      throw new InvalidParameterException("Invalid limit parameter. Must be a positive integer.",
          2006);
    }
    if (effectiveOffset < 0) {
      throw new InvalidParameterException("Invalid offset parameter. Must not be negative.", 2007);
    }
    String region = StringUtils.hasText(regionId) ? regionId.trim() : null;

    if (lastSec != null) {
      if (start != null || end != null) {
        throw new InvalidParameterException(
            "lastSec cannot be combined with start or end.", 2001);
      }
      if (lastSec <= 0 || lastSec > MAX_LAST_SECONDS) {
        throw new InvalidParameterException(
            "Invalid lastSec parameter. Supported range: 1-" + MAX_LAST_SECONDS + ".", 2002);
      }
      return new RangeQuery(RangeMode.LAST_SECONDS, nowMs - lastSec * 1000L, nowMs, region,
          effectiveLimit, effectiveOffset);
    }

    if (start != null || end != null) {
      if (start == null || end == null) {
        throw new InvalidParameterException("start and end must be provided together.", 2003);
      }
      if (end < start) {
        throw new InvalidParameterException("end must be greater than or equal to start.", 2004);
      }
      if (spanExceedsMaximum(start, end)) {
        throw new InvalidParameterException(
            "Requested range exceeds the maximum of " + MAX_SPAN_MS + " ms (7 days).", 2005);
      }
      return new RangeQuery(RangeMode.EXPLICIT, start, end, region, effectiveLimit,
          effectiveOffset);
    }

    return new RangeQuery(RangeMode.LATEST, 0L, 0L, region, effectiveLimit, effectiveOffset);
  }

  private static boolean spanExceedsMaximum(long start, long end) {
    try {
      return Math.subtractExact(end, start) > MAX_SPAN_MS;
    } catch (ArithmeticException ex) {
      // wider than a long can hold
      return true;
    }
  }
}

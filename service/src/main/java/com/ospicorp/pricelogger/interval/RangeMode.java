package com.ospicorp.pricelogger.interval;

public enum RangeMode {
  /** Most recent row per region, newest first. */
  LATEST,
  /** Trailing window ending now, newest first. */
  LAST_SECONDS,
  /** Explicit {@code [start, end]} window, oldest first. */
  EXPLICIT
}

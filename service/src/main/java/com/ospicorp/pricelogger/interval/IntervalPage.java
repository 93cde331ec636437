package com.ospicorp.pricelogger.interval;

import java.util.List;

public record IntervalPage(List<Interval> rows, long offset, int limit, long totalCount) {

  public boolean hasNextPage() {
    return offset + rows.size() < totalCount;
  }

  /** 1-based page number of this page. */
  public long page() {
    return offset / limit + 1;
  }

  public long totalPages() {
    return (totalCount + limit - 1) / limit;
  }
}

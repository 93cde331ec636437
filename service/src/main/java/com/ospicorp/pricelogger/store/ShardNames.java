package com.ospicorp.pricelogger.store;

public final class ShardNames {
  public static final String INTERVALS = "intervals";
  public static final String ABUSE = "abuse";

  private ShardNames() {
  }
}

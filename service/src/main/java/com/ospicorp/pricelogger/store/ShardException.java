package com.ospicorp.pricelogger.store;

public class ShardException extends RuntimeException {
  private final String shard;

  public ShardException(String shard, String message, Throwable cause) {
    super("Shard " + shard + ": " + message, cause);
    this.shard = shard;
  }

  public String shard() {
    return shard;
  }
}

package com.ospicorp.pricelogger.store;

/**
 * A unit of work executed on a shard's worker thread.
 */
@FunctionalInterface
public interface ShardWork<T> {

  T run(ShardSession session);
}

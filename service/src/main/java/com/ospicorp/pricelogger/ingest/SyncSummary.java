package com.ospicorp.pricelogger.ingest;

/**
 * Outcome of one ingestion cycle.
 *
 * @param received elements in the upstream {@code 5MIN} array
 * @param parsed elements that normalized into an interval
 * @param dropped elements skipped for a bad timestamp or missing region
 * @param inserted intervals that were new to the store
 */
public record SyncSummary(int received, int parsed, int dropped, int inserted) {

  public String message() {
    return "Sync completed. Received " + received + " intervals, inserted " + inserted
        + " new intervals.";
  }
}

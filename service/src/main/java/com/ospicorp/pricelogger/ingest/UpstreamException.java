package com.ospicorp.pricelogger.ingest;

/**
 * The upstream report could not be fetched or did not have the expected shape.
 */
public class UpstreamException extends RuntimeException {

  public UpstreamException(String message) {
    super(message);
  }

  public UpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.ospicorp.pricelogger.interval;

/**
 * A query parameter combination the range routes refuse. Rendered as a 400 with a numeric error
 * code and a link to that code's documentation page.
 */
public class InvalidParameterException extends RuntimeException {

  static final String ERROR_DOCS_BASE = "https://api.coststhismuch.au/docs/errors/";

  private final int errorCode;

  public InvalidParameterException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}

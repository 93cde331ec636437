package com.ospicorp.pricelogger.auth;

import org.springframework.security.core.AuthenticationException;

/**
 * A token failed verification. The message never says which check failed.
 */
public class InvalidTokenException extends AuthenticationException {

  public InvalidTokenException() {
    super("Invalid or expired token");
  }
}
